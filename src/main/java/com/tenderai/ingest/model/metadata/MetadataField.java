package com.tenderai.ingest.model.metadata;

/**
 * One value stored under a key of a {@link MetadataRecord}.
 *
 * <p>Implementations: {@link TrackedValue}, {@link DeadlineValue}, {@link LotList}, {@link
 * KeywordBuckets} and {@link OpaqueField} for keys the core does not interpret.
 */
public interface MetadataField {}
