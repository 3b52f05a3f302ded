package com.tenderai.ingest.service;

import com.tenderai.ingest.model.metadata.MetadataRecord;
import com.tenderai.ingest.model.metadata.SourceDocument;
import java.util.Optional;

/**
 * Turns raw document or webpage text into a partial metadata record whose tracked values are
 * labelled with {@code source}. Returns empty when nothing could be extracted.
 */
@FunctionalInterface
public interface MetadataFragmentExtractor {

  Optional<MetadataRecord> extractFragment(String text, SourceDocument source);
}
