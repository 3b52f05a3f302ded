package com.tenderai.ingest.service;

import com.tenderai.ingest.model.DocumentCategory;

/**
 * Last-resort classifier consulted when the filename and keyword rules find nothing.
 *
 * <p>Implementations may call out to a model and may fail; callers treat any exception as {@link
 * DocumentCategory#UNKNOWN}.
 */
@FunctionalInterface
public interface ExternalDocumentClassifier {

  DocumentCategory classify(String sample, String filename, boolean scanned);
}
