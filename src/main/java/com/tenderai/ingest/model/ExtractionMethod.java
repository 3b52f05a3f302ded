package com.tenderai.ingest.model;

/** How the full text of a document was obtained. */
public enum ExtractionMethod {
  DIGITAL,
  OCR
}
