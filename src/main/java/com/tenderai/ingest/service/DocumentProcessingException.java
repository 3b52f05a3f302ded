package com.tenderai.ingest.service;

/**
 * File-scoped failure raised inside the format readers and caught by the classifier and the
 * extraction engine, which turn it into a record with {@code success=false}.
 */
public class DocumentProcessingException extends RuntimeException {

  public enum Kind {
    /** Extension or mime type not handled. */
    UNSUPPORTED_FORMAT,
    /** Image rendering, OCR or the legacy conversion tool failed. */
    CONVERSION_FAILURE,
    /** A format library rejected the bytes. */
    PARSE_FAILURE
  }

  private final Kind kind;

  public DocumentProcessingException(Kind kind, String message) {
    super(message);
    this.kind = kind;
  }

  public DocumentProcessingException(Kind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = kind;
  }

  public Kind getKind() {
    return kind;
  }

  /** Error text stored on records, e.g. {@code PARSE_FAILURE: End-of-File, expected line}. */
  public String describe() {
    return kind + ": " + getMessage();
  }
}
