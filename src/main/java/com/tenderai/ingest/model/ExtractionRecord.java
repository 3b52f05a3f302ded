package com.tenderai.ingest.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Full-text extraction of one selected file, handed to the caller for persistence. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExtractionRecord {

  private String filename;

  @Builder.Default private DocumentCategory category = DocumentCategory.UNKNOWN;

  @Builder.Default private String fullText = "";

  /** Null for formats without a page notion (DOCX, DOC, spreadsheets, text). */
  private Integer pageCount;

  @Builder.Default private ExtractionMethod method = ExtractionMethod.DIGITAL;

  private long size;

  private String mime;

  private boolean success;

  private String error;

  public boolean hasText() {
    return success && fullText != null && !fullText.isBlank();
  }
}
