package com.tenderai.ingest.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of the cheap first-page scan of one file.
 *
 * <p>{@code sampleText} only lives for the duration of a pipeline run: the orchestrator purges it
 * once candidate selection is over, and it is never persisted.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ClassificationRecord {

  private String filename;

  /** First page / rows / characters of the file. Ephemeral. */
  @Builder.Default private String sampleText = "";

  @Builder.Default private DocumentCategory category = DocumentCategory.UNKNOWN;

  /** True when the first PDF page carries fewer than 100 characters of digital text. */
  private boolean scanned;

  private String mime;

  private long size;

  private boolean success;

  private String error;

  /** Drops the sample text; called once selection for the run completes. */
  public void purgeSample() {
    this.sampleText = "";
  }

  public static ClassificationRecord failed(RawFile file, String error) {
    return ClassificationRecord.builder()
        .filename(file.getFilename())
        .mime(file.getMime())
        .size(file.getSize())
        .success(false)
        .error(error)
        .build();
  }
}
