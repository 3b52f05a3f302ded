package com.tenderai.ingest.model;

import com.tenderai.ingest.model.metadata.MetadataRecord;
import java.util.List;
import lombok.Builder;
import lombok.Data;

/** Everything the persistence layer needs after ingesting one tender. */
@Data
@Builder
public class TenderIngestResult {

  public enum Status {
    LISTED,
    ERROR
  }

  private String externalReference;

  private Status status;

  private String errorMessage;

  private MetadataRecord metadata;

  private Phase1Source phase1Source;

  /** Successful full-text extractions in deep-context order. */
  @Builder.Default private List<ExtractionRecord> documents = List.of();

  /** Context text assembled from {@code documents} for deep analysis. */
  private String deepContext;

  private boolean cancelled;
}
