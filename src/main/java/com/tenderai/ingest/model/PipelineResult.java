package com.tenderai.ingest.model;

import com.tenderai.ingest.model.metadata.MetadataRecord;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Data;

/**
 * Output of one orchestrator run over a tender bundle.
 *
 * <p>{@code extractions} preserves the order in which documents were extracted, which for the
 * assemble-all mode is also the context order. Classification records already have their sample
 * text purged.
 */
@Data
@Builder
public class PipelineResult {

  @Builder.Default
  private Map<DocumentCategory, ExtractionRecord> extractions = new LinkedHashMap<>();

  @Builder.Default private List<ClassificationRecord> classifications = List.of();

  /** Best candidate per category after the multi-tender guard, in deep-context order. */
  @Builder.Default
  private Map<DocumentCategory, ClassificationRecord> selection = new LinkedHashMap<>();

  /** Accumulated record; null only when no source produced anything. */
  private MetadataRecord metadata;

  @Builder.Default private Phase1Source source = Phase1Source.NONE;

  /** Category whose merge completed the record; null if it was complete from the start. */
  private DocumentCategory completedBy;

  private boolean complete;

  /** No candidate survived selection: callers treat this as insufficient data. */
  private boolean noUsableDocument;

  private boolean cancelled;

  public int extractionCount() {
    return extractions == null ? 0 : extractions.size();
  }

  public Map<DocumentCategory, ExtractionRecord> getExtractions() {
    return extractions == null ? null : new LinkedHashMap<>(extractions);
  }
}
