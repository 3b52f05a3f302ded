package com.tenderai.ingest.model.metadata;

import java.time.LocalDate;
import lombok.Builder;
import lombok.Value;

/** A scalar value paired with the document (and date) that produced it. */
@Value
@Builder(toBuilder = true)
public class TrackedValue implements MetadataField {

  /** Scalar normalized to text; null when the source had nothing. */
  String value;

  SourceDocument sourceDocument;

  LocalDate sourceDate;

  /** Missing iff the value is null or blank. */
  public boolean isMissing() {
    return value == null || value.isBlank();
  }

  public static TrackedValue of(String value, SourceDocument source) {
    return TrackedValue.builder().value(value).sourceDocument(source).build();
  }

  public static TrackedValue missing(SourceDocument source) {
    return TrackedValue.builder().sourceDocument(source).build();
  }
}
