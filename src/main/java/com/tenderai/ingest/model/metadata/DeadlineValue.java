package com.tenderai.ingest.model.metadata;

import lombok.Builder;
import lombok.Value;

/** Submission deadline: date and time tracked independently. Only the date is required. */
@Value
@Builder(toBuilder = true)
public class DeadlineValue implements MetadataField {

  TrackedValue date;

  TrackedValue time;

  public boolean isDateMissing() {
    return date == null || date.isMissing();
  }
}
