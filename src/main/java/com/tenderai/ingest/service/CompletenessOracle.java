package com.tenderai.ingest.service;

import com.tenderai.ingest.model.metadata.DeadlineValue;
import com.tenderai.ingest.model.metadata.MetadataField;
import com.tenderai.ingest.model.metadata.MetadataFields;
import com.tenderai.ingest.model.metadata.MetadataRecord;
import com.tenderai.ingest.model.metadata.OpaqueField;
import com.tenderai.ingest.model.metadata.TrackedValue;
import java.util.ArrayList;
import java.util.List;

/** Required-field check over a {@link MetadataRecord}. Stateless, called after every merge. */
public final class CompletenessOracle {

  private CompletenessOracle() {}

  public static boolean isComplete(MetadataRecord record) {
    return missingFields(record).isEmpty();
  }

  /** Required fields that are absent or empty, in {@link MetadataFields#REQUIRED} order. */
  public static List<String> missingFields(MetadataRecord record) {
    if (record == null) {
      return new ArrayList<>(MetadataFields.REQUIRED);
    }
    List<String> missing = new ArrayList<>();
    for (String name : MetadataFields.REQUIRED) {
      if (isMissing(record.get(name))) {
        missing.add(name);
      }
    }
    return missing;
  }

  /**
   * A tracked value is missing when blank; a deadline when its date is; an uninterpreted value only
   * when it is null or a blank string.
   */
  static boolean isMissing(MetadataField field) {
    if (field == null) return true;
    if (field instanceof TrackedValue tv) return tv.isMissing();
    if (field instanceof DeadlineValue d) return d.isDateMissing();
    if (field instanceof OpaqueField o) return o.isBlankText();
    return false;
  }
}
