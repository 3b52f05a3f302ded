package com.tenderai.ingest.model;

/**
 * Which kind of source satisfied the required Phase-1 fields.
 *
 * <ul>
 *   <li>{@code PRIMARY}: the record was complete before any document was needed, or the primary
 *       notice completed it.
 *   <li>{@code FALLBACK}: the rules or specification document had to be used.
 *   <li>{@code NONE}: the waterfall was exhausted and required fields are still missing.
 * </ul>
 */
public enum Phase1Source {
  PRIMARY,
  FALLBACK,
  NONE;

  public static Phase1Source forCompletingCategory(DocumentCategory category) {
    return category == null || category == DocumentCategory.PRIMARY_NOTICE ? PRIMARY : FALLBACK;
  }
}
