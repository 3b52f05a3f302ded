package com.tenderai.ingest.model.metadata;

import java.util.List;

/** Field names of the Phase-1 tender metadata record. */
public final class MetadataFields {

  private MetadataFields() {}

  public static final String REFERENCE = "reference";
  public static final String TENDER_TYPE = "tender_type";
  public static final String ISSUING_INSTITUTION = "issuing_institution";
  public static final String EXECUTION_LOCATION = "execution_location";
  public static final String FOLDER_OPENING_LOCATION = "folder_opening_location";
  public static final String SUBJECT = "subject";
  public static final String TOTAL_ESTIMATED_VALUE = "total_estimated_value";
  public static final String SUBMISSION_DEADLINE = "submission_deadline";
  public static final String LOTS = "lots";
  public static final String KEYWORDS = "keywords";
  public static final String WEBSITE_EXTENDED = "website_extended";

  /** Older extraction prompts emit the reference under this name. */
  public static final String REFERENCE_ALIAS = "reference_tender";

  /** Fields merged with the plain tracked-value rule. */
  public static final List<String> TRACKED_SCALARS =
      List.of(
          REFERENCE,
          TENDER_TYPE,
          ISSUING_INSTITUTION,
          EXECUTION_LOCATION,
          FOLDER_OPENING_LOCATION,
          SUBJECT,
          TOTAL_ESTIMATED_VALUE);

  /** A record is complete when none of these is missing. */
  public static final List<String> REQUIRED =
      List.of(REFERENCE, SUBJECT, SUBMISSION_DEADLINE, ISSUING_INSTITUTION);
}
