package com.tenderai.ingest.model.metadata;

import lombok.Builder;
import lombok.Value;

/** One line item of a multi-lot tender. Lots are not provenance tracked. */
@Value
@Builder(toBuilder = true)
public class Lot {

  String lotNumber;

  String lotSubject;

  String lotEstimatedValue;

  String cautionProvisoire;
}
