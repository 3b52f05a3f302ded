package com.tenderai.ingest.model;

import lombok.Builder;
import lombok.Value;

/** One tender handed to the batch service: its document bundle and optional webpage data. */
@Value
@Builder
public class TenderJob {

  /** Caller-side identifier, used in logs and summaries. */
  String id;

  TenderBundle bundle;

  WebsiteNotice website;
}
