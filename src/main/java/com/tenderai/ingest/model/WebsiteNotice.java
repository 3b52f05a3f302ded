package com.tenderai.ingest.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** What the scraping layer read from the tender's consultation webpage. All fields optional. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WebsiteNotice {

  private String reference;

  /** Full consultation text of the page, fed to Phase-1 extraction first. */
  private String consultationText;

  /** Raw administrative contact block, kept unstructured for deep analysis. */
  private String contactAdministratif;
}
