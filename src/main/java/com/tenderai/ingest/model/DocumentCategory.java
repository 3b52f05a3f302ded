package com.tenderai.ingest.model;

import java.util.Locale;

/**
 * Role a file plays inside a tender bundle.
 *
 * <p>The {@code label} is the short French acronym used in filenames, prompts and persisted
 * records (AVIS, RC, CPS, ...).
 */
public enum DocumentCategory {
  PRIMARY_NOTICE("AVIS"),
  RULES("RC"),
  SPECIFICATION("CPS"),
  ADDENDUM("ANNEXE"),
  PRICE_SCHEDULE("BPDE"),
  COMMITMENT_FORM("AE"),
  COST_BREAKDOWN("DSH"),
  GENERAL_ADMIN_CLAUSES("CCAG"),
  TECHNICAL_CLAUSES("CCTP"),
  QUANTITY_SCHEDULE("BQ"),
  ESTIMATED_QUANTITIES("DQE"),
  OTHER("OTHER"),
  UNKNOWN("UNKNOWN");

  private final String label;

  DocumentCategory(String label) {
    this.label = label;
  }

  public String getLabel() {
    return label;
  }

  /** Resolves a short label (case-insensitive); {@code null} when nothing matches. */
  public static DocumentCategory fromLabel(String label) {
    if (label == null) return null;
    String wanted = label.trim().toUpperCase(Locale.ROOT);
    for (DocumentCategory c : values()) {
      if (c.label.equals(wanted)) return c;
    }
    return null;
  }
}
