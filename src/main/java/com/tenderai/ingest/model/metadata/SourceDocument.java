package com.tenderai.ingest.model.metadata;

import com.tenderai.ingest.model.DocumentCategory;
import java.util.Locale;

/** Where a tracked value came from: the tender webpage or one of the bundle's documents. */
public enum SourceDocument {
  WEBSITE("WEBSITE"),
  AVIS("AVIS"),
  RC("RC"),
  CPS("CPS"),
  ANNEXE("ANNEXE"),
  OTHER("OTHER");

  private final String label;

  SourceDocument(String label) {
    this.label = label;
  }

  public String getLabel() {
    return label;
  }

  public static SourceDocument fromCategory(DocumentCategory category) {
    if (category == null) return OTHER;
    switch (category) {
      case PRIMARY_NOTICE:
        return AVIS;
      case RULES:
        return RC;
      case SPECIFICATION:
        return CPS;
      case ADDENDUM:
        return ANNEXE;
      default:
        return OTHER;
    }
  }

  /** Lenient parse of a label returned by the extraction model; unknown labels map to OTHER. */
  public static SourceDocument fromLabel(String label) {
    if (label == null || label.isBlank()) return null;
    String wanted = label.trim().toUpperCase(Locale.ROOT);
    for (SourceDocument s : values()) {
      if (s.label.equals(wanted)) return s;
    }
    return OTHER;
  }
}
