package com.tenderai.ingest.service;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.log4j.Log4j2;

/**
 * Detects a notice that lists several tenders (a buyer's periodic compilation) rather than
 * announcing one. Such a notice must not feed the metadata of a single tender.
 */
@Log4j2
public final class MultiTenderGuard {

  /** More distinct reference-shaped substrings than this flags a compilation. */
  public static final int MAX_REFERENCE_PATTERNS = 3;

  private static final List<String> LISTING_PHRASES =
      List.of(
          "appels d'offres suivants",
          "marchés suivants",
          "consultations suivantes",
          "liste des appels",
          "tableau des marchés",
          "les références ci-après",
          "les marchés ci-après");

  /** e.g. {@code n° 01/2024}, {@code ref: 123-2024}, {@code 12/ao/2024}. */
  private static final List<Pattern> REFERENCE_PATTERNS =
      List.of(
          Pattern.compile("n[°o]?\\s*\\d+[/\\-]\\d{4}"),
          Pattern.compile("ref[:\\s]+\\d+[/\\-]\\d{4}"),
          Pattern.compile("\\d+[/\\-]ao[/\\-]\\d{4}"));

  private MultiTenderGuard() {}

  /**
   * @param tenderReference reference of the tender being processed; reported in the diagnostics
   *     only
   */
  public static boolean isMultiTender(String sample, String tenderReference) {
    if (sample == null || sample.isEmpty()) return false;
    String text = sample.toLowerCase(Locale.ROOT);

    for (String phrase : LISTING_PHRASES) {
      if (text.contains(phrase)) {
        log.warn("guard.multiTender phrase=\"{}\" tenderRef={}", phrase, tenderReference);
        return true;
      }
    }

    Set<String> references = distinctReferences(text);
    if (references.size() > MAX_REFERENCE_PATTERNS) {
      log.warn(
          "guard.multiTender references={} count={} tenderRef={}",
          references,
          references.size(),
          tenderReference);
      return true;
    }
    return false;
  }

  static Set<String> distinctReferences(String lowerText) {
    Set<String> found = new LinkedHashSet<>();
    for (Pattern p : REFERENCE_PATTERNS) {
      Matcher m = p.matcher(lowerText);
      while (m.find()) {
        found.add(m.group());
      }
    }
    return found;
  }
}
