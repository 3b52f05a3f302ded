package com.tenderai.ingest.service;

import static com.tenderai.ingest.model.DocumentCategory.*;

import com.tenderai.ingest.model.DocumentCategory;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Filename and content heuristics for tender documents. Pure functions over fixed tables.
 *
 * <p>Map iteration order is the match priority: the notice is tried first, then rules and
 * specification, then the ancillary forms.
 */
public final class ClassificationRules {

  private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;

  private static final Map<DocumentCategory, List<Pattern>> FILENAME_PATTERNS =
      new LinkedHashMap<>();

  private static final Map<DocumentCategory, List<String>> CONTENT_KEYWORDS =
      new LinkedHashMap<>();

  /** A notice-looking filename that also names the rules or specification is not the notice. */
  private static final Pattern NOTICE_EXCLUSION =
      Pattern.compile("\\b(rc|cps|ccaf|rcdp|rcdg)\\b");

  static {
    filename(
        PRIMARY_NOTICE, "\\bavis\\b", "\\bavis[\\s_-]", "[\\s_-]avis\\b", "avis[\\s_-]*(ar|fr)");
    filename(RULES, "\\brc\\b", "\\brcdp\\b", "\\brcdg\\b");
    filename(SPECIFICATION, "\\bcps\\b", "\\bccaf\\b");
    filename(ADDENDUM, "\\bannexe\\b");
    filename(PRICE_SCHEDULE, "\\bbpde\\b", "\\bbordereau[\\s_-]*prix\\b", "\\bbdp\\b");
    filename(COMMITMENT_FORM, "\\bae\\b", "\\bacte[\\s_-]*engagement\\b");
    filename(COST_BREAKDOWN, "\\bdsh\\b", "\\bsous[\\s_-]*detail\\b", "\\bdecomposition\\b");
    filename(GENERAL_ADMIN_CLAUSES, "\\bccag\\b");
    filename(TECHNICAL_CLAUSES, "\\bcctp\\b");
    filename(QUANTITY_SCHEDULE, "\\bbq\\b", "\\bbordereau[\\s_-]*quantit\\b");
    filename(ESTIMATED_QUANTITIES, "\\bdqe\\b", "\\bdevis[\\s_-]*quantitatif\\b");

    CONTENT_KEYWORDS.put(
        PRIMARY_NOTICE,
        List.of(
            "avis de consultation",
            "avis d'appel d'offres",
            "avis d'appel",
            "avis appel offres",
            "avis ao",
            "avis"));
    CONTENT_KEYWORDS.put(
        RULES,
        List.of(
            "règlement de consultation",
            "reglement de consultation",
            "règlement de la consultation",
            "reglement de la consultation"));
    CONTENT_KEYWORDS.put(
        SPECIFICATION,
        List.of(
            "cahier des prescriptions spéciales",
            "cahier des prescriptions speciales",
            "cahier des clauses"));
    CONTENT_KEYWORDS.put(ADDENDUM, List.of("annexe", "additif", "avenant"));
  }

  private ClassificationRules() {}

  private static void filename(DocumentCategory category, String... regexes) {
    FILENAME_PATTERNS.put(
        category,
        List.of(regexes).stream().map(r -> Pattern.compile(r, FLAGS)).collect(Collectors.toList()));
  }

  /** Category implied by the filename alone. Directory components are ignored. */
  public static Optional<DocumentCategory> byFilename(String filename) {
    if (filename == null || filename.isBlank()) return Optional.empty();
    String base = baseName(filename.toLowerCase(Locale.ROOT));
    for (Map.Entry<DocumentCategory, List<Pattern>> e : FILENAME_PATTERNS.entrySet()) {
      for (Pattern p : e.getValue()) {
        if (!p.matcher(base).find()) continue;
        if (e.getKey() == PRIMARY_NOTICE && NOTICE_EXCLUSION.matcher(base).find()) continue;
        return Optional.of(e.getKey());
      }
    }
    return Optional.empty();
  }

  /** Category implied by keyword substrings; only the four core document kinds are detected. */
  public static Optional<DocumentCategory> byContent(String text) {
    if (text == null || text.isEmpty()) return Optional.empty();
    String lower = text.toLowerCase(Locale.ROOT);
    for (Map.Entry<DocumentCategory, List<String>> e : CONTENT_KEYWORDS.entrySet()) {
      for (String keyword : e.getValue()) {
        if (lower.contains(keyword)) return Optional.of(e.getKey());
      }
    }
    return Optional.empty();
  }

  /** Filename first, then content; empty when neither matches. */
  public static Optional<DocumentCategory> match(String text, String filename) {
    Optional<DocumentCategory> byName = byFilename(filename);
    return byName.isPresent() ? byName : byContent(text);
  }

  static String baseName(String filename) {
    int slash = Math.max(filename.lastIndexOf('/'), filename.lastIndexOf('\\'));
    return slash >= 0 ? filename.substring(slash + 1) : filename;
  }
}
