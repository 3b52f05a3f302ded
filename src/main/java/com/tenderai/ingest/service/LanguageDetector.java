package com.tenderai.ingest.service;

import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/** Filename and sample-text language signals used to prefer the French version of a document. */
public final class LanguageDetector {

  static final int FRENCH_MIN_MARKERS = 2;
  static final int ARABIC_MIN_CHARS = 50;

  private static final List<Pattern> FRENCH_FILENAME =
      compile(
          "[\\s_\\-.]fr[\\s_\\-.]",
          "[\\s_\\-.]fr$",
          "^fr[\\s_\\-.]",
          "[\\s_\\-]français",
          "[\\s_\\-]francais",
          "[\\s_\\-]french",
          "\\(fr\\)",
          "\\[fr\\]",
          "version[\\s_\\-]*fr");

  private static final List<String> FRENCH_MARKERS =
      List.of(
          "règlement de consultation",
          "cahier des prescriptions",
          "avis d'appel d'offres",
          "marché public",
          "le soumissionnaire",
          "pièces justificatives");

  private static final List<Pattern> ARABIC_FILENAME =
      compile(
          "[\\s_\\-.]ar[\\s_\\-.]",
          "[\\s_\\-.]ar$",
          "^ar[\\s_\\-.]",
          "[\\s_\\-]arabe",
          "[\\s_\\-]arabic",
          "\\(ar\\)",
          "\\[ar\\]",
          "version[\\s_\\-]*ar",
          "عربي",
          "العربية");

  private static final Pattern ARABIC_CHAR = Pattern.compile("[\\u0600-\\u06FF]");
  private static final Pattern LATIN_CHAR = Pattern.compile("[a-zA-Z]");

  private LanguageDetector() {}

  public static boolean isFrench(String filename, String sample) {
    if (anyMatch(FRENCH_FILENAME, lower(filename))) return true;
    String text = lower(sample);
    if (text.isEmpty()) return false;
    int score = 0;
    for (String marker : FRENCH_MARKERS) {
      if (text.contains(marker)) score++;
    }
    return score >= FRENCH_MIN_MARKERS;
  }

  /** Arabic filename marker, or Arabic script dominating Latin letters with more than 50 chars. */
  public static boolean isArabic(String filename, String sample) {
    if (anyMatch(ARABIC_FILENAME, lower(filename))) return true;
    if (sample == null || sample.isEmpty()) return false;
    int arabic = count(ARABIC_CHAR, sample);
    int latin = count(LATIN_CHAR, sample);
    return arabic > latin && arabic > ARABIC_MIN_CHARS;
  }

  private static List<Pattern> compile(String... regexes) {
    return List.of(regexes).stream().map(Pattern::compile).collect(Collectors.toList());
  }

  private static boolean anyMatch(List<Pattern> patterns, String s) {
    if (s.isEmpty()) return false;
    for (Pattern p : patterns) {
      if (p.matcher(s).find()) return true;
    }
    return false;
  }

  private static int count(Pattern p, String s) {
    Matcher m = p.matcher(s);
    int n = 0;
    while (m.find()) n++;
    return n;
  }

  private static String lower(String s) {
    return s == null ? "" : s.toLowerCase(Locale.ROOT);
  }
}
