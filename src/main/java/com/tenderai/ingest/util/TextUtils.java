package com.tenderai.ingest.util;

import java.util.Arrays;
import java.util.stream.Collectors;

public final class TextUtils {

  private static final String FENCE = "```";
  private static final String JSON_FENCE = "```json";

  private TextUtils() {}

  /** First {@code max} characters of {@code s}; null stays null. */
  public static String truncate(String s, int max) {
    if (s == null || s.length() <= max) return s;
    return s.substring(0, max);
  }

  /** First {@code max} whitespace-separated words joined by single spaces. */
  public static String truncateWords(String s, int max) {
    if (s == null) return null;
    String trimmed = s.strip();
    if (trimmed.isEmpty()) return "";
    return Arrays.stream(trimmed.split("\\s+")).limit(max).collect(Collectors.joining(" "));
  }

  /**
   * Body of the first Markdown code block of a model reply ({@code ```json} preferred), or the
   * whole reply when it has none.
   */
  public static String stripCodeFences(String s) {
    if (s == null) return null;
    String body = s;
    int open = s.indexOf(JSON_FENCE);
    int skip = JSON_FENCE.length();
    if (open < 0) {
      open = s.indexOf(FENCE);
      skip = FENCE.length();
    }
    if (open >= 0) {
      int start = open + skip;
      int close = s.indexOf(FENCE, start);
      body = close >= 0 ? s.substring(start, close) : s.substring(start);
    }
    return body.strip();
  }
}
