package com.tenderai.ingest.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import org.junit.jupiter.api.Test;

class TextUtilsTest {

  @Test
  void stripCodeFencesPrefersJsonBlock() {
    String reply = "Voici:\n```\nnot this\n```\n```json\n{\"a\": 1}\n```";
    assertEquals("{\"a\": 1}", TextUtils.stripCodeFences(reply));
    assertEquals("plain", TextUtils.stripCodeFences("```\nplain\n```"));
    assertEquals("{\"a\": 1}", TextUtils.stripCodeFences("```json\n{\"a\": 1}\n```"));
    assertEquals("{\"a\": 1}", TextUtils.stripCodeFences("  {\"a\": 1} "));
    assertEquals("{\"a\": 1}", TextUtils.stripCodeFences("```json\n{\"a\": 1}"));
    assertNull(TextUtils.stripCodeFences(null));
  }

  @Test
  void truncateWordsCollapsesWhitespace() {
    assertEquals("un deux trois", TextUtils.truncateWords("  un\n deux\t trois quatre ", 3));
    assertEquals("", TextUtils.truncateWords("   ", 3));
  }

  @Test
  void truncateKeepsShortStrings() {
    assertEquals("abc", TextUtils.truncate("abc", 5));
    assertEquals("ab", TextUtils.truncate("abc", 2));
    assertNull(TextUtils.truncate(null, 2));
  }
}
