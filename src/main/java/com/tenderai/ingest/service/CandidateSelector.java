package com.tenderai.ingest.service;

import com.tenderai.ingest.model.ClassificationRecord;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.extern.log4j.Log4j2;

/**
 * Picks one representative among the classified files of a category.
 *
 * <p>French versions first, then language-neutral ones (no signal, or both signals), then
 * Arabic-only versions. Within a tier the first candidate in input order wins.
 */
@Log4j2
public final class CandidateSelector {

  private CandidateSelector() {}

  public static Optional<ClassificationRecord> selectBest(List<ClassificationRecord> candidates) {
    if (candidates == null || candidates.isEmpty()) {
      return Optional.empty();
    }
    List<ClassificationRecord> french = new ArrayList<>();
    List<ClassificationRecord> neutral = new ArrayList<>();
    List<ClassificationRecord> arabic = new ArrayList<>();

    for (ClassificationRecord c : candidates) {
      boolean fr = LanguageDetector.isFrench(c.getFilename(), c.getSampleText());
      boolean ar = LanguageDetector.isArabic(c.getFilename(), c.getSampleText());
      log.debug("selector.language file={} french={} arabic={}", c.getFilename(), fr, ar);
      if (fr && !ar) {
        french.add(c);
      } else if (ar && !fr) {
        arabic.add(c);
      } else {
        neutral.add(c);
      }
    }

    if (!french.isEmpty()) {
      return Optional.of(french.get(0));
    }
    if (!neutral.isEmpty()) {
      return Optional.of(neutral.get(0));
    }
    log.warn("selector.arabicOnly file={}", arabic.get(0).getFilename());
    return Optional.of(arabic.get(0));
  }
}
