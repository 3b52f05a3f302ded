package com.tenderai.ingest.service;

import com.tenderai.ingest.model.metadata.DeadlineValue;
import com.tenderai.ingest.model.metadata.KeywordBuckets;
import com.tenderai.ingest.model.metadata.Lot;
import com.tenderai.ingest.model.metadata.LotList;
import com.tenderai.ingest.model.metadata.MetadataField;
import com.tenderai.ingest.model.metadata.MetadataFields;
import com.tenderai.ingest.model.metadata.MetadataRecord;
import com.tenderai.ingest.model.metadata.TrackedValue;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Field-level fill of a base record from a fallback record.
 *
 * <p>The base always wins where it has a value. Merging the same fallback twice gives the same
 * record as merging it once.
 */
public final class FusionMerger {

  private FusionMerger() {}

  /**
   * @return {@code fallback} when {@code base} is null or empty, {@code base} when {@code fallback}
   *     is null or empty, otherwise a new record
   */
  public static MetadataRecord merge(MetadataRecord base, MetadataRecord fallback) {
    if (base == null || base.isEmpty()) return fallback == null ? base : fallback;
    if (fallback == null || fallback.isEmpty()) return base;

    Map<String, MetadataField> out = new LinkedHashMap<>(base.asMap());

    for (String key : MetadataFields.TRACKED_SCALARS) {
      put(out, key, mergeTracked(out.get(key), fallback.get(key)));
    }
    put(
        out,
        MetadataFields.SUBMISSION_DEADLINE,
        mergeDeadline(out.get(MetadataFields.SUBMISSION_DEADLINE), fallback.deadline()));
    put(out, MetadataFields.LOTS, mergeLots(out.get(MetadataFields.LOTS), fallback.lots()));
    put(
        out,
        MetadataFields.KEYWORDS,
        mergeKeywords(out.get(MetadataFields.KEYWORDS), fallback.keywords()));

    fallback.asMap().forEach(out::putIfAbsent);
    return MetadataRecord.of(out);
  }

  private static void put(Map<String, MetadataField> out, String key, MetadataField value) {
    if (value != null) out.put(key, value);
  }

  /**
   * Base unless missing by {@link CompletenessOracle#isMissing}; the fallback is taken whole so its
   * provenance travels with it.
   */
  static MetadataField mergeTracked(MetadataField base, MetadataField fallback) {
    if (CompletenessOracle.isMissing(base) && fallback instanceof TrackedValue) {
      return fallback;
    }
    return base;
  }

  static MetadataField mergeDeadline(MetadataField base, DeadlineValue fallback) {
    if (fallback == null) return base;
    DeadlineValue b = base instanceof DeadlineValue d ? d : DeadlineValue.builder().build();
    return DeadlineValue.builder()
        .date((TrackedValue) mergeTracked(b.getDate(), fallback.getDate()))
        .time((TrackedValue) mergeTracked(b.getTime(), fallback.getTime()))
        .build();
  }

  /** Per language: the base list if non-empty, else the fallback list. Lists are never mixed. */
  static MetadataField mergeKeywords(MetadataField base, KeywordBuckets fallback) {
    if (fallback == null) return base;
    KeywordBuckets b = base instanceof KeywordBuckets k ? k : KeywordBuckets.empty();
    return KeywordBuckets.builder()
        .fr(b.getFr().isEmpty() ? fallback.getFr() : b.getFr())
        .eng(b.getEng().isEmpty() ? fallback.getEng() : b.getEng())
        .ar(b.getAr().isEmpty() ? fallback.getAr() : b.getAr())
        .build();
  }

  /**
   * Empty base lots take the fallback list. Otherwise each base lot is paired with the fallback lot
   * of the same number (the first one when numbers repeat), or failing that the one at the same
   * index, and only its blank attributes are filled. A blank lot number is only taken from a match
   * that its number would find again. The output has exactly the base's lots.
   */
  static MetadataField mergeLots(MetadataField base, LotList fallback) {
    LotList b = base instanceof LotList l ? l : null;
    if (b == null || b.isEmpty()) {
      return fallback != null ? fallback : base;
    }
    if (fallback == null || fallback.isEmpty()) return base;

    Map<String, Lot> byNumber = new HashMap<>();
    for (Lot lot : fallback.getLots()) {
      if (!isBlank(lot.getLotNumber())) byNumber.putIfAbsent(lot.getLotNumber().strip(), lot);
    }

    List<Lot> merged = new ArrayList<>(b.size());
    List<Lot> fbLots = fallback.getLots();
    for (int i = 0; i < b.size(); i++) {
      Lot lot = b.getLots().get(i);
      Lot match = null;
      String number = lot.getLotNumber();
      if (!isBlank(number) && byNumber.containsKey(number.strip())) {
        match = byNumber.get(number.strip());
      } else if (i < fbLots.size()) {
        match = fbLots.get(i);
      }
      merged.add(match == null ? lot : fillLot(lot, match, byNumber));
    }
    return new LotList(merged);
  }

  private static Lot fillLot(Lot lot, Lot from, Map<String, Lot> byNumber) {
    boolean numberFindsMatch =
        !isBlank(from.getLotNumber()) && byNumber.get(from.getLotNumber().strip()) == from;
    return lot.toBuilder()
        .lotSubject(isBlank(lot.getLotSubject()) ? from.getLotSubject() : lot.getLotSubject())
        .lotEstimatedValue(
            isBlank(lot.getLotEstimatedValue())
                ? from.getLotEstimatedValue()
                : lot.getLotEstimatedValue())
        .cautionProvisoire(
            isBlank(lot.getCautionProvisoire())
                ? from.getCautionProvisoire()
                : lot.getCautionProvisoire())
        .lotNumber(
            isBlank(lot.getLotNumber()) && numberFindsMatch
                ? from.getLotNumber()
                : lot.getLotNumber())
        .build();
  }

  private static boolean isBlank(String s) {
    return s == null || s.isBlank();
  }
}
