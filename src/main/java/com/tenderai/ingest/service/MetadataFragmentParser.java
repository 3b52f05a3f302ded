package com.tenderai.ingest.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.tenderai.ingest.model.metadata.DeadlineValue;
import com.tenderai.ingest.model.metadata.KeywordBuckets;
import com.tenderai.ingest.model.metadata.Lot;
import com.tenderai.ingest.model.metadata.LotList;
import com.tenderai.ingest.model.metadata.MetadataFields;
import com.tenderai.ingest.model.metadata.MetadataRecord;
import com.tenderai.ingest.model.metadata.OpaqueField;
import com.tenderai.ingest.model.metadata.SourceDocument;
import com.tenderai.ingest.model.metadata.TrackedValue;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import lombok.extern.log4j.Log4j2;

/**
 * Validates the JSON shape of an extracted fragment and converts it into a {@link MetadataRecord}.
 *
 * <p>Malformed values never fail the whole fragment: a tracked field with the wrong shape becomes a
 * missing value, lots and keywords drop the entries they cannot read, and keys the core does not
 * know are carried as {@link OpaqueField}s.
 */
@Log4j2
public class MetadataFragmentParser {

  /**
   * @param source label stamped on plain-string values and on objects without a readable {@code
   *     source_document}
   * @param sourceDate when non-null, replaces the {@code source_date} of every tracked value
   */
  public MetadataRecord parse(JsonNode root, SourceDocument source, LocalDate sourceDate) {
    if (root == null || !root.isObject()) {
      log.warn(
          "fragment.parse rejected non-object root type={}",
          root == null ? null : root.getNodeType());
      return MetadataRecord.empty();
    }
    MetadataRecord.Builder out = MetadataRecord.builder();
    boolean hasReference = root.has(MetadataFields.REFERENCE);

    Iterator<Map.Entry<String, JsonNode>> it = root.fields();
    while (it.hasNext()) {
      Map.Entry<String, JsonNode> e = it.next();
      String key = e.getKey();
      JsonNode node = e.getValue();
      if (MetadataFields.REFERENCE_ALIAS.equals(key)) {
        if (hasReference) continue;
        key = MetadataFields.REFERENCE;
      }

      if (MetadataFields.TRACKED_SCALARS.contains(key)) {
        out.field(key, tracked(node, source, sourceDate));
      } else if (MetadataFields.SUBMISSION_DEADLINE.equals(key)) {
        out.field(key, deadline(node, source, sourceDate));
      } else if (MetadataFields.LOTS.equals(key)) {
        out.field(key, lots(node));
      } else if (MetadataFields.KEYWORDS.equals(key)) {
        out.field(key, keywords(node));
      } else {
        out.field(key, new OpaqueField(node.deepCopy()));
      }
    }
    return out.build();
  }

  TrackedValue tracked(JsonNode node, SourceDocument source, LocalDate sourceDate) {
    if (node == null || node.isNull() || node.isMissingNode()) {
      return TrackedValue.builder().sourceDocument(source).sourceDate(sourceDate).build();
    }
    if (node.isValueNode()) {
      return TrackedValue.builder()
          .value(scalar(node))
          .sourceDocument(source)
          .sourceDate(sourceDate)
          .build();
    }
    if (!node.isObject()) {
      log.debug("fragment.parse malformed tracked value type={}", node.getNodeType());
      return TrackedValue.builder().sourceDocument(source).sourceDate(sourceDate).build();
    }
    SourceDocument label = SourceDocument.fromLabel(scalar(node.get("source_document")));
    return TrackedValue.builder()
        .value(scalar(node.get("value")))
        .sourceDocument(label == null ? source : label)
        .sourceDate(sourceDate != null ? sourceDate : date(node.get("source_date")))
        .build();
  }

  DeadlineValue deadline(JsonNode node, SourceDocument source, LocalDate sourceDate) {
    if (node != null && node.isObject()) {
      return DeadlineValue.builder()
          .date(tracked(node.get("date"), source, sourceDate))
          .time(tracked(node.get("time"), source, sourceDate))
          .build();
    }
    if (node != null && node.isTextual()) {
      return DeadlineValue.builder().date(tracked(node, source, sourceDate)).build();
    }
    return DeadlineValue.builder().build();
  }

  LotList lots(JsonNode node) {
    if (node == null || !node.isArray()) return new LotList(List.of());
    List<Lot> lots = new ArrayList<>();
    for (JsonNode lot : node) {
      if (!lot.isObject()) continue;
      lots.add(
          Lot.builder()
              .lotNumber(scalar(lot.get("lot_number")))
              .lotSubject(scalar(lot.get("lot_subject")))
              .lotEstimatedValue(scalar(lot.get("lot_estimated_value")))
              .cautionProvisoire(scalar(lot.get("caution_provisoire")))
              .build());
    }
    return new LotList(lots);
  }

  KeywordBuckets keywords(JsonNode node) {
    if (node == null || !node.isObject()) return KeywordBuckets.empty();
    return KeywordBuckets.builder()
        .fr(strings(first(node, "keywords_fr", "fr")))
        .eng(strings(first(node, "keywords_eng", "eng")))
        .ar(strings(first(node, "keywords_ar", "ar")))
        .build();
  }

  private static JsonNode first(JsonNode node, String name, String alias) {
    return node.has(name) ? node.get(name) : node.get(alias);
  }

  private static List<String> strings(JsonNode node) {
    List<String> out = new ArrayList<>();
    if (node == null || !node.isArray()) return out;
    for (JsonNode item : node) {
      String s = scalar(item);
      if (s != null && !s.isBlank()) out.add(s);
    }
    return out;
  }

  /** Text of a value node; numbers and booleans as their JSON text; null otherwise. */
  private static String scalar(JsonNode node) {
    if (node == null || node.isNull() || !node.isValueNode()) return null;
    return node.asText();
  }

  private static LocalDate date(JsonNode node) {
    String s = scalar(node);
    if (s == null || s.isBlank()) return null;
    try {
      return LocalDate.parse(s.strip());
    } catch (DateTimeParseException e) {
      log.debug("fragment.parse unreadable source_date={}", s);
      return null;
    }
  }
}
