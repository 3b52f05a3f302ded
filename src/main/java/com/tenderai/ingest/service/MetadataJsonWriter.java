package com.tenderai.ingest.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tenderai.ingest.model.metadata.DeadlineValue;
import com.tenderai.ingest.model.metadata.KeywordBuckets;
import com.tenderai.ingest.model.metadata.Lot;
import com.tenderai.ingest.model.metadata.LotList;
import com.tenderai.ingest.model.metadata.MetadataField;
import com.tenderai.ingest.model.metadata.MetadataRecord;
import com.tenderai.ingest.model.metadata.OpaqueField;
import com.tenderai.ingest.model.metadata.TrackedValue;
import java.util.List;
import java.util.Map;

/**
 * Renders a {@link MetadataRecord} in the persisted JSON layout: tracked values as {@code {value,
 * source_document, source_date}}, snake_case lot attributes and {@code keywords_fr/eng/ar}
 * buckets.
 */
public class MetadataJsonWriter {

  private final ObjectMapper om;

  public MetadataJsonWriter(ObjectMapper om) {
    this.om = om;
  }

  public ObjectNode toJson(MetadataRecord record) {
    ObjectNode root = om.createObjectNode();
    if (record == null) return root;
    for (Map.Entry<String, MetadataField> e : record.asMap().entrySet()) {
      root.set(e.getKey(), field(e.getValue()));
    }
    return root;
  }

  /** Tracked-value node as stored inside {@code website_extended}. */
  public ObjectNode tracked(TrackedValue tv) {
    ObjectNode node = om.createObjectNode();
    if (tv == null) return node;
    node.put("value", tv.getValue());
    node.put(
        "source_document",
        tv.getSourceDocument() == null ? null : tv.getSourceDocument().getLabel());
    node.put("source_date", tv.getSourceDate() == null ? null : tv.getSourceDate().toString());
    return node;
  }

  private JsonNode field(MetadataField field) {
    if (field instanceof TrackedValue tv) {
      return tracked(tv);
    }
    if (field instanceof DeadlineValue d) {
      ObjectNode node = om.createObjectNode();
      node.set("date", d.getDate() == null ? om.nullNode() : tracked(d.getDate()));
      node.set("time", d.getTime() == null ? om.nullNode() : tracked(d.getTime()));
      return node;
    }
    if (field instanceof LotList lots) {
      ArrayNode arr = om.createArrayNode();
      for (Lot lot : lots.getLots()) {
        ObjectNode node = arr.addObject();
        node.put("lot_number", lot.getLotNumber());
        node.put("lot_subject", lot.getLotSubject());
        node.put("lot_estimated_value", lot.getLotEstimatedValue());
        node.put("caution_provisoire", lot.getCautionProvisoire());
      }
      return arr;
    }
    if (field instanceof KeywordBuckets k) {
      ObjectNode node = om.createObjectNode();
      node.set("keywords_fr", strings(k.getFr()));
      node.set("keywords_eng", strings(k.getEng()));
      node.set("keywords_ar", strings(k.getAr()));
      return node;
    }
    if (field instanceof OpaqueField o) {
      return o.getNode() == null ? om.nullNode() : o.getNode().deepCopy();
    }
    return om.nullNode();
  }

  private ArrayNode strings(List<String> values) {
    ArrayNode arr = om.createArrayNode();
    values.forEach(arr::add);
    return arr;
  }
}
