package com.tenderai.ingest.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
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
import java.util.List;
import org.junit.jupiter.api.Test;

class MetadataJsonWriterTest {

  private final ObjectMapper om = new ObjectMapper();
  private final MetadataJsonWriter writer = new MetadataJsonWriter(om);

  @Test
  void nullRecordIsEmptyObject() {
    assertEquals(0, writer.toJson(null).size());
  }

  @Test
  void trackedValueCarriesProvenance() {
    TrackedValue tv =
        TrackedValue.builder()
            .value("Commune de Fès")
            .sourceDocument(SourceDocument.AVIS)
            .sourceDate(LocalDate.of(2024, 3, 18))
            .build();

    ObjectNode node = writer.tracked(tv);

    assertEquals("Commune de Fès", node.get("value").asText());
    assertEquals("AVIS", node.get("source_document").asText());
    assertEquals("2024-03-18", node.get("source_date").asText());
  }

  @Test
  void persistedLayout() {
    ObjectNode extended = om.createObjectNode().put("portal", "marchespublics.gov.ma");
    MetadataRecord record =
        MetadataRecord.builder()
            .tracked(MetadataFields.SUBJECT, "Travaux de voirie", SourceDocument.WEBSITE)
            .field(
                MetadataFields.SUBMISSION_DEADLINE,
                DeadlineValue.builder()
                    .date(TrackedValue.of("2024-05-02", SourceDocument.RC))
                    .build())
            .field(
                MetadataFields.LOTS,
                LotList.of(
                    Lot.builder().lotNumber("1").lotSubject("Voirie").build(),
                    Lot.builder().lotNumber("2").cautionProvisoire("5000").build()))
            .field(
                MetadataFields.KEYWORDS,
                KeywordBuckets.builder().fr(List.of("voirie", "assainissement")).build())
            .field(MetadataFields.WEBSITE_EXTENDED, new OpaqueField(extended))
            .build();

    ObjectNode json = writer.toJson(record);

    assertEquals("WEBSITE", json.get("subject").get("source_document").asText());
    assertTrue(json.get("subject").get("source_date").isNull());

    JsonNode deadline = json.get("submission_deadline");
    assertEquals("2024-05-02", deadline.get("date").get("value").asText());
    assertTrue(deadline.get("time").isNull());

    JsonNode lots = json.get("lots");
    assertEquals(2, lots.size());
    assertEquals("Voirie", lots.get(0).get("lot_subject").asText());
    assertEquals("5000", lots.get(1).get("caution_provisoire").asText());
    assertTrue(lots.get(1).get("lot_subject").isNull());

    JsonNode keywords = json.get("keywords");
    assertEquals(2, keywords.get("keywords_fr").size());
    assertEquals(0, keywords.get("keywords_ar").size());

    assertEquals("marchespublics.gov.ma", json.get("website_extended").get("portal").asText());
    assertNotSame(extended, json.get("website_extended"));
  }
}
