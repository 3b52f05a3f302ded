package com.tenderai.ingest.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.same;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tenderai.ingest.model.DocumentCategory;
import com.tenderai.ingest.model.ExtractionRecord;
import com.tenderai.ingest.model.Phase1Source;
import com.tenderai.ingest.model.PipelineResult;
import com.tenderai.ingest.model.TenderBundle;
import com.tenderai.ingest.model.TenderIngestResult;
import com.tenderai.ingest.model.WebsiteNotice;
import com.tenderai.ingest.model.metadata.MetadataFields;
import com.tenderai.ingest.model.metadata.MetadataRecord;
import com.tenderai.ingest.model.metadata.OpaqueField;
import com.tenderai.ingest.model.metadata.SourceDocument;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TenderIngestServiceTest {

  private TenderDocumentOrchestrator orchestrator;
  private MetadataFragmentExtractor fragments;
  private TenderIngestService service;

  @BeforeEach
  void setUp() {
    orchestrator = mock(TenderDocumentOrchestrator.class);
    fragments = mock(MetadataFragmentExtractor.class);
    service = new TenderIngestService(orchestrator, fragments, new DeepContextAssembler());
    when(orchestrator.assembleAll(any(), any(CancellationSignal.class)))
        .thenReturn(PipelineResult.builder().build());
    when(orchestrator.assembleAll(any(), any(PipelineResult.class), any()))
        .thenReturn(PipelineResult.builder().build());
  }

  private static TenderBundle oneFile() {
    return TenderBundle.of(Map.of("avis.pdf", new byte[] {1}), null);
  }

  private static WebsiteNotice website(String contact) {
    return WebsiteNotice.builder()
        .reference("WEB-7")
        .consultationText("Consultation n° 12/2024 : travaux de voirie")
        .contactAdministratif(contact)
        .build();
  }

  @Test
  void completeWebsiteSkipsDocuments() {
    when(fragments.extractFragment(anyString(), eq(SourceDocument.WEBSITE)))
        .thenReturn(Optional.of(CompletenessOracleTest.complete(SourceDocument.WEBSITE)));

    TenderIngestResult r = service.ingest(oneFile(), website(null));

    assertEquals(TenderIngestResult.Status.LISTED, r.getStatus());
    assertEquals(Phase1Source.PRIMARY, r.getPhase1Source());
    assertEquals("AO-12/2024", r.getExternalReference());
    verify(orchestrator, never()).runLazy(any(), any(), any());
    verify(orchestrator).assembleAll(any(), any(CancellationSignal.class));
  }

  @Test
  void incompleteWebsiteSeedsWaterfall() {
    MetadataRecord partial =
        MetadataRecord.builder()
            .tracked(MetadataFields.SUBJECT, "Voirie", SourceDocument.WEBSITE)
            .build();
    when(fragments.extractFragment(anyString(), eq(SourceDocument.WEBSITE)))
        .thenReturn(Optional.of(partial));
    Map<DocumentCategory, ExtractionRecord> lazyExtractions = new LinkedHashMap<>();
    lazyExtractions.put(
        DocumentCategory.RULES,
        ExtractionRecord.builder().filename("rc.pdf").fullText("rc").success(true).build());
    PipelineResult lazy =
        PipelineResult.builder()
            .metadata(CompletenessOracleTest.complete(SourceDocument.RC))
            .source(Phase1Source.FALLBACK)
            .extractions(lazyExtractions)
            .build();
    when(orchestrator.runLazy(any(), eq(partial), any())).thenReturn(lazy);

    TenderIngestResult r = service.ingest(oneFile(), website(null));

    assertEquals(Phase1Source.FALLBACK, r.getPhase1Source());
    verify(orchestrator).assembleAll(any(), same(lazy), any());
    verify(orchestrator, never()).assembleAll(any(), any(CancellationSignal.class));
  }

  @Test
  void bundleGetsWebsiteReferenceForDiagnostics() {
    when(fragments.extractFragment(anyString(), any())).thenReturn(Optional.empty());
    when(orchestrator.runLazy(any(), any(), any()))
        .thenAnswer(
            inv -> {
              TenderBundle b = inv.getArgument(0);
              assertEquals(Optional.of("WEB-7"), b.tenderReference());
              return PipelineResult.builder().build();
            });

    service.ingest(oneFile(), website(null));

    verify(orchestrator).runLazy(any(), any(), any());
  }

  @Test
  void nothingExtractedIsError() {
    when(fragments.extractFragment(anyString(), any())).thenReturn(Optional.empty());
    when(orchestrator.runLazy(any(), any(), any())).thenReturn(PipelineResult.builder().build());

    TenderIngestResult r = service.ingest(oneFile(), website(null));

    assertEquals(TenderIngestResult.Status.ERROR, r.getStatus());
    assertEquals(TenderIngestService.PHASE1_FAILED, r.getErrorMessage());
    assertEquals(Phase1Source.NONE, r.getPhase1Source());
  }

  @Test
  void noWebsiteAndNoFilesIsError() {
    TenderIngestResult r = service.ingest(TenderBundle.empty(), null);

    assertEquals(TenderIngestResult.Status.ERROR, r.getStatus());
    assertTrue(r.getDocuments().isEmpty());
    verify(orchestrator, never()).assembleAll(any(), any(CancellationSignal.class));
    verify(orchestrator, never()).assembleAll(any(), any(PipelineResult.class), any());
  }

  @Test
  void contactIsKeptUnderWebsiteExtended() {
    when(fragments.extractFragment(anyString(), eq(SourceDocument.WEBSITE)))
        .thenReturn(Optional.of(CompletenessOracleTest.complete(SourceDocument.WEBSITE)));
    Map<DocumentCategory, ExtractionRecord> all = new LinkedHashMap<>();
    all.put(
        DocumentCategory.RULES,
        ExtractionRecord.builder()
            .filename("rc.pdf")
            .category(DocumentCategory.RULES)
            .fullText("texte du rc")
            .success(true)
            .build());
    all.put(
        DocumentCategory.PRIMARY_NOTICE,
        ExtractionRecord.builder().filename("avis.pdf").fullText("").success(false).build());
    when(orchestrator.assembleAll(any(), any(CancellationSignal.class)))
        .thenReturn(PipelineResult.builder().extractions(all).build());

    TenderIngestResult r = service.ingest(oneFile(), website("M. Alami, tél 0522"));

    OpaqueField extended = (OpaqueField) r.getMetadata().get(MetadataFields.WEBSITE_EXTENDED);
    JsonNode contact = extended.getNode().get(TenderIngestService.CONTACT_KEY);
    assertEquals("M. Alami, tél 0522", contact.get("value").asText());
    assertEquals("WEBSITE", contact.get("source_document").asText());
    assertTrue(contact.get("source_date").isNull());
    assertEquals(1, r.getDocuments().size());
    assertTrue(r.getDeepContext().startsWith("=== RC: rc.pdf ===\ntexte du rc"));
    assertTrue(r.getDeepContext().endsWith("M. Alami, tél 0522"));
  }

  @Test
  void contactMergesIntoExistingExtendedBlock() {
    ObjectNode existing = JsonNodeFactory.instance.objectNode().put("site", "marchespublics");
    MetadataRecord r =
        TenderIngestService.attachContact(
            MetadataRecord.builder()
                .field(MetadataFields.WEBSITE_EXTENDED, new OpaqueField(existing))
                .build(),
            "contact");

    JsonNode node = ((OpaqueField) r.get(MetadataFields.WEBSITE_EXTENDED)).getNode();
    assertEquals("marchespublics", node.get("site").asText());
    assertEquals("contact", node.get(TenderIngestService.CONTACT_KEY).get("value").asText());
    assertFalse(existing.has(TenderIngestService.CONTACT_KEY));
  }

  @Test
  void cancelledRunSkipsDeepContext() {
    CancellationSignal signal = new CancellationSignal();
    signal.cancel();

    TenderIngestResult r = service.ingest(oneFile(), null, signal);

    assertTrue(r.isCancelled());
    assertNull(r.getDeepContext());
    verify(orchestrator, never()).assembleAll(any(), any(CancellationSignal.class));
    verify(orchestrator, never()).assembleAll(any(), any(PipelineResult.class), any());
  }
}
