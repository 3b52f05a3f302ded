package com.tenderai.ingest.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.tenderai.ingest.model.ClassificationRecord;
import com.tenderai.ingest.model.DocumentCategory;
import com.tenderai.ingest.model.ExtractionRecord;
import com.tenderai.ingest.model.Phase1Source;
import com.tenderai.ingest.model.PipelineResult;
import com.tenderai.ingest.model.RawFile;
import com.tenderai.ingest.model.TenderBundle;
import com.tenderai.ingest.model.WebsiteNotice;
import com.tenderai.ingest.model.metadata.MetadataFields;
import com.tenderai.ingest.model.metadata.MetadataRecord;
import com.tenderai.ingest.model.metadata.SourceDocument;
import com.tenderai.ingest.service.format.LegacyDocConverter;
import com.tenderai.ingest.service.format.PdfDocumentReader;
import com.tenderai.ingest.service.format.SpreadsheetReader;
import com.tenderai.ingest.service.format.WordDocumentReader;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TenderDocumentOrchestratorTest {

  private MetadataFragmentExtractor fragments;
  private DocumentClassifier classifier;
  private ExtractionEngine engine;
  private TenderDocumentOrchestrator orchestrator;

  @BeforeEach
  void setUp() {
    OcrService ocr = mock(OcrService.class);
    LegacyDocConverter legacyDoc = mock(LegacyDocConverter.class);
    PdfDocumentReader pdf = new PdfDocumentReader();
    WordDocumentReader word = new WordDocumentReader();
    SpreadsheetReader sheets = new SpreadsheetReader();
    classifier = spy(new DocumentClassifier(pdf, word, sheets, legacyDoc, ocr, null, false));
    engine = spy(new ExtractionEngine(pdf, word, sheets, legacyDoc, ocr));
    fragments = mock(MetadataFragmentExtractor.class);
    when(fragments.extractFragment(anyString(), any())).thenReturn(Optional.empty());
    orchestrator = new TenderDocumentOrchestrator(classifier, engine, fragments);
  }

  static TenderBundle bundle(String... nameThenText) {
    Map<String, byte[]> files = new LinkedHashMap<>();
    for (int i = 0; i < nameThenText.length; i += 2) {
      files.put(nameThenText[i], nameThenText[i + 1].getBytes(StandardCharsets.UTF_8));
    }
    return TenderBundle.of(files, "12/2024");
  }

  static TenderBundle standardBundle() {
    return bundle(
        "avis.txt", "Avis de consultation ouverte n° 12/2024",
        "rc.txt", "Règlement de consultation",
        "cps.txt", "Cahier des prescriptions spéciales",
        "annexe.txt", "Annexe 1 : plans");
  }

  static MetadataRecord partial(SourceDocument src) {
    return MetadataRecord.builder()
        .tracked(MetadataFields.REFERENCE, "12/2024", src)
        .tracked(MetadataFields.SUBJECT, "Voirie", src)
        .build();
  }

  @Test
  void completeSeedExtractsNothing() {
    PipelineResult r =
        orchestrator.runLazy(
            standardBundle(),
            CompletenessOracleTest.complete(SourceDocument.WEBSITE),
            CancellationSignal.none());

    assertEquals(0, r.extractionCount());
    assertTrue(r.isComplete());
    assertEquals(Phase1Source.PRIMARY, r.getSource());
    assertNull(r.getCompletedBy());
    verify(engine, never()).extractFull(any(), anyBoolean());
  }

  @Test
  void waterfallStopsOnceNoticeCompletesRecord() {
    when(fragments.extractFragment(anyString(), eq(SourceDocument.AVIS)))
        .thenReturn(Optional.of(CompletenessOracleTest.complete(SourceDocument.AVIS)));

    PipelineResult r =
        orchestrator.runLazy(
            standardBundle(), partial(SourceDocument.WEBSITE), CancellationSignal.none());

    assertEquals(
        List.of(DocumentCategory.PRIMARY_NOTICE), List.copyOf(r.getExtractions().keySet()));
    assertEquals(DocumentCategory.PRIMARY_NOTICE, r.getCompletedBy());
    assertEquals(Phase1Source.PRIMARY, r.getSource());
    assertEquals(
        SourceDocument.WEBSITE,
        r.getMetadata().tracked(MetadataFields.SUBJECT).getSourceDocument());
  }

  @Test
  void fallsBackToRulesAndSpecification() {
    when(fragments.extractFragment(anyString(), eq(SourceDocument.CPS)))
        .thenReturn(Optional.of(CompletenessOracleTest.complete(SourceDocument.CPS)));

    PipelineResult r = orchestrator.runLazy(standardBundle(), null, CancellationSignal.none());

    assertEquals(
        List.of(
            DocumentCategory.PRIMARY_NOTICE,
            DocumentCategory.RULES,
            DocumentCategory.SPECIFICATION),
        List.copyOf(r.getExtractions().keySet()));
    assertEquals(Phase1Source.FALLBACK, r.getSource());
    assertEquals(DocumentCategory.SPECIFICATION, r.getCompletedBy());
  }

  @Test
  void exhaustedWaterfallIsIncomplete() {
    PipelineResult r = orchestrator.runLazy(standardBundle(), null, CancellationSignal.none());

    assertFalse(r.isComplete());
    assertEquals(Phase1Source.NONE, r.getSource());
    assertEquals(3, r.extractionCount());
    assertNull(r.getMetadata());
  }

  @Test
  void multiTenderNoticeIsSkipped() {
    TenderBundle b =
        bundle(
            "avis.txt", "Avis : liste des appels d'offres de la semaine",
            "rc.txt", "Règlement de consultation");

    PipelineResult r = orchestrator.runLazy(b, null, CancellationSignal.none());

    assertEquals(List.of(DocumentCategory.RULES), List.copyOf(r.getExtractions().keySet()));
    verify(fragments, never()).extractFragment(anyString(), eq(SourceDocument.AVIS));
  }

  @Test
  void noUsableDocument() {
    PipelineResult r =
        orchestrator.runLazy(
            bundle("photo.jpg", "x", "notes.txt", "rien d'utile ici"),
            null,
            CancellationSignal.none());

    assertTrue(r.isNoUsableDocument());
    assertEquals(0, r.extractionCount());
    assertEquals(2, r.getClassifications().size());
  }

  @Test
  void samplesArePurgedAfterRun() {
    PipelineResult r = orchestrator.runLazy(standardBundle(), null, CancellationSignal.none());
    for (ClassificationRecord c : r.getClassifications()) {
      assertEquals("", c.getSampleText());
    }
  }

  @Test
  void hiddenFilesAreNeverClassified() {
    PipelineResult r =
        orchestrator.runLazy(
            bundle(".avis.txt", "Avis de consultation", "~$rc.txt", "Règlement de consultation"),
            null,
            CancellationSignal.none());
    assertTrue(r.getClassifications().isEmpty());
    assertTrue(r.isNoUsableDocument());
  }

  @Test
  void cancelledBeforeStartDoesNothing() {
    CancellationSignal signal = new CancellationSignal();
    signal.cancel();

    PipelineResult r = orchestrator.runLazy(standardBundle(), null, signal);

    assertTrue(r.isCancelled());
    assertEquals(0, r.extractionCount());
  }

  @Test
  void cancellationBetweenCategories() {
    CancellationSignal signal = new CancellationSignal();
    when(fragments.extractFragment(anyString(), eq(SourceDocument.AVIS)))
        .thenAnswer(
            inv -> {
              signal.cancel();
              return Optional.empty();
            });

    PipelineResult r = orchestrator.runLazy(standardBundle(), null, signal);

    assertTrue(r.isCancelled());
    assertEquals(
        List.of(DocumentCategory.PRIMARY_NOTICE), List.copyOf(r.getExtractions().keySet()));
  }

  @Test
  void assembleAllFollowsDeepContextOrder() {
    PipelineResult r = orchestrator.assembleAll(standardBundle(), CancellationSignal.none());

    assertEquals(
        List.of(
            DocumentCategory.ADDENDUM,
            DocumentCategory.SPECIFICATION,
            DocumentCategory.RULES,
            DocumentCategory.PRIMARY_NOTICE),
        List.copyOf(r.getExtractions().keySet()));
    assertNull(r.getMetadata());
    verify(fragments, never()).extractFragment(anyString(), any());
  }

  @Test
  void assembleAllReusesLazyExtractions() {
    TenderBundle b = standardBundle();
    PipelineResult lazy = orchestrator.runLazy(b, null, CancellationSignal.none());
    Map<DocumentCategory, ExtractionRecord> previous = lazy.getExtractions();

    PipelineResult all = orchestrator.assembleAll(b, lazy, CancellationSignal.none());

    assertSame(
        previous.get(DocumentCategory.RULES), all.getExtractions().get(DocumentCategory.RULES));
    // three waterfall extractions plus the addendum
    verify(engine, times(4)).extractFull(any(), anyBoolean());
  }

  @Test
  void lazyThenAssembleClassifiesEachFileOnce() {
    TenderBundle b = standardBundle();
    PipelineResult lazy = orchestrator.runLazy(b, null, CancellationSignal.none());

    PipelineResult all = orchestrator.assembleAll(b, lazy, CancellationSignal.none());

    verify(classifier, times(4)).classify(any());
    for (RawFile f : b.files()) {
      verify(classifier, times(1)).classify(f);
    }
    assertEquals(4, lazy.getSelection().size());
    assertEquals(lazy.getSelection(), all.getSelection());
  }

  @Test
  void ingestClassifiesEachFileOnce() {
    TenderIngestService ingest =
        new TenderIngestService(orchestrator, fragments, new DeepContextAssembler());
    TenderBundle b =
        bundle(
            "avis.txt", "Avis de consultation ouverte n° 12/2024",
            "rc.txt", "Règlement de consultation");

    ingest.ingest(b, new WebsiteNotice());

    verify(classifier, times(2)).classify(any());
    verify(engine, times(2)).extractFull(any(), anyBoolean());
  }

  @Test
  void selectionOverridesExtractionCategory() {
    // the sample only sees the specification heading, the full text also names the rules
    String text =
        "Cahier des prescriptions spéciales " + "x".repeat(3000) + " règlement de consultation";
    PipelineResult r =
        orchestrator.assembleAll(bundle("piece.txt", text), CancellationSignal.none());

    assertEquals(
        List.of(DocumentCategory.SPECIFICATION), List.copyOf(r.getExtractions().keySet()));
    assertEquals(
        DocumentCategory.SPECIFICATION,
        r.getExtractions().get(DocumentCategory.SPECIFICATION).getCategory());
  }
}
