package com.tenderai.ingest.service;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
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
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import lombok.extern.log4j.Log4j2;

/**
 * Ingests one tender: website-first Phase-1 metadata, the lazy document waterfall when the webpage
 * leaves required fields open, then full extraction of every selected document for deep context.
 */
@Log4j2
public class TenderIngestService {

  static final String PHASE1_FAILED = "Phase 1 extraction failed (website + documents)";
  static final String CONTACT_KEY = "contact_administratif";

  private final TenderDocumentOrchestrator orchestrator;
  private final MetadataFragmentExtractor fragmentExtractor;
  private final DeepContextAssembler contextAssembler;

  public TenderIngestService(
      TenderDocumentOrchestrator orchestrator,
      MetadataFragmentExtractor fragmentExtractor,
      DeepContextAssembler contextAssembler) {
    this.orchestrator = Objects.requireNonNull(orchestrator, "orchestrator must not be null");
    this.fragmentExtractor =
        Objects.requireNonNull(fragmentExtractor, "fragmentExtractor must not be null");
    this.contextAssembler =
        Objects.requireNonNull(contextAssembler, "contextAssembler must not be null");
  }

  public TenderIngestResult ingest(TenderBundle bundle, WebsiteNotice website) {
    return ingest(bundle, website, CancellationSignal.none());
  }

  public TenderIngestResult ingest(
      TenderBundle bundle, WebsiteNotice website, CancellationSignal signal) {
    TenderBundle docs = bundle == null ? TenderBundle.empty() : bundle;
    WebsiteNotice web = website == null ? new WebsiteNotice() : website;
    String websiteRef = blankToNull(web.getReference());
    String tenderRef = docs.tenderReference().orElse(websiteRef);
    log.info(
        "ingest.start tenderRef={} files={} website={}",
        tenderRef,
        docs.size(),
        web.getConsultationText() != null);

    MetadataRecord merged = websiteFragment(web, tenderRef);
    Phase1Source source =
        CompletenessOracle.isComplete(merged) ? Phase1Source.PRIMARY : Phase1Source.NONE;
    PipelineResult lazy = null;
    boolean cancelled = signal.isCancelled();

    if (!CompletenessOracle.isComplete(merged) && !cancelled) {
      if (docs.isEmpty()) {
        log.warn(
            "ingest.phase1.noDocuments tenderRef={} missing={}",
            tenderRef,
            CompletenessOracle.missingFields(merged));
      } else {
        TenderBundle withRef =
            docs.tenderReference().isPresent() ? docs : docs.withReference(tenderRef);
        lazy = orchestrator.runLazy(withRef, merged, signal);
        merged = lazy.getMetadata();
        source = lazy.getSource();
        cancelled = lazy.isCancelled();
      }
    }

    TenderIngestResult.TenderIngestResultBuilder result =
        TenderIngestResult.builder().phase1Source(source);
    if (merged != null && !merged.isEmpty()) {
      merged = attachContact(merged, web.getContactAdministratif());
      String extractedRef = blankToNull(merged.valueOf(MetadataFields.REFERENCE));
      result
          .status(TenderIngestResult.Status.LISTED)
          .metadata(merged)
          .externalReference(
              extractedRef != null
                  ? extractedRef
                  : websiteRef != null ? websiteRef : docs.tenderReference().orElse(null));
    } else {
      log.error("ingest.phase1.failed tenderRef={}", tenderRef);
      result
          .status(TenderIngestResult.Status.ERROR)
          .errorMessage(PHASE1_FAILED)
          .externalReference(tenderRef);
    }

    if (!cancelled && !docs.isEmpty()) {
      TenderBundle withRef =
          docs.tenderReference().isPresent() ? docs : docs.withReference(tenderRef);
      PipelineResult all =
          lazy == null
              ? orchestrator.assembleAll(withRef, signal)
              : orchestrator.assembleAll(withRef, lazy, signal);
      List<ExtractionRecord> documents =
          all.getExtractions().values().stream()
              .filter(ExtractionRecord::isSuccess)
              .collect(Collectors.toList());
      result
          .documents(documents)
          .deepContext(contextAssembler.assemble(documents, web.getContactAdministratif()));
      cancelled = all.isCancelled();
    }

    TenderIngestResult out = result.cancelled(cancelled).build();
    log.info(
        "ingest.finish tenderRef={} status={} source={} documents={} cancelled={}",
        out.getExternalReference(),
        out.getStatus(),
        out.getPhase1Source(),
        out.getDocuments().size(),
        cancelled);
    return out;
  }

  private MetadataRecord websiteFragment(WebsiteNotice web, String tenderRef) {
    String text = web.getConsultationText();
    if (text == null || text.isBlank()) return null;
    try {
      MetadataRecord fragment =
          fragmentExtractor.extractFragment(text, SourceDocument.WEBSITE).orElse(null);
      log.info(
          "ingest.website tenderRef={} fields={} missing={}",
          tenderRef,
          fragment == null ? 0 : fragment.keys().size(),
          CompletenessOracle.missingFields(fragment));
      return fragment;
    } catch (RuntimeException e) {
      log.error("ingest.website failed tenderRef={}", tenderRef, e);
      return null;
    }
  }

  /** Keeps the raw webpage contact under {@code website_extended} for deep analysis. */
  static MetadataRecord attachContact(MetadataRecord record, String contact) {
    if (contact == null || contact.isBlank()) return record;
    ObjectNode tracked = JsonNodeFactory.instance.objectNode();
    tracked.put("value", contact);
    tracked.put("source_document", SourceDocument.WEBSITE.getLabel());
    tracked.putNull("source_date");

    ObjectNode extended = JsonNodeFactory.instance.objectNode();
    if (record.get(MetadataFields.WEBSITE_EXTENDED) instanceof OpaqueField existing
        && existing.getNode() != null
        && existing.getNode().isObject()) {
      extended = (ObjectNode) existing.getNode().deepCopy();
    }
    extended.set(CONTACT_KEY, tracked);
    return record.with(MetadataFields.WEBSITE_EXTENDED, new OpaqueField(extended));
  }

  private static String blankToNull(String s) {
    return s == null || s.isBlank() ? null : s.trim();
  }
}
