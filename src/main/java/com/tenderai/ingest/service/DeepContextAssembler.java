package com.tenderai.ingest.service;

import com.tenderai.ingest.model.DocumentCategory;
import com.tenderai.ingest.model.ExtractionRecord;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import lombok.extern.log4j.Log4j2;

/** Builds the text context handed to deep analysis from a tender's extracted documents. */
@Log4j2
public class DeepContextAssembler {

  public static final int PER_DOCUMENT_CHARS = 8000;
  public static final int TOTAL_CHARS = 30000;

  static final String CONTACT_HEADER = "=== CONTACT ADMINISTRATIF (Site Web - à structurer) ===";

  /**
   * Documents in addendum, specification, rules, notice order, each as a {@code === LABEL: f ===}
   * block, then the website contact block when present.
   *
   * @return "" when no document has text
   */
  public String assemble(Collection<ExtractionRecord> documents, String websiteContact) {
    List<String> parts = new ArrayList<>();
    for (DocumentCategory category : TenderDocumentOrchestrator.DEEP_CONTEXT_ORDER) {
      for (ExtractionRecord doc : documents) {
        if (doc.getCategory() != category || !doc.hasText()) continue;
        String text = doc.getFullText();
        if (text.length() > PER_DOCUMENT_CHARS) text = text.substring(0, PER_DOCUMENT_CHARS);
        parts.add("=== " + category.getLabel() + ": " + doc.getFilename() + " ===\n" + text);
      }
    }
    if (parts.isEmpty()) {
      log.warn("deepContext.empty documents={}", documents.size());
      return "";
    }
    String context = String.join("\n\n", parts);
    if (websiteContact != null && !websiteContact.isBlank()) {
      context += "\n\n" + CONTACT_HEADER + "\n" + websiteContact;
    }
    if (context.length() > TOTAL_CHARS) {
      context = context.substring(0, TOTAL_CHARS);
    }
    log.debug("deepContext.done blocks={} chars={}", parts.size(), context.length());
    return context;
  }
}
