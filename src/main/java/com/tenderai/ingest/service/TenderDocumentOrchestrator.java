package com.tenderai.ingest.service;

import static com.tenderai.ingest.model.DocumentCategory.ADDENDUM;
import static com.tenderai.ingest.model.DocumentCategory.PRIMARY_NOTICE;
import static com.tenderai.ingest.model.DocumentCategory.RULES;
import static com.tenderai.ingest.model.DocumentCategory.SPECIFICATION;

import com.tenderai.ingest.model.ClassificationRecord;
import com.tenderai.ingest.model.DocumentCategory;
import com.tenderai.ingest.model.ExtractionRecord;
import com.tenderai.ingest.model.Phase1Source;
import com.tenderai.ingest.model.PipelineResult;
import com.tenderai.ingest.model.RawFile;
import com.tenderai.ingest.model.TenderBundle;
import com.tenderai.ingest.model.metadata.MetadataRecord;
import com.tenderai.ingest.model.metadata.SourceDocument;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;
import lombok.extern.log4j.Log4j2;

/**
 * Drives one tender bundle through classification, candidate selection and extraction.
 *
 * <p>{@link #runLazy} walks notice, rules and specification and stops as soon as the accumulated
 * record has every required field, so OCR is only paid for when a field is still missing. {@link
 * #assembleAll} extracts every selected addendum, specification, rules and notice for deep
 * analysis, regardless of completeness.
 *
 * <p>A run is single threaded and owns its bundle and records; instances hold no per-run state.
 */
@Log4j2
public class TenderDocumentOrchestrator {

  public static final List<DocumentCategory> WATERFALL =
      List.of(PRIMARY_NOTICE, RULES, SPECIFICATION);

  public static final List<DocumentCategory> DEEP_CONTEXT_ORDER =
      List.of(ADDENDUM, SPECIFICATION, RULES, PRIMARY_NOTICE);

  private final DocumentClassifier classifier;
  private final ExtractionEngine extractionEngine;
  private final MetadataFragmentExtractor fragmentExtractor;

  public TenderDocumentOrchestrator(
      DocumentClassifier classifier,
      ExtractionEngine extractionEngine,
      MetadataFragmentExtractor fragmentExtractor) {
    this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
    this.extractionEngine =
        Objects.requireNonNull(extractionEngine, "extractionEngine must not be null");
    this.fragmentExtractor =
        Objects.requireNonNull(fragmentExtractor, "fragmentExtractor must not be null");
  }

  /**
   * Lazy waterfall seeded with {@code current} (may be null).
   *
   * <p>The oracle is consulted before every extraction; each successful extraction is turned into
   * a fragment and merged into the accumulated record.
   */
  public PipelineResult runLazy(
      TenderBundle bundle, MetadataRecord current, CancellationSignal signal) {
    String tenderRef = bundle.tenderReference().orElse(null);
    List<ClassificationRecord> classifications = classifyBundle(bundle, signal);
    // selection covers every category; assembleAll(bundle, lazy, signal) reuses it
    Map<DocumentCategory, ClassificationRecord> selected =
        selectCandidates(classifications, DEEP_CONTEXT_ORDER, tenderRef);
    boolean usable = WATERFALL.stream().anyMatch(selected::containsKey);

    Map<DocumentCategory, ExtractionRecord> extractions = new LinkedHashMap<>();
    MetadataRecord record = current;
    DocumentCategory completedBy = null;
    boolean cancelled = signal.isCancelled();

    for (DocumentCategory category : WATERFALL) {
      ClassificationRecord choice = selected.get(category);
      if (choice == null) continue;
      if (signal.isCancelled()) {
        log.info("orchestrator.cancelled before={} tenderRef={}", category.getLabel(), tenderRef);
        cancelled = true;
        break;
      }
      if (CompletenessOracle.isComplete(record)) {
        log.info(
            "orchestrator.complete skipping={} tenderRef={}", category.getLabel(), tenderRef);
        break;
      }
      Optional<RawFile> file = bundle.file(choice.getFilename());
      if (file.isEmpty()) continue;

      log.info(
          "orchestrator.extract category={} file={} scanned={} missing={}",
          category.getLabel(),
          choice.getFilename(),
          choice.isScanned(),
          CompletenessOracle.missingFields(record));
      ExtractionRecord extraction = extract(file.get(), choice, category);
      extractions.put(category, extraction);
      if (!extraction.isSuccess()) continue;

      Optional<MetadataRecord> fragment =
          fragment(extraction.getFullText(), SourceDocument.fromCategory(category));
      if (fragment.isPresent()) {
        boolean wasComplete = CompletenessOracle.isComplete(record);
        record = FusionMerger.merge(record, fragment.get());
        if (!wasComplete && CompletenessOracle.isComplete(record)) {
          completedBy = category;
        }
      }
    }

    classifications.forEach(ClassificationRecord::purgeSample);
    boolean complete = CompletenessOracle.isComplete(record);
    Phase1Source source =
        complete ? Phase1Source.forCompletingCategory(completedBy) : Phase1Source.NONE;
    if (!usable) {
      log.warn("orchestrator.noUsableDocument files={} tenderRef={}", bundle.size(), tenderRef);
    }
    log.info(
        "orchestrator.lazy.done tenderRef={} extracted={} complete={} source={} missing={}",
        tenderRef,
        extractions.keySet(),
        complete,
        source,
        CompletenessOracle.missingFields(record));

    return PipelineResult.builder()
        .extractions(extractions)
        .classifications(classifications)
        .selection(selected)
        .metadata(record)
        .source(source)
        .completedBy(completedBy)
        .complete(complete)
        .noUsableDocument(!usable)
        .cancelled(cancelled)
        .build();
  }

  /** Classifies, selects, then extracts every selected category in {@link #DEEP_CONTEXT_ORDER}. */
  public PipelineResult assembleAll(TenderBundle bundle, CancellationSignal signal) {
    List<ClassificationRecord> classifications = classifyBundle(bundle, signal);
    Map<DocumentCategory, ClassificationRecord> selected =
        selectCandidates(
            classifications, DEEP_CONTEXT_ORDER, bundle.tenderReference().orElse(null));
    return assemble(bundle, classifications, selected, Map.of(), signal);
  }

  /**
   * Continues from a {@link #runLazy} result over the same bundle: its classifications and
   * selection are reused as is, and its successful extractions of the same file are not repeated.
   */
  public PipelineResult assembleAll(
      TenderBundle bundle, PipelineResult lazy, CancellationSignal signal) {
    return assemble(
        bundle, lazy.getClassifications(), lazy.getSelection(), lazy.getExtractions(), signal);
  }

  private PipelineResult assemble(
      TenderBundle bundle,
      List<ClassificationRecord> classifications,
      Map<DocumentCategory, ClassificationRecord> selected,
      Map<DocumentCategory, ExtractionRecord> alreadyExtracted,
      CancellationSignal signal) {
    String tenderRef = bundle.tenderReference().orElse(null);
    Map<DocumentCategory, ExtractionRecord> extractions = new LinkedHashMap<>();
    boolean cancelled = signal.isCancelled();
    for (DocumentCategory category : DEEP_CONTEXT_ORDER) {
      ClassificationRecord choice = selected.get(category);
      if (choice == null) continue;
      if (signal.isCancelled()) {
        cancelled = true;
        break;
      }
      ExtractionRecord previous = alreadyExtracted.get(category);
      if (previous != null && previous.isSuccess()
          && choice.getFilename().equals(previous.getFilename())) {
        log.debug(
            "orchestrator.reuse category={} file={}", category.getLabel(), choice.getFilename());
        extractions.put(category, previous);
        continue;
      }
      Optional<RawFile> file = bundle.file(choice.getFilename());
      if (file.isEmpty()) continue;
      extractions.put(category, extract(file.get(), choice, category));
    }

    classifications.forEach(ClassificationRecord::purgeSample);
    log.info(
        "orchestrator.assembleAll.done tenderRef={} extracted={} cancelled={}",
        tenderRef,
        extractions.keySet(),
        cancelled);
    return PipelineResult.builder()
        .extractions(extractions)
        .classifications(classifications)
        .selection(selected)
        .noUsableDocument(selected.isEmpty())
        .cancelled(cancelled)
        .build();
  }

  /** Classifies every visible file once, in bundle order. */
  List<ClassificationRecord> classifyBundle(TenderBundle bundle, CancellationSignal signal) {
    List<ClassificationRecord> out = new ArrayList<>();
    for (RawFile file : bundle.files()) {
      if (signal.isCancelled()) break;
      if (file.isHiddenOrTemporary()) {
        log.debug("orchestrator.skipHidden file={}", file.getFilename());
        continue;
      }
      out.add(classifier.classify(file));
    }
    return out;
  }

  /**
   * Best candidate per category, in {@code order}. A notice flagged as a multi-tender compilation
   * is dropped, so its slot stays empty and the walk falls through to the next category.
   */
  static Map<DocumentCategory, ClassificationRecord> selectCandidates(
      List<ClassificationRecord> classifications,
      List<DocumentCategory> order,
      String tenderReference) {
    Map<DocumentCategory, ClassificationRecord> selected = new LinkedHashMap<>();
    for (DocumentCategory category : order) {
      List<ClassificationRecord> candidates =
          classifications.stream()
              .filter(c -> c.isSuccess() && c.getCategory() == category)
              .collect(Collectors.toList());
      Optional<ClassificationRecord> best = CandidateSelector.selectBest(candidates);
      if (best.isEmpty()) continue;
      if (category == PRIMARY_NOTICE
          && MultiTenderGuard.isMultiTender(best.get().getSampleText(), tenderReference)) {
        log.warn("orchestrator.ignoreNotice file={} reason=multiTender", best.get().getFilename());
        continue;
      }
      selected.put(category, best.get());
    }
    return selected;
  }

  private ExtractionRecord extract(
      RawFile file, ClassificationRecord choice, DocumentCategory category) {
    ExtractionRecord extraction = extractionEngine.extractFull(file, choice.isScanned());
    if (extraction.isSuccess()
        && extraction.getCategory() != category
        && extraction.getCategory() != DocumentCategory.UNKNOWN) {
      log.debug(
          "orchestrator.recategorized file={} selectedAs={} fullTextSays={}",
          file.getFilename(),
          category.getLabel(),
          extraction.getCategory().getLabel());
    }
    extraction.setCategory(category);
    return extraction;
  }

  private Optional<MetadataRecord> fragment(String text, SourceDocument source) {
    try {
      return fragmentExtractor.extractFragment(text, source);
    } catch (RuntimeException e) {
      log.error("orchestrator.fragment failed source={}", source.getLabel(), e);
      return Optional.empty();
    }
  }
}
