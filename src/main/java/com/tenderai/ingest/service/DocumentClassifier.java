package com.tenderai.ingest.service;

import com.tenderai.ingest.model.ClassificationRecord;
import com.tenderai.ingest.model.DocumentCategory;
import com.tenderai.ingest.model.FileType;
import com.tenderai.ingest.model.RawFile;
import com.tenderai.ingest.service.DocumentProcessingException.Kind;
import com.tenderai.ingest.service.format.LegacyDocConverter;
import com.tenderai.ingest.service.format.PdfDocumentReader;
import com.tenderai.ingest.service.format.SpreadsheetReader;
import com.tenderai.ingest.service.format.WordDocumentReader;
import com.tenderai.ingest.util.TextUtils;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;
import lombok.extern.log4j.Log4j2;

/**
 * First-pass scan of one file: a bounded text sample plus a category guess.
 *
 * <p>Never performs full extraction. Per-file failures come back as records with {@code
 * success=false}.
 */
@Log4j2
public class DocumentClassifier {

  static final int TEXT_SAMPLE_BYTES = 2000;
  static final int EXTERNAL_MIN_CHARS = 20;
  static final int EXTERNAL_SCANNED_WORDS = 500;
  static final int EXTERNAL_DIGITAL_CHARS = 2000;

  private final PdfDocumentReader pdfReader;
  private final WordDocumentReader wordReader;
  private final SpreadsheetReader spreadsheetReader;
  private final LegacyDocConverter legacyDocConverter;
  private final OcrService ocrService;
  private final ExternalDocumentClassifier externalClassifier;
  private final boolean externalEnabled;

  public DocumentClassifier(
      PdfDocumentReader pdfReader,
      WordDocumentReader wordReader,
      SpreadsheetReader spreadsheetReader,
      LegacyDocConverter legacyDocConverter,
      OcrService ocrService,
      ExternalDocumentClassifier externalClassifier,
      boolean externalEnabled) {
    this.pdfReader = Objects.requireNonNull(pdfReader, "pdfReader must not be null");
    this.wordReader = Objects.requireNonNull(wordReader, "wordReader must not be null");
    this.spreadsheetReader =
        Objects.requireNonNull(spreadsheetReader, "spreadsheetReader must not be null");
    this.legacyDocConverter =
        Objects.requireNonNull(legacyDocConverter, "legacyDocConverter must not be null");
    this.ocrService = Objects.requireNonNull(ocrService, "ocrService must not be null");
    this.externalClassifier = externalClassifier;
    this.externalEnabled = externalEnabled && externalClassifier != null;
  }

  public ClassificationRecord classify(RawFile file) {
    byte[] bytes = file.getBytes();
    boolean scanned = false;
    String sample;
    try {
      switch (file.getType()) {
        case PDF:
          PdfDocumentReader.FirstPage first = pdfReader.firstPage(bytes);
          scanned = first.isScanned();
          sample = scanned ? ocrSample(file, bytes, first.getText()) : first.getText();
          break;
        case DOCX:
          sample = wordReader.sample(bytes);
          break;
        case DOC:
          sample = legacyDocConverter.sample(bytes);
          break;
        case XLSX:
        case XLS:
          sample = spreadsheetReader.sample(bytes);
          break;
        case TXT:
          sample =
              new String(
                  Arrays.copyOf(bytes, Math.min(bytes.length, TEXT_SAMPLE_BYTES)),
                  StandardCharsets.UTF_8);
          break;
        default:
          String error =
              new DocumentProcessingException(
                      Kind.UNSUPPORTED_FORMAT,
                      "Unsupported file type: " + FileType.extensionOf(file.getFilename()))
                  .describe();
          log.info("classifier.skip file={} reason={}", file.getFilename(), error);
          return ClassificationRecord.failed(file, error);
      }
    } catch (DocumentProcessingException e) {
      log.error("classifier.failed file={} error={}", file.getFilename(), e.describe(), e);
      return ClassificationRecord.failed(file, e.describe());
    } catch (RuntimeException e) {
      log.error("classifier.failed file={}", file.getFilename(), e);
      return ClassificationRecord.failed(file, Kind.PARSE_FAILURE + ": " + e.getMessage());
    }

    DocumentCategory category = categorize(sample, file.getFilename(), scanned, externalEnabled);
    log.info(
        "classifier.done file={} category={} scanned={} sampleChars={}",
        file.getFilename(),
        category.getLabel(),
        scanned,
        sample.length());
    return ClassificationRecord.builder()
        .filename(file.getFilename())
        .sampleText(sample)
        .category(category)
        .scanned(scanned)
        .mime(file.getMime())
        .size(file.getSize())
        .success(true)
        .build();
  }

  /** Classifies every file in input order. */
  public List<ClassificationRecord> classifyAll(List<RawFile> files) {
    return files.stream().map(this::classify).collect(Collectors.toList());
  }

  /**
   * Filename rules, then content keywords, then (when allowed) the external classifier. Without
   * the external step the result depends only on {@code text} and {@code filename}.
   */
  public DocumentCategory categorize(
      String text, String filename, boolean scanned, boolean allowExternal) {
    Optional<DocumentCategory> ruled = ClassificationRules.match(text, filename);
    if (ruled.isPresent()) {
      return ruled.get();
    }
    if (allowExternal
        && externalClassifier != null
        && text != null
        && text.strip().length() > EXTERNAL_MIN_CHARS) {
      String input =
          scanned
              ? TextUtils.truncateWords(text, EXTERNAL_SCANNED_WORDS)
              : TextUtils.truncate(text, EXTERNAL_DIGITAL_CHARS);
      try {
        DocumentCategory external = externalClassifier.classify(input, filename, scanned);
        if (external != null && external != DocumentCategory.UNKNOWN) {
          log.info("classifier.external file={} category={}", filename, external.getLabel());
          return external;
        }
      } catch (RuntimeException e) {
        log.warn("classifier.external failed file={} msg={}", filename, e.getMessage());
      }
    }
    log.debug("classifier.ambiguous file={}", filename);
    return DocumentCategory.UNKNOWN;
  }

  /** OCR of page 1; the sparse digital text is kept when OCR fails or reads nothing. */
  private String ocrSample(RawFile file, byte[] bytes, String digitalText) {
    try {
      List<String> pages = ocrService.ocrPages(file.getFilename(), bytes, 1);
      String text = pages.isEmpty() ? "" : pages.get(0).strip();
      if (!text.isEmpty()) {
        return text;
      }
      log.warn("classifier.ocrSample empty file={}", file.getFilename());
    } catch (DocumentProcessingException e) {
      log.error("classifier.ocrSample failed file={} error={}", file.getFilename(), e.describe());
    }
    return digitalText;
  }
}
