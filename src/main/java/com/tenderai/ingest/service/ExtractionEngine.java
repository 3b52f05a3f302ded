package com.tenderai.ingest.service;

import com.tenderai.ingest.model.DocumentCategory;
import com.tenderai.ingest.model.ExtractionMethod;
import com.tenderai.ingest.model.ExtractionRecord;
import com.tenderai.ingest.model.FileType;
import com.tenderai.ingest.model.RawFile;
import com.tenderai.ingest.service.DocumentProcessingException.Kind;
import com.tenderai.ingest.service.format.LegacyDocConverter;
import com.tenderai.ingest.service.format.PdfDocumentReader;
import com.tenderai.ingest.service.format.SpreadsheetReader;
import com.tenderai.ingest.service.format.WordDocumentReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import lombok.extern.log4j.Log4j2;

/**
 * Full-text extraction of one selected file, digital or OCR.
 *
 * <p>Format failures never escape: they end up as a record with {@code success=false}, an error
 * prefixed with its {@link Kind}, and for OCR, legacy DOC and spreadsheets a sentinel text.
 */
@Log4j2
public class ExtractionEngine {

  private final PdfDocumentReader pdfReader;
  private final WordDocumentReader wordReader;
  private final SpreadsheetReader spreadsheetReader;
  private final LegacyDocConverter legacyDocConverter;
  private final OcrService ocrService;

  public ExtractionEngine(
      PdfDocumentReader pdfReader,
      WordDocumentReader wordReader,
      SpreadsheetReader spreadsheetReader,
      LegacyDocConverter legacyDocConverter,
      OcrService ocrService) {
    this.pdfReader = Objects.requireNonNull(pdfReader, "pdfReader must not be null");
    this.wordReader = Objects.requireNonNull(wordReader, "wordReader must not be null");
    this.spreadsheetReader =
        Objects.requireNonNull(spreadsheetReader, "spreadsheetReader must not be null");
    this.legacyDocConverter =
        Objects.requireNonNull(legacyDocConverter, "legacyDocConverter must not be null");
    this.ocrService = Objects.requireNonNull(ocrService, "ocrService must not be null");
  }

  public ExtractionRecord extractFull(RawFile file, boolean scanned) {
    long t0 = System.currentTimeMillis();
    ExtractionRecord.ExtractionRecordBuilder record =
        ExtractionRecord.builder()
            .filename(file.getFilename())
            .size(file.getSize())
            .mime(file.getMime())
            .method(ExtractionMethod.DIGITAL);
    try {
      byte[] bytes = file.getBytes();
      FileType type = file.getType();
      switch (type) {
        case PDF:
          if (scanned) {
            ocrPdf(file, bytes, record);
          } else {
            PdfDocumentReader.PdfText pdf = pdfReader.fullText(bytes);
            record.fullText(pdf.getText()).pageCount(pdf.getPageCount()).success(true);
          }
          break;
        case DOCX:
          record.fullText(wordReader.fullText(bytes)).success(true);
          break;
        case DOC:
          Optional<String> doc = legacyDocConverter.fullText(bytes);
          if (doc.isPresent()) {
            record.fullText(doc.get()).success(true);
          } else {
            record
                .fullText(LegacyDocConverter.FAILURE_SENTINEL)
                .success(false)
                .error(Kind.CONVERSION_FAILURE + ": no readable text in legacy document");
          }
          break;
        case XLSX:
        case XLS:
          try {
            record.fullText(spreadsheetReader.fullText(bytes, type)).success(true);
          } catch (DocumentProcessingException e) {
            record
                .fullText("[EXCEL EXTRACTION FAILED: " + e.getMessage() + "]")
                .success(false)
                .error(e.describe());
          }
          break;
        case TXT:
          record.fullText(new String(bytes, StandardCharsets.UTF_8)).success(true);
          break;
        default:
          record
              .success(false)
              .error(
                  Kind.UNSUPPORTED_FORMAT
                      + ": Unsupported file type: "
                      + FileType.extensionOf(file.getFilename()));
      }
    } catch (DocumentProcessingException e) {
      log.error("extraction.failed file={} error={}", file.getFilename(), e.describe(), e);
      record.fullText("").pageCount(null).success(false).error(e.describe());
    } catch (RuntimeException e) {
      log.error("extraction.failed file={}", file.getFilename(), e);
      record
          .fullText("")
          .pageCount(null)
          .success(false)
          .error(Kind.PARSE_FAILURE + ": " + e.getMessage());
    }

    ExtractionRecord out = record.build();
    if (out.isSuccess()) {
      out.setCategory(
          ClassificationRules.match(out.getFullText(), out.getFilename())
              .orElse(DocumentCategory.UNKNOWN));
    }
    log.info(
        "extraction.done file={} method={} success={} chars={} pages={} durationMs={}",
        out.getFilename(),
        out.getMethod(),
        out.isSuccess(),
        out.getFullText() == null ? 0 : out.getFullText().length(),
        out.getPageCount(),
        System.currentTimeMillis() - t0);
    return out;
  }

  /** Every page through OCR with {@code --- Page N ---} markers; failures become a sentinel. */
  private void ocrPdf(RawFile file, byte[] bytes, ExtractionRecord.ExtractionRecordBuilder record) {
    record.method(ExtractionMethod.OCR);
    try {
      List<String> pages = ocrService.ocrPages(file.getFilename(), bytes, 0);
      if (pages.isEmpty()) {
        record
            .fullText("[OCR FAILED: No images extracted]")
            .pageCount(0)
            .success(false)
            .error(Kind.CONVERSION_FAILURE + ": No images extracted");
        return;
      }
      List<String> parts = new ArrayList<>(pages.size());
      for (int i = 0; i < pages.size(); i++) {
        parts.add("--- Page " + (i + 1) + " ---\n" + pages.get(i));
      }
      record.fullText(String.join("\n\n", parts).strip()).pageCount(pages.size()).success(true);
    } catch (DocumentProcessingException e) {
      log.error("extraction.ocr failed file={} error={}", file.getFilename(), e.describe());
      record
          .fullText("[OCR FAILED: " + e.getMessage() + "]")
          .pageCount(0)
          .success(false)
          .error(e.describe());
    }
  }
}
