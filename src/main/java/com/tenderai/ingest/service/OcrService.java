package com.tenderai.ingest.service;

import com.tenderai.ingest.config.IngestProperties;
import com.tenderai.ingest.service.DocumentProcessingException.Kind;
import com.tenderai.ingest.service.format.PdfDocumentReader;
import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import lombok.extern.log4j.Log4j2;
import net.sourceforge.tess4j.ITesseract;
import net.sourceforge.tess4j.Tesseract;
import net.sourceforge.tess4j.TesseractException;

/**
 * Tesseract OCR of PDF pages with the fixed French + Arabic + English model.
 *
 * <p>Rendering and recognition of a document run as one task on the {@link ConversionPool}. A
 * {@link Tesseract} instance is not thread safe, so each task builds its own engine.
 */
@Log4j2
public class OcrService {

  private final IngestProperties.Ocr config;
  private final PdfDocumentReader pdfReader;
  private final ConversionPool pool;

  public OcrService(IngestProperties.Ocr config, PdfDocumentReader pdfReader, ConversionPool pool) {
    this.config = Objects.requireNonNull(config, "config must not be null");
    this.pdfReader = Objects.requireNonNull(pdfReader, "pdfReader must not be null");
    this.pool = Objects.requireNonNull(pool, "pool must not be null");
  }

  /**
   * Renders and recognizes up to {@code maxPages} pages (all when {@code maxPages <= 0}).
   *
   * @return one text per rendered page, in page order
   * @throws DocumentProcessingException {@code CONVERSION_FAILURE} when rendering or OCR fails
   */
  public List<String> ocrPages(String filename, byte[] pdfBytes, int maxPages) {
    return pool.call(
        "ocr " + filename,
        () -> {
          ITesseract engine = newEngine();
          List<String> pages = new ArrayList<>();
          pdfReader.renderPages(
              pdfBytes,
              config.getDpi(),
              maxPages,
              (i, image) -> pages.add(recognize(engine, image)));
          log.info("ocr.done file={} pages={}", filename, pages.size());
          return pages;
        });
  }

  String recognize(ITesseract engine, BufferedImage image) {
    try {
      String text = engine.doOCR(image);
      return text == null ? "" : text;
    } catch (TesseractException e) {
      throw new DocumentProcessingException(
          Kind.CONVERSION_FAILURE, "Tesseract failed: " + e.getMessage(), e);
    }
  }

  protected ITesseract newEngine() {
    Tesseract t = new Tesseract();
    if (config.getDataPath() != null && !config.getDataPath().isBlank()) {
      t.setDatapath(config.getDataPath());
    }
    t.setLanguage(config.getLanguages());
    t.setOcrEngineMode(config.getEngineMode());
    t.setPageSegMode(config.getPageSegMode());
    t.setVariable("user_defined_dpi", String.valueOf(config.getDpi()));
    return t;
  }
}
