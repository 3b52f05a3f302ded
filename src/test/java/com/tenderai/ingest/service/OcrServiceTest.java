package com.tenderai.ingest.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.tenderai.ingest.TestDocuments;
import com.tenderai.ingest.config.IngestProperties;
import com.tenderai.ingest.service.format.PdfDocumentReader;
import java.awt.image.BufferedImage;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import net.sourceforge.tess4j.ITesseract;
import net.sourceforge.tess4j.TesseractException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OcrServiceTest {

  private ExecutorService executor;
  private ITesseract engine;
  private OcrService ocr;

  @BeforeEach
  void setUp() {
    executor = Executors.newFixedThreadPool(2);
    engine = mock(ITesseract.class);
    IngestProperties.Ocr config = new IngestProperties.Ocr();
    config.setDpi(36);
    ocr =
        new OcrService(config, new PdfDocumentReader(), new ConversionPool(executor)) {
          @Override
          protected ITesseract newEngine() {
            return engine;
          }
        };
  }

  @AfterEach
  void tearDown() {
    executor.shutdownNow();
  }

  @Test
  void onePageTextPerRenderedPage() throws TesseractException {
    when(engine.doOCR(any(BufferedImage.class))).thenReturn("page", (String) null);

    List<String> pages = ocr.ocrPages("scan.pdf", TestDocuments.pdf("", ""), 0);

    assertEquals(List.of("page", ""), pages);
  }

  @Test
  void maxPagesLimitsWork() throws TesseractException {
    when(engine.doOCR(any(BufferedImage.class))).thenReturn("p");

    assertEquals(1, ocr.ocrPages("scan.pdf", TestDocuments.pdf("", "", ""), 1).size());
    verify(engine, times(1)).doOCR(any(BufferedImage.class));
  }

  @Test
  void engineFailureIsConversionFailure() throws TesseractException {
    when(engine.doOCR(any(BufferedImage.class))).thenThrow(new TesseractException("no tessdata"));

    DocumentProcessingException e =
        assertThrows(
            DocumentProcessingException.class,
            () -> ocr.ocrPages("scan.pdf", TestDocuments.pdf(""), 0));
    assertEquals(DocumentProcessingException.Kind.CONVERSION_FAILURE, e.getKind());
  }

  @Test
  void unreadablePdfIsConversionFailure() {
    DocumentProcessingException e =
        assertThrows(
            DocumentProcessingException.class,
            () -> ocr.ocrPages("scan.pdf", new byte[] {1, 2, 3}, 0));
    assertEquals(DocumentProcessingException.Kind.CONVERSION_FAILURE, e.getKind());
  }
}
