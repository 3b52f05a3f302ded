package com.tenderai.ingest.service.format;

import com.tenderai.ingest.service.DocumentProcessingException;
import com.tenderai.ingest.service.DocumentProcessingException.Kind;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import lombok.Value;
import lombok.extern.log4j.Log4j2;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.rendering.ImageType;
import org.apache.pdfbox.rendering.PDFRenderer;
import org.apache.pdfbox.text.PDFTextStripper;

/** PDFBox-backed digital text extraction, scanned-page detection and page rendering. */
@Log4j2
public class PdfDocumentReader {

  /**
   * A first page with fewer digital characters than this (after trimming) is treated as a scan.
   * Empirical constant; change only with explicit sign-off.
   */
  public static final int SCANNED_TEXT_THRESHOLD = 100;

  /** Digital text of page 1 and the scan verdict derived from it. */
  @Value
  public static class FirstPage {
    String text;
    boolean scanned;
  }

  /** Full digital text and page count. */
  @Value
  public static class PdfText {
    String text;
    int pageCount;
  }

  /** Receives each rendered page; returning normally moves on to the next page. */
  @FunctionalInterface
  public interface PageVisitor {
    void visit(int pageIndex, BufferedImage image);
  }

  public static boolean isScanned(String digitalText) {
    return digitalText == null || digitalText.strip().length() < SCANNED_TEXT_THRESHOLD;
  }

  /**
   * Digital text of the first page. Unreadable or empty documents are reported as scanned with no
   * text so the caller falls back to OCR.
   */
  public FirstPage firstPage(byte[] bytes) {
    try (PDDocument doc = Loader.loadPDF(bytes)) {
      if (doc.getNumberOfPages() == 0) {
        return new FirstPage("", true);
      }
      String text = pageText(doc, 1);
      return new FirstPage(text, isScanned(text));
    } catch (IOException e) {
      log.warn("pdf.firstPage unreadable, assuming scanned msg={}", e.getMessage());
      return new FirstPage("", true);
    }
  }

  /** Per-page digital text joined with blank lines. */
  public PdfText fullText(byte[] bytes) {
    try (PDDocument doc = Loader.loadPDF(bytes)) {
      int pages = doc.getNumberOfPages();
      List<String> parts = new ArrayList<>(pages);
      for (int p = 1; p <= pages; p++) {
        parts.add(pageText(doc, p));
      }
      return new PdfText(String.join("\n\n", parts), pages);
    } catch (IOException e) {
      throw new DocumentProcessingException(
          Kind.PARSE_FAILURE, "PDF rejected: " + e.getMessage(), e);
    }
  }

  /**
   * Renders up to {@code maxPages} pages (all when {@code maxPages <= 0}) one at a time, so only a
   * single page image is alive at any moment.
   *
   * @return number of pages rendered
   */
  public int renderPages(byte[] bytes, int dpi, int maxPages, PageVisitor visitor) {
    try (PDDocument doc = Loader.loadPDF(bytes)) {
      int pages = doc.getNumberOfPages();
      int limit = maxPages <= 0 ? pages : Math.min(pages, maxPages);
      PDFRenderer renderer = new PDFRenderer(doc);
      for (int i = 0; i < limit; i++) {
        BufferedImage image = renderer.renderImageWithDPI(i, dpi, ImageType.RGB);
        visitor.visit(i, image);
      }
      return limit;
    } catch (IOException e) {
      throw new DocumentProcessingException(
          Kind.CONVERSION_FAILURE, "PDF page rendering failed: " + e.getMessage(), e);
    }
  }

  private static String pageText(PDDocument doc, int page) throws IOException {
    PDFTextStripper stripper = new PDFTextStripper();
    stripper.setStartPage(page);
    stripper.setEndPage(page);
    String text = stripper.getText(doc);
    return text == null ? "" : text;
  }
}
