package com.tenderai.ingest.service.format;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.tenderai.ingest.TestDocuments;
import com.tenderai.ingest.service.DocumentProcessingException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class PdfDocumentReaderTest {

  private final PdfDocumentReader reader = new PdfDocumentReader();

  @Test
  void scannedThresholdIsHundredCharacters() {
    assertTrue(reader.firstPage(TestDocuments.pdf("x".repeat(99))).isScanned());
    assertFalse(reader.firstPage(TestDocuments.pdf("x".repeat(100))).isScanned());
    assertTrue(PdfDocumentReader.isScanned(null));
    assertTrue(PdfDocumentReader.isScanned("   " + "y".repeat(99) + "\n\n"));
  }

  @Test
  void pageWithoutTextIsScanned() {
    PdfDocumentReader.FirstPage first = reader.firstPage(TestDocuments.pdf(""));
    assertTrue(first.isScanned());
    assertEquals("", first.getText().strip());
  }

  @Test
  void unreadableBytesAreTreatedAsScanned() {
    PdfDocumentReader.FirstPage first =
        reader.firstPage("not a pdf".getBytes(StandardCharsets.US_ASCII));
    assertTrue(first.isScanned());
    assertEquals("", first.getText());
  }

  @Test
  void fullTextJoinsPages() {
    PdfDocumentReader.PdfText text = reader.fullText(TestDocuments.pdf("Page un", "Page deux"));
    assertEquals(2, text.getPageCount());
    assertTrue(text.getText().contains("Page un"));
    assertTrue(text.getText().indexOf("Page deux") > text.getText().indexOf("Page un"));
  }

  @Test
  void fullTextRejectsGarbage() {
    DocumentProcessingException e =
        assertThrows(DocumentProcessingException.class, () -> reader.fullText(new byte[] {1, 2}));
    assertEquals(DocumentProcessingException.Kind.PARSE_FAILURE, e.getKind());
  }

  @Test
  void renderPagesHonoursLimit() {
    byte[] pdf = TestDocuments.pdf("a", "b", "c");
    List<Integer> seen = new ArrayList<>();

    assertEquals(2, reader.renderPages(pdf, 36, 2, (i, image) -> seen.add(i)));
    assertEquals(List.of(0, 1), seen);
    assertEquals(3, reader.renderPages(pdf, 36, 0, (i, image) -> {}));
  }
}
