package com.tenderai.ingest.service.format;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.tenderai.ingest.TestDocuments;
import com.tenderai.ingest.model.FileType;
import com.tenderai.ingest.service.DocumentProcessingException;
import org.junit.jupiter.api.Test;

class SpreadsheetReaderTest {

  private final SpreadsheetReader reader = new SpreadsheetReader();

  private static final Object[][] ROWS = {
    {"N°", "Désignation", "Quantité"}, {}, {"1", "Bitume", 120}
  };

  @Test
  void fullTextMarksEverySheetAndSkipsBlankRows() {
    byte[] xlsx = TestDocuments.xlsx(new String[] {"DQE", "BPDE"}, ROWS);

    assertEquals(
        "=== Sheet: DQE ===\n"
            + "N° | Désignation | Quantité\n"
            + "1 | Bitume | 120\n"
            + "=== Sheet: BPDE ===\n"
            + "N° | Désignation | Quantité\n"
            + "1 | Bitume | 120",
        reader.fullText(xlsx, FileType.XLSX));
  }

  @Test
  void sampleReadsFirstSheetOnly() {
    byte[] xlsx = TestDocuments.xlsx(new String[] {"DQE", "BPDE"}, ROWS);
    assertEquals("N° | Désignation | Quantité\n1 | Bitume | 120", reader.sample(xlsx));
  }

  @Test
  void sampleCapsRows() {
    Object[][] rows = new Object[30][];
    for (int i = 0; i < rows.length; i++) rows[i] = new Object[] {"r" + i};
    String sample = reader.sample(TestDocuments.xlsx(new String[] {"S"}, rows));
    assertEquals(SpreadsheetReader.SAMPLE_ROWS, sample.split("\n").length);
  }

  @Test
  void garbageFailsBothReadPaths() {
    DocumentProcessingException e =
        assertThrows(
            DocumentProcessingException.class,
            () -> reader.fullText(new byte[] {9, 9, 9}, FileType.XLSX));
    assertEquals(DocumentProcessingException.Kind.PARSE_FAILURE, e.getKind());
  }
}
