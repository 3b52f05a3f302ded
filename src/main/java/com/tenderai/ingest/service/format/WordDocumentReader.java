package com.tenderai.ingest.service.format;

import com.tenderai.ingest.service.DocumentProcessingException;
import com.tenderai.ingest.service.DocumentProcessingException.Kind;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFTable;
import org.apache.poi.xwpf.usermodel.XWPFTableRow;

/** DOCX text via Apache POI XWPF. */
public class WordDocumentReader {

  /** Paragraphs are collected until this many characters have been seen. */
  public static final int SAMPLE_CHARS = 1000;

  /** Leading paragraphs, roughly the first page. */
  public String sample(byte[] bytes) {
    try (XWPFDocument doc = open(bytes)) {
      List<String> parts = new ArrayList<>();
      int seen = 0;
      for (XWPFParagraph p : doc.getParagraphs()) {
        String text = p.getText();
        parts.add(text);
        seen += text.length();
        if (seen > SAMPLE_CHARS) break;
      }
      return String.join("\n", parts);
    } catch (IOException e) {
      throw parseFailure(e);
    }
  }

  /** All paragraphs, then every table row as pipe-joined cell text. */
  public String fullText(byte[] bytes) {
    try (XWPFDocument doc = open(bytes)) {
      List<String> lines = new ArrayList<>();
      for (XWPFParagraph p : doc.getParagraphs()) {
        lines.add(p.getText());
      }
      for (XWPFTable table : doc.getTables()) {
        for (XWPFTableRow row : table.getRows()) {
          lines.add(
              row.getTableCells().stream()
                  .map(c -> c.getText())
                  .collect(Collectors.joining(" | ")));
        }
      }
      return String.join("\n", lines);
    } catch (IOException e) {
      throw parseFailure(e);
    }
  }

  private static XWPFDocument open(byte[] bytes) throws IOException {
    try {
      return new XWPFDocument(new ByteArrayInputStream(bytes));
    } catch (RuntimeException e) {
      // POI reports broken packages with unchecked exceptions as well
      throw new IOException(e.getMessage(), e);
    }
  }

  private static DocumentProcessingException parseFailure(IOException e) {
    return new DocumentProcessingException(
        Kind.PARSE_FAILURE, "DOCX rejected: " + e.getMessage(), e);
  }
}
