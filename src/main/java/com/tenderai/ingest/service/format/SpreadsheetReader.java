package com.tenderai.ingest.service.format;

import com.tenderai.ingest.model.FileType;
import com.tenderai.ingest.service.DocumentProcessingException;
import com.tenderai.ingest.service.DocumentProcessingException.Kind;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.log4j.Log4j2;
import org.apache.poi.hssf.extractor.ExcelExtractor;
import org.apache.poi.hssf.usermodel.HSSFWorkbook;
import org.apache.poi.openxml4j.exceptions.OpenXML4JException;
import org.apache.poi.openxml4j.opc.OPCPackage;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.apache.poi.ss.util.NumberToTextConverter;
import org.apache.poi.xssf.extractor.XSSFEventBasedExcelExtractor;
import org.apache.xmlbeans.XmlException;

/**
 * XLSX / XLS text via Apache POI.
 *
 * <p>The structured read walks sheets and rows; when POI cannot build a workbook model (broken
 * styles, exotic records) the streaming text extractors are tried before giving up.
 */
@Log4j2
public class SpreadsheetReader {

  public static final int SAMPLE_ROWS = 20;

  private static final String CELL_SEPARATOR = " | ";

  /** First non-blank rows of the first sheet. */
  public String sample(byte[] bytes) {
    try (Workbook wb = WorkbookFactory.create(new ByteArrayInputStream(bytes))) {
      if (wb.getNumberOfSheets() == 0) return "";
      DataFormatter formatter = new DataFormatter();
      List<String> lines = new ArrayList<>();
      for (Row row : wb.getSheetAt(0)) {
        String line = rowText(row, formatter);
        if (line == null) continue;
        lines.add(line);
        if (lines.size() >= SAMPLE_ROWS) break;
      }
      return String.join("\n", lines);
    } catch (IOException | RuntimeException e) {
      throw new DocumentProcessingException(
          Kind.PARSE_FAILURE, "Spreadsheet rejected: " + e.getMessage(), e);
    }
  }

  /**
   * Every sheet as a {@code === Sheet: <name> ===} marker followed by its non-blank rows.
   *
   * @throws DocumentProcessingException when neither the structured read nor the text extractor
   *     fallback can read the bytes
   */
  public String fullText(byte[] bytes, FileType type) {
    try (Workbook wb = WorkbookFactory.create(new ByteArrayInputStream(bytes))) {
      DataFormatter formatter = new DataFormatter();
      List<String> lines = new ArrayList<>();
      for (Sheet sheet : wb) {
        lines.add("=== Sheet: " + sheet.getSheetName() + " ===");
        for (Row row : sheet) {
          String line = rowText(row, formatter);
          if (line != null) lines.add(line);
        }
      }
      return String.join("\n", lines);
    } catch (IOException | RuntimeException e) {
      log.warn("spreadsheet.structured failed, trying text extractor msg={}", e.getMessage());
      return fallbackText(bytes, type);
    }
  }

  private String fallbackText(byte[] bytes, FileType type) {
    try {
      if (type == FileType.XLS) {
        try (ExcelExtractor extractor =
            new ExcelExtractor(new HSSFWorkbook(new ByteArrayInputStream(bytes)))) {
          extractor.setIncludeSheetNames(true);
          return extractor.getText();
        }
      }
      try (OPCPackage pkg = OPCPackage.open(new ByteArrayInputStream(bytes));
          XSSFEventBasedExcelExtractor extractor = new XSSFEventBasedExcelExtractor(pkg)) {
        extractor.setIncludeSheetNames(true);
        return extractor.getText();
      }
    } catch (IOException | OpenXML4JException | XmlException | RuntimeException e) {
      throw new DocumentProcessingException(Kind.PARSE_FAILURE, e.getMessage(), e);
    }
  }

  /** Pipe-joined cell text, or null when every cell is empty. */
  private static String rowText(Row row, DataFormatter formatter) {
    short last = row.getLastCellNum();
    if (last <= 0) return null;
    List<String> cells = new ArrayList<>(last);
    boolean any = false;
    for (int i = 0; i < last; i++) {
      String value = cellText(row.getCell(i), formatter);
      any |= !value.isEmpty();
      cells.add(value);
    }
    return any ? String.join(CELL_SEPARATOR, cells) : null;
  }

  /** Cached results for formulas, formatted values otherwise. */
  private static String cellText(Cell cell, DataFormatter formatter) {
    if (cell == null) return "";
    if (cell.getCellType() != CellType.FORMULA) {
      return formatter.formatCellValue(cell);
    }
    switch (cell.getCachedFormulaResultType()) {
      case NUMERIC:
        return NumberToTextConverter.toText(cell.getNumericCellValue());
      case STRING:
        return cell.getStringCellValue();
      case BOOLEAN:
        return String.valueOf(cell.getBooleanCellValue());
      default:
        return "";
    }
  }
}
