package com.tenderai.ingest.model;

import java.util.Locale;
import org.apache.commons.io.FilenameUtils;

/** File formats the ingest core knows how to sample and extract, keyed by extension. */
public enum FileType {
  PDF("pdf", "application/pdf"),
  DOCX("docx", "application/vnd.openxmlformats-officedocument.wordprocessingml.document"),
  DOC("doc", "application/msword"),
  XLSX("xlsx", "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet"),
  XLS("xls", "application/vnd.ms-excel"),
  TXT("txt", "text/plain"),
  UNSUPPORTED("", "application/octet-stream");

  private final String extension;
  private final String mime;

  FileType(String extension, String mime) {
    this.extension = extension;
    this.mime = mime;
  }

  public String getExtension() {
    return extension;
  }

  public String getMime() {
    return mime;
  }

  public boolean isSpreadsheet() {
    return this == XLSX || this == XLS;
  }

  /** Lower-cased extension of {@code filename} without the dot ("" when absent). */
  public static String extensionOf(String filename) {
    if (filename == null) return "";
    String ext = FilenameUtils.getExtension(filename);
    return ext == null ? "" : ext.toLowerCase(Locale.ROOT);
  }

  public static FileType fromFilename(String filename) {
    String ext = extensionOf(filename);
    if (ext.isEmpty()) return UNSUPPORTED;
    for (FileType t : values()) {
      if (t.extension.equals(ext)) return t;
    }
    return UNSUPPORTED;
  }
}
