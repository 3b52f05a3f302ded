package com.tenderai.ingest.model;

import java.util.Arrays;
import java.util.Objects;
import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * One file of a tender bundle as supplied by the caller.
 *
 * <p>Immutable: the content is copied on the way in and on the way out so a pipeline run can never
 * alter the caller's bytes.
 */
@Getter
@EqualsAndHashCode
public final class RawFile {

  private final String filename;

  @Getter(AccessLevel.NONE)
  private final byte[] bytes;

  private final FileType type;

  private RawFile(String filename, byte[] bytes) {
    this.filename = Objects.requireNonNull(filename, "filename must not be null");
    this.bytes = bytes == null ? new byte[0] : Arrays.copyOf(bytes, bytes.length);
    this.type = FileType.fromFilename(filename);
  }

  public static RawFile of(String filename, byte[] bytes) {
    return new RawFile(filename, bytes);
  }

  public byte[] getBytes() {
    return Arrays.copyOf(bytes, bytes.length);
  }

  public long getSize() {
    return bytes.length;
  }

  public String getMime() {
    return type.getMime();
  }

  /** Base name without any directory part, as stored inside archives. */
  public String getBaseName() {
    int slash = Math.max(filename.lastIndexOf('/'), filename.lastIndexOf('\\'));
    return slash >= 0 ? filename.substring(slash + 1) : filename;
  }

  /** Hidden, temporary and archive-metadata entries are never classified. */
  public boolean isHiddenOrTemporary() {
    String base = getBaseName();
    return filename.startsWith(".")
        || filename.startsWith("__")
        || base.startsWith(".")
        || base.startsWith("~$")
        || base.startsWith("__");
  }

  @Override
  public String toString() {
    return "RawFile[" + filename + ", " + bytes.length + " bytes]";
  }
}
