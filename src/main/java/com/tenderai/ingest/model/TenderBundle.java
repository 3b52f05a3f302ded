package com.tenderai.ingest.model;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/** The flat {@code filename -> bytes} document set of one tender, plus its reference if known. */
public final class TenderBundle {

  private final Map<String, RawFile> files;
  private final String tenderReference;

  private TenderBundle(Map<String, RawFile> files, String tenderReference) {
    this.files = Collections.unmodifiableMap(files);
    this.tenderReference = tenderReference;
  }

  public static TenderBundle of(Map<String, byte[]> contents, String tenderReference) {
    Map<String, RawFile> files = new LinkedHashMap<>();
    if (contents != null) {
      contents.forEach((name, bytes) -> files.put(name, RawFile.of(name, bytes)));
    }
    return new TenderBundle(files, tenderReference);
  }

  public static TenderBundle of(Map<String, byte[]> contents) {
    return of(contents, null);
  }

  public static TenderBundle empty() {
    return new TenderBundle(new LinkedHashMap<>(), null);
  }

  /** Same files under another tender reference. */
  public TenderBundle withReference(String reference) {
    return new TenderBundle(files, reference);
  }

  public Collection<RawFile> files() {
    return files.values();
  }

  public Optional<RawFile> file(String filename) {
    return Optional.ofNullable(files.get(filename));
  }

  public Optional<String> tenderReference() {
    return Optional.ofNullable(tenderReference);
  }

  public boolean isEmpty() {
    return files.isEmpty();
  }

  public int size() {
    return files.size();
  }
}
