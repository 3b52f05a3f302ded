package com.tenderai.ingest.service;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative stop request for a running tender. Checked between files and categories, never in
 * the middle of a file.
 */
public final class CancellationSignal {

  private final AtomicBoolean cancelled = new AtomicBoolean();

  public static CancellationSignal none() {
    return new CancellationSignal();
  }

  public void cancel() {
    cancelled.set(true);
  }

  public boolean isCancelled() {
    return cancelled.get();
  }
}
