package com.tenderai.ingest.service;

import com.tenderai.ingest.service.DocumentProcessingException.Kind;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import lombok.extern.log4j.Log4j2;

/**
 * Bounded worker pool for the blocking, CPU or subprocess heavy steps: page rendering + OCR and
 * legacy DOC conversion.
 *
 * <p>Callers block until their task finishes, so at most {@code poolSize} renders or conversions
 * run at once no matter how many tenders are processed concurrently.
 */
@Log4j2
public class ConversionPool {

  private final ExecutorService executor;

  public ConversionPool(ExecutorService executor) {
    this.executor = Objects.requireNonNull(executor, "executor must not be null");
  }

  /**
   * Runs {@code task} on the pool and waits for it.
   *
   * @throws DocumentProcessingException the task's own processing exception, or a {@code
   *     CONVERSION_FAILURE} wrapping anything else
   */
  public <T> T call(String label, Callable<T> task) {
    long t0 = System.nanoTime();
    Future<T> future = executor.submit(task);
    try {
      T result = future.get();
      log.debug(
          "conversion.done task={} durationMs={}", label, (System.nanoTime() - t0) / 1_000_000);
      return result;
    } catch (InterruptedException e) {
      future.cancel(true);
      Thread.currentThread().interrupt();
      throw new DocumentProcessingException(Kind.CONVERSION_FAILURE, label + " interrupted", e);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause() == null ? e : e.getCause();
      if (cause instanceof DocumentProcessingException dpe) {
        throw dpe;
      }
      throw new DocumentProcessingException(
          Kind.CONVERSION_FAILURE, label + " failed: " + cause.getMessage(), cause);
    }
  }
}
