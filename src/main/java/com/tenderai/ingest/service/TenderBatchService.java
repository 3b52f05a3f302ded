package com.tenderai.ingest.service;

import com.tenderai.ingest.model.TenderIngestResult;
import com.tenderai.ingest.model.TenderJob;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import lombok.extern.log4j.Log4j2;

/**
 * Runs independent tenders concurrently on the tender pool. Results come back in job order; a
 * tender that throws becomes an {@code ERROR} result instead of failing the batch.
 */
@Log4j2
public class TenderBatchService {

  private final TenderIngestService ingestService;
  private final ExecutorService tenderPool;

  public TenderBatchService(TenderIngestService ingestService, ExecutorService tenderPool) {
    this.ingestService = Objects.requireNonNull(ingestService, "ingestService must not be null");
    this.tenderPool = Objects.requireNonNull(tenderPool, "tenderPool must not be null");
  }

  public List<TenderIngestResult> ingestAll(List<TenderJob> jobs, CancellationSignal signal) {
    log.info("batch.start jobs={}", jobs.size());
    List<Future<TenderIngestResult>> futures = new ArrayList<>(jobs.size());
    for (TenderJob job : jobs) {
      futures.add(
          tenderPool.submit(() -> ingestService.ingest(job.getBundle(), job.getWebsite(), signal)));
    }

    List<TenderIngestResult> results = new ArrayList<>(jobs.size());
    for (int i = 0; i < futures.size(); i++) {
      TenderJob job = jobs.get(i);
      try {
        results.add(futures.get(i).get());
      } catch (ExecutionException e) {
        log.error("batch.job failed id={}", job.getId(), e.getCause());
        results.add(failed(job, e.getCause()));
      } catch (InterruptedException e) {
        log.warn("batch.interrupted id={} remaining={}", job.getId(), futures.size() - i);
        signal.cancel();
        futures.subList(i, futures.size()).forEach(f -> f.cancel(true));
        Thread.currentThread().interrupt();
        break;
      }
    }
    log.info("batch.finish jobs={} results={}", jobs.size(), results.size());
    return results;
  }

  private static TenderIngestResult failed(TenderJob job, Throwable cause) {
    String ref =
        job.getBundle() == null
            ? job.getId()
            : job.getBundle().tenderReference().orElse(job.getId());
    return TenderIngestResult.builder()
        .externalReference(ref)
        .status(TenderIngestResult.Status.ERROR)
        .errorMessage(cause == null ? "unknown failure" : cause.toString())
        .build();
  }
}
