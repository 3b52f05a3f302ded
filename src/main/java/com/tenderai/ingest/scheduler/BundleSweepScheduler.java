package com.tenderai.ingest.scheduler;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tenderai.ingest.model.ExtractionRecord;
import com.tenderai.ingest.model.TenderBundle;
import com.tenderai.ingest.model.TenderIngestResult;
import com.tenderai.ingest.model.TenderJob;
import com.tenderai.ingest.model.WebsiteNotice;
import com.tenderai.ingest.service.CancellationSignal;
import com.tenderai.ingest.service.MetadataJsonWriter;
import com.tenderai.ingest.service.TenderBatchService;
import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.apache.commons.io.FileUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;

/**
 * Picks up tender bundles dropped into the input directory, one subdirectory per tender, and
 * writes one JSON summary per tender into the output directory.
 *
 * <p>The directory name is the tender reference. An optional {@value #WEBSITE_SIDECAR} file holds
 * the scraped {@link WebsiteNotice} and is not part of the bundle. A tender whose summary already
 * exists is skipped.
 */
@Log4j2
@RequiredArgsConstructor
public class BundleSweepScheduler {

  static final String WEBSITE_SIDECAR = ".website.json";

  private final TenderBatchService batch;
  private final MetadataJsonWriter metadataWriter;
  private final ObjectMapper om;

  @Value("${tender.sweep.input-dir}")
  private String inputDir;

  @Value("${tender.sweep.output-dir}")
  private String outputDir;

  @Value("${tender.sweep.max-per-run:10}")
  private int maxPerRun;

  @Scheduled(cron = "${tender.sweep.cron:0 */5 * * * *}")
  public void sweepAndIngest() {
    log.info(
        "scheduler.start inputDir={} outputDir={} maxPerRun={}", inputDir, outputDir, maxPerRun);
    int processed = sweep(new File(inputDir), new File(outputDir), maxPerRun);
    log.info("scheduler.finish processed={} inputDir={}", processed, inputDir);
  }

  /** One sweep over {@code in}; returns the number of tenders ingested. */
  int sweep(File in, File out, int limit) {
    File[] dirs = in.listFiles(File::isDirectory);
    if (dirs == null) {
      log.warn("scheduler.skip inputDir missing path={}", in.getAbsolutePath());
      return 0;
    }
    Arrays.sort(dirs, Comparator.comparing(File::getName));

    List<TenderJob> jobs = new ArrayList<>();
    for (File dir : dirs) {
      if (jobs.size() >= limit) {
        log.info("scheduler.limit reached maxPerRun={}, stopping this cycle", limit);
        break;
      }
      if (summaryFile(out, dir.getName()).exists()) {
        log.debug("scheduler.skip completed tenderRef={}", dir.getName());
        continue;
      }
      try {
        jobs.add(readJob(dir));
      } catch (IOException | RuntimeException ex) {
        log.error("scheduler.error tenderRef={} msg={}", dir.getName(), ex.getMessage(), ex);
      }
    }
    if (jobs.isEmpty()) return 0;

    List<TenderIngestResult> results = batch.ingestAll(jobs, CancellationSignal.none());
    for (int i = 0; i < results.size(); i++) {
      String id = jobs.get(i).getId();
      try {
        FileUtils.forceMkdir(out);
        om.writerWithDefaultPrettyPrinter()
            .writeValue(summaryFile(out, id), summary(results.get(i)));
        log.info("scheduler.process tenderRef={} status={}", id, results.get(i).getStatus());
      } catch (IOException ex) {
        log.error("scheduler.error tenderRef={} msg={}", id, ex.getMessage(), ex);
      }
    }
    return results.size();
  }

  TenderJob readJob(File dir) throws IOException {
    Map<String, byte[]> contents = new LinkedHashMap<>();
    WebsiteNotice website = null;
    File[] files = dir.listFiles(File::isFile);
    if (files != null) {
      Arrays.sort(files, Comparator.comparing(File::getName));
      for (File f : files) {
        if (WEBSITE_SIDECAR.equals(f.getName())) {
          website = om.readValue(f, WebsiteNotice.class);
        } else {
          contents.put(f.getName(), FileUtils.readFileToByteArray(f));
        }
      }
    }
    return TenderJob.builder()
        .id(dir.getName())
        .bundle(TenderBundle.of(contents, dir.getName()))
        .website(website)
        .build();
  }

  ObjectNode summary(TenderIngestResult r) {
    ObjectNode root = om.createObjectNode();
    root.put("external_reference", r.getExternalReference());
    root.put("status", r.getStatus() == null ? null : r.getStatus().name());
    root.put("error_message", r.getErrorMessage());
    root.put("phase1_source", r.getPhase1Source() == null ? null : r.getPhase1Source().name());
    root.put("cancelled", r.isCancelled());
    root.set("metadata", metadataWriter.toJson(r.getMetadata()));
    ArrayNode docs = root.putArray("documents");
    for (ExtractionRecord doc : r.getDocuments()) {
      ObjectNode d = docs.addObject();
      d.put("filename", doc.getFilename());
      d.put("category", doc.getCategory().getLabel());
      d.put("method", doc.getMethod().name());
      d.put("page_count", doc.getPageCount());
      d.put("chars", doc.getFullText() == null ? 0 : doc.getFullText().length());
    }
    root.put("deep_context_chars", r.getDeepContext() == null ? 0 : r.getDeepContext().length());
    return root;
  }

  private static File summaryFile(File out, String tenderRef) {
    return new File(out, tenderRef + ".json");
  }
}
