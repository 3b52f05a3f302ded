package com.tenderai.ingest;

import com.tenderai.ingest.config.IngestProperties;
import lombok.extern.log4j.Log4j2;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Entry point for the tender ingest service.
 *
 * <p>Classifies the documents of each tender bundle, extracts Phase-1 metadata website first and
 * lazily from the notice, rules and specification, and assembles deep-analysis context. With
 * {@code tender.sweep.enabled=true} bundles are picked up from a drop directory on a schedule.
 *
 * <pre>
 *   mvn spring-boot:run
 * </pre>
 */
@Log4j2
@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties(IngestProperties.class)
public class TenderIngestApplication {

  public static void main(String[] args) {
    log.info("Starting Tender Ingest application...");
    SpringApplication.run(TenderIngestApplication.class, args);
    log.info("Tender Ingest application started successfully.");
  }
}
