package com.tenderai.ingest.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tenderai.ingest.scheduler.BundleSweepScheduler;
import com.tenderai.ingest.service.MetadataJsonWriter;
import com.tenderai.ingest.service.TenderBatchService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadPoolExecutor;
import lombok.extern.log4j.Log4j2;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/** Worker pools of the ingest core plus the scheduler for the bundle sweep. */
@Log4j2
@Configuration
@EnableScheduling
public class ExecutorConfig {

  public static final String CONVERSION_POOL = "conversionExecutor";
  public static final String TENDER_POOL = "tenderExecutor";

  @Value("${scheduled.threadpool.size:2}")
  private int schedulerPoolSize;

  /** OCR and legacy conversion; bounded so concurrent tenders cannot oversubscribe the CPU. */
  @Bean(name = CONVERSION_POOL, destroyMethod = "shutdown")
  public ExecutorService conversionExecutor(IngestProperties props) {
    IngestProperties.Pool pool = props.getPool();
    int threads =
        pool.getConversionThreads() > 0
            ? pool.getConversionThreads()
            : Runtime.getRuntime().availableProcessors();
    ThreadPoolTaskExecutor executor =
        executor("conversion-", threads, pool.getAwaitTerminationSeconds());
    log.info("executor.init name={} threads={}", CONVERSION_POOL, threads);
    return executor.getThreadPoolExecutor();
  }

  @Bean(name = TENDER_POOL, destroyMethod = "shutdown")
  public ExecutorService tenderExecutor(IngestProperties props) {
    IngestProperties.Pool pool = props.getPool();
    ThreadPoolTaskExecutor executor =
        executor("tender-", pool.getTenderThreads(), pool.getAwaitTerminationSeconds());
    log.info("executor.init name={} threads={}", TENDER_POOL, pool.getTenderThreads());
    return executor.getThreadPoolExecutor();
  }

  /** Dedicated scheduler pool for @Scheduled jobs with graceful shutdown and error logging. */
  @Bean
  public ThreadPoolTaskScheduler taskScheduler(IngestProperties props) {
    ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
    scheduler.setPoolSize(schedulerPoolSize);
    scheduler.setThreadNamePrefix("bundle-sweep-scheduler-");
    scheduler.setErrorHandler(t -> log.error("Uncaught exception in scheduled task", t));
    scheduler.setWaitForTasksToCompleteOnShutdown(true);
    scheduler.setAwaitTerminationSeconds(props.getPool().getAwaitTerminationSeconds());
    RejectedExecutionHandler reh = new ThreadPoolExecutor.CallerRunsPolicy();
    scheduler.setRejectedExecutionHandler(reh);
    scheduler.initialize();
    log.info("ThreadPoolTaskScheduler initialized poolSize={}", schedulerPoolSize);
    return scheduler;
  }

  @Bean
  @ConditionalOnProperty(
      prefix = "tender.sweep",
      name = "enabled",
      havingValue = "true",
      matchIfMissing = false)
  public BundleSweepScheduler bundleSweepScheduler(
      TenderBatchService batch, MetadataJsonWriter metadataWriter, ObjectMapper om) {
    return new BundleSweepScheduler(batch, metadataWriter, om);
  }

  private static ThreadPoolTaskExecutor executor(
      String prefix, int threads, int awaitTerminationSeconds) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(threads);
    executor.setMaxPoolSize(threads);
    executor.setThreadNamePrefix(prefix);
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(awaitTerminationSeconds);
    executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
    executor.initialize();
    return executor;
  }
}
