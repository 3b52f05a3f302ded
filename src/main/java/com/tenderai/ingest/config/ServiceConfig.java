package com.tenderai.ingest.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.tenderai.ingest.service.ConversionPool;
import com.tenderai.ingest.service.DeepContextAssembler;
import com.tenderai.ingest.service.DocumentClassifier;
import com.tenderai.ingest.service.ExternalDocumentClassifier;
import com.tenderai.ingest.service.ExtractionEngine;
import com.tenderai.ingest.service.MetadataFragmentExtractor;
import com.tenderai.ingest.service.MetadataFragmentParser;
import com.tenderai.ingest.service.MetadataJsonWriter;
import com.tenderai.ingest.service.OcrService;
import com.tenderai.ingest.service.PromptLoaderService;
import com.tenderai.ingest.service.TenderBatchService;
import com.tenderai.ingest.service.TenderDocumentOrchestrator;
import com.tenderai.ingest.service.TenderIngestService;
import com.tenderai.ingest.service.format.LegacyDocConverter;
import com.tenderai.ingest.service.format.PdfDocumentReader;
import com.tenderai.ingest.service.format.SpreadsheetReader;
import com.tenderai.ingest.service.format.WordDocumentReader;
import java.util.concurrent.ExecutorService;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@RequiredArgsConstructor
public class ServiceConfig {

  private final IngestProperties props;

  // -------------------
  // Utility
  // -------------------

  @Bean
  public ObjectMapper objectMapper() {
    return new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
  }

  @Bean
  public PromptLoaderService promptLoaderService() {
    return new PromptLoaderService();
  }

  @Bean
  public ConversionPool conversionPool(
      @Qualifier(ExecutorConfig.CONVERSION_POOL) ExecutorService executor) {
    return new ConversionPool(executor);
  }

  // -------------------
  // Format readers
  // -------------------

  @Bean
  public PdfDocumentReader pdfDocumentReader() {
    return new PdfDocumentReader();
  }

  @Bean
  public WordDocumentReader wordDocumentReader() {
    return new WordDocumentReader();
  }

  @Bean
  public SpreadsheetReader spreadsheetReader() {
    return new SpreadsheetReader();
  }

  @Bean
  public LegacyDocConverter legacyDocConverter(ConversionPool pool) {
    return new LegacyDocConverter(props.getLegacyDoc(), pool);
  }

  @Bean
  public OcrService ocrService(PdfDocumentReader pdfReader, ConversionPool pool) {
    return new OcrService(props.getOcr(), pdfReader, pool);
  }

  // -------------------
  // Core Services
  // -------------------

  @Bean
  public DocumentClassifier documentClassifier(
      PdfDocumentReader pdfReader,
      WordDocumentReader wordReader,
      SpreadsheetReader spreadsheetReader,
      LegacyDocConverter legacyDocConverter,
      OcrService ocrService,
      ObjectProvider<ExternalDocumentClassifier> externalClassifier) {
    return new DocumentClassifier(
        pdfReader,
        wordReader,
        spreadsheetReader,
        legacyDocConverter,
        ocrService,
        externalClassifier.getIfAvailable(),
        props.getAi().isClassifierEnabled());
  }

  @Bean
  public ExtractionEngine extractionEngine(
      PdfDocumentReader pdfReader,
      WordDocumentReader wordReader,
      SpreadsheetReader spreadsheetReader,
      LegacyDocConverter legacyDocConverter,
      OcrService ocrService) {
    return new ExtractionEngine(
        pdfReader, wordReader, spreadsheetReader, legacyDocConverter, ocrService);
  }

  @Bean
  public MetadataFragmentParser metadataFragmentParser() {
    return new MetadataFragmentParser();
  }

  @Bean
  public MetadataJsonWriter metadataJsonWriter(ObjectMapper om) {
    return new MetadataJsonWriter(om);
  }

  @Bean
  public TenderDocumentOrchestrator tenderDocumentOrchestrator(
      DocumentClassifier classifier,
      ExtractionEngine extractionEngine,
      MetadataFragmentExtractor fragmentExtractor) {
    return new TenderDocumentOrchestrator(classifier, extractionEngine, fragmentExtractor);
  }

  @Bean
  public DeepContextAssembler deepContextAssembler() {
    return new DeepContextAssembler();
  }

  @Bean
  public TenderIngestService tenderIngestService(
      TenderDocumentOrchestrator orchestrator,
      MetadataFragmentExtractor fragmentExtractor,
      DeepContextAssembler contextAssembler) {
    return new TenderIngestService(orchestrator, fragmentExtractor, contextAssembler);
  }

  @Bean
  public TenderBatchService tenderBatchService(
      TenderIngestService ingestService,
      @Qualifier(ExecutorConfig.TENDER_POOL) ExecutorService tenderPool) {
    return new TenderBatchService(ingestService, tenderPool);
  }
}
