package com.tenderai.ingest.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/** Tunables of the ingest core, bound from {@code tender.ingest.*}. */
@Data
@ConfigurationProperties(prefix = "tender.ingest")
public class IngestProperties {

  private Ocr ocr = new Ocr();
  private LegacyDoc legacyDoc = new LegacyDoc();
  private Pool pool = new Pool();
  private Ai ai = new Ai();

  @Data
  public static class Ocr {
    /** Tesseract language pack combination. */
    private String languages = "fra+ara+eng";

    /** Page render resolution fed to the OCR engine. */
    private int dpi = 200;

    /** tessdata directory; null lets Tess4J use TESSDATA_PREFIX. */
    private String dataPath;

    private int engineMode = 3;

    private int pageSegMode = 3;
  }

  @Data
  public static class LegacyDoc {
    private String command = "antiword";

    private int sampleTimeoutSeconds = 30;

    private int fullTimeoutSeconds = 60;
  }

  @Data
  public static class Pool {
    /** Workers for OCR and legacy conversion; 0 means one per available processor. */
    private int conversionThreads = 0;

    /** Tenders processed concurrently by the batch service. */
    private int tenderThreads = 4;

    private int awaitTerminationSeconds = 30;
  }

  @Data
  public static class Ai {
    /** Enables the chat-model backed fragment extractor and classifier. */
    private boolean enabled = true;

    /** Consult the external classifier when heuristics return UNKNOWN. */
    private boolean classifierEnabled = true;

    private String model = "gpt-4o-mini";

    private int maxInputChars = 20000;

    private int minInputChars = 50;

    private String fragmentPrompt = "prompts/primary-metadata.yml";

    private String classifierPrompt = "prompts/document-classifier.yml";
  }
}
