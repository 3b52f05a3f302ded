package com.tenderai.ingest.service.format;

import com.tenderai.ingest.config.IngestProperties;
import com.tenderai.ingest.service.ConversionPool;
import com.tenderai.ingest.service.DocumentProcessingException;
import java.io.File;
import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.log4j.Log4j2;
import org.apache.commons.io.FileUtils;

/**
 * Text of legacy Word 97-2003 {@code .doc} files.
 *
 * <p>Conversion goes through the external {@code antiword} tool, run on the {@link ConversionPool}
 * with a hard timeout. When the tool is missing, times out or exits non-zero, printable Latin runs
 * are scraped from the raw bytes under several decodings instead.
 */
@Log4j2
public class LegacyDocConverter {

  public static final String FAILURE_SENTINEL =
      "[.DOC EXTRACTION FAILED - Install antiword for better support]";

  static final int SAMPLE_CHARS = 1000;

  private static final List<Charset> DECODINGS =
      List.of(StandardCharsets.UTF_8, StandardCharsets.ISO_8859_1, Charset.forName("windows-1252"));

  private static final Pattern SAMPLE_RUN = Pattern.compile("[a-zA-ZÀ-ÿ\\s]{4,}");
  private static final Pattern FULL_RUN = Pattern.compile("[a-zA-ZÀ-ÿ0-9\\s.,;:\\-()]{4,}");
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  private final IngestProperties.LegacyDoc config;
  private final ConversionPool pool;

  public LegacyDocConverter(IngestProperties.LegacyDoc config, ConversionPool pool) {
    this.config = config;
    this.pool = pool;
  }

  /** First ~1000 characters, or "" when nothing readable was found. */
  public String sample(byte[] bytes) {
    return convert(bytes, config.getSampleTimeoutSeconds())
        .or(() -> scrape(bytes, SAMPLE_RUN, 50))
        .map(LegacyDocConverter::head)
        .orElse("");
  }

  /** Whole-document text; empty when both the tool and the byte scrape came up with nothing. */
  public Optional<String> fullText(byte[] bytes) {
    Optional<String> converted = convert(bytes, config.getFullTimeoutSeconds());
    if (converted.isPresent()) return converted;
    return scrape(bytes, FULL_RUN, 100);
  }

  private static String head(String text) {
    return text.length() > SAMPLE_CHARS ? text.substring(0, SAMPLE_CHARS) : text;
  }

  /** antiword output, or empty on any tool failure. */
  Optional<String> convert(byte[] bytes, int timeoutSeconds) {
    try {
      return pool.call("antiword", () -> runTool(bytes, timeoutSeconds));
    } catch (DocumentProcessingException e) {
      log.warn("legacyDoc.convert failed kind={} msg={}", e.getKind(), e.getMessage());
      return Optional.empty();
    }
  }

  private Optional<String> runTool(byte[] bytes, int timeoutSeconds) throws InterruptedException {
    File input = null;
    File output = null;
    Process process = null;
    try {
      input = Files.createTempFile("tender-", ".doc").toFile();
      output = Files.createTempFile("tender-", ".txt").toFile();
      FileUtils.writeByteArrayToFile(input, bytes);

      process =
          new ProcessBuilder(config.getCommand(), input.getAbsolutePath())
              .redirectOutput(output)
              .redirectError(ProcessBuilder.Redirect.DISCARD)
              .start();
      if (!process.waitFor(timeoutSeconds, TimeUnit.SECONDS)) {
        log.warn("legacyDoc.timeout after {}s", timeoutSeconds);
        return Optional.empty();
      }
      if (process.exitValue() != 0) {
        log.warn("legacyDoc.exit code={}", process.exitValue());
        return Optional.empty();
      }
      String text = FileUtils.readFileToString(output, StandardCharsets.UTF_8);
      return text.isBlank() ? Optional.empty() : Optional.of(text);
    } catch (IOException e) {
      log.warn("legacyDoc.tool unavailable command={} msg={}", config.getCommand(), e.getMessage());
      return Optional.empty();
    } finally {
      if (process != null && process.isAlive()) {
        process.destroyForcibly();
      }
      FileUtils.deleteQuietly(input);
      FileUtils.deleteQuietly(output);
    }
  }

  /**
   * Joins the matches of {@code run} over each decoding in turn; the first decoding yielding more
   * than {@code minChars} characters wins.
   */
  static Optional<String> scrape(byte[] bytes, Pattern run, int minChars) {
    for (Charset charset : DECODINGS) {
      String decoded = new String(bytes, charset).replace("\uFFFD", "");
      StringBuilder joined = new StringBuilder();
      Matcher m = run.matcher(decoded);
      while (m.find()) {
        if (joined.length() > 0) joined.append(' ');
        joined.append(m.group());
      }
      String text = WHITESPACE.matcher(joined).replaceAll(" ").strip();
      if (text.length() > minChars) {
        log.debug("legacyDoc.scrape charset={} chars={}", charset.name(), text.length());
        return Optional.of(text);
      }
    }
    return Optional.empty();
  }
}
