package com.tenderai.ingest.service;

import com.tenderai.ingest.config.IngestProperties;
import com.tenderai.ingest.model.DocumentCategory;
import com.tenderai.ingest.prompt.PromptConfig;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import lombok.extern.log4j.Log4j2;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.prompt.PromptTemplate;
import org.springframework.ai.chat.prompt.SystemPromptTemplate;
import org.springframework.ai.openai.OpenAiChatOptions;

/** One-word document category from the chat model. */
@Log4j2
public class AiDocumentClassifier implements ExternalDocumentClassifier {

  private final ChatClient chat;
  private final PromptConfig prompt;
  private final IngestProperties.Ai config;

  public AiDocumentClassifier(
      ChatClient.Builder builder, PromptConfig prompt, IngestProperties.Ai config) {
    this.chat = builder.build();
    this.prompt = Objects.requireNonNull(prompt, "prompt must not be null");
    this.config = Objects.requireNonNull(config, "config must not be null");
  }

  /**
   * @return the named category, {@code OTHER} for an answer outside the list, {@code UNKNOWN} when
   *     the call fails
   */
  @Override
  public DocumentCategory classify(String sample, String filename, boolean scanned) {
    Map<String, Object> vars = new HashMap<>();
    if (prompt.getRules() != null) vars.putAll(prompt.getRules());
    vars.put("filename", filename == null ? "" : filename);
    vars.put("text", sample == null ? "" : sample);

    Message systemMsg = new SystemPromptTemplate(prompt.getSystemTemplate()).createMessage(vars);
    Message userMsg = new PromptTemplate(prompt.getUserTemplate()).createMessage(vars);
    OpenAiChatOptions options =
        OpenAiChatOptions.builder().model(config.getModel()).temperature(0.0).maxTokens(10).build();

    String reply;
    try {
      reply =
          chat.prompt().messages(List.of(systemMsg, userMsg)).options(options).call().content();
    } catch (RuntimeException e) {
      log.error("aiClassifier.call failed file={}", filename, e);
      return DocumentCategory.UNKNOWN;
    }
    DocumentCategory category = toCategory(reply);
    log.info(
        "aiClassifier.done file={} scanned={} reply={} category={}",
        filename,
        scanned,
        reply,
        category);
    return category;
  }

  static DocumentCategory toCategory(String reply) {
    if (reply == null || reply.isBlank()) return DocumentCategory.UNKNOWN;
    String word =
        reply.strip().split("\\s+")[0].replaceAll("[^A-Za-z]", "").toUpperCase(Locale.ROOT);
    DocumentCategory category = DocumentCategory.fromLabel(word);
    if (category == null || category == DocumentCategory.UNKNOWN) {
      return DocumentCategory.OTHER;
    }
    return category;
  }
}
