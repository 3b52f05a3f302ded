package com.tenderai.ingest.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tenderai.ingest.config.IngestProperties;
import com.tenderai.ingest.model.metadata.MetadataRecord;
import com.tenderai.ingest.model.metadata.SourceDocument;
import com.tenderai.ingest.prompt.PromptConfig;
import com.tenderai.ingest.util.TextUtils;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import lombok.extern.log4j.Log4j2;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.prompt.PromptTemplate;
import org.springframework.ai.chat.prompt.SystemPromptTemplate;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.ai.openai.api.ResponseFormat;

/**
 * Phase-1 metadata extraction through the chat model.
 *
 * <p>The source label goes to the model with the text so it can stamp {@code source_document} on
 * every value; the reply is parsed and shape-checked by {@link MetadataFragmentParser}.
 */
@Log4j2
public class AiFragmentExtractor implements MetadataFragmentExtractor {

  private final ChatClient chat;
  private final PromptConfig prompt;
  private final MetadataFragmentParser parser;
  private final IngestProperties.Ai config;
  private final ObjectMapper om = new ObjectMapper();

  public AiFragmentExtractor(
      ChatClient.Builder builder,
      PromptConfig prompt,
      MetadataFragmentParser parser,
      IngestProperties.Ai config) {
    this.chat = builder.build();
    this.prompt = Objects.requireNonNull(prompt, "prompt must not be null");
    this.parser = Objects.requireNonNull(parser, "parser must not be null");
    this.config = Objects.requireNonNull(config, "config must not be null");
  }

  @Override
  public Optional<MetadataRecord> extractFragment(String text, SourceDocument source) {
    return extractFragment(text, source, null);
  }

  public Optional<MetadataRecord> extractFragment(
      String text, SourceDocument source, LocalDate sourceDate) {
    if (text == null || text.strip().length() < config.getMinInputChars()) {
      log.warn("aiFragment.skip source={} reason=text too short", source.getLabel());
      return Optional.empty();
    }

    Map<String, Object> vars = new HashMap<>();
    if (prompt.getRules() != null) vars.putAll(prompt.getRules());
    vars.put("source_label", source.getLabel());
    vars.put("text", TextUtils.truncate(text, config.getMaxInputChars()));

    Message systemMsg = new SystemPromptTemplate(prompt.getSystemTemplate()).createMessage(vars);
    Message userMsg = new PromptTemplate(prompt.getUserTemplate()).createMessage(vars);

    OpenAiChatOptions options =
        OpenAiChatOptions.builder()
            .model(config.getModel())
            .temperature(0.0)
            .maxTokens(4096)
            .responseFormat(ResponseFormat.builder().type(ResponseFormat.Type.JSON_OBJECT).build())
            .build();

    String reply;
    try {
      reply =
          chat.prompt().messages(List.of(systemMsg, userMsg)).options(options).call().content();
    } catch (RuntimeException e) {
      log.error("aiFragment.call failed source={}", source.getLabel(), e);
      return Optional.empty();
    }
    if (reply == null || reply.isBlank()) {
      log.warn("aiFragment.empty reply source={}", source.getLabel());
      return Optional.empty();
    }

    try {
      JsonNode root = om.readTree(TextUtils.stripCodeFences(reply));
      MetadataRecord record = parser.parse(root, source, sourceDate);
      log.info("aiFragment.done source={} keys={}", source.getLabel(), record.keys());
      return record.isEmpty() ? Optional.empty() : Optional.of(record);
    } catch (JsonProcessingException e) {
      log.error(
          "aiFragment.parse failed source={} msg={} reply={}",
          source.getLabel(),
          e.getOriginalMessage(),
          TextUtils.truncate(reply, 500));
      return Optional.empty();
    }
  }
}
