package com.tenderai.ingest.config;

import com.tenderai.ingest.prompt.PromptConfig;
import com.tenderai.ingest.service.AiDocumentClassifier;
import com.tenderai.ingest.service.AiFragmentExtractor;
import com.tenderai.ingest.service.ExternalDocumentClassifier;
import com.tenderai.ingest.service.MetadataFragmentExtractor;
import com.tenderai.ingest.service.MetadataFragmentParser;
import com.tenderai.ingest.service.PromptLoaderService;
import java.util.Optional;
import lombok.extern.log4j.Log4j2;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * ChatGPT configuration for Spring AI.
 *
 * <p>Spring AI autoconfigures the {@link OpenAiChatModel} from {@code spring.ai.openai.*}. With
 * {@code tender.ingest.ai.enabled=false} no model bean is touched and fragment extraction yields
 * nothing, so only the webpage and heuristics feed the pipeline.
 */
@Log4j2
@Configuration
public class ChatGptConfig {

  @Bean
  @ConditionalOnProperty(
      prefix = "tender.ingest.ai",
      name = "enabled",
      havingValue = "true",
      matchIfMissing = true)
  public ChatClient.Builder chatClientBuilder(OpenAiChatModel openAiChatModel) {
    return ChatClient.builder(openAiChatModel);
  }

  @Bean
  @ConditionalOnProperty(
      prefix = "tender.ingest.ai",
      name = "enabled",
      havingValue = "true",
      matchIfMissing = true)
  public MetadataFragmentExtractor aiFragmentExtractor(
      ChatClient.Builder chatClientBuilder,
      PromptLoaderService promptLoader,
      MetadataFragmentParser parser,
      IngestProperties props) {
    PromptConfig prompt = promptLoader.load(props.getAi().getFragmentPrompt());
    return new AiFragmentExtractor(chatClientBuilder, prompt, parser, props.getAi());
  }

  @Bean
  @ConditionalOnProperty(
      prefix = "tender.ingest.ai",
      name = "enabled",
      havingValue = "true",
      matchIfMissing = true)
  public ExternalDocumentClassifier aiDocumentClassifier(
      ChatClient.Builder chatClientBuilder,
      PromptLoaderService promptLoader,
      IngestProperties props) {
    PromptConfig prompt = promptLoader.load(props.getAi().getClassifierPrompt());
    return new AiDocumentClassifier(chatClientBuilder, prompt, props.getAi());
  }

  @Bean
  @ConditionalOnMissingBean(MetadataFragmentExtractor.class)
  public MetadataFragmentExtractor noopFragmentExtractor() {
    log.warn("aiFragment.disabled fragments will be empty");
    return (text, source) -> Optional.empty();
  }
}
