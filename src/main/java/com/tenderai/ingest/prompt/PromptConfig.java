package com.tenderai.ingest.prompt;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;
import lombok.Data;

/**
 * One chat prompt as stored under {@code src/main/resources/prompts}.
 *
 * <p>{@code rules} entries are template variables; they carry text such as JSON examples that
 * cannot appear literally in a template.
 */
@Data
public class PromptConfig {
  @JsonProperty("system")
  private String systemTemplate;

  @JsonProperty("user")
  private String userTemplate;

  @JsonProperty("rules")
  private Map<String, String> rules;
}
