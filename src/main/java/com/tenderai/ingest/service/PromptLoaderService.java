package com.tenderai.ingest.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.tenderai.ingest.prompt.PromptConfig;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import lombok.extern.log4j.Log4j2;
import org.apache.commons.io.IOUtils;
import org.springframework.core.io.ClassPathResource;

/** Reads prompt files from the classpath: YAML first, JSON as a fallback. */
@Log4j2
public class PromptLoaderService {

  private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
  private final ObjectMapper jsonMapper = new ObjectMapper();

  public PromptConfig load(String path) {
    String raw;
    try (InputStream in = new ClassPathResource(path).getInputStream()) {
      raw = IOUtils.toString(in, StandardCharsets.UTF_8);
    } catch (IOException e) {
      log.error("Failed to read prompt classpath:{}", path, e);
      throw new IllegalStateException("Failed to read prompt classpath:" + path, e);
    }

    try {
      Map<String, Object> map = yamlMapper.readValue(raw, new TypeReference<>() {});
      PromptConfig cfg = new PromptConfig();
      cfg.setSystemTemplate(asString(map.get("system")));
      cfg.setUserTemplate(asString(map.get("user")));
      cfg.setRules(toStringMap(map.get("rules")));
      log.info("Prompt loaded from classpath:{} (YAML)", path);
      return cfg;
    } catch (IOException | RuntimeException yamlErr) {
      log.warn("YAML parse failed, trying JSON. path={} reason={}", path, yamlErr.getMessage());
    }

    try {
      PromptConfig cfg = jsonMapper.readValue(raw, PromptConfig.class);
      if (cfg.getRules() == null) {
        cfg.setRules(Map.of());
      }
      log.info("Prompt loaded from classpath:{} (JSON)", path);
      return cfg;
    } catch (IOException e) {
      log.error("Failed to parse prompt classpath:{}", path, e);
      throw new IllegalStateException("Failed to parse prompt classpath:" + path, e);
    }
  }

  private static String asString(Object o) {
    return (o == null) ? null : o.toString();
  }

  /** Rule values may be scalars of any YAML type; templates only take strings. */
  private static Map<String, String> toStringMap(Object node) {
    if (!(node instanceof Map<?, ?> src)) return Map.of();
    Map<String, String> out = new LinkedHashMap<>();
    for (Map.Entry<?, ?> e : src.entrySet()) {
      String k = Objects.toString(e.getKey(), "");
      String v = (e.getValue() == null) ? null : e.getValue().toString();
      out.put(k, v);
    }
    return out;
  }
}
