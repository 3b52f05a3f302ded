package com.tenderai.ingest.model.metadata;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Value;

/** A value under a key the core does not interpret; carried through merges untouched. */
@Value
public class OpaqueField implements MetadataField {

  JsonNode node;

  /** Plain-string opaque values count as missing when blank. */
  public boolean isBlankText() {
    return node == null || node.isNull() || (node.isTextual() && node.asText().isBlank());
  }
}
