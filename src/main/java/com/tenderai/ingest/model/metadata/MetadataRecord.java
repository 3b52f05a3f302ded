package com.tenderai.ingest.model.metadata;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * Provenance-tracked tender metadata: an ordered, immutable map from field name to {@link
 * MetadataField}.
 *
 * <p>Instances are only ever replaced, never mutated; {@link #with(String, MetadataField)} returns
 * a copy.
 */
@EqualsAndHashCode
@ToString
public final class MetadataRecord {

  private final Map<String, MetadataField> fields;

  private MetadataRecord(Map<String, MetadataField> fields) {
    this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
  }

  public static MetadataRecord empty() {
    return new MetadataRecord(Map.of());
  }

  public static MetadataRecord of(Map<String, ? extends MetadataField> fields) {
    Map<String, MetadataField> copy = new LinkedHashMap<>();
    if (fields != null) {
      fields.forEach(
          (k, v) -> {
            if (k != null && v != null) copy.put(k, v);
          });
    }
    return new MetadataRecord(copy);
  }

  public static Builder builder() {
    return new Builder();
  }

  public MetadataField get(String key) {
    return fields.get(key);
  }

  public boolean has(String key) {
    return fields.containsKey(key);
  }

  public Set<String> keys() {
    return fields.keySet();
  }

  public Map<String, MetadataField> asMap() {
    return fields;
  }

  public boolean isEmpty() {
    return fields.isEmpty();
  }

  /** The tracked value under {@code key}, or null when absent or differently shaped. */
  public TrackedValue tracked(String key) {
    return fields.get(key) instanceof TrackedValue tv ? tv : null;
  }

  /** Convenience: the scalar under a tracked key, or null. */
  public String valueOf(String key) {
    TrackedValue tv = tracked(key);
    return tv == null ? null : tv.getValue();
  }

  public DeadlineValue deadline() {
    return fields.get(MetadataFields.SUBMISSION_DEADLINE) instanceof DeadlineValue d ? d : null;
  }

  public LotList lots() {
    return fields.get(MetadataFields.LOTS) instanceof LotList l ? l : null;
  }

  public KeywordBuckets keywords() {
    return fields.get(MetadataFields.KEYWORDS) instanceof KeywordBuckets k ? k : null;
  }

  public MetadataRecord with(String key, MetadataField value) {
    Objects.requireNonNull(key, "key must not be null");
    Map<String, MetadataField> copy = new LinkedHashMap<>(fields);
    if (value == null) {
      copy.remove(key);
    } else {
      copy.put(key, value);
    }
    return new MetadataRecord(copy);
  }

  public static final class Builder {
    private final Map<String, MetadataField> fields = new LinkedHashMap<>();

    private Builder() {}

    public Builder field(String key, MetadataField value) {
      if (key != null && value != null) fields.put(key, value);
      return this;
    }

    public Builder tracked(String key, String value, SourceDocument source) {
      return field(key, TrackedValue.of(value, source));
    }

    public MetadataRecord build() {
      return new MetadataRecord(fields);
    }
  }
}
