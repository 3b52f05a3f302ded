package com.tenderai.ingest.model.metadata;

import java.util.List;
import lombok.Builder;
import lombok.Value;

/** Search keywords, one independent list per language. */
@Value
public class KeywordBuckets implements MetadataField {

  List<String> fr;

  List<String> eng;

  List<String> ar;

  @Builder
  public KeywordBuckets(List<String> fr, List<String> eng, List<String> ar) {
    this.fr = fr == null ? List.of() : List.copyOf(fr);
    this.eng = eng == null ? List.of() : List.copyOf(eng);
    this.ar = ar == null ? List.of() : List.copyOf(ar);
  }

  public static KeywordBuckets empty() {
    return new KeywordBuckets(List.of(), List.of(), List.of());
  }
}
