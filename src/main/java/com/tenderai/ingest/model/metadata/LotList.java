package com.tenderai.ingest.model.metadata;

import java.util.List;
import lombok.Value;

/** Ordered lots of a tender. */
@Value
public class LotList implements MetadataField {

  List<Lot> lots;

  public LotList(List<Lot> lots) {
    this.lots = lots == null ? List.of() : List.copyOf(lots);
  }

  public static LotList of(Lot... lots) {
    return new LotList(List.of(lots));
  }

  public boolean isEmpty() {
    return lots.isEmpty();
  }

  public int size() {
    return lots.size();
  }
}
