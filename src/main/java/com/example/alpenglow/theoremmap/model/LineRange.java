package com.example.alpenglow.theoremmap.model;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Value;

import java.util.List;

@Value
public class LineRange {
  int start;
  int end;

  public static LineRange of(int start, int end) {
    return new LineRange(start, end);
  }

  /** Serialized as a two-element array, the way a tuple is dumped. */
  @JsonValue
  public List<Integer> asList() {
    return List.of(start, end);
  }

  public String format() {
    return start + "-" + end;
  }
}
