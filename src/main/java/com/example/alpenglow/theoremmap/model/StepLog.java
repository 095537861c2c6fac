package com.example.alpenglow.theoremmap.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/** One finished pipeline stage: what ran, what it found, and when. */
@Value
@Builder
public class StepLog {
  String name;
  String note;
  Instant at;
  /** Milliseconds since the run started. */
  long elapsedMs;

  public String summary() {
    return String.format("%-22s +%5dms  %s", name, elapsedMs, note == null ? "" : note);
  }
}
