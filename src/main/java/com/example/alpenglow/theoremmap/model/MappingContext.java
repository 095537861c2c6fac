package com.example.alpenglow.theoremmap.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.experimental.Accessors;

import java.time.Duration;
import java.time.Instant;
import java.util.*;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Accessors(chain = true, fluent = false)
public class MappingContext {
  // input
  private MappingRequest request;

  // extracted
  private Map<String, ProseStatement> proseStatements = new LinkedHashMap<>();
  private Map<String, FormalStatement> formalStatements = new LinkedHashMap<>();

  // matched
  private List<TheoremMapping> mappings = new ArrayList<>();

  // assembled
  private MappingReport report;
  private Instant now = Instant.now();

  // audit trail
  private List<StepLog> steps = new ArrayList<>();

  public MappingContext addStep(String name, String note) {
    Instant at = Instant.now();
    steps.add(StepLog.builder()
        .name(name)
        .note(note)
        .at(at)
        .elapsedMs(Duration.between(now, at).toMillis())
        .build());
    return this;
  }
}
