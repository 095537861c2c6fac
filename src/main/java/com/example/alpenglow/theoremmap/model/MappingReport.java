package com.example.alpenglow.theoremmap.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Aggregate of one run. {@code mappedTheorems} counts mapping candidates, so a prose statement
 * matched by three declarations contributes three.
 */
@Value
@Builder
public class MappingReport {
  String generationTimestamp;
  int totalWhitepaperTheorems;
  int totalTlaTheorems;
  int mappedTheorems;
  @Builder.Default
  Map<String, Integer> verificationSummary = Map.of();
  @Builder.Default
  List<TheoremMapping> mappings = List.of();
  @Builder.Default
  List<String> unmappedWhitepaper = List.of();
  @Builder.Default
  List<String> unmappedTla = List.of();
  @Builder.Default
  Map<String, List<String>> crossReferences = Map.of();
  @Builder.Default
  Map<String, Object> statistics = Map.of();

  /** Mapped candidates over whitepaper statements, in percent; 0 when there are no statements. */
  @JsonIgnore
  public double getCoveragePercent() {
    if (totalWhitepaperTheorems == 0) {
      return 0.0;
    }
    return mappedTheorems * 100.0 / totalWhitepaperTheorems;
  }
}
