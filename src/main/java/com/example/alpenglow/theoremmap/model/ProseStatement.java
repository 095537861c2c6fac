package com.example.alpenglow.theoremmap.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/** A numbered statement ("Theorem 4", "Assumption 1") recovered from the whitepaper text. */
@Value
@Builder
public class ProseStatement {
  String id;
  StatementKind type;
  String title;
  String statement;
  @Builder.Default
  String proofSketch = "";
  @Builder.Default
  String section = "unknown";
  Integer pageNumber;
  @Builder.Default
  List<String> dependencies = List.of();
}
