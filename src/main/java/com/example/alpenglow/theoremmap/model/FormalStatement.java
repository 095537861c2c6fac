package com.example.alpenglow.theoremmap.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/** A THEOREM or LEMMA declaration found in a formal specification module. */
@Value
@Builder
public class FormalStatement {
  String id;
  String name;
  String statement;
  @Builder.Default
  ProofStatus proofStatus = ProofStatus.UNKNOWN;
  String module;
  String filePath;
  int lineNumber;
  @Builder.Default
  List<String> dependencies = List.of();
  @Builder.Default
  List<String> proofObligations = List.of();
}
