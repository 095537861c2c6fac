package com.example.alpenglow.theoremmap.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/** One candidate correspondence between a whitepaper statement and a formal declaration. */
@Value
@Builder(toBuilder = true)
public class TheoremMapping {
  public static final String KEYWORD_BASED = "keyword_based";

  String whitepaperId;
  String tlaId;
  double confidence;
  String mappingType;
  VerificationStatus verificationStatus;
  @Builder.Default
  String fileLocation = "";
  @Builder.Default
  LineRange lineRange = LineRange.of(0, 0);
  @Builder.Default
  List<String> crossReferences = List.of();
  @Builder.Default
  String notes = "";
  String lastUpdated;
  @Builder.Default
  String checksum = "";
}
