package com.example.alpenglow.theoremmap.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Per-backend verification state attached to a mapping. Only the TLAPS status is derived from the
 * formal sources; TLC and Stateright stay {@code "unknown"} unless result files say otherwise.
 */
@Value
@Builder(toBuilder = true)
public class VerificationStatus {
  public static final String UNKNOWN = "unknown";

  @Builder.Default
  String tlapsStatus = UNKNOWN;
  @Builder.Default
  String tlcStatus = UNKNOWN;
  @Builder.Default
  String staterightStatus = UNKNOWN;
  String lastVerified;
  Double verificationTime;
  int proofObligationsTotal;
  int proofObligationsComplete;
  @Builder.Default
  List<String> errorMessages = List.of();
}
