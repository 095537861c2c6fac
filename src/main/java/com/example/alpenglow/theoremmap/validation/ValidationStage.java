package com.example.alpenglow.theoremmap.validation;

/** Identifies which part of the run request a validator looks at. */
public enum ValidationStage {
  /** Source locations that the extractors read. */
  INPUTS,
  /** Locations the run writes to. */
  OUTPUTS
}
