package com.example.alpenglow.theoremmap.model;

import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;

/** Validated locations for one run. */
@Value
@Builder
public class MappingRequest {
  Path whitepaper;
  Path specsDir;
  Path proofsDir;
  Path outputDir;
  Path projectRoot;
}
