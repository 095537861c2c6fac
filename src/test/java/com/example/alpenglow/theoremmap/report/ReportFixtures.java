package com.example.alpenglow.theoremmap.report;

import com.example.alpenglow.theoremmap.model.LineRange;
import com.example.alpenglow.theoremmap.model.MappingReport;
import com.example.alpenglow.theoremmap.model.TheoremMapping;
import com.example.alpenglow.theoremmap.model.VerificationStatus;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

final class ReportFixtures {
  private ReportFixtures() {}

  static TheoremMapping mapping(String whitepaperId, String tlaId, String fileLocation) {
    return TheoremMapping.builder()
        .whitepaperId(whitepaperId)
        .tlaId(tlaId)
        .confidence(0.7)
        .mappingType(TheoremMapping.KEYWORD_BASED)
        .verificationStatus(VerificationStatus.builder()
            .tlapsStatus("complete")
            .tlcStatus("verified")
            .lastVerified("2025-01-15 10:30:00")
            .proofObligationsTotal(2)
            .build())
        .fileLocation(fileLocation)
        .lineRange(LineRange.of(5, 10))
        .lastUpdated("2025-01-15T12:00:00")
        .build();
  }

  static MappingReport report(TheoremMapping... mappings) {
    Map<String, Integer> summary = new LinkedHashMap<>();
    summary.put("tlaps_complete", mappings.length);
    summary.put("tlc_verified", mappings.length);
    return MappingReport.builder()
        .generationTimestamp("2025-01-15T12:00:00")
        .totalWhitepaperTheorems(2)
        .totalTlaTheorems(3)
        .mappedTheorems(mappings.length)
        .verificationSummary(summary)
        .mappings(List.of(mappings))
        .build();
  }

  static MappingReport emptyReport() {
    return MappingReport.builder()
        .generationTimestamp("2025-01-15T12:00:00")
        .verificationSummary(Map.of("tlaps_complete", 0))
        .build();
  }
}
