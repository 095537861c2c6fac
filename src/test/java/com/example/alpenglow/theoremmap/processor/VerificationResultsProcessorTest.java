package com.example.alpenglow.theoremmap.processor;

import com.example.alpenglow.theoremmap.model.*;
import com.example.alpenglow.theoremmap.service.VerificationResultsService;
import com.example.alpenglow.theoremmap.service.VerificationResultsService.BackendResult;
import com.example.alpenglow.theoremmap.service.VerificationResultsService.VerificationResults;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class VerificationResultsProcessorTest {

  private final VerificationResultsService service = mock(VerificationResultsService.class);
  private final VerificationResultsProcessor processor = new VerificationResultsProcessor(service);

  @Test
  void overlaysBackendStatusesByDeclarationName() {
    VerificationResults results = new VerificationResults(
        Map.of("Safety", new BackendResult("verified", "2025-01-15 10:30:00")),
        Map.of("Safety", new BackendResult("passed", "2025-01-15T11:00:00")));

    TheoremMapping out = processor.overlay(mapping("Consensus_Safety"), formal("Consensus_Safety", "Safety"), results);

    VerificationStatus status = out.getVerificationStatus();
    assertThat(status.getTlcStatus()).isEqualTo("verified");
    assertThat(status.getStaterightStatus()).isEqualTo("passed");
    assertThat(status.getTlapsStatus()).isEqualTo("complete");
    assertThat(status.getLastVerified()).isEqualTo("2025-01-15 10:30:00");
  }

  @Test
  void fallsBackToMappingIdWhenNameIsUnknown() {
    VerificationResults results = new VerificationResults(
        Map.of("Consensus_Safety", new BackendResult("failed", null)), Map.of());

    TheoremMapping out = processor.overlay(mapping("Consensus_Safety"), formal("Consensus_Safety", "Safety"), results);

    assertThat(out.getVerificationStatus().getTlcStatus()).isEqualTo("failed");
    assertThat(out.getVerificationStatus().getStaterightStatus()).isEqualTo("unknown");
  }

  @Test
  void leavesMappingUntouchedWithoutResults() {
    TheoremMapping mapping = mapping("Consensus_Safety");

    TheoremMapping out = processor.overlay(mapping, formal("Consensus_Safety", "Safety"),
        new VerificationResults(Map.of("Other", new BackendResult("verified", null)), Map.of()));

    assertThat(out).isSameAs(mapping);
  }

  @Test
  void processSkipsLoadingWhenThereAreNoMappings() {
    MappingContext out = processor.process(new MappingContext()
        .setRequest(MappingRequest.builder().projectRoot(Path.of(".")).build())).block();

    assertThat(out).isNotNull();
    verifyNoInteractions(service);
  }

  @Test
  void processReplacesMappingsWithOverlaidCopies() {
    when(service.load(any())).thenReturn(new VerificationResults(
        Map.of("Safety", new BackendResult("verified", null)), Map.of()));
    Map<String, FormalStatement> formal = new LinkedHashMap<>();
    formal.put("Consensus_Safety", formal("Consensus_Safety", "Safety"));

    MappingContext out = processor.process(new MappingContext()
        .setRequest(MappingRequest.builder().projectRoot(Path.of(".")).build())
        .setFormalStatements(formal)
        .setMappings(List.of(mapping("Consensus_Safety")))).block();

    assertThat(out).isNotNull();
    assertThat(out.getMappings()).singleElement()
        .extracting(m -> m.getVerificationStatus().getTlcStatus())
        .isEqualTo("verified");
    assertThat(out.getSteps().get(0).getNote()).isEqualTo("tlc=1, stateright=0, updated=1");
  }

  private static TheoremMapping mapping(String tlaId) {
    return TheoremMapping.builder()
        .whitepaperId("theorem_1")
        .tlaId(tlaId)
        .confidence(KeywordMatchProcessor.KEYWORD_CONFIDENCE)
        .mappingType(TheoremMapping.KEYWORD_BASED)
        .verificationStatus(VerificationStatus.builder().tlapsStatus("complete").build())
        .build();
  }

  private static FormalStatement formal(String id, String name) {
    return FormalStatement.builder().id(id).name(name).statement("TRUE").build();
  }
}
