package com.example.alpenglow.theoremmap.cli;

import com.example.alpenglow.theoremmap.config.MappingProperties;
import com.example.alpenglow.theoremmap.model.MappingReport;
import com.example.alpenglow.theoremmap.model.MappingRequest;
import com.example.alpenglow.theoremmap.service.TheoremMappingPipeline;
import com.example.alpenglow.theoremmap.validation.OutputLocationValidator;
import com.example.alpenglow.theoremmap.validation.RequiredInputsValidator;
import com.example.alpenglow.theoremmap.validation.ValidationService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.springframework.boot.DefaultApplicationArguments;
import reactor.core.publisher.Mono;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class TheoremMappingCommandTest {

  private final TheoremMappingPipeline pipeline = mock(TheoremMappingPipeline.class);
  private final ValidationService validationService =
      new ValidationService(List.of(new RequiredInputsValidator(), new OutputLocationValidator()));

  @Test
  void missingFlagsExitWithOneWithoutRunning() {
    TheoremMappingCommand command = new TheoremMappingCommand(new MappingProperties(), validationService, pipeline);

    command.run(new DefaultApplicationArguments());

    assertThat(command.getExitCode()).isEqualTo(1);
    verifyNoInteractions(pipeline);
  }

  @Test
  void successfulRunExitsWithZero(@TempDir Path dir) {
    when(pipeline.run(any())).thenReturn(Mono.just(MappingReport.builder().generationTimestamp("now").build()));
    TheoremMappingCommand command = new TheoremMappingCommand(properties(dir), validationService, pipeline);

    command.run(new DefaultApplicationArguments());

    assertThat(command.getExitCode()).isZero();
    verify(pipeline).run(any());
  }

  @Test
  void pipelineFailureExitsWithOne(@TempDir Path dir) {
    when(pipeline.run(any())).thenReturn(Mono.error(new IllegalStateException("boom")));
    TheoremMappingCommand command = new TheoremMappingCommand(properties(dir), validationService, pipeline);

    command.run(new DefaultApplicationArguments());

    assertThat(command.getExitCode()).isEqualTo(1);
  }

  @Test
  void acceptsFlagsWithSpaceSeparatedValues(@TempDir Path dir) {
    when(pipeline.run(any())).thenReturn(Mono.just(MappingReport.builder().generationTimestamp("now").build()));
    TheoremMappingCommand command = new TheoremMappingCommand(new MappingProperties(), validationService, pipeline);

    command.run(new DefaultApplicationArguments(
        "--whitepaper", dir.resolve("paper.md").toString(),
        "--specs-dir", dir.resolve("specs").toString(),
        "--proofs-dir", dir.resolve("proofs").toString(),
        "--output-dir", dir.resolve("out").toString()));

    assertThat(command.getExitCode()).isZero();
    ArgumentCaptor<MappingRequest> request = ArgumentCaptor.forClass(MappingRequest.class);
    verify(pipeline).run(request.capture());
    assertThat(request.getValue().getWhitepaper().getFileName()).hasToString("paper.md");
    assertThat(request.getValue().getSpecsDir().getFileName()).hasToString("specs");
    assertThat(request.getValue().getOutputDir().getFileName()).hasToString("out");
  }

  private static MappingProperties properties(Path dir) {
    MappingProperties properties = new MappingProperties();
    properties.setWhitepaper(dir.resolve("paper.md").toString());
    properties.setSpecsDir(dir.resolve("specs").toString());
    properties.setProofsDir(dir.resolve("proofs").toString());
    properties.setOutputDir(dir.resolve("out").toString());
    return properties;
  }
}
