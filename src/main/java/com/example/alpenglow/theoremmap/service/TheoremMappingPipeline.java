package com.example.alpenglow.theoremmap.service;

import com.example.alpenglow.theoremmap.model.MappingContext;
import com.example.alpenglow.theoremmap.model.MappingReport;
import com.example.alpenglow.theoremmap.model.MappingRequest;
import com.example.alpenglow.theoremmap.processor.*;
import com.example.alpenglow.theoremmap.report.ReportSynthesizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.aop.support.AopUtils;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Runs one mapping cycle: both extractors, the matcher, the verification overlay and report
 * assembly, then hands the frozen report to the synthesizer. Stages run one after another on the
 * subscribing thread.
 */
@Slf4j
@Service
public class TheoremMappingPipeline {

  // Explicit, deterministic order; the two extractors do not depend on each other
  private static final List<Class<? extends MappingStage>> DEFAULT_ORDER = List.of(
          ProseExtractionProcessor.class,
          FormalExtractionProcessor.class,
          KeywordMatchProcessor.class,
          VerificationResultsProcessor.class,
          ReportAssemblyProcessor.class
  );

  private final Map<Class<? extends MappingStage>, MappingStage> stagesByType;
  private final ReportSynthesizer reportSynthesizer;

  public TheoremMappingPipeline(List<MappingStage> stages, ReportSynthesizer reportSynthesizer) {
    // Use AopUtils.getTargetClass to handle Spring proxies (CGLIB/JDK)
    this.stagesByType = stages.stream()
        .collect(Collectors.toMap(
            TheoremMappingPipeline::getConcreteType,
            Function.identity(),
            (left, right) -> left,
            LinkedHashMap::new
        ));
    this.reportSynthesizer = reportSynthesizer;
  }

  public Mono<MappingReport> run(MappingRequest request) {
    return runContext(request).map(MappingContext::getReport);
  }

  public Mono<MappingContext> runContext(MappingRequest request) {
    log.info("Starting theorem mapping generation");
    Mono<MappingContext> pipeline = Mono.just(new MappingContext().setRequest(request));
    for (MappingStage stage : buildOrderedChain()) {
      pipeline = pipeline.flatMap(current -> {
        log.debug("[{}] running", stage.name());
        return stage.process(current);
      });
    }
    return pipeline.map(this::writeReports);
  }

  private MappingContext writeReports(MappingContext ctx) {
    MappingReport report = ctx.getReport();
    if (report == null) {
      throw new IllegalStateException("No report was assembled; is the report-assembly stage registered?");
    }
    Path outputDir = ctx.getRequest().getOutputDir();
    List<Path> written = reportSynthesizer.synthesize(report, outputDir);
    ctx.addStep("report-synthesis", "files=" + written.size() + ", dir=" + outputDir);
    if (log.isDebugEnabled()) {
      ctx.getSteps().forEach(step -> log.debug(step.summary()));
    }
    log.info("Theorem mapping generation complete: {} mappings", report.getMappedTheorems());
    return ctx;
  }

  private List<MappingStage> buildOrderedChain() {
    Set<MappingStage> seen = new LinkedHashSet<>();
    List<MappingStage> ordered = new ArrayList<>();

    // 1) Add stages in DEFAULT_ORDER if present, holding back report assembly
    for (Class<? extends MappingStage> type : DEFAULT_ORDER) {
      MappingStage stage = stagesByType.get(type);
      if (stage != null && type != ReportAssemblyProcessor.class && seen.add(stage)) {
        ordered.add(stage);
      }
    }

    // 2) Add any remaining stages (in registration order) so they still feed the report
    MappingStage assembly = stagesByType.get(ReportAssemblyProcessor.class);
    for (MappingStage stage : stagesByType.values()) {
      if (stage != assembly && seen.add(stage)) {
        ordered.add(stage);
      }
    }

    // 3) Report assembly always closes the chain
    if (assembly != null) {
      ordered.add(assembly);
    }
    return ordered;
  }

  @SuppressWarnings("unchecked")
  private static Class<? extends MappingStage> getConcreteType(MappingStage stage) {
    Class<?> target = AopUtils.getTargetClass(stage);
    if (target == null || !MappingStage.class.isAssignableFrom(target)) {
      target = stage.getClass();
    }
    return (Class<? extends MappingStage>) target;
  }
}
