package com.example.alpenglow.theoremmap.cli;

import com.example.alpenglow.theoremmap.config.MappingProperties;
import com.example.alpenglow.theoremmap.model.MappingReport;
import com.example.alpenglow.theoremmap.model.MappingRequest;
import com.example.alpenglow.theoremmap.service.TheoremMappingPipeline;
import com.example.alpenglow.theoremmap.validation.ValidationContext;
import com.example.alpenglow.theoremmap.validation.ValidationException;
import com.example.alpenglow.theoremmap.validation.ValidationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;
import java.util.function.BiConsumer;

/**
 * Command line entry: validates the run flags, drives one pipeline run and prints the summary.
 * Any failure is logged and turned into exit code 1.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TheoremMappingCommand implements ApplicationRunner, ExitCodeGenerator {

    private static final Map<String, BiConsumer<MappingProperties, String>> PATH_FLAGS = Map.of(
            "--whitepaper", MappingProperties::setWhitepaper,
            "--specs-dir", MappingProperties::setSpecsDir,
            "--proofs-dir", MappingProperties::setProofsDir,
            "--output-dir", MappingProperties::setOutputDir,
            "--project-root", MappingProperties::setProjectRoot);

    private final MappingProperties properties;
    private final ValidationService validationService;
    private final TheoremMappingPipeline pipeline;

    private int exitCode = 0;

    @Override
    public void run(ApplicationArguments args) {
        try {
            applySpaceSeparatedFlags(args.getSourceArgs());
            ValidationContext validated = validationService.validate(properties);
            validated.getNotices().forEach(notice -> log.warn(notice));

            MappingRequest request = validated.toRequest();
            MappingReport report = pipeline.run(request).block();
            if (report == null) {
                throw new IllegalStateException("Pipeline completed without a report");
            }
            printSummary(report, request);
            exitCode = 0;
        } catch (ValidationException e) {
            log.error("Invalid arguments: {}", e.getMessage());
            exitCode = 1;
        } catch (Exception e) {
            log.error("Error during theorem mapping generation: {}", e.getMessage(), e);
            exitCode = 1;
        }
    }

    /** Spring binds only {@code --flag=value}; pick up {@code --flag value} pairs here. */
    private void applySpaceSeparatedFlags(String[] sourceArgs) {
        for (int i = 0; i + 1 < sourceArgs.length; i++) {
            BiConsumer<MappingProperties, String> setter = PATH_FLAGS.get(sourceArgs[i]);
            if (setter != null && !sourceArgs[i + 1].startsWith("--")) {
                setter.accept(properties, sourceArgs[i + 1]);
                i++;
            }
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    private void printSummary(MappingReport report, MappingRequest request) {
        Map<String, Integer> summary = report.getVerificationSummary();
        log.info("Theorem Mapping Summary:");
        log.info("  Whitepaper theorems: {}", report.getTotalWhitepaperTheorems());
        log.info("  TLA+ theorems: {}", report.getTotalTlaTheorems());
        log.info("  Mapped theorems: {}", report.getMappedTheorems());
        log.info("  Coverage: {}%", String.format(Locale.ROOT, "%.1f", report.getCoveragePercent()));
        log.info("  TLAPS complete: {}", summary.getOrDefault("tlaps_complete", 0));
        log.info("  TLC verified: {}", summary.getOrDefault("tlc_verified", 0));
        log.info("  Stateright passed: {}", summary.getOrDefault("stateright_passed", 0));
        log.info("Reports generated in: {}", request.getOutputDir());
    }
}
