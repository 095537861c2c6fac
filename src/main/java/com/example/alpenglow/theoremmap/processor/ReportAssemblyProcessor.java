package com.example.alpenglow.theoremmap.processor;

import com.example.alpenglow.theoremmap.config.MappingProperties;
import com.example.alpenglow.theoremmap.model.*;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.*;

/**
 * Freezes the matched mappings into a {@link MappingReport}. Every number the report views print is
 * computed here, once.
 */
@Slf4j
@Component
public class ReportAssemblyProcessor implements MappingStage {

    private static final String NAME = "report-assembly";

    private final boolean trackUnmapped;
    private final double coverageWarningThreshold;

    public ReportAssemblyProcessor(MappingProperties properties) {
        this.trackUnmapped = properties.getReport().isTrackUnmapped();
        this.coverageWarningThreshold = properties.getReport().getCoverageWarningThreshold();
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Mono<MappingContext> process(MappingContext ctx) {
        MappingReport report = assemble(ctx.getProseStatements(), ctx.getFormalStatements(), ctx.getMappings());
        ctx.setReport(report);

        if (report.getTotalWhitepaperTheorems() > 0
                && report.getCoveragePercent() < coverageWarningThreshold * 100.0) {
            log.warn("Low mapping coverage ({}%). Consider adding more formal specifications.",
                    String.format(Locale.ROOT, "%.1f", report.getCoveragePercent()));
        }
        return Mono.just(ctx.addStep(NAME, "mapped=" + report.getMappedTheorems()
                + ", coverage=" + String.format(Locale.ROOT, "%.1f", report.getCoveragePercent())));
    }

    public MappingReport assemble(Map<String, ProseStatement> prose,
                                  Map<String, FormalStatement> formal,
                                  List<TheoremMapping> mappings) {
        List<TheoremMapping> frozen = List.copyOf(mappings);
        return MappingReport.builder()
                .generationTimestamp(LocalDateTime.now().toString())
                .totalWhitepaperTheorems(prose.size())
                .totalTlaTheorems(formal.size())
                .mappedTheorems(frozen.size())
                .verificationSummary(summarize(frozen))
                .mappings(frozen)
                .unmappedWhitepaper(trackUnmapped ? unmapped(prose.keySet(), frozen, true) : List.of())
                .unmappedTla(trackUnmapped ? unmapped(formal.keySet(), frozen, false) : List.of())
                .crossReferences(crossReferences(prose, frozen))
                .statistics(statistics(frozen))
                .build();
    }

    // ----------------------------------------------------
    // summary + statistics
    // ----------------------------------------------------
    private Map<String, Integer> summarize(List<TheoremMapping> mappings) {
        Map<String, Integer> summary = new LinkedHashMap<>();
        for (String key : List.of("tlaps_complete", "tlaps_incomplete", "tlaps_missing",
                "tlc_verified", "tlc_failed", "stateright_passed", "stateright_failed")) {
            summary.put(key, 0);
        }
        for (TheoremMapping mapping : mappings) {
            VerificationStatus status = mapping.getVerificationStatus();
            summary.computeIfPresent("tlaps_" + status.getTlapsStatus(), (k, v) -> v + 1);
            summary.computeIfPresent("tlc_" + status.getTlcStatus(), (k, v) -> v + 1);
            summary.computeIfPresent("stateright_" + status.getStaterightStatus(), (k, v) -> v + 1);
        }
        return summary;
    }

    private Map<String, Object> statistics(List<TheoremMapping> mappings) {
        Map<String, Integer> tlaps = new TreeMap<>();
        Map<String, Integer> tlc = new TreeMap<>();
        Map<String, Integer> stateright = new TreeMap<>();
        Map<String, Integer> types = new TreeMap<>();
        int obligationsTotal = 0;
        int obligationsComplete = 0;

        for (TheoremMapping mapping : mappings) {
            VerificationStatus status = mapping.getVerificationStatus();
            tlaps.merge(status.getTlapsStatus(), 1, Integer::sum);
            tlc.merge(status.getTlcStatus(), 1, Integer::sum);
            stateright.merge(status.getStaterightStatus(), 1, Integer::sum);
            types.merge(mapping.getMappingType(), 1, Integer::sum);
            obligationsTotal += status.getProofObligationsTotal();
            obligationsComplete += status.getProofObligationsComplete();
        }

        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("tlaps_status_distribution", tlaps);
        stats.put("tlc_status_distribution", tlc);
        stats.put("stateright_status_distribution", stateright);
        stats.put("mapping_type_distribution", types);

        DoubleSummaryStatistics confidence = mappings.stream()
                .mapToDouble(TheoremMapping::getConfidence)
                .summaryStatistics();
        if (confidence.getCount() > 0) {
            Map<String, Double> confidenceStats = new LinkedHashMap<>();
            confidenceStats.put("mean", confidence.getAverage());
            confidenceStats.put("min", confidence.getMin());
            confidenceStats.put("max", confidence.getMax());
            stats.put("confidence_stats", confidenceStats);
        }

        Map<String, Object> obligations = new LinkedHashMap<>();
        obligations.put("total", obligationsTotal);
        obligations.put("complete", obligationsComplete);
        obligations.put("completion_rate", obligationsTotal > 0 ? (double) obligationsComplete / obligationsTotal : 0.0);
        stats.put("proof_obligations", obligations);
        return stats;
    }

    // Formal ids reachable through the prose dependencies of each mapped statement.
    private Map<String, List<String>> crossReferences(Map<String, ProseStatement> prose, List<TheoremMapping> mappings) {
        Map<String, Set<String>> formalByProse = new LinkedHashMap<>();
        for (TheoremMapping mapping : mappings) {
            formalByProse.computeIfAbsent(mapping.getWhitepaperId(), k -> new LinkedHashSet<>()).add(mapping.getTlaId());
        }

        Map<String, Set<String>> refs = new LinkedHashMap<>();
        for (TheoremMapping mapping : mappings) {
            ProseStatement statement = prose.get(mapping.getWhitepaperId());
            if (statement == null) {
                continue;
            }
            for (String dependency : statement.getDependencies()) {
                Set<String> targets = formalByProse.get(dependency);
                if (targets != null) {
                    refs.computeIfAbsent(mapping.getTlaId(), k -> new LinkedHashSet<>()).addAll(targets);
                }
            }
        }

        Map<String, List<String>> out = new LinkedHashMap<>();
        refs.forEach((k, v) -> out.put(k, List.copyOf(v)));
        return out;
    }

    private List<String> unmapped(Set<String> ids, List<TheoremMapping> mappings, boolean whitepaperSide) {
        Set<String> mapped = new HashSet<>();
        for (TheoremMapping mapping : mappings) {
            mapped.add(whitepaperSide ? mapping.getWhitepaperId() : mapping.getTlaId());
        }
        return ids.stream().filter(id -> !mapped.contains(id)).toList();
    }
}
