package com.example.alpenglow.theoremmap.report;

import com.example.alpenglow.theoremmap.config.MappingProperties;
import com.example.alpenglow.theoremmap.model.MappingReport;
import com.example.alpenglow.theoremmap.model.TheoremMapping;
import com.example.alpenglow.theoremmap.util.TemplateRenderer;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Narrative view: summary, coverage, verification summary and the mapping table. */
@Component
public class MarkdownReportWriter implements ReportWriter {

    private static final String TEMPLATE = """
            # {{title}}

            Generated: {{generated}}

            ## Summary

            - **Total Whitepaper Theorems**: {{totalWhitepaper}}
            - **Total TLA+ Theorems**: {{totalTla}}
            - **Mapped Theorems**: {{mapped}}
            - **Mapping Coverage**: {{coverage}}%

            ## Verification Status Summary

            {{verificationSummary}}
            ## Detailed Theorem Mappings

            | Whitepaper ID | TLA+ ID | Confidence | Type | TLAPS Status | File Location | Line Range |
            |---------------|---------|------------|------|--------------|---------------|------------|
            {{rows}}{{unmapped}}""";

    private final String title;

    public MarkdownReportWriter(MappingProperties properties) {
        this.title = properties.getReport().getTitle();
    }

    @Override
    public String fileName() {
        return ReportFormats.BASE_NAME + ".md";
    }

    @Override
    public int order() {
        return 2;
    }

    @Override
    public void write(MappingReport report, Path target) throws IOException {
        Files.writeString(target, render(report), StandardCharsets.UTF_8);
    }

    String render(MappingReport report) {
        Map<String, Object> vars = new LinkedHashMap<>();
        vars.put("title", title);
        vars.put("generated", report.getGenerationTimestamp());
        vars.put("totalWhitepaper", report.getTotalWhitepaperTheorems());
        vars.put("totalTla", report.getTotalTlaTheorems());
        vars.put("mapped", report.getMappedTheorems());
        vars.put("coverage", ReportFormats.percent(report.getCoveragePercent()));
        vars.put("verificationSummary", verificationSummary(report.getVerificationSummary()));
        vars.put("rows", rows(report.getMappings()));
        vars.put("unmapped", unmappedSection("Unmapped Whitepaper Theorems", report.getUnmappedWhitepaper())
                + unmappedSection("Unmapped TLA+ Theorems", report.getUnmappedTla()));
        return TemplateRenderer.render(TEMPLATE, vars);
    }

    private static String verificationSummary(Map<String, Integer> summary) {
        StringBuilder sb = new StringBuilder();
        summary.forEach((key, count) ->
                sb.append("- **").append(ReportFormats.label(key)).append("**: ").append(count).append('\n'));
        return sb.toString();
    }

    private static String rows(List<TheoremMapping> mappings) {
        StringBuilder sb = new StringBuilder();
        for (TheoremMapping mapping : mappings) {
            sb.append("| ").append(cell(mapping.getWhitepaperId()))
                    .append(" | ").append(cell(mapping.getTlaId()))
                    .append(" | ").append(ReportFormats.confidence(mapping.getConfidence()))
                    .append(" | ").append(cell(mapping.getMappingType()))
                    .append(" | ").append(cell(mapping.getVerificationStatus().getTlapsStatus()))
                    .append(" | ").append(cell(mapping.getFileLocation()))
                    .append(" | ").append(mapping.getLineRange().format())
                    .append(" |\n");
        }
        return sb.toString();
    }

    private static String unmappedSection(String heading, List<String> ids) {
        if (ids == null || ids.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder("\n## ").append(heading).append("\n\n");
        for (String id : ids) {
            sb.append("- ").append(id).append('\n');
        }
        return sb.toString();
    }

    private static String cell(String value) {
        return value == null ? "" : value.replace("|", "\\|");
    }
}
