package com.example.alpenglow.theoremmap.report;

import com.example.alpenglow.theoremmap.config.MappingProperties;
import com.example.alpenglow.theoremmap.model.MappingReport;
import com.example.alpenglow.theoremmap.model.TheoremMapping;
import com.example.alpenglow.theoremmap.util.TemplateRenderer;
import org.springframework.stereotype.Component;
import org.springframework.web.util.HtmlUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Minimal styled page for browsing the mapping table. */
@Component
public class HtmlReportWriter implements ReportWriter {

    private static final String PAGE = """
            <!DOCTYPE html>
            <html>
            <head>
                <meta charset="UTF-8">
                <title>{{title}}</title>
                <style>
                    body { font-family: Arial, sans-serif; margin: 40px; }
                    table { border-collapse: collapse; width: 100%; }
                    th, td { border: 1px solid #ddd; padding: 8px; text-align: left; }
                    th { background-color: #f2f2f2; }
                    .status-complete { color: green; font-weight: bold; }
                    .status-incomplete { color: orange; font-weight: bold; }
                    .status-unknown { color: gray; }
                    .summary { background-color: #f9f9f9; padding: 20px; margin: 20px 0; }
                </style>
            </head>
            <body>
                <h1>{{title}}</h1>
                <p class="summary"><strong>Generated:</strong> {{generated}}<br>{{mapped}} mappings across {{totalWhitepaper}} whitepaper and {{totalTla}} TLA+ theorems ({{coverage}}% coverage)</p>
                <table>
                    <thead>
                        <tr>
                            <th>Whitepaper ID</th>
                            <th>TLA+ ID</th>
                            <th>Confidence</th>
                            <th>TLAPS Status</th>
                            <th>File Location</th>
                        </tr>
                    </thead>
                    <tbody>
            {{raw:rows}}        </tbody>
                </table>
            </body>
            </html>
            """;

    private static final String ROW = """
                        <tr>
                            <td>{{whitepaperId}}</td>
                            <td>{{tlaId}}</td>
                            <td>{{confidence}}</td>
                            <td class="status-{{tlaps}}">{{tlaps}}</td>
                            <td>{{fileLocation}}</td>
                        </tr>
            """;

    private final String title;

    public HtmlReportWriter(MappingProperties properties) {
        this.title = properties.getReport().getTitle();
    }

    @Override
    public String fileName() {
        return ReportFormats.BASE_NAME + ".html";
    }

    @Override
    public int order() {
        return 3;
    }

    @Override
    public void write(MappingReport report, Path target) throws IOException {
        Files.writeString(target, render(report), StandardCharsets.UTF_8);
    }

    String render(MappingReport report) {
        Map<String, Object> vars = new LinkedHashMap<>();
        vars.put("title", title);
        vars.put("generated", report.getGenerationTimestamp());
        vars.put("mapped", report.getMappedTheorems());
        vars.put("totalWhitepaper", report.getTotalWhitepaperTheorems());
        vars.put("totalTla", report.getTotalTlaTheorems());
        vars.put("coverage", ReportFormats.percent(report.getCoveragePercent()));
        vars.put("rows", rows(report.getMappings()));
        return TemplateRenderer.render(PAGE, vars, HtmlUtils::htmlEscape);
    }

    private static String rows(List<TheoremMapping> mappings) {
        StringBuilder sb = new StringBuilder();
        for (TheoremMapping mapping : mappings) {
            Map<String, Object> vars = new LinkedHashMap<>();
            vars.put("whitepaperId", mapping.getWhitepaperId());
            vars.put("tlaId", mapping.getTlaId());
            vars.put("confidence", ReportFormats.confidence(mapping.getConfidence()));
            vars.put("tlaps", mapping.getVerificationStatus().getTlapsStatus());
            vars.put("fileLocation", mapping.getFileLocation());
            sb.append(TemplateRenderer.render(ROW, vars, HtmlUtils::htmlEscape));
        }
        return sb.toString();
    }
}
