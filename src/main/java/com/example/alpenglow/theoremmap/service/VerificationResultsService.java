package com.example.alpenglow.theoremmap.service;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Reads model-checking and cross-validation result files that other tooling leaves under the
 * project root. Nothing here runs a checker; absent results simply leave statuses unknown.
 */
@Slf4j
@Service
public class VerificationResultsService {

    static final Path TLC_RESULTS = Path.of("results", "tlc");
    static final Path STATERIGHT_RESULTS = Path.of("stateright", "target", "test-results");

    private static final Pattern TIMESTAMP = Pattern.compile("(\\d{4}-\\d{2}-\\d{2} \\d{2}:\\d{2}:\\d{2})");
    private static final Pattern INVARIANT_VIOLATED = Pattern.compile("Invariant.*violated", Pattern.DOTALL);

    private final ObjectMapper objectMapper;

    public VerificationResultsService() {
        this(new ObjectMapper());
    }

    public VerificationResultsService(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /** A backend verdict for one property or test. */
    public record BackendResult(String status, String timestamp) {}

    /** Results per backend, keyed by property or test name. */
    public record VerificationResults(Map<String, BackendResult> tlc, Map<String, BackendResult> stateright) {
        public static VerificationResults empty() {
            return new VerificationResults(Map.of(), Map.of());
        }

        public boolean isEmpty() {
            return tlc.isEmpty() && stateright.isEmpty();
        }
    }

    public VerificationResults load(Path projectRoot) {
        if (projectRoot == null) {
            return VerificationResults.empty();
        }
        log.info("Checking verification results under {}", projectRoot);
        Map<String, BackendResult> tlc = loadTlc(projectRoot.resolve(TLC_RESULTS));
        Map<String, BackendResult> stateright = loadStateright(projectRoot.resolve(STATERIGHT_RESULTS));
        log.info("Loaded {} TLC results and {} Stateright results", tlc.size(), stateright.size());
        return new VerificationResults(tlc, stateright);
    }

    // ---------------- TLC ----------------
    private Map<String, BackendResult> loadTlc(Path dir) {
        if (!Files.isDirectory(dir)) {
            log.warn("TLC output directory not found: {}", dir);
            return Map.of();
        }
        Map<String, BackendResult> results = new LinkedHashMap<>();
        for (Path file : list(dir, ".out")) {
            parseTlcOutput(file).ifPresent(r -> results.put(stem(file), r));
        }
        for (Path file : list(dir, ".json")) {
            results.putAll(parseTlcJson(file));
        }
        return results;
    }

    Optional<BackendResult> parseTlcOutput(Path file) {
        String content;
        try {
            content = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.warn("Could not parse TLC output {}: {}", file, e.getMessage());
            return Optional.empty();
        }
        return Optional.of(new BackendResult(tlcStatusOf(content), firstTimestamp(content)));
    }

    static String tlcStatusOf(String content) {
        if (content.contains("Model checking completed")) {
            return "verified";
        }
        if (content.contains("Error:") || INVARIANT_VIOLATED.matcher(content).find()) {
            return "failed";
        }
        if (content.toLowerCase(Locale.ROOT).contains("timeout")) {
            return "timeout";
        }
        return "unknown";
    }

    private Map<String, BackendResult> parseTlcJson(Path file) {
        try {
            TlcReport report = objectMapper.readValue(file.toFile(), TlcReport.class);
            Map<String, BackendResult> results = new LinkedHashMap<>();
            if (report.results != null) {
                for (TlcEntry entry : report.results) {
                    if (entry == null || entry.property == null || entry.property.isBlank()) {
                        continue;
                    }
                    String status = entry.status == null ? "unknown" : entry.status;
                    results.put(entry.property, new BackendResult(status, entry.timestamp));
                }
            }
            return results;
        } catch (IOException e) {
            log.warn("Could not parse TLC JSON {}: {}", file, e.getMessage());
            return Map.of();
        }
    }

    // ---------------- Stateright ----------------
    private Map<String, BackendResult> loadStateright(Path dir) {
        if (!Files.isDirectory(dir)) {
            log.warn("Stateright output directory not found: {}", dir);
            return Map.of();
        }
        Map<String, BackendResult> results = new LinkedHashMap<>();
        for (Path file : list(dir, ".json")) {
            try {
                StaterightReport report = objectMapper.readValue(file.toFile(), StaterightReport.class);
                if (report.tests == null) {
                    continue;
                }
                for (StaterightTest test : report.tests) {
                    if (test == null || test.name == null) {
                        continue;
                    }
                    // only tests named after a theorem or lemma say anything about one
                    String lower = test.name.toLowerCase(Locale.ROOT);
                    if (lower.contains("theorem") || lower.contains("lemma")) {
                        results.put(test.name, new BackendResult(test.passed ? "passed" : "failed", test.timestamp));
                    }
                }
            } catch (IOException e) {
                log.warn("Could not parse Stateright JSON {}: {}", file, e.getMessage());
            }
        }
        return results;
    }

    private List<Path> list(Path dir, String suffix) {
        try (Stream<Path> files = Files.list(dir)) {
            return files.filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(suffix))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Could not list " + dir, e);
        }
    }

    private static String firstTimestamp(String content) {
        Matcher m = TIMESTAMP.matcher(content);
        return m.find() ? m.group(1) : null;
    }

    private static String stem(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot < 0 ? name : name.substring(0, dot);
    }

    // ---------------- JSON mapping types ----------------
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class TlcReport {
        public List<TlcEntry> results;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static class TlcEntry {
        public String property;
        public String status;
        public String timestamp;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static class StaterightReport {
        public List<StaterightTest> tests;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static class StaterightTest {
        public String name;
        public boolean passed;
        public String timestamp;
    }
}
