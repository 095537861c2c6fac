package com.example.alpenglow.theoremmap.processor;

import com.example.alpenglow.theoremmap.model.MappingContext;
import com.example.alpenglow.theoremmap.model.ProseStatement;
import com.example.alpenglow.theoremmap.model.StatementKind;
import com.example.alpenglow.theoremmap.util.StatementTextUtils;
import com.example.alpenglow.theoremmap.vocabulary.TheoremVocabulary;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.*;
import java.util.regex.Matcher;

/**
 * Recovers "Theorem N" and "Assumption N" statements from the whitepaper. A missing whitepaper
 * yields no statements; a whitepaper that exists but cannot be decoded fails the run.
 */
@Slf4j
@Component
public class ProseExtractionProcessor implements MappingStage {

    private static final String NAME = "prose-extraction";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Mono<MappingContext> process(MappingContext ctx) {
        Path whitepaper = ctx.getRequest().getWhitepaper();
        Map<String, ProseStatement> statements = parse(whitepaper);
        ctx.setProseStatements(statements);

        long theorems = statements.values().stream().filter(s -> s.getType() == StatementKind.THEOREM).count();
        return Mono.just(ctx.addStep(NAME, "statements=" + statements.size()
                + ", theorems=" + theorems
                + ", assumptions=" + (statements.size() - theorems)));
    }

    public Map<String, ProseStatement> parse(Path whitepaper) {
        log.info("Parsing whitepaper: {}", whitepaper);

        String content;
        try {
            content = Files.readString(whitepaper, StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            log.error("Whitepaper file not found: {}", whitepaper);
            return new LinkedHashMap<>();
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read whitepaper " + whitepaper, e);
        }

        Map<String, ProseStatement> statements = extract(content);
        log.info("Whitepaper extraction complete: {} statements", statements.size());
        return statements;
    }

    /** Extract every numbered theorem and assumption; a repeated id keeps the later statement. */
    public Map<String, ProseStatement> extract(String content) {
        Map<String, ProseStatement> statements = new LinkedHashMap<>();
        if (content == null || content.isBlank()) {
            return statements;
        }

        String text = content.replace("\r\n", "\n").replace('\r', '\n');
        NavigableMap<Integer, String> sections = extractSections(text);

        Matcher m = TheoremVocabulary.PROSE_STATEMENT.matcher(text);
        while (m.find()) {
            StatementKind kind = StatementKind.fromKeyword(m.group(1));
            String ordinal = m.group(2);
            String explicitTitle = m.group(3);
            String statement = StatementTextUtils.cleanProse(m.group(4));

            String id = kind.idFor(ordinal);
            ProseStatement parsed = ProseStatement.builder()
                    .id(id)
                    .type(kind)
                    .title(explicitTitle == null || explicitTitle.isBlank()
                            ? kind.defaultTitle(ordinal)
                            : explicitTitle.strip())
                    .statement(statement)
                    .proofSketch(kind == StatementKind.THEOREM ? proofSketchAfter(text, m.end()) : "")
                    .section(sectionAt(sections, StatementTextUtils.lineNumberAt(text, m.start())))
                    .dependencies(extractDependencies(statement))
                    .build();

            if (statements.put(id, parsed) != null) {
                log.debug("Duplicate whitepaper statement {}; keeping the later occurrence", id);
            }
        }
        return statements;
    }

    // ----------------------------------------------------
    // sections: line number -> "1 Intro > 1.2 Safety"
    // ----------------------------------------------------
    private NavigableMap<Integer, String> extractSections(String text) {
        NavigableMap<Integer, String> sections = new TreeMap<>();
        Map<Integer, String> hierarchy = new TreeMap<>();

        String[] lines = text.split("\n", -1);
        for (int i = 0; i < lines.length; i++) {
            Matcher m = TheoremVocabulary.SECTION_HEADING.matcher(lines[i].strip());
            if (!m.matches()) {
                continue;
            }
            int level = m.group(1).length();
            hierarchy.put(level, m.group(2) + " " + m.group(3).strip());
            hierarchy.keySet().removeIf(l -> l > level);
            sections.put(i + 1, String.join(" > ", hierarchy.values()));
        }
        return sections;
    }

    private String sectionAt(NavigableMap<Integer, String> sections, int line) {
        Map.Entry<Integer, String> entry = sections.floorEntry(line);
        return entry == null ? TheoremVocabulary.UNKNOWN_SECTION : entry.getValue();
    }

    private String proofSketchAfter(String text, int statementEnd) {
        Matcher proof = TheoremVocabulary.PROSE_PROOF.matcher(text);
        proof.region(statementEnd, text.length());
        if (proof.lookingAt()) {
            return StatementTextUtils.cleanProse(proof.group(1));
        }
        return "";
    }

    private List<String> extractDependencies(String statement) {
        Set<String> dependencies = new LinkedHashSet<>();
        Matcher m = TheoremVocabulary.PROSE_REFERENCE.matcher(statement);
        while (m.find()) {
            dependencies.add(m.group(1).toLowerCase(Locale.ROOT) + "_" + m.group(2));
        }
        return List.copyOf(dependencies);
    }
}
