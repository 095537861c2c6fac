package com.example.alpenglow.theoremmap.processor;

import com.example.alpenglow.theoremmap.config.MappingProperties;
import com.example.alpenglow.theoremmap.model.FormalStatement;
import com.example.alpenglow.theoremmap.model.MappingContext;
import com.example.alpenglow.theoremmap.model.MappingRequest;
import com.example.alpenglow.theoremmap.model.ProofStatus;
import com.example.alpenglow.theoremmap.util.StatementTextUtils;
import com.example.alpenglow.theoremmap.vocabulary.TheoremVocabulary;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

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
 * Scans specification and proof directories for formal modules and extracts their THEOREM and
 * LEMMA declarations. Unreadable modules are skipped; the remaining files are still processed.
 */
@Slf4j
@Component
public class FormalExtractionProcessor implements MappingStage {

    private static final String NAME = "formal-extraction";

    private final String extension;

    @Autowired
    public FormalExtractionProcessor(MappingProperties properties) {
        this(properties.getFormalExtension());
    }

    public FormalExtractionProcessor(String extension) {
        this.extension = (extension == null || extension.isBlank())
                ? TheoremVocabulary.FORMAL_EXTENSION
                : extension;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Mono<MappingContext> process(MappingContext ctx) {
        MappingRequest request = ctx.getRequest();
        Map<String, FormalStatement> statements = parse(request.getSpecsDir(), request.getProofsDir());
        ctx.setFormalStatements(statements);

        long complete = statements.values().stream()
                .filter(s -> s.getProofStatus() == ProofStatus.COMPLETE)
                .count();
        return Mono.just(ctx.addStep(NAME, "declarations=" + statements.size() + ", complete=" + complete));
    }

    public Map<String, FormalStatement> parse(Path specsDir, Path proofsDir) {
        log.info("Parsing formal modules in: {} and {}", specsDir, proofsDir);

        List<Path> files = new ArrayList<>();
        files.addAll(discover(specsDir));
        files.addAll(discover(proofsDir));
        log.info("Found {} formal module files", files.size());

        Map<String, FormalStatement> statements = new LinkedHashMap<>();
        for (Path file : files) {
            String content;
            try {
                content = Files.readString(file, StandardCharsets.UTF_8);
            } catch (IOException e) {
                log.warn("Could not read {}: {}", file, e.getMessage());
                continue;
            }
            extractModule(content, moduleName(file), file.toString(), statements);
        }

        log.info("Formal extraction complete: {} declarations", statements.size());
        return statements;
    }

    /**
     * Extract the declarations of one module into {@code target}. Theorems are read before lemmas,
     * so a lemma sharing a theorem's name replaces it.
     */
    public void extractModule(String content, String module, String filePath, Map<String, FormalStatement> target) {
        if (content == null || content.isBlank()) {
            return;
        }
        String text = content.replace("\r\n", "\n").replace('\r', '\n');
        ProofStatus status = proofStatusOf(text);

        extractDeclarations(TheoremVocabulary.FORMAL_THEOREM, text, module, filePath, status, target);
        extractDeclarations(TheoremVocabulary.FORMAL_LEMMA, text, module, filePath, status, target);
    }

    /** Whole-file status: both proof markers anywhere mean every declaration counts as complete. */
    public static ProofStatus proofStatusOf(String content) {
        if (content == null) {
            return ProofStatus.UNKNOWN;
        }
        boolean started = content.contains(TheoremVocabulary.PROOF_START);
        boolean completed = content.contains(TheoremVocabulary.PROOF_COMPLETE);
        if (started && completed) {
            return ProofStatus.COMPLETE;
        }
        if (started) {
            return ProofStatus.INCOMPLETE;
        }
        return ProofStatus.UNKNOWN;
    }

    private void extractDeclarations(Pattern pattern, String text, String module, String filePath,
                                     ProofStatus status, Map<String, FormalStatement> target) {
        Matcher m = pattern.matcher(text);
        while (m.find()) {
            String name = m.group(1);
            String statement = StatementTextUtils.cleanFormal(m.group(2));
            String id = module + "_" + name;

            FormalStatement parsed = FormalStatement.builder()
                    .id(id)
                    .name(name)
                    .statement(statement)
                    .proofStatus(status)
                    .module(module)
                    .filePath(filePath)
                    .lineNumber(StatementTextUtils.lineNumberAt(text, m.start()))
                    .dependencies(extractDependencies(statement))
                    .proofObligations(extractProofObligations(text, m.end()))
                    .build();

            if (target.put(id, parsed) != null) {
                log.debug("Duplicate formal declaration {}; keeping the later occurrence", id);
            }
        }
    }

    private List<String> extractDependencies(String statement) {
        Set<String> dependencies = new LinkedHashSet<>();
        Matcher m = TheoremVocabulary.FORMAL_REFERENCE.matcher(statement);
        while (m.find()) {
            dependencies.add(m.group(1) != null ? m.group(1) : m.group(2));
        }
        return List.copyOf(dependencies);
    }

    // The declaration's own proof block, if one starts right after its body.
    private List<String> extractProofObligations(String text, int declarationEnd) {
        String rest = text.substring(declarationEnd).stripLeading();
        if (!rest.startsWith(TheoremVocabulary.PROOF_START)) {
            return List.of();
        }
        int qed = rest.indexOf(TheoremVocabulary.PROOF_COMPLETE);
        String block = qed < 0 ? rest : rest.substring(0, qed);

        List<String> obligations = new ArrayList<>();
        Matcher m = TheoremVocabulary.PROOF_STEP.matcher(block);
        while (m.find()) {
            obligations.add("<" + m.group(1) + ">" + m.group(2) + ": " + StatementTextUtils.collapseWhitespace(m.group(3)));
        }
        return obligations;
    }

    private List<Path> discover(Path root) {
        if (root == null || !Files.isDirectory(root)) {
            log.warn("Formal module directory not found: {}", root);
            return List.of();
        }
        try (Stream<Path> walk = Files.walk(root)) {
            return walk.filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(extension))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Could not scan " + root, e);
        }
    }

    private String moduleName(Path file) {
        String fileName = file.getFileName().toString();
        return fileName.endsWith(extension)
                ? fileName.substring(0, fileName.length() - extension.length())
                : fileName;
    }
}
