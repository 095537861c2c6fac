package com.example.alpenglow.theoremmap.processor;

import com.example.alpenglow.theoremmap.lexicon.ImportanceLexicon;
import com.example.alpenglow.theoremmap.model.*;
import com.example.alpenglow.theoremmap.util.StatementTextUtils;
import com.example.alpenglow.theoremmap.vocabulary.TheoremVocabulary;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.*;

/**
 * Pairs every whitepaper statement with every formal declaration and keeps the pairs that share an
 * important domain term, or where a whitepaper theorem meets a declaration named like a theorem.
 * Every kept pair gets the same confidence: it signals "heuristic match found", not a probability.
 */
@Slf4j
@Component
public class KeywordMatchProcessor implements MappingStage {

    private static final String NAME = "keyword-match";

    public static final double KEYWORD_CONFIDENCE = 0.7;
    static final int LINE_RANGE_SPAN = 5;

    private final ImportanceLexicon importanceLexicon;

    public KeywordMatchProcessor(ImportanceLexicon importanceLexicon) {
        this.importanceLexicon = importanceLexicon;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Mono<MappingContext> process(MappingContext ctx) {
        List<TheoremMapping> mappings = match(ctx.getProseStatements(), ctx.getFormalStatements());
        ctx.setMappings(mappings);

        long covered = mappings.stream().map(TheoremMapping::getWhitepaperId).distinct().count();
        return Mono.just(ctx.addStep(NAME, "mappings=" + mappings.size() + ", coveredStatements=" + covered));
    }

    public List<TheoremMapping> match(Map<String, ProseStatement> proseStatements,
                                      Map<String, FormalStatement> formalStatements) {
        if (proseStatements == null || proseStatements.isEmpty()
                || formalStatements == null || formalStatements.isEmpty()) {
            log.info("Created 0 theorem mappings");
            return new ArrayList<>();
        }

        // formal side is tokenised once, not once per prose statement
        Map<String, Set<String>> formalTerms = new LinkedHashMap<>();
        for (FormalStatement formal : formalStatements.values()) {
            formalTerms.put(formal.getId(), importantTerms(formal.getName() + " " + formal.getStatement()));
        }

        String lastUpdated = LocalDateTime.now().toString();
        List<TheoremMapping> mappings = new ArrayList<>();
        for (ProseStatement prose : proseStatements.values()) {
            Set<String> proseTerms = importantTerms(prose.getTitle() + " " + prose.getStatement());
            for (FormalStatement formal : formalStatements.values()) {
                if (isMatch(prose, proseTerms, formal, formalTerms.get(formal.getId()))) {
                    mappings.add(toMapping(prose, formal, lastUpdated));
                }
            }
        }

        log.info("Created {} theorem mappings", mappings.size());
        return mappings;
    }

    private boolean isMatch(ProseStatement prose, Set<String> proseTerms,
                            FormalStatement formal, Set<String> formalTerms) {
        if (!proseTerms.isEmpty() && !formalTerms.isEmpty()
                && !Collections.disjoint(proseTerms, formalTerms)) {
            return true;
        }
        return prose.getType() == StatementKind.THEOREM
                && formal.getName() != null
                && formal.getName().toLowerCase(Locale.ROOT).contains(TheoremVocabulary.THEOREM_NAME_HINT);
    }

    private Set<String> importantTerms(String text) {
        return importanceLexicon.findImportantTerms(StatementTextUtils.wordTokens(text));
    }

    private TheoremMapping toMapping(ProseStatement prose, FormalStatement formal, String lastUpdated) {
        VerificationStatus status = VerificationStatus.builder()
                .tlapsStatus(formal.getProofStatus().code())
                .proofObligationsTotal(formal.getProofObligations().size())
                .build();

        return TheoremMapping.builder()
                .whitepaperId(prose.getId())
                .tlaId(formal.getId())
                .confidence(KEYWORD_CONFIDENCE)
                .mappingType(TheoremMapping.KEYWORD_BASED)
                .verificationStatus(status)
                .fileLocation(formal.getFilePath() == null ? "" : formal.getFilePath())
                .lineRange(LineRange.of(formal.getLineNumber(), formal.getLineNumber() + LINE_RANGE_SPAN))
                .crossReferences(prose.getDependencies())
                .lastUpdated(lastUpdated)
                .build();
    }
}
