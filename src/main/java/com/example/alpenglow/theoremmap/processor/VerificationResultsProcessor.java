package com.example.alpenglow.theoremmap.processor;

import com.example.alpenglow.theoremmap.model.FormalStatement;
import com.example.alpenglow.theoremmap.model.MappingContext;
import com.example.alpenglow.theoremmap.model.TheoremMapping;
import com.example.alpenglow.theoremmap.model.VerificationStatus;
import com.example.alpenglow.theoremmap.service.VerificationResultsService;
import com.example.alpenglow.theoremmap.service.VerificationResultsService.BackendResult;
import com.example.alpenglow.theoremmap.service.VerificationResultsService.VerificationResults;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Overlays TLC and Stateright verdicts found on disk onto the matched mappings. The TLAPS status is
 * left as the formal extractor derived it.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class VerificationResultsProcessor implements MappingStage {

    private static final String NAME = "verification-results";

    private final VerificationResultsService resultsService;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Mono<MappingContext> process(MappingContext ctx) {
        if (ctx.getMappings().isEmpty()) {
            return Mono.just(ctx.addStep(NAME, "no mappings; skipped"));
        }

        VerificationResults results = resultsService.load(ctx.getRequest().getProjectRoot());
        if (results.isEmpty()) {
            return Mono.just(ctx.addStep(NAME, "no results found"));
        }

        int updated = 0;
        List<TheoremMapping> overlaid = new ArrayList<>(ctx.getMappings().size());
        for (TheoremMapping mapping : ctx.getMappings()) {
            TheoremMapping next = overlay(mapping, ctx.getFormalStatements().get(mapping.getTlaId()), results);
            if (next != mapping) {
                updated++;
            }
            overlaid.add(next);
        }
        ctx.setMappings(overlaid);
        log.debug("[{}] updated {} of {} mappings", NAME, updated, overlaid.size());
        return Mono.just(ctx.addStep(NAME, "tlc=" + results.tlc().size()
                + ", stateright=" + results.stateright().size()
                + ", updated=" + updated));
    }

    TheoremMapping overlay(TheoremMapping mapping, FormalStatement formal, VerificationResults results) {
        BackendResult tlc = lookup(results.tlc(), formal, mapping.getTlaId());
        BackendResult stateright = lookup(results.stateright(), formal, mapping.getTlaId());
        if (tlc == null && stateright == null) {
            return mapping;
        }

        VerificationStatus current = mapping.getVerificationStatus();
        VerificationStatus.VerificationStatusBuilder status = current.toBuilder();
        String lastVerified = current.getLastVerified();
        if (tlc != null) {
            status.tlcStatus(tlc.status());
            if (lastVerified == null) {
                lastVerified = tlc.timestamp();
            }
        }
        if (stateright != null) {
            status.staterightStatus(stateright.status());
            if (lastVerified == null) {
                lastVerified = stateright.timestamp();
            }
        }
        return mapping.toBuilder()
                .verificationStatus(status.lastVerified(lastVerified).build())
                .build();
    }

    private static BackendResult lookup(Map<String, BackendResult> byName, FormalStatement formal, String tlaId) {
        if (formal != null && byName.containsKey(formal.getName())) {
            return byName.get(formal.getName());
        }
        return byName.get(tlaId);
    }
}
