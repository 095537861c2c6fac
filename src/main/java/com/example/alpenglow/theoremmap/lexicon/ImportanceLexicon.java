package com.example.alpenglow.theoremmap.lexicon;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;

public interface ImportanceLexicon {

    /**
     * Return true when the token is a domain term worth matching on. Tokens are expected in lower
     * case.
     */
    boolean isImportant(String token);

    /**
     * Reduce a token set to its important terms, keeping the iteration order of the input.
     */
    default Set<String> findImportantTerms(Collection<String> tokens) {
        if (tokens == null || tokens.isEmpty()) {
            return Set.of();
        }

        Set<String> results = new LinkedHashSet<>();
        for (String token : tokens) {
            if (token != null && isImportant(token)) {
                results.add(token);
            }
        }
        return results;
    }
}
