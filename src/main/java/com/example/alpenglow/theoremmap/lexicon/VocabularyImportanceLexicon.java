package com.example.alpenglow.theoremmap.lexicon;

import com.example.alpenglow.theoremmap.vocabulary.TheoremVocabulary;
import org.springframework.stereotype.Component;

import java.util.Locale;

@Component
public class VocabularyImportanceLexicon implements ImportanceLexicon {

    @Override
    public boolean isImportant(String token) {
        if (token == null || token.isBlank()) {
            return false;
        }
        return TheoremVocabulary.IMPORTANCE_KEYWORDS.contains(token.toLowerCase(Locale.ROOT));
    }
}
