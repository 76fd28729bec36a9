package com.sharpskill.search.service;

import com.sharpskill.search.config.TokenizerProperties;
import com.sharpskill.search.exception.TokenizationException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

@Component
@RequiredArgsConstructor
public class LexicalTokenizer implements Tokenizer {

    private static final Pattern SEPARATOR = Pattern.compile("[^\\p{L}\\p{N}]+");

    private final TokenizerProperties properties;

    @Override
    public List<String> tokenize(String text, Set<String> retainedShortTerms) {
        List<String> out = new ArrayList<>();
        for (String token : normalize(text)) {
            if (!isShort(token) || retainedShortTerms.contains(token)) {
                out.add(token);
            }
        }
        return out;
    }

    @Override
    public List<String> normalize(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        checkWellFormed(text);

        String lower = text.toLowerCase(Locale.ROOT);
        List<String> out = new ArrayList<>();
        for (String raw : SEPARATOR.split(lower)) {
            if (raw.isEmpty()) {
                continue;
            }
            String token = properties.aliases().getOrDefault(raw, raw);
            if (properties.stemming()) {
                token = foldPlural(token);
            }
            out.add(token);
        }
        return out;
    }

    @Override
    public boolean isShort(String term) {
        return term.length() < properties.minTokenLength();
    }

    /**
     * Conservative English plural folding: {@code hooks -> hook},
     * {@code libraries -> library}. Leaves {@code cypress}, {@code redis},
     * {@code status} and anything containing digits untouched.
     */
    static String foldPlural(String token) {
        int len = token.length();
        if (len <= 3 || !token.chars().allMatch(Character::isLetter)) {
            return token;
        }
        if (token.endsWith("ies") && len > 4) {
            return token.substring(0, len - 3) + "y";
        }
        if (token.endsWith("s") && !token.endsWith("ss") && !token.endsWith("us") && !token.endsWith("is")) {
            return token.substring(0, len - 1);
        }
        return token;
    }

    private static void checkWellFormed(String text) {
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (Character.isHighSurrogate(c)) {
                if (i + 1 >= text.length() || !Character.isLowSurrogate(text.charAt(i + 1))) {
                    throw new TokenizationException("Unpaired high surrogate at index " + i);
                }
                i++;
            } else if (Character.isLowSurrogate(c)) {
                throw new TokenizationException("Unpaired low surrogate at index " + i);
            }
        }
    }
}
