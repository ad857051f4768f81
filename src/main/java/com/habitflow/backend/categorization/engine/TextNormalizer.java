package com.habitflow.backend.categorization.engine;

import java.text.Normalizer;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Turns free text into the token sequence every matcher works on.
 *
 * Example: "  Go to the GYM!! " => [go, gym]
 */
public final class TextNormalizer {

    public static final int MAX_INPUT_LENGTH = 200;

    static final Set<String> STOP_WORDS = Set.of("a", "an", "the", "to", "my");

    private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{M}+");
    private static final Pattern APOSTROPHES = Pattern.compile("['’`]");
    private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^a-z0-9]+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private TextNormalizer() {}

    public static List<String> tokenize(String text) {
        if (text == null || text.isBlank()) return List.of();

        String s = clamp(text);

        // 1. Lowercase
        s = s.toLowerCase(Locale.ROOT);

        // 2. Remove accents (compatibility decomposition also folds ligatures / full-width forms)
        s = Normalizer.normalize(s, Normalizer.Form.NFKD);
        s = COMBINING_MARKS.matcher(s).replaceAll("");
        // decompositions may reintroduce capitals ("™" => "TM")
        s = s.toLowerCase(Locale.ROOT);

        // 3. "don't" => "dont", everything else that is not [a-z0-9] separates tokens
        s = APOSTROPHES.matcher(s).replaceAll("");
        s = NON_ALPHANUMERIC.matcher(s).replaceAll(" ").trim();
        if (s.isEmpty()) return List.of();

        List<String> tokens = new ArrayList<>();
        for (String t : WHITESPACE.split(s)) {
            if (!t.isEmpty() && !STOP_WORDS.contains(t)) {
                tokens.add(t);
            }
        }
        return List.copyOf(tokens);
    }

    /**
     * Normalized form as a single string (tokens joined by one space). Idempotent.
     */
    public static String normalize(String text) {
        return String.join(" ", tokenize(text));
    }

    static String clamp(String text) {
        if (text.length() <= MAX_INPUT_LENGTH) return text;
        int end = MAX_INPUT_LENGTH;
        if (Character.isHighSurrogate(text.charAt(end - 1))) {
            end--;
        }
        return text.substring(0, end);
    }
}
