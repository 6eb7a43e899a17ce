package com.example.repoassist;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lexical normalization shared by the index and the ranker. Identifiers are split on camel case,
 * snake case and punctuation, lower-cased, stripped of stop words and reduced with a small
 * suffix stemmer so that "authentication" and "authenticate" meet at "authentic".
 */
public final class Tokenizer {

    private static final Pattern WORD = Pattern.compile("[A-Za-z0-9]+");
    private static final Pattern CAMEL = Pattern.compile("[A-Z]+(?![a-z])|[A-Z]?[a-z]+|[0-9]+");

    private static final Set<String> STOP_WORDS = Set.of(
            "a", "an", "the", "is", "are", "was", "were", "be", "been", "of", "to", "in", "on", "for",
            "and", "or", "it", "its", "this", "that", "these", "those", "with", "as", "at", "by", "from",
            "where", "what", "which", "who", "why", "how", "does", "do", "did", "can", "could", "should",
            "would", "i", "me", "my", "we", "our", "you", "your", "there", "here", "about", "into");

    // longest first; a suffix is only stripped when at least MIN_STEM characters remain
    private static final String[] SUFFIXES = {
            "ations", "ation", "ating", "ated", "ates", "ate", "ments", "ment", "ings", "ing",
            "ers", "er", "ed", "es", "s"
    };
    private static final int MIN_STEM = 4;

    private Tokenizer() {
    }

    /** All normalized tokens of a text, in order, with repetitions. */
    public static List<String> tokens(String text) {
        List<String> out = new ArrayList<>();
        if (text == null || text.isEmpty()) return out;
        Matcher words = WORD.matcher(text);
        while (words.find()) {
            String word = words.group();
            List<String> parts = new ArrayList<>();
            Matcher camel = CAMEL.matcher(word);
            while (camel.find()) parts.add(camel.group());
            if (parts.size() > 1) {
                addNormalized(out, word);
            }
            for (String p : parts) addNormalized(out, p);
        }
        return out;
    }

    /** Distinct normalized query terms in first-seen order. */
    public static List<String> queryTerms(String query) {
        return new ArrayList<>(new LinkedHashSet<>(tokens(query)));
    }

    private static void addNormalized(List<String> out, String raw) {
        String lower = raw.toLowerCase(Locale.ROOT);
        if (lower.length() < 2 || STOP_WORDS.contains(lower)) return;
        out.add(stem(lower));
    }

    public static String stem(String word) {
        if (word.length() <= MIN_STEM || Character.isDigit(word.charAt(0))) return word;
        for (String suffix : SUFFIXES) {
            if (word.endsWith(suffix) && word.length() - suffix.length() >= MIN_STEM) {
                return word.substring(0, word.length() - suffix.length());
            }
        }
        return word;
    }

    /** Normalized path segments, without the file extension ("auth/login.py" gives [auth, login]). */
    public static List<String> pathSegments(String path) {
        List<String> out = new ArrayList<>();
        String[] parts = path.split("/");
        for (int i = 0; i < parts.length; i++) {
            String part = parts[i];
            if (i == parts.length - 1) {
                int dot = part.lastIndexOf('.');
                if (dot > 0) part = part.substring(0, dot);
            }
            String lower = part.toLowerCase(Locale.ROOT);
            if (!lower.isEmpty()) out.add(lower);
        }
        return out;
    }
}
