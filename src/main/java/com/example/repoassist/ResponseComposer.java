package com.example.repoassist;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.springframework.stereotype.Component;

/**
 * Splits the validated answer into its parts: a unified diff in patch mode and a trailing list of
 * next actions. Diffs are passed through as written.
 */
@Component
public class ResponseComposer {

    private static final Pattern DIFF_BLOCK = Pattern.compile("```diff\\r?\\n(.*?)```", Pattern.DOTALL);
    private static final Pattern NEXT_ACTIONS = Pattern.compile(
            "(?im)^[#*\\s]*(?:Next Actions?|Next Steps?|Suggested Steps?|Recommendations?)\\**\\s*:?\\**[ \\t]*\\r?\\n"
                    + "((?:[ \\t]*(?:[-*\\u2022]|\\d+[.)]).*(?:\\r?\\n|$))+)");
    private static final Pattern BULLET = Pattern.compile("^[ \\t]*(?:[-*\\u2022]|\\d+[.)])[ \\t]*");

    public static final class Composed {
        private final String answer;
        private final String patchDiff;
        private final List<String> nextActions;

        Composed(String answer, String patchDiff, List<String> nextActions) {
            this.answer = answer;
            this.patchDiff = patchDiff;
            this.nextActions = nextActions;
        }

        public String getAnswer() { return answer; }
        public String getPatchDiff() { return patchDiff; }
        public List<String> getNextActions() { return nextActions; }
    }

    public Composed compose(String text, AssistMode mode) {
        String answer = text == null ? "" : text;
        String diff = null;
        if (mode == AssistMode.PATCH) {
            String[] split = extractPatch(answer);
            diff = split[0];
            answer = split[1];
        }
        List<String> actions = new ArrayList<>();
        answer = extractNextActions(answer, actions);
        return new Composed(answer.trim(), diff, actions);
    }

    /** [diff or null, remaining text] */
    static String[] extractPatch(String text) {
        Matcher m = DIFF_BLOCK.matcher(text);
        if (m.find()) {
            String cleaned = text.substring(0, m.start()) + text.substring(m.end());
            return new String[]{m.group(1).trim(), cleaned.trim()};
        }
        StringBuilder diff = new StringBuilder();
        StringBuilder rest = new StringBuilder();
        boolean inDiff = false;
        for (String line : text.split("\n", -1)) {
            if (line.startsWith("--- ") || line.startsWith("+++ ")) inDiff = true;
            (inDiff ? diff : rest).append(line).append("\n");
        }
        if (diff.length() == 0) return new String[]{null, text};
        return new String[]{diff.toString().trim(), rest.toString().trim()};
    }

    static String extractNextActions(String text, List<String> actions) {
        Matcher m = NEXT_ACTIONS.matcher(text);
        if (!m.find()) return text;
        for (String line : m.group(1).split("\\r?\\n")) {
            String a = BULLET.matcher(line).replaceFirst("").trim();
            if (!a.isEmpty()) actions.add(a);
        }
        return (text.substring(0, m.start()) + text.substring(m.end())).trim();
    }
}
