package com.example.repoassist;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Post-validates the citation markers of a synthesized answer. A marker may list several ids
 * ({@code [E1, E3]}); ids that are not in the request's evidence set, or whose source no longer
 * resolves, are removed, and a marker left without ids disappears. The surviving ids, in order of
 * first appearance, are the answer's citations.
 */
@Slf4j
@Component
public class CitationValidator {

    static final Pattern MARKER = Pattern.compile("\\[\\s*(E\\d+(?:\\s*,\\s*E\\d+)*)\\s*\\]");
    private static final Pattern ID = Pattern.compile("E\\d+");

    private final EvidenceStore store;

    public CitationValidator(EvidenceStore store) {
        this.store = store;
    }

    public static final class Result {
        private final String text;
        private final List<String> citations;
        private final List<String> stripped;

        Result(String text, List<String> citations, List<String> stripped) {
            this.text = text;
            this.citations = citations;
            this.stripped = stripped;
        }

        public String getText() { return text; }
        public List<String> getCitations() { return citations; }
        public List<String> getStripped() { return stripped; }
    }

    /**
     * @throws CitationStaleException when a cited item belongs to an epoch that is no longer
     *                                published; the request has to be restarted
     */
    public Result validate(String answer, EvidenceSet evidence) {
        Set<String> cited = new LinkedHashSet<>();
        List<String> stripped = new ArrayList<>();
        StringBuffer out = new StringBuffer();
        Matcher m = MARKER.matcher(answer == null ? "" : answer);
        while (m.find()) {
            List<String> kept = new ArrayList<>();
            Matcher ids = ID.matcher(m.group(1));
            while (ids.find()) {
                String id = ids.group();
                if (resolves(evidence, id)) {
                    if (!kept.contains(id)) kept.add(id);
                } else {
                    stripped.add(id);
                }
            }
            cited.addAll(kept);
            String replacement = kept.isEmpty() ? "" : "[" + String.join(", ", kept) + "]";
            m.appendReplacement(out, Matcher.quoteReplacement(replacement));
        }
        m.appendTail(out);
        String text = out.toString();
        if (!stripped.isEmpty()) {
            log.warn("Stripped {} citations not backed by request {}: {}", stripped.size(), evidence.getRequestId(), stripped);
            text = text.replaceAll("[ \\t]+([.,;:!?])", "$1").replaceAll("[ \\t]{2,}", " ");
        }
        return new Result(text, new ArrayList<>(cited), stripped);
    }

    private boolean resolves(EvidenceSet evidence, String id) {
        if (!evidence.contains(id)) return false;
        try {
            store.resolveSource(evidence, id);
            return true;
        } catch (EvidenceNotFoundException e) {
            log.warn("Citation {} no longer resolves: {}", id, e.getMessage());
            return false;
        }
    }
}
