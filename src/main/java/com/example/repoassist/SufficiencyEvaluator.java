package com.example.repoassist;

import java.util.List;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * Decides whether the evidence gathered so far justifies an answer. Each intent needs at least
 * one on-topic item of the kind it is about; repository spans count only when their score
 * reaches the relevance floor.
 */
@Component
public class SufficiencyEvaluator {

    private final double relevanceFloor;

    @Autowired
    public SufficiencyEvaluator(Environment env) {
        this(env.getProperty("retriever.relevance-floor", Double.class, 1.0));
    }

    public SufficiencyEvaluator(double relevanceFloor) {
        this.relevanceFloor = relevanceFloor;
    }

    public static final class Verdict {
        private final boolean sufficient;
        private final String requirement;

        Verdict(boolean sufficient, String requirement) {
            this.sufficient = sufficient;
            this.requirement = requirement;
        }

        public boolean isSufficient() { return sufficient; }
        /** What the intent needs, e.g. "a code chunk above the relevance floor". */
        public String getRequirement() { return requirement; }

        public String getReason() {
            return (sufficient ? "found " : "missing ") + requirement;
        }
    }

    public Verdict evaluate(Intent intent, List<EvidenceItem> evidence, RepositorySnapshot snapshot) {
        switch (intent) {
            case LOCATE:
            case PATCH:
                return has(relevantCode(evidence, snapshot), "a code chunk above the relevance floor");
            case OVERVIEW:
                return has(relevantRepositoryContent(evidence), "repository content above the relevance floor");
            case PRIORITIZE:
                return has(external(evidence), "an issue or pull request");
            case SUGGEST:
                return has(relevantRepositoryContent(evidence) || external(evidence),
                        "repository content or an issue or pull request");
            default:
                throw new IllegalStateException("unknown intent " + intent);
        }
    }

    private static Verdict has(boolean found, String what) {
        return new Verdict(found, what);
    }

    private boolean relevantCode(List<EvidenceItem> evidence, RepositorySnapshot snapshot) {
        for (EvidenceItem e : evidence) {
            if (!isSpan(e) || e.getScore() < relevanceFloor) continue;
            SourceFile f = snapshot.file(e.getFilePath());
            if (f != null && f.getKind() != FileKind.DOCS) return true;
        }
        return false;
    }

    private boolean relevantRepositoryContent(List<EvidenceItem> evidence) {
        for (EvidenceItem e : evidence) {
            if (e.getKind().isRepositoryContent() && e.getScore() >= relevanceFloor) return true;
        }
        return false;
    }

    private static boolean external(List<EvidenceItem> evidence) {
        for (EvidenceItem e : evidence) {
            if (e.getKind() == EvidenceKind.ISSUE || e.getKind() == EvidenceKind.PULL_REQUEST) return true;
        }
        return false;
    }

    private static boolean isSpan(EvidenceItem e) {
        return e.getKind() == EvidenceKind.CHUNK || e.getKind() == EvidenceKind.FILE_RANGE;
    }

    public double getRelevanceFloor() {
        return relevanceFloor;
    }
}
