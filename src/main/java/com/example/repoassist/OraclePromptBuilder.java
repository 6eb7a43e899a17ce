package com.example.repoassist;

import java.util.List;

import org.springframework.stereotype.Component;

@Component
public class OraclePromptBuilder {

    static final String CITATION_CONSTRAINT =
            "Every sentence that states a fact about the repository, an issue or a pull request MUST end with "
                    + "at least one citation marker such as [E1], using ONLY the evidence ids listed below. "
                    + "Never invent ids. If the evidence does not support a claim, say that it could not be found "
                    + "instead of guessing.";

    private static final int MAX_EVIDENCE_CHARS = 2400;
    private static final int RECENT_QUERIES_SHOWN = 3;

    public String classification(String query, ClassificationContext ctx) {
        StringBuilder p = new StringBuilder();
        p.append("You are a classifier for questions about a source repository. ");
        p.append("Respond with exactly ONE token on a single line and NOTHING ELSE, chosen from: ");
        p.append("LOCATE, OVERVIEW, PRIORITIZE, SUGGEST, PATCH.\n");
        for (Intent i : Intent.values()) {
            p.append(i.name()).append(" = ").append(i.getDescription()).append("\n");
        }
        p.append("\nEXAMPLES (input => expected single-token output):\n");
        p.append("Where is authentication implemented? => LOCATE\n");
        p.append("What does this repository do? => OVERVIEW\n");
        p.append("Which open issues should we fix first? => PRIORITIZE\n");
        p.append("What should we work on next in the parser? => SUGGEST\n");
        p.append("Add a null check to the login handler => PATCH\n\n");
        if (ctx != null) {
            if (ctx.getRepositoryId() != null) {
                p.append("Repository: ").append(ctx.getRepositoryId())
                        .append(" (").append(ctx.getTotalFiles()).append(" files)\n");
            }
            if (ctx.getMode() != null) {
                p.append("Requested mode: ").append(ctx.getMode().name()).append("\n");
            }
            List<String> recent = ctx.getRecentQueries();
            if (!recent.isEmpty()) {
                p.append("Recent questions in this conversation:\n");
                for (String q : recent.subList(Math.max(0, recent.size() - RECENT_QUERIES_SHOWN), recent.size())) {
                    p.append("  - ").append(q).append("\n");
                }
            }
            p.append("\n");
        }
        p.append("QUESTION:\n").append(query).append("\n\n");
        p.append("REPLY WITH ONE TOKEN:\n");
        return p.toString();
    }

    public String synthesis(SynthesisRequest req) {
        StringBuilder p = new StringBuilder();
        p.append("You are an expert repository assistant. Answer the question using only the evidence below.\n");
        p.append("Mode: ").append(req.getMode().name()).append("\n");
        p.append(req.getMode().getInstructions()).append("\n");
        if (req.getIntent() != null) {
            p.append("The question was classified as: ").append(req.getIntent().getDescription()).append("\n");
        }
        p.append("\n").append(CITATION_CONSTRAINT).append("\n\n");
        p.append("Question: ").append(req.getQuery()).append("\n\n");
        p.append("EVIDENCE:\n");
        for (EvidenceItem e : req.getEvidence()) {
            p.append("[").append(e.getId()).append("] ").append(e.getKind().getLabel())
                    .append(" ").append(e.location()).append("\n");
            String text = e.getDisplayText() == null ? "" : e.getDisplayText();
            if (text.length() > MAX_EVIDENCE_CHARS) text = text.substring(0, MAX_EVIDENCE_CHARS) + "\n...";
            p.append("```\n").append(text).append("\n```\n\n");
        }
        if (!req.getNotes().isEmpty()) {
            p.append("NOTES (mention these limitations where relevant):\n");
            for (String n : req.getNotes()) p.append("- ").append(n).append("\n");
            p.append("\n");
        }
        p.append("ANSWER:\n");
        return p.toString();
    }

    public String tagging(List<TagSubject> subjects) {
        StringBuilder p = new StringBuilder();
        p.append("Write a short descriptive tag (at most 12 words) for each file or directory below. ");
        p.append("Reply with one line per entry in the form 'path: tag' and NOTHING ELSE.\n\n");
        for (TagSubject s : subjects) {
            p.append(s.isDirectory() ? "DIRECTORY " : "FILE ").append(s.getPath()).append("\n");
            if (s.getContent() != null && !s.getContent().isBlank()) {
                p.append("```\n").append(s.getContent()).append("\n```\n");
            }
            p.append("\n");
        }
        return p.toString().trim();
    }

    public String extraSteps(String query, Intent intent, List<ToolRequest> planned) {
        StringBuilder p = new StringBuilder();
        p.append("A repository assistant plans to answer the question below with these tool calls:\n");
        for (ToolRequest r : planned) p.append("- ").append(r).append("\n");
        p.append("\nIf additional repository searches would help, reply with up to two lines of the form ");
        p.append("'SEARCH: <search terms>'. Reply NONE if the plan is enough.\n\n");
        p.append("Intent: ").append(intent.getDescription()).append("\n");
        p.append("Question: ").append(query).append("\n");
        return p.toString();
    }
}
