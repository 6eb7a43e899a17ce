package com.example.repoassist;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.springframework.core.env.Environment;
import org.springframework.stereotype.Service;

/**
 * Reasoning engine backed by the {@code ollama run <model>} command line. Each call pipes one
 * prompt to stdin and reads the whole of stdout.
 */
@Service
public class OllamaReasoningEngine implements ReasoningEngine {

    private static final org.slf4j.Logger log = org.slf4j.LoggerFactory.getLogger(OllamaReasoningEngine.class);

    private static final Pattern TAG_LINE = Pattern.compile("^\\s*[-*]?\\s*`?([^`:]+?)`?\\s*:\\s*(.+?)\\s*$");
    private static final Pattern SEARCH_LINE = Pattern.compile("(?i)^\\s*SEARCH\\s*:\\s*(.+?)\\s*$");
    private static final int MAX_TAG_CHARS = 120;

    private final String command;
    private final String model;
    private final long processTimeoutSeconds;
    private final boolean extraSteps;

    private final OraclePromptBuilder promptBuilder;

    private final ProcessRunner processRunner;

    public OllamaReasoningEngine(Environment env, OraclePromptBuilder promptBuilder, ProcessRunner processRunner) {
        this.command = env.getProperty("ollama.command", "ollama");
        this.model = env.getProperty("ollama.model", "codellama:13b-instruct");
        // the caller enforces the oracle timeout; this only reaps a process nobody waits for any more
        this.processTimeoutSeconds = env.getProperty("oracle.timeout.seconds", Long.class, 60L) + 5;
        this.extraSteps = env.getProperty("ollama.extra-steps", Boolean.class, false);
        this.promptBuilder = promptBuilder;
        this.processRunner = processRunner;
    }

    @Override
    public Intent classify(String query, ClassificationContext context) throws OracleException {
        String resp = runWithPrompt(promptBuilder.classification(query, context));
        String[] toks = resp.trim().split("\\s+");
        String first = toks.length == 0 ? "" : toks[0];
        Intent intent = Intent.fromLabel(first);
        log.info("OllamaReasoningEngine: classification response='{}' -> {}", first, intent);
        if (intent == null) {
            throw new OracleUnparseableException("Classifier answered with an unknown intent '" + first + "'", resp);
        }
        return intent;
    }

    @Override
    public String synthesize(SynthesisRequest request) throws OracleException {
        return runWithPrompt(promptBuilder.synthesis(request));
    }

    @Override
    public Map<String, String> describe(List<TagSubject> subjects) throws OracleException {
        if (subjects.isEmpty()) return Map.of();
        String resp = runWithPrompt(promptBuilder.tagging(subjects));
        Set<String> known = new HashSet<>();
        for (TagSubject s : subjects) known.add(s.getPath());
        return parseTags(resp, known);
    }

    @Override
    public List<ToolRequest> proposeExtraSteps(String query, Intent intent, List<ToolRequest> planned) throws OracleException {
        if (!extraSteps) return List.of();
        String resp = runWithPrompt(promptBuilder.extraSteps(query, intent, planned));
        List<ToolRequest> out = new ArrayList<>();
        for (String line : resp.split("\n")) {
            Matcher m = SEARCH_LINE.matcher(line);
            if (m.matches()) out.add(ToolRequest.searchRepo(m.group(1), SearchFilters.NONE));
        }
        return out;
    }

    static Map<String, String> parseTags(String response, Set<String> knownPaths) {
        Map<String, String> tags = new LinkedHashMap<>();
        for (String line : response.split("\n")) {
            Matcher m = TAG_LINE.matcher(line);
            if (!m.matches()) continue;
            String path = m.group(1).trim();
            if (path.endsWith("/")) path = path.substring(0, path.length() - 1);
            if (!knownPaths.contains(path)) continue;
            String tag = m.group(2);
            if (tag.length() > MAX_TAG_CHARS) tag = tag.substring(0, MAX_TAG_CHARS);
            tags.put(path, tag);
        }
        return tags;
    }

    // Run Ollama with a raw prompt and return trimmed stdout
    private String runWithPrompt(String promptStr) throws OracleException {
        List<String> cmd = new ArrayList<>();
        cmd.add(command);
        cmd.add("run");
        cmd.add(model);

        log.info("OllamaReasoningEngine: Running command: {} [prompt length={}]", String.join(" ", cmd), promptStr.length());
        log.debug("OllamaReasoningEngine: Prompt (truncated 1000 chars):\n{}",
                promptStr.length() > 1000 ? promptStr.substring(0, 1000) + "..." : promptStr);

        Process proc;
        try {
            proc = processRunner.start(cmd);
        } catch (IOException e) {
            throw new OracleException("Could not start " + String.join(" ", cmd) + ": " + e.getMessage(), e);
        }

        try (OutputStream os = proc.getOutputStream()) {
            os.write(promptStr.getBytes(StandardCharsets.UTF_8));
            os.flush();
        } catch (IOException io) {
            log.error("OllamaReasoningEngine: Error writing prompt to Ollama stdin", io);
        }

        StringBuilder resp = new StringBuilder();
        StringBuilder err = new StringBuilder();
        Thread outReader = reader(proc, true, resp, "ollama-stdout-reader");
        Thread errReader = reader(proc, false, err, "ollama-stderr-reader");
        outReader.start();
        errReader.start();

        boolean finished;
        try {
            finished = proc.waitFor(processTimeoutSeconds, TimeUnit.SECONDS);
            outReader.join(2000);
            errReader.join(2000);
        } catch (InterruptedException e) {
            proc.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new OracleException("Interrupted while waiting for " + String.join(" ", cmd), e);
        }
        if (!finished) {
            log.warn("OllamaReasoningEngine: Process did not finish within {}s, destroying...", processTimeoutSeconds);
            proc.destroyForcibly();
            throw new OracleTimeoutException("ollama did not answer within " + processTimeoutSeconds + "s");
        }
        int exitCode = proc.exitValue();
        log.info("OllamaReasoningEngine: Process exited with code {}", exitCode);
        if (err.length() > 0) {
            log.warn("OllamaReasoningEngine: Stderr from Ollama:\n{}", err.toString().trim());
        }

        String out;
        synchronized (resp) {
            out = resp.toString().trim();
        }
        if (out.isEmpty()) {
            throw new OracleException("No response from Ollama (exit code " + exitCode + "). Check that Ollama is "
                    + "running and the model " + model + " is available");
        }
        log.debug("OllamaReasoningEngine: Raw response from Ollama:\n{}", out);
        return out;
    }

    private static Thread reader(Process proc, boolean stdout, StringBuilder sink, String name) {
        return new Thread(() -> {
            try (BufferedReader r = new BufferedReader(new InputStreamReader(
                    stdout ? proc.getInputStream() : proc.getErrorStream(), StandardCharsets.UTF_8))) {
                String l;
                while ((l = r.readLine()) != null) {
                    synchronized (sink) {
                        sink.append(l).append("\n");
                    }
                }
            } catch (IOException io) {
                log.error("OllamaReasoningEngine: Error reading {}", stdout ? "stdout" : "stderr", io);
            }
        }, name);
    }
}
