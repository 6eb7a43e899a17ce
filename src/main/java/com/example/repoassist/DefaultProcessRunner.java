package com.example.repoassist;

import java.io.IOException;
import java.util.List;

import lombok.extern.slf4j.Slf4j;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/** Forks the reasoning-engine command; {@code ollama.host} is passed on as OLLAMA_HOST when set. */
@Slf4j
@Component
public class DefaultProcessRunner implements ProcessRunner {

    private final String ollamaHost;

    public DefaultProcessRunner(Environment env) {
        this.ollamaHost = env.getProperty("ollama.host");
    }

    @Override
    public Process start(List<String> command) throws IOException {
        ProcessBuilder pb = new ProcessBuilder(command);
        if (ollamaHost != null && !ollamaHost.isBlank()) {
            pb.environment().put("OLLAMA_HOST", ollamaHost);
        }
        log.debug("Starting {}", String.join(" ", command));
        return pb.start();
    }
}
