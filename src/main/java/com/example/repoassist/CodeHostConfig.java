package com.example.repoassist;

import java.time.Duration;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;

@Configuration
public class CodeHostConfig {

    private static final Logger log = LoggerFactory.getLogger(CodeHostConfig.class);

    @Bean
    public CodeHostClient codeHostClient(Environment env, RestTemplateBuilder builder, ObjectMapper mapper) {
        String repository = env.getProperty("codehost.github.repository");
        if (repository == null || repository.isBlank()) {
            log.info("codehost.github.repository not set; issue and pull request lookups will be empty");
            return new NoopCodeHostClient();
        }
        String apiUrl = env.getProperty("codehost.github.api-url", "https://api.github.com");
        String token = env.getProperty("codehost.github.token");
        RestTemplateBuilder b = builder
                .rootUri(apiUrl)
                .defaultHeader("Accept", "application/vnd.github+json")
                .setConnectTimeout(Duration.ofSeconds(10))
                .setReadTimeout(Duration.ofSeconds(30));
        if (token != null && !token.isBlank()) {
            b = b.defaultHeader("Authorization", "Bearer " + token);
        }
        boolean prFiles = env.getProperty("codehost.github.pr-files", Boolean.class, false);
        log.info("Using GitHub repository {} via {}", repository, apiUrl);
        return new GitHubCodeHostClient(b.build(), mapper, repository, prFiles);
    }
}
