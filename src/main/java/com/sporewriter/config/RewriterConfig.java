package com.sporewriter.config;

import com.sporewriter.engine.MatchValidator;
import com.sporewriter.engine.RewriteEngine;
import com.sporewriter.engine.RewriteOptions;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the rewrite core from {@link RewriterProperties}.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(RewriterProperties.class)
public class RewriterConfig {

    @Bean
    public MatchValidator matchValidator(RewriterProperties properties) {
        boolean induced = properties.getMatch().isRequireInduced();
        log.info("Match validation: induced={}", induced);
        return new MatchValidator(induced);
    }

    @Bean
    public RewriteEngine rewriteEngine(MatchValidator matchValidator, RewriterProperties properties) {
        RewriteOptions options = RewriteOptions.builder()
                .deleteUnmatchedPatternEdges(properties.getRewrite().isDeleteUnmatchedPatternEdges())
                .build();
        log.info("Rewrite options: {}", options);
        return new RewriteEngine(matchValidator, options);
    }
}
