package com.sporewriter.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Settings under the {@code rewriter} prefix.
 */
@Data
@ConfigurationProperties(prefix = "rewriter")
public class RewriterProperties {

    private Match match = new Match();
    private Rewrite rewrite = new Rewrite();
    private Cors cors = new Cors();

    @Data
    public static class Match {
        /** Reject matches that map non-adjacent LHS nodes onto adjacent input nodes. */
        private boolean requireInduced = false;
    }

    @Data
    public static class Rewrite {
        /** Delete input edges whose LHS edge has no RHS counterpart between kept nodes. */
        private boolean deleteUnmatchedPatternEdges = false;
    }

    @Data
    public static class Cors {
        private List<String> allowedOrigins = new ArrayList<>(List.of("*"));
    }
}
