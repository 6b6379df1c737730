package com.codegraph.core.service.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Overall application configuration for the CodeGraph service.
 *
 * Contains toggles and feature flags.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "codegraph")
public class CodeGraphConfig {

    /**
     * Feature flags for optional capabilities.
     */
    private Features features = new Features();

    @Getter
    @Setter
    public static class Features {

        /**
         * Resolve calls whose callee lives in another file of the same repository.
         */
        private boolean crossFileResolutionEnabled = true;

        /**
         * Run registered repository analyzers after extraction.
         */
        private boolean analysisEnabled = true;

        /**
         * Connect the graph store when the application starts.
         * Failures are logged and the store stays disconnected.
         */
        private boolean connectOnStartup = true;
    }
}
