package com.cardiorisk.config;

import com.cardiorisk.scoring.MissingDemographicsPolicy;
import io.github.cdimascio.dotenv.Dotenv;

import java.time.Duration;

/**
 * AssessmentConfig - Service settings from .env or the environment
 */
public class AssessmentConfig {
    public final String httpHost;
    public final int httpPort;
    public final Duration askTimeout;
    public final int historyLimit;
    public final boolean legacyMissingDemographics;

    public AssessmentConfig() {
        this(Dotenv.configure().ignoreIfMissing().load());
    }

    public AssessmentConfig(Dotenv d) {
        this.httpHost = d.get("HTTP_HOST", "localhost");
        this.httpPort = Integer.parseInt(d.get("HTTP_PORT", "8080"));
        this.askTimeout = Duration.ofSeconds(Long.parseLong(d.get("ASK_TIMEOUT_SECONDS", "5")));
        this.historyLimit = Integer.parseInt(d.get("HISTORY_LIMIT", "50"));
        this.legacyMissingDemographics = Boolean.parseBoolean(d.get("LEGACY_MISSING_DEMOGRAPHICS", "false"));
        if (historyLimit < 1) {
            throw new IllegalArgumentException("HISTORY_LIMIT must be at least 1: " + historyLimit);
        }
    }

    public MissingDemographicsPolicy demographicsPolicy() {
        return legacyMissingDemographics
            ? MissingDemographicsPolicy.LEGACY_DEFAULT
            : MissingDemographicsPolicy.REJECT;
    }

    @Override
    public String toString() {
        return String.format("AssessmentConfig{http=%s:%d, askTimeout=%ds, historyLimit=%d, legacyDemographics=%s}",
            httpHost, httpPort, askTimeout.getSeconds(), historyLimit, legacyMissingDemographics);
    }
}
