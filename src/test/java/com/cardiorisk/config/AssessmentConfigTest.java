package com.cardiorisk.config;

import com.cardiorisk.scoring.MissingDemographicsPolicy;
import io.github.cdimascio.dotenv.Dotenv;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class AssessmentConfigTest {

    @Test
    void readsValuesFromEnvFile() {
        Dotenv dotenv = Dotenv.configure()
            .directory("./src/test/resources")
            .filename("assessment-test.env")
            .load();

        AssessmentConfig config = new AssessmentConfig(dotenv);

        assertThat(config.httpHost).isEqualTo("0.0.0.0");
        assertThat(config.httpPort).isEqualTo(9191);
        assertThat(config.askTimeout).isEqualTo(Duration.ofSeconds(2));
        assertThat(config.historyLimit).isEqualTo(5);
        assertThat(config.demographicsPolicy()).isEqualTo(MissingDemographicsPolicy.LEGACY_DEFAULT);
    }

    @Test
    void fallsBackToDefaults() {
        Dotenv dotenv = Dotenv.configure()
            .directory("./src/test/resources")
            .filename("does-not-exist.env")
            .ignoreIfMissing()
            .load();

        AssessmentConfig config = new AssessmentConfig(dotenv);

        assertThat(config.httpPort).isEqualTo(8080);
        assertThat(config.historyLimit).isEqualTo(50);
        assertThat(config.demographicsPolicy()).isEqualTo(MissingDemographicsPolicy.REJECT);
    }
}
