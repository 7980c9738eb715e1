package com.jobbergate.cli;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CliSettingsTest {

    @Test
    void fromEnvironment_empty_usesDefaults() {
        CliSettings settings = CliSettings.fromEnvironment(Map.of());

        assertThat(settings.apiUrl()).isEqualTo("http://localhost:8000");
        assertThat(settings.userEmail()).isNull();
        assertThat(settings.requestTimeout()).isEqualTo(Duration.ofSeconds(30));
        assertThat(settings.supportContact()).isEqualTo(CliSettings.DEFAULT_SUPPORT_CONTACT);
    }

    @Test
    void fromEnvironment_readsEveryVariable() {
        CliSettings settings = CliSettings.fromEnvironment(Map.of(
                "JOBBERGATE_API_URL",         "https://jobbergate.example.com/",
                "JOBBERGATE_USER_EMAIL",      "me@example.com",
                "JOBBERGATE_REQUEST_TIMEOUT", "5",
                "JOBBERGATE_SUPPORT_CONTACT", "support@example.com"));

        assertThat(settings.apiUrl()).isEqualTo("https://jobbergate.example.com");
        assertThat(settings.userEmail()).isEqualTo("me@example.com");
        assertThat(settings.requestTimeout()).isEqualTo(Duration.ofSeconds(5));
        assertThat(settings.supportContact()).isEqualTo("support@example.com");
    }

    @Test
    void fromEnvironment_badTimeout_throws() {
        assertThatThrownBy(() -> CliSettings.fromEnvironment(Map.of("JOBBERGATE_REQUEST_TIMEOUT", "soon")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("soon");
        assertThatThrownBy(() -> CliSettings.fromEnvironment(Map.of("JOBBERGATE_REQUEST_TIMEOUT", "0")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void withApiUrl_keepsOtherSettings() {
        CliSettings settings = CliSettings.fromEnvironment(Map.of("JOBBERGATE_USER_EMAIL", "me@example.com"))
                .withApiUrl("http://other:9000/");

        assertThat(settings.apiUrl()).isEqualTo("http://other:9000");
        assertThat(settings.userEmail()).isEqualTo("me@example.com");
    }
}
