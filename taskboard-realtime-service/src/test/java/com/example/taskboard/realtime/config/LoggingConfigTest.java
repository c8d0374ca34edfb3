package com.example.taskboard.realtime.config;

import org.junit.jupiter.api.Test;

import java.util.regex.Pattern;

import static org.assertj.core.api.Assertions.assertThat;

class LoggingConfigTest {

    private final Pattern tokenParam = Pattern.compile("(^|&)(token)=[^&]*");

    @Test
    void masksCredentialParameter() {
        assertThat(LoggingConfig.maskedQuery("token=eyJhbGciOi.abc.def&client=web", tokenParam))
                .isEqualTo("?token=***&client=web");
        assertThat(LoggingConfig.maskedQuery("client=web&token=eyJ", tokenParam))
                .isEqualTo("?client=web&token=***");
    }

    @Test
    void leavesSimilarlyNamedParametersAlone() {
        assertThat(LoggingConfig.maskedQuery("refresh_token=x", tokenParam)).isEqualTo("?refresh_token=x");
    }

    @Test
    void emptyQueryRendersNothing() {
        assertThat(LoggingConfig.maskedQuery(null, tokenParam)).isEmpty();
    }
}
