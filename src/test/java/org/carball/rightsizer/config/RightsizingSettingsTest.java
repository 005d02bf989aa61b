package org.carball.rightsizer.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

public class RightsizingSettingsTest {

    private ListAppender<ILoggingEvent> logAppender;
    private Logger logger;

    @BeforeEach
    void setUp() {
        logger = (Logger) LoggerFactory.getLogger(RightsizingSettings.class);
        logAppender = new ListAppender<>();
        logAppender.start();
        logger.addAppender(logAppender);
        logger.setLevel(Level.DEBUG);
        logger.setAdditive(false);
    }

    @AfterEach
    void tearDown() {
        logger.detachAppender(logAppender);
        logger.setAdditive(true);
    }

    @Test
    void shouldAcceptDefaults() {
        // When
        RightsizingSettings.defaults().validate();

        // Then
        assertThat(warnings()).isEmpty();
    }

    @Test
    void shouldWarnOnInvertedThresholds() {
        // Given
        RightsizingSettings settings = RightsizingSettings.defaults().toBuilder()
                .cpuThresholdLow(90.0)
                .cpuThresholdHigh(40.0)
                .build();

        // When
        settings.validate();

        // Then
        assertThat(warnings()).anyMatch(message -> message.contains("CPU low threshold (90.0)"));
    }

    @Test
    void shouldWarnOnOutOfRangeConcurrencyAndTimeouts() {
        // Given
        RightsizingSettings settings = RightsizingSettings.defaults().toBuilder()
                .maxWorkers(0)
                .aiConcurrency(-1)
                .generationLeap(5)
                .instanceTimeoutSeconds(600)
                .batchTimeoutSeconds(300)
                .build();

        // When
        settings.validate();

        // Then
        assertThat(warnings()).hasSize(4);
    }

    @Test
    void shouldSummarizeConfiguration() {
        // Given
        RightsizingSettings settings = RightsizingSettings.defaults().toBuilder()
                .generationLeapEnabled(false)
                .build();

        // Then
        assertThat(RightsizingSettings.defaults().getConfigurationSummary())
                .isEqualTo("Profile: default | CPU: 20-80% | Memory: 20-80% | Leap: +2 | Workers: 10");
        assertThat(settings.getConfigurationSummary()).contains("Leap: off");
    }

    private List<String> warnings() {
        return logAppender.list.stream()
                .filter(event -> event.getLevel() == Level.WARN)
                .map(ILoggingEvent::getFormattedMessage)
                .toList();
    }
}
