package ai.docsite.reviewer.logging;

import static org.assertj.core.api.Assertions.assertThat;

import ai.docsite.reviewer.config.LogFormat;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.encoder.Encoder;
import ch.qos.logback.core.encoder.LayoutWrappingEncoder;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class LoggingConfiguratorTest {

    @AfterEach
    void restoreTextFormat() {
        LoggingConfigurator.configure(LogFormat.TEXT);
    }

    @Test
    void jsonFormatWrapsSimpleJsonLayout() {
        Encoder<ILoggingEvent> encoder = LoggingConfigurator.encoderFor(LogFormat.JSON, new LoggerContext());

        assertThat(encoder).isInstanceOf(LayoutWrappingEncoder.class);
        assertThat(((LayoutWrappingEncoder<ILoggingEvent>) encoder).getLayout()).isInstanceOf(SimpleJsonLayout.class);
        assertThat(encoder.isStarted()).isTrue();
    }

    @Test
    void textFormatUsesPattern() {
        Encoder<ILoggingEvent> encoder = LoggingConfigurator.encoderFor(LogFormat.TEXT, new LoggerContext());

        assertThat(encoder).isInstanceOf(PatternLayoutEncoder.class);
        assertThat(((PatternLayoutEncoder) encoder).getPattern()).isEqualTo(LoggingConfigurator.TEXT_PATTERN);
    }

    @Test
    void configuringTheLiveContextKeepsLoggingUsable() {
        LoggingConfigurator.configure(LogFormat.JSON);

        org.slf4j.LoggerFactory.getLogger(LoggingConfiguratorTest.class).warn("json logging active");
        assertThat(org.slf4j.LoggerFactory.getILoggerFactory()).isInstanceOf(LoggerContext.class);
    }
}
