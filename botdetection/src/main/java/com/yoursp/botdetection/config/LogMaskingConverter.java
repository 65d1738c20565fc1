package com.yoursp.botdetection.config;

import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.pattern.CompositeConverter;

import java.util.regex.Pattern;

/**
 * Logback converter that masks bot-detection secrets in log messages.
 * <ul>
 * <li>stylesheet URLs: {@code /client<token>.css} → {@code /client[REDACTED].css}</li>
 * <li>ping keys: {@code ping[<hash>]} → first 8 hex chars + "..."</li>
 * </ul>
 * <p>
 * Registered in logback-spring.xml:
 * {@code <conversionRule conversionWord="mask" converterClass=
 * "com.yoursp.botdetection.config.LogMaskingConverter" />}
 * </p>
 */
public class LogMaskingConverter extends CompositeConverter<ILoggingEvent> {

    // Matches /client<token>.css
    private static final Pattern STYLESHEET_PATTERN = Pattern.compile("(/client)[A-Za-z0-9]+(\\.css)");

    // Matches ping[<64 hex chars>]
    private static final Pattern PING_KEY_PATTERN = Pattern.compile("(ping\\[)([0-9a-f]{8})[0-9a-f]+(\\])");

    @Override
    protected String transform(ILoggingEvent event, String formattedMessage) {
        if (formattedMessage == null || formattedMessage.isEmpty()) {
            return formattedMessage;
        }

        String masked = formattedMessage;
        masked = STYLESHEET_PATTERN.matcher(masked).replaceAll("$1[REDACTED]$2");
        masked = PING_KEY_PATTERN.matcher(masked).replaceAll("$1$2...$3");

        return masked;
    }
}
