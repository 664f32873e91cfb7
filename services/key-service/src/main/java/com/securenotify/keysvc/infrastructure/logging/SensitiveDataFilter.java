package com.securenotify.keysvc.infrastructure.logging;

import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.filter.Filter;
import ch.qos.logback.core.spi.FilterReply;

import java.util.regex.Pattern;

/**
 * Drops log events that would print a secret in clear: confirmation codes, API keys,
 * code hashes and the cleanup secret. Attached to the appenders in logback-spring.xml.
 */
public class SensitiveDataFilter extends Filter<ILoggingEvent> {

    private static final Pattern SECRET_ASSIGNMENT = Pattern.compile(
            "(?i)(confirmation_?code|x-api-key|api_?key|cleanup_?secret|code_?hash|password)\\s*[=:]\\s*\"?[^\\s\",*\\]}]+");

    @Override
    public FilterReply decide(ILoggingEvent event) {
        return containsSecret(event.getFormattedMessage()) ? FilterReply.DENY : FilterReply.NEUTRAL;
    }

    public static boolean containsSecret(String message) {
        if (message == null) {
            return false;
        }
        return SECRET_ASSIGNMENT.matcher(message).find();
    }
}
