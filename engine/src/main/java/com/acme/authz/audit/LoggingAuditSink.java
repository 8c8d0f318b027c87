package com.acme.authz.audit;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Writes every decision to the {@code com.acme.authz.audit} logger.
 */
public final class LoggingAuditSink implements AuditSink {
    private static final Logger LOG = Logger.getLogger(LoggingAuditSink.class.getName());

    private final Level level;

    public LoggingAuditSink() {
        this(Level.INFO);
    }

    public LoggingAuditSink(Level level) {
        this.level = level == null ? Level.INFO : level;
    }

    @Override
    public void append(AuditEvent event) {
        if (!LOG.isLoggable(level)) {
            return;
        }
        LOG.log(level, "decision=" + event.decision()
            + " identity=" + event.identity()
            + " operation=" + event.operation()
            + " resource=" + event.resource()
            + " statement=" + (event.defaulted() ? "default" : String.valueOf(event.statementIndex())));
    }
}
