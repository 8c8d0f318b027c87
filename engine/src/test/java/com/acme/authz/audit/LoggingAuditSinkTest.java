package com.acme.authz.audit;

import com.acme.authz.policy.Decision;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LoggingAuditSinkTest {
    private final Logger logger = Logger.getLogger(LoggingAuditSink.class.getName());
    private final List<LogRecord> records = new ArrayList<>();
    private final Handler handler = new Handler() {
        @Override
        public void publish(LogRecord record) {
            records.add(record);
        }

        @Override
        public void flush() {
        }

        @Override
        public void close() {
        }
    };
    private Level previousLevel;

    @BeforeEach
    void attachHandler() {
        previousLevel = logger.getLevel();
        logger.setLevel(Level.ALL);
        logger.addHandler(handler);
    }

    @AfterEach
    void detachHandler() {
        logger.removeHandler(handler);
        logger.setLevel(previousLevel);
    }

    @Test
    void shouldLogDecisionWithMatchedStatement() {
        new LoggingAuditSink().append(new AuditEvent(1L, "alice", "read", "/docs/a", Decision.ALLOWED, 3));

        assertEquals(1, records.size());
        LogRecord record = records.get(0);
        assertEquals(Level.INFO, record.getLevel());
        assertTrue(record.getMessage().contains("decision=ALLOWED"), record.getMessage());
        assertTrue(record.getMessage().contains("identity=alice"), record.getMessage());
        assertTrue(record.getMessage().contains("statement=3"), record.getMessage());
    }

    @Test
    void shouldMarkDefaultDecisionAtConfiguredLevel() {
        new LoggingAuditSink(Level.FINE)
            .append(new AuditEvent(1L, "bob", "write", "/x", Decision.DENIED, AuditEvent.NO_STATEMENT));

        assertEquals(1, records.size());
        assertEquals(Level.FINE, records.get(0).getLevel());
        assertTrue(records.get(0).getMessage().contains("statement=default"), records.get(0).getMessage());
    }

    @Test
    void shouldSkipWhenLevelDisabled() {
        logger.setLevel(Level.WARNING);
        new LoggingAuditSink().append(new AuditEvent(1L, "bob", "write", "/x", Decision.DENIED, 0));
        assertTrue(records.isEmpty());
    }
}
