package com.github.salilvnair.formflow.engine.session;

import com.github.salilvnair.formflow.engine.exception.FormFlowException;
import com.github.salilvnair.formflow.engine.model.DialogueState;
import com.github.salilvnair.formflow.engine.model.FieldDescriptor;
import com.github.salilvnair.formflow.engine.model.SessionSnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

@Slf4j
@Component
public class InMemorySessionStore implements SessionStore {

    private final Map<String, FormSession> sessions = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemorySessionStore() {
        this(Clock.systemUTC());
    }

    InMemorySessionStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public FormSession create(List<FieldDescriptor> fields, String formUrl, String userId) {
        List<FieldDescriptor> askable = FieldListFlattener.flatten(fields);
        if (askable.isEmpty()) {
            throw FormFlowException.malformed("form_schema has no askable fields");
        }
        String id = UUID.randomUUID().toString();
        FormSession session = new FormSession(id, formUrl, blankToNull(userId), askable, clock.instant());
        sessions.put(id, session);
        log.debug("Created session {} with {} askable fields", id, askable.size());
        return session;
    }

    @Override
    public FormSession get(String sessionId) {
        FormSession session = sessionId == null ? null : sessions.get(sessionId);
        if (session == null || session.isTerminated()) {
            throw FormFlowException.sessionNotFound(sessionId);
        }
        return session;
    }

    @Override
    public SessionLease acquire(String sessionId) {
        FormSession session = get(sessionId);
        if (!session.tryLock()) {
            throw FormFlowException.busy(sessionId);
        }
        if (session.isTerminated()) {
            session.unlock();
            throw FormFlowException.sessionNotFound(sessionId);
        }
        return new SessionLease(session);
    }

    @Override
    public void commit(String sessionId, String field, String value, double confidence) {
        try (SessionLease lease = acquire(sessionId)) {
            FormSession session = lease.session();
            if (session.field(field) == null) {
                throw FormFlowException.malformed("Unknown field: " + field);
            }
            double bounded = Math.max(0.0d, Math.min(1.0d, confidence));
            session.getRemainingFields().remove(field);
            session.getSkippedFields().remove(field);
            session.getExtractedValues().put(field, value);
            session.getConfidenceScores().put(field, bounded);
            session.getCommitHistory().remove(field);
            session.getCommitHistory().push(field);
            session.resetClarificationAttempts(field);
            session.touch(clock.instant());
        }
    }

    @Override
    public void undoCommit(String sessionId, String field) {
        try (SessionLease lease = acquire(sessionId)) {
            FormSession session = lease.session();
            if (!session.isCommitted(field)) {
                return;
            }
            session.getExtractedValues().remove(field);
            session.getConfidenceScores().remove(field);
            session.getCommitHistory().remove(field);
            session.getRemainingFields().remove(field);
            session.getRemainingFields().addFirst(field);
            session.touch(clock.instant());
        }
    }

    @Override
    public SessionSnapshot delete(String sessionId) {
        try (SessionLease lease = acquire(sessionId)) {
            FormSession session = lease.session();
            SessionSnapshot snapshot = new SessionSnapshot(
                    new LinkedHashMap<>(session.getExtractedValues()),
                    session.getExtractedValues().size()
            );
            session.setState(DialogueState.TERMINATED);
            sessions.remove(sessionId, session);
            return snapshot;
        }
    }

    @Override
    public void touch(String sessionId) {
        try (SessionLease lease = acquire(sessionId)) {
            lease.session().touch(clock.instant());
        }
    }

    @Override
    public int purgeIdle(Duration ttl) {
        Instant cutoff = clock.instant().minus(ttl);
        int purged = 0;
        for (FormSession session : sessions.values()) {
            if (!session.getLastActivityAt().isBefore(cutoff)) {
                continue;
            }
            if (!session.tryLock()) {
                log.debug("Skipping busy idle session {}", session.getId());
                continue;
            }
            try {
                if (session.getLastActivityAt().isBefore(cutoff) && !session.isTerminated()) {
                    session.setState(DialogueState.TERMINATED);
                    sessions.remove(session.getId(), session);
                    purged++;
                }
            } finally {
                session.unlock();
            }
        }
        return purged;
    }

    @Override
    public int size() {
        return sessions.size();
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
