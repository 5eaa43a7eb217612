package com.github.salilvnair.formflow.engine.session;

import com.github.salilvnair.formflow.engine.model.FieldDescriptor;
import com.github.salilvnair.formflow.engine.model.SessionSnapshot;

import java.time.Duration;
import java.util.List;

/**
 * Keyed session registry with one writer per session. Mutating calls fail fast with
 * {@code SESSION_BUSY} when another caller holds the session, and with {@code SESSION_NOT_FOUND}
 * for unknown or deleted ids.
 */
public interface SessionStore {

    FormSession create(List<FieldDescriptor> fields, String formUrl, String userId);

    FormSession get(String sessionId);

    SessionLease acquire(String sessionId);

    void commit(String sessionId, String field, String value, double confidence);

    /** Clears the committed value of {@code field} and puts it back at the head of the queue. */
    void undoCommit(String sessionId, String field);

    SessionSnapshot delete(String sessionId);

    void touch(String sessionId);

    int purgeIdle(Duration ttl);

    int size();
}
