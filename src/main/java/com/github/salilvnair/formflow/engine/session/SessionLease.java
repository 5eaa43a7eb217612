package com.github.salilvnair.formflow.engine.session;

/**
 * Exclusive hold on a session for the duration of one turn. Closing releases the lock.
 */
public final class SessionLease implements AutoCloseable {

    private final FormSession session;
    private boolean released;

    SessionLease(FormSession session) {
        this.session = session;
    }

    public FormSession session() {
        return session;
    }

    @Override
    public void close() {
        if (!released) {
            released = true;
            session.unlock();
        }
    }
}
