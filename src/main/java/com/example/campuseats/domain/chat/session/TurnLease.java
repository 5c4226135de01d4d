package com.example.campuseats.domain.chat.session;

import java.util.concurrent.atomic.AtomicBoolean;

import lombok.extern.slf4j.Slf4j;

/**
 * Exclusive right to run one turn for a session. Closing more than once is harmless.
 */
@Slf4j
public class TurnLease implements AutoCloseable {

    private final String sessionId;
    private final AtomicBoolean inFlight;
    private final AtomicBoolean closed = new AtomicBoolean();

    TurnLease(String sessionId, AtomicBoolean inFlight) {
        this.sessionId = sessionId;
        this.inFlight = inFlight;
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            inFlight.set(false);
            log.debug("Turn lease released [{}]", sessionId);
        }
    }
}
