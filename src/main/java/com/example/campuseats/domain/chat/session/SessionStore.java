package com.example.campuseats.domain.chat.session;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * In-memory sessions keyed by session id. Mutations of one session are serialized; different
 * sessions never block each other.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SessionStore {

    private final ChatSessionProperties chatSessionProperties;
    private final Clock clock;

    private final ConcurrentHashMap<String, Entry> sessions = new ConcurrentHashMap<>();

    /**
     * Returns a snapshot of the session, creating it from {@code seedHistory} when the id is new.
     * The seed is ignored for existing sessions.
     */
    public Session getOrCreate(String sessionId, List<ChatTurn> seedHistory) {
        Entry entry = sessions.computeIfAbsent(sessionId, id -> {
            log.info("Session created [{}] with {} seeded turns", id, seedHistory.size());
            return new Entry(new Session(id, seedHistory, clock.instant()));
        });
        return read(entry);
    }

    public Optional<Session> find(String sessionId) {
        return Optional.ofNullable(sessions.get(sessionId)).map(this::read);
    }

    public Session snapshot(String sessionId) {
        return find(sessionId).orElseThrow(SessionNotFoundException::new);
    }

    /**
     * Runs a read-modify-write on the stored session under its lock and returns what the mutation returns.
     */
    public <T> T apply(String sessionId, Function<Session, T> mutation) {
        Entry entry = sessions.get(sessionId);
        if (entry == null) {
            throw new SessionNotFoundException();
        }
        entry.lock.lock();
        try {
            T result = mutation.apply(entry.session);
            entry.session.touch(clock.instant());
            return result;
        } finally {
            entry.lock.unlock();
        }
    }

    /**
     * Claims the single in-flight turn of a session, creating an empty session if it was evicted meanwhile.
     *
     * @throws SessionBusyException when another turn of the same session is still running
     */
    public TurnLease beginTurn(String sessionId) {
        Entry entry = sessions.compute(sessionId, (id, existing) -> {
            Entry current = existing != null ? existing : new Entry(new Session(id, List.of(), clock.instant()));
            if (!current.inFlight.compareAndSet(false, true)) {
                log.warn("Concurrent turn rejected [{}]", id);
                throw new SessionBusyException();
            }
            return current;
        });
        return new TurnLease(sessionId, entry.inFlight);
    }

    @Scheduled(fixedDelayString = "${chat.session.sweep-interval:PT5M}")
    public void evictIdleSessions() {
        Instant cutoff = clock.instant().minus(chatSessionProperties.ttl());
        int before = sessions.size();
        for (Map.Entry<String, Entry> candidate : sessions.entrySet()) {
            sessions.computeIfPresent(candidate.getKey(), (id, entry) -> isEvictable(entry, cutoff) ? null : entry);
        }
        int evicted = before - sessions.size();
        if (evicted > 0) {
            log.info("Evicted {} idle sessions", evicted);
        }
    }

    int size() {
        return sessions.size();
    }

    private boolean isEvictable(Entry entry, Instant cutoff) {
        if (entry.inFlight.get() || !entry.lock.tryLock()) {
            return false;
        }
        try {
            return entry.session.getLastActivity().isBefore(cutoff);
        } finally {
            entry.lock.unlock();
        }
    }

    private Session read(Entry entry) {
        entry.lock.lock();
        try {
            return entry.session.copy();
        } finally {
            entry.lock.unlock();
        }
    }

    private static final class Entry {
        private final Session session;
        private final ReentrantLock lock = new ReentrantLock();
        private final AtomicBoolean inFlight = new AtomicBoolean();

        private Entry(Session session) {
            this.session = session;
        }
    }
}
