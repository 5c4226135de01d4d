package com.example.campuseats.domain.chat.session;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.example.campuseats.domain.chat.dialogue.Stage;
import com.example.campuseats.domain.order.OrderDraft;

import lombok.Getter;

/**
 * Server-side state of one conversation. Only {@link SessionStore} hands out mutable instances,
 * and only inside {@link SessionStore#apply}.
 */
@Getter
public class Session {

    private final String sessionId;
    private final List<ChatTurn> history;
    private Stage stage;
    private OrderDraft draft;
    private Instant lastActivity;

    Session(String sessionId, List<ChatTurn> seedHistory, Instant createdAt) {
        this.sessionId = sessionId;
        this.history = new ArrayList<>(seedHistory);
        this.stage = Stage.IDLE;
        this.lastActivity = createdAt;
    }

    private Session(Session source) {
        this.sessionId = source.sessionId;
        this.history = new ArrayList<>(source.history);
        this.stage = source.stage;
        this.draft = source.draft == null ? null : source.draft.copy();
        this.lastActivity = source.lastActivity;
    }

    public List<ChatTurn> getHistory() {
        return Collections.unmodifiableList(history);
    }

    /**
     * Returns a copy of the draft; callers never share the stored instance.
     */
    public OrderDraft getDraft() {
        return draft == null ? null : draft.copy();
    }

    public boolean hasDraft() {
        return draft != null;
    }

    public void append(ChatTurn turn) {
        history.add(turn);
    }

    /**
     * Moves to {@code next} together with its draft. A draft exists exactly in the stages that need one.
     */
    public void moveTo(Stage next, OrderDraft nextDraft) {
        if (next == Stage.ORDER_COMPLETE) {
            throw new IllegalArgumentException("ORDER_COMPLETE is never stored; completed orders return to IDLE");
        }
        if (next.isDraftRequired() != (nextDraft != null)) {
            throw new IllegalStateException(String.format(
                "Stage %s %s a draft", next, next.isDraftRequired() ? "requires" : "must not carry"));
        }
        if (next.isCollecting() && !nextDraft.hasItems()) {
            throw new IllegalStateException("Field collection needs at least one item");
        }
        this.stage = next;
        this.draft = nextDraft == null ? null : nextDraft.copy();
    }

    void touch(Instant now) {
        this.lastActivity = now;
    }

    public Session copy() {
        return new Session(this);
    }
}
