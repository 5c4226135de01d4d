package com.example.campuseats.domain.chat.service;

import org.springframework.stereotype.Component;

import com.example.campuseats.domain.chat.session.ChatTurn;
import com.example.campuseats.domain.chat.session.SessionStore;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Finalizes turns that did not reach a normal end of stream. Only history grows; stage and draft
 * stay exactly as they were before the turn.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TurnCancellation {

    private final SessionStore sessionStore;

    public void recordStopped(String sessionId, String userMessage, String deliveredContent) {
        sessionStore.apply(sessionId, session -> {
            session.append(ChatTurn.user(userMessage));
            session.append(ChatTurn.assistant(deliveredContent, ChatTurn.Status.STOPPED));
            return null;
        });
        log.info("Turn stopped [{}] with {} chars delivered", sessionId, deliveredContent.length());
    }

    public void recordFailed(String sessionId, String userMessage, String apology) {
        sessionStore.apply(sessionId, session -> {
            session.append(ChatTurn.user(userMessage));
            session.append(ChatTurn.assistant(apology, ChatTurn.Status.FAILED));
            return null;
        });
        log.info("Turn failed [{}]", sessionId);
    }
}
