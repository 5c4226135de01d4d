package com.example.campuseats.domain.chat.service;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

import org.springframework.stereotype.Service;

import com.example.campuseats.domain.chat.dialogue.DialogueController;
import com.example.campuseats.domain.chat.dialogue.Reply;
import com.example.campuseats.domain.chat.dialogue.TurnDecision;
import com.example.campuseats.domain.chat.dto.ChatRequest;
import com.example.campuseats.domain.chat.dto.DialogState;
import com.example.campuseats.domain.chat.dto.HistoryMessage;
import com.example.campuseats.domain.chat.session.ChatTurn;
import com.example.campuseats.domain.chat.session.Session;
import com.example.campuseats.domain.chat.session.SessionStore;
import com.example.campuseats.domain.chat.session.TurnLease;
import com.example.campuseats.domain.chat.stream.Fragment;
import com.example.campuseats.domain.chat.stream.FragmentWriter;
import com.example.campuseats.domain.chat.stream.TurnCancelledException;
import com.example.campuseats.domain.order.OrderDraft;
import com.example.campuseats.domain.order.service.OrderPersistException;
import com.example.campuseats.domain.order.service.OrderRecordStore;
import com.example.campuseats.global.client.GenerationEngine;
import com.example.campuseats.global.client.GenerationFailedException;
import com.example.campuseats.global.error.ErrorCode;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs one chat turn end to end: claims the session, lets the dialogue controller decide, streams
 * the reply and commits the outcome only after the stream ended normally.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ChatTurnService {

    private final SessionStore sessionStore;
    private final DialogueController dialogueController;
    private final GenerationEngine generationEngine;
    private final PromptFactory promptFactory;
    private final OrderRecordStore orderRecordStore;
    private final TurnCancellation turnCancellation;

    /**
     * Claims the session before anything is written, so a busy session is rejected with a normal
     * HTTP error instead of a broken stream.
     */
    public TurnResponseBody openTurn(ChatRequest request) {
        String sessionId = request.sessionId();
        sessionStore.getOrCreate(sessionId, seedHistory(request.history()));
        TurnLease lease = sessionStore.beginTurn(sessionId);
        log.info("Turn started [{}]: {}", sessionId, request.message());

        return new TurnResponseBody(sessionId, lease,
            out -> runTurn(sessionId, request.message(), new FragmentWriter(sessionId, out)));
    }

    void runTurn(String sessionId, String message, FragmentWriter writer) {
        Session snapshot = sessionStore.snapshot(sessionId);
        TurnDecision decision;
        try {
            decision = dialogueController.decide(snapshot, message, writer);
            streamReply(decision.reply(), snapshot, message, writer);
        } catch (TurnCancelledException e) {
            turnCancellation.recordStopped(sessionId, message, writer.getDeliveredContent());
            return;
        } catch (GenerationFailedException e) {
            log.error("Generation failed [{}]: {}", sessionId, e.getMessage());
            fail(sessionId, message, writer, ErrorCode.GENERATION_FAILED);
            return;
        } catch (RuntimeException e) {
            log.error("Unexpected turn failure [{}]: {}", sessionId, e.getMessage(), e);
            fail(sessionId, message, writer, ErrorCode.GENERATION_FAILED);
            return;
        }
        commit(sessionId, message, decision, writer);
    }

    private void streamReply(Reply reply, Session snapshot, String message, FragmentWriter writer) {
        if (!reply.generated()) {
            writer.emit(Fragment.content(reply.text()));
            return;
        }
        generationEngine.stream(
            promptFactory.build(reply.toolContext(), snapshot.getHistory(), message),
            text -> writer.emit(Fragment.content(text)));
        if (writer.getDeliveredContent().isEmpty()) {
            throw new GenerationFailedException(new IllegalStateException("The model returned no text"));
        }
    }

    private void commit(String sessionId, String message, TurnDecision decision, FragmentWriter writer) {
        if (decision.completedOrder() != null) {
            try {
                orderRecordStore.append(decision.completedOrder());
            } catch (OrderPersistException e) {
                String apology = "\n\n" + ErrorCode.ORDER_SAVE_FAILED.getMessage();
                try {
                    writer.emit(Fragment.content(apology));
                } catch (TurnCancelledException ignored) {
                    log.info("Client gone before the save failure was reported [{}]", sessionId);
                }
                turnCancellation.recordFailed(sessionId, message, writer.getDeliveredContent());
                return;
            }
        }
        sessionStore.apply(sessionId, session -> {
            session.append(ChatTurn.user(message));
            session.append(ChatTurn.assistant(writer.getDeliveredContent(), ChatTurn.Status.COMPLETED));
            session.moveTo(decision.stage(), decision.draft());
            return null;
        });
        log.info("Turn completed [{}]: stage {}", sessionId, decision.stage());
    }

    private void fail(String sessionId, String message, FragmentWriter writer, ErrorCode errorCode) {
        String apology = errorCode.getMessage();
        log.warn("Fallback reply [{}]: {}", sessionId, errorCode.getCode());
        try {
            writer.emit(Fragment.content(writer.getDeliveredContent().isEmpty() ? apology : "\n\n" + apology));
        } catch (TurnCancelledException e) {
            turnCancellation.recordStopped(sessionId, message, writer.getDeliveredContent());
            return;
        }
        turnCancellation.recordFailed(sessionId, message, apology);
    }

    public void warmUp() {
        generationEngine.warmUp();
    }

    public DialogState describe(String sessionId) {
        return buildDialogState(sessionStore.snapshot(sessionId));
    }

    private DialogState buildDialogState(Session session) {
        OrderDraft draft = session.getDraft();
        List<DialogState.DraftItem> items = draft == null ? List.of() : draft.getItems().stream()
            .map(line -> DialogState.DraftItem.builder()
                .name(line.name())
                .quantity(line.quantity())
                .unitPrice(line.unitPrice())
                .lineTotal(line.lineTotal())
                .build())
            .toList();

        Map<String, String> fields = new LinkedHashMap<>();
        if (draft != null) {
            draft.getFields().forEach((field, value) -> {
                if (value.validated()) {
                    fields.put(field.name().toLowerCase(Locale.ROOT), value.value());
                }
            });
        }

        return DialogState.builder()
            .sessionId(session.getSessionId())
            .stage(session.getStage().name())
            .items(items)
            .fields(fields)
            .nextAction(determineNextAction(session))
            .total(draft == null ? BigDecimal.ZERO : draft.total())
            .historySize(session.getHistory().size())
            .build();
    }

    private String determineNextAction(Session session) {
        switch (session.getStage()) {
            case ITEM_INQUIRY:
                return "Ask whether to order the item";
            case ORDER_PENDING_CONFIRMATION:
                return "Confirm or cancel the order";
            case COLLECTING_RFID:
            case COLLECTING_BUILDING:
            case COLLECTING_PHONE:
            case COLLECTING_SPECIAL_REQUEST:
                return "Provide the " + Objects.requireNonNull(session.getStage().getCollectedField()).getDisplayName();
            default:
                return "Ask about the menu or order an item";
        }
    }

    private static List<ChatTurn> seedHistory(List<HistoryMessage> history) {
        return history.stream()
            .filter(entry -> entry.text() != null && entry.sender() != null)
            .filter(entry -> entry.sender().equalsIgnoreCase("user") || entry.sender().equalsIgnoreCase("bot"))
            .map(entry -> entry.sender().equalsIgnoreCase("user")
                ? ChatTurn.user(entry.text())
                : ChatTurn.assistant(entry.text(), ChatTurn.Status.COMPLETED))
            .toList();
    }
}
