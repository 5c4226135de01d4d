package com.example.campuseats.domain.chat.dialogue;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import org.springframework.stereotype.Service;

import com.example.campuseats.domain.chat.session.Session;
import com.example.campuseats.domain.chat.stream.Fragment;
import com.example.campuseats.domain.chat.stream.FragmentSink;
import com.example.campuseats.domain.menu.dto.ItemMention;
import com.example.campuseats.domain.menu.dto.MenuItem;
import com.example.campuseats.domain.menu.service.CategoryLookupResult;
import com.example.campuseats.domain.menu.service.MenuGateway;
import com.example.campuseats.domain.menu.service.MenuLookupResult;
import com.example.campuseats.domain.menu.service.ToolUnavailableException;
import com.example.campuseats.domain.order.OrderDraft;
import com.example.campuseats.domain.order.OrderLine;
import com.example.campuseats.domain.order.OrderProperties;
import com.example.campuseats.domain.order.OrderRecord;
import com.example.campuseats.domain.order.RequiredField;
import com.example.campuseats.domain.order.service.OrderRecordStore;
import com.example.campuseats.domain.order.validation.FieldValidationService;
import com.example.campuseats.domain.order.validation.ValidationResult;
import com.example.campuseats.domain.restaurant.RestaurantHoursService;
import com.example.campuseats.domain.restaurant.dto.RestaurantHours;
import com.example.campuseats.global.error.ErrorCode;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Decides, for one message, which tools to call, how the order flow moves and what to reply.
 * Works on a session snapshot and never writes to the session store itself.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DialogueController {

    private final IntentClassifier intentClassifier;
    private final MenuGateway menuGateway;
    private final RestaurantHoursService restaurantHoursService;
    private final FieldValidationService fieldValidationService;
    private final ReplyTemplates replyTemplates;
    private final OrderProperties orderProperties;
    private final Clock clock;

    /**
     * Status fragments for tool calls go to {@code statusSink} before each call is made.
     */
    public TurnDecision decide(Session session, String message, FragmentSink statusSink) {
        ClassifiedMessage classified = intentClassifier.classify(message);
        Stage stage = session.getStage();
        log.info("Intent [{}]: {} in stage {}", session.getSessionId(), classified.intent(), stage);

        if (classified.intent() == Intent.CANCEL) {
            return handleCancel(session);
        }
        if (stage.isCollecting()) {
            return handleCollecting(session, message, classified, statusSink);
        }
        if (stage == Stage.ITEM_INQUIRY || stage == Stage.ORDER_PENDING_CONFIRMATION) {
            return handleDraftAwaitingConfirmation(session, classified, statusSink);
        }
        return handleOpenConversation(session, classified, statusSink);
    }

    private TurnDecision handleCancel(Session session) {
        if (!session.hasDraft()) {
            return TurnDecision.unchanged(session, Reply.direct(replyTemplates.nothingToCancel()));
        }
        log.info("Order cancelled [{}] in stage {}", session.getSessionId(), session.getStage());
        return TurnDecision.of(Stage.IDLE, null, Reply.direct(replyTemplates.orderCancelled()));
    }

    /**
     * ITEM_INQUIRY and ORDER_PENDING_CONFIRMATION: the draft holds verified items but no field has been collected.
     */
    private TurnDecision handleDraftAwaitingConfirmation(Session session, ClassifiedMessage classified, FragmentSink statusSink) {
        Stage stage = session.getStage();
        OrderDraft draft = session.getDraft();

        switch (classified.intent()) {
            case ITEM_QUESTION:
            case ORDER_ITEM:
                if (classified.namesItems()) {
                    return handleItems(session, classified, statusSink);
                }
                if (classified.refersBack()) {
                    return confirm(stage, draft);
                }
                return TurnDecision.unchanged(session, Reply.direct(replyTemplates.awaitingConfirmation(draft)));
            case AFFIRM:
                return confirm(stage, draft);
            case DENY:
                log.info("Draft declined [{}]", session.getSessionId());
                return TurnDecision.of(Stage.IDLE, null, Reply.direct(replyTemplates.orderCancelled()));
            default:
                return answerWithTools(session, classified, statusSink, draftContext(draft));
        }
    }

    private TurnDecision confirm(Stage stage, OrderDraft draft) {
        if (stage == Stage.ITEM_INQUIRY) {
            return TurnDecision.of(Stage.ORDER_PENDING_CONFIRMATION, draft,
                Reply.direct(replyTemplates.orderSummary(draft, List.of())));
        }
        RequiredField first = draft.firstIncompleteField()
            .orElseThrow(() -> new IllegalStateException("A draft awaiting confirmation has no collected fields"));
        return TurnDecision.of(Stage.collecting(first), draft, Reply.direct("Great! " + replyTemplates.promptFor(first)));
    }

    private TurnDecision handleOpenConversation(Session session, ClassifiedMessage classified, FragmentSink statusSink) {
        if (classified.namesItems()) {
            return handleItems(session, classified, statusSink);
        }
        return answerWithTools(session, classified, statusSink, null);
    }

    /**
     * Looks every mention up independently. Found items form a new draft; if nothing was found any
     * existing draft is kept as it was.
     */
    private TurnDecision handleItems(Session session, ClassifiedMessage classified, FragmentSink statusSink) {
        List<MenuLookupResult> results;
        try {
            results = lookUpAll(classified.mentions(), statusSink);
        } catch (ToolUnavailableException e) {
            return TurnDecision.unchanged(session, Reply.direct(ErrorCode.MENU_UNAVAILABLE.getMessage()));
        }

        List<MenuLookupResult> found = results.stream().filter(MenuLookupResult::isFound).toList();
        List<MenuLookupResult> missing = results.stream().filter(result -> !result.isFound()).toList();

        if (found.isEmpty()) {
            String reply = session.hasDraft()
                ? replyTemplates.unavailableWithDraft(missing, session.getDraft())
                : replyTemplates.unavailable(missing);
            return TurnDecision.unchanged(session, Reply.direct(reply));
        }

        OrderDraft draft = OrderDraft.withItems(found.stream()
            .map(result -> new OrderLine(result.getItem().name(), result.getItem().price(), result.getMention().quantity()))
            .toList());
        if (session.hasDraft()) {
            log.info("Unconfirmed draft replaced [{}]", session.getSessionId());
        }

        if (classified.intent() == Intent.ORDER_ITEM) {
            return TurnDecision.of(Stage.ORDER_PENDING_CONFIRMATION, draft,
                Reply.direct(replyTemplates.orderSummary(draft, missing)));
        }
        return TurnDecision.of(Stage.ITEM_INQUIRY, draft, Reply.direct(replyTemplates.availability(found, missing)));
    }

    private TurnDecision handleCollecting(Session session, String message, ClassifiedMessage classified, FragmentSink statusSink) {
        RequiredField field = session.getStage().getCollectedField();
        OrderDraft draft = session.getDraft();

        if (fieldValidationService.isPlausible(field, message)) {
            ValidationResult result;
            try {
                result = fieldValidationService.validate(field, message);
            } catch (ToolUnavailableException e) {
                return TurnDecision.unchanged(session,
                    Reply.direct(ErrorCode.VALIDATION_UNAVAILABLE.getMessage() + " " + replyTemplates.promptFor(field)));
            }
            if (!result.valid()) {
                log.info("Field rejected [{}] {}: {}", session.getSessionId(), field, result.reason());
                return TurnDecision.unchanged(session, Reply.direct(replyTemplates.invalid(result.reason(), field)));
            }
            draft.recordValidated(field, result.value());
            return advance(session.getSessionId(), field, result.value(), draft);
        }

        if (classified.intent() == Intent.ITEM_QUESTION && classified.namesItems()) {
            try {
                List<MenuLookupResult> results = lookUpAll(classified.mentions(), statusSink);
                return TurnDecision.unchanged(session, Reply.direct(replyTemplates.itemFactsDuringCollection(
                    results.stream().filter(MenuLookupResult::isFound).toList(),
                    results.stream().filter(r -> !r.isFound()).toList(),
                    field)));
            } catch (ToolUnavailableException e) {
                return TurnDecision.unchanged(session,
                    Reply.direct(ErrorCode.MENU_UNAVAILABLE.getMessage() + " " + replyTemplates.reprompt(field)));
            }
        }
        return TurnDecision.unchanged(session, Reply.direct(replyTemplates.reprompt(field)));
    }

    private TurnDecision advance(String sessionId, RequiredField accepted, String value, OrderDraft draft) {
        Optional<RequiredField> next = draft.firstIncompleteField();
        if (next.isPresent()) {
            return TurnDecision.of(Stage.collecting(next.get()), draft,
                Reply.direct(replyTemplates.fieldAccepted(accepted, value, next.get())));
        }
        OrderRecord order = OrderRecord.from(sessionId, draft, LocalDateTime.now(clock));
        log.info("Order complete [{}]: total {} {}", sessionId, orderProperties.currency(), OrderRecordStore.money(order.total()));
        return new TurnDecision(Stage.IDLE, null, Reply.direct(replyTemplates.orderConfirmed(order)), order);
    }

    /**
     * Menu, category, opening hours and general questions. These go to the model with whatever
     * verified tool output applies; the stage only moves from IDLE to BROWSING.
     */
    private TurnDecision answerWithTools(Session session, ClassifiedMessage classified, FragmentSink statusSink, String draftContext) {
        Stage stage = session.getStage();
        Stage browsing = stage == Stage.IDLE ? Stage.BROWSING : stage;
        OrderDraft draft = session.getDraft();

        switch (classified.intent()) {
            case MENU_OVERVIEW: {
                statusSink.emit(Fragment.status("Fetching menu data..."));
                try {
                    List<MenuItem> menu = menuGateway.fetchMenu();
                    String context = menu.isEmpty()
                        ? "[TOOL] The menu is empty today."
                        : "[TOOL] Today's menu:\n" + menuLines(menu);
                    return TurnDecision.of(browsing, draft, Reply.generate(join(context, draftContext)));
                } catch (ToolUnavailableException e) {
                    return TurnDecision.unchanged(session, Reply.direct(ErrorCode.MENU_UNAVAILABLE.getMessage()));
                }
            }
            case CATEGORY: {
                statusSink.emit(Fragment.status(String.format("Looking up '%s' in the menu...", classified.category())));
                try {
                    CategoryLookupResult result = menuGateway.lookupCategory(classified.category());
                    if (!result.found() || result.items().isEmpty()) {
                        return TurnDecision.of(browsing, draft, Reply.direct(replyTemplates.categoryMissing(classified.category())));
                    }
                    String context = String.format("[TOOL] Items in category '%s':\n%s", result.category(), menuLines(result.items()));
                    return TurnDecision.of(browsing, draft, Reply.generate(join(context, draftContext)));
                } catch (ToolUnavailableException e) {
                    return TurnDecision.unchanged(session, Reply.direct(ErrorCode.MENU_UNAVAILABLE.getMessage()));
                }
            }
            case OPEN_RESTAURANTS: {
                statusSink.emit(Fragment.status("Checking which restaurants are open... Please wait."));
                try {
                    List<RestaurantHours> open = restaurantHoursService.findOpenNow();
                    String context = open.isEmpty()
                        ? "[TOOL] No restaurants are currently open."
                        : "[TOOL] Open restaurants right now:\n" + open.stream()
                            .map(restaurant -> "- " + restaurant.describe())
                            .collect(Collectors.joining("\n"));
                    return TurnDecision.of(browsing, draft, Reply.generate(join(context, draftContext)));
                } catch (ToolUnavailableException e) {
                    return TurnDecision.unchanged(session, Reply.direct(ErrorCode.RESTAURANTS_UNAVAILABLE.getMessage()));
                }
            }
            default:
                return TurnDecision.unchanged(session, Reply.generate(draftContext));
        }
    }

    private List<MenuLookupResult> lookUpAll(List<ItemMention> mentions, FragmentSink statusSink) {
        List<MenuLookupResult> results = new ArrayList<>();
        for (ItemMention mention : mentions) {
            statusSink.emit(Fragment.status(String.format("Looking up '%s' in the menu...", mention.phrase())));
            results.add(menuGateway.lookupItem(mention));
        }
        return results;
    }

    private String draftContext(OrderDraft draft) {
        if (draft == null) {
            return null;
        }
        String items = draft.getItems().stream()
            .map(line -> line.quantity() + "x " + line.name())
            .collect(Collectors.joining(", "));
        return String.format("[ORDER FLOW] The user has an unconfirmed order: %s. "
            + "After answering, ask them to confirm the order with 'yes' or cancel it with 'no'.", items);
    }

    private String menuLines(List<MenuItem> items) {
        return items.stream()
            .map(item -> String.format("- %s: %s %s", item.name(), orderProperties.currency(), OrderRecordStore.money(item.price())))
            .collect(Collectors.joining("\n"));
    }

    private static String join(String context, String extra) {
        return extra == null ? context : context + "\n\n" + extra;
    }
}
