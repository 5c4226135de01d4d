package com.example.campuseats.domain.chat.dialogue;

import com.example.campuseats.domain.chat.session.ChatSessionProperties;
import com.example.campuseats.domain.chat.session.Session;
import com.example.campuseats.domain.chat.session.SessionStore;
import com.example.campuseats.domain.chat.stream.Fragment;
import com.example.campuseats.domain.menu.dto.ItemMention;
import com.example.campuseats.domain.menu.dto.MenuItem;
import com.example.campuseats.domain.menu.service.CategoryLookupResult;
import com.example.campuseats.domain.menu.service.MenuGateway;
import com.example.campuseats.domain.menu.service.MenuLookupResult;
import com.example.campuseats.domain.menu.service.ToolUnavailableException;
import com.example.campuseats.domain.order.OrderDraft;
import com.example.campuseats.domain.order.OrderLine;
import com.example.campuseats.domain.order.OrderProperties;
import com.example.campuseats.domain.order.RequiredField;
import com.example.campuseats.domain.order.validation.FieldValidationService;
import com.example.campuseats.domain.order.validation.FieldValidator;
import com.example.campuseats.domain.restaurant.RestaurantHoursService;
import com.example.campuseats.domain.restaurant.dto.RestaurantHours;
import com.example.campuseats.global.error.ErrorCode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class DialogueControllerTest {

    private static final Map<String, MenuItem> CATALOG = Map.of(
            "margherita", new MenuItem("Margherita", new BigDecimal("31.00")),
            "pepperoni", new MenuItem("Pepperoni", new BigDecimal("35.00")),
            "chicken bowl", new MenuItem("Chicken Bowl", new BigDecimal("28.50")));

    private static final Map<RequiredField, String> COLLECTED = Map.of(
            RequiredField.RFID, "12345678",
            RequiredField.BUILDING, "A1A",
            RequiredField.PHONE, "0501234567");

    private final Clock clock = Clock.fixed(Instant.parse("2024-05-01T08:30:00Z"), ZoneOffset.UTC);
    private final OrderProperties orderProperties =
            new OrderProperties(8, List.of("A1A", "A2B"), 9, 15, "AED", "orders.txt", false);

    private MenuGateway menuGateway;
    private RestaurantHoursService restaurantHoursService;
    private DialogueController controller;
    private SessionStore sessionStore;
    private List<Fragment> statuses;

    @BeforeEach
    void setUp() {
        menuGateway = mock(MenuGateway.class);
        restaurantHoursService = mock(RestaurantHoursService.class);
        when(menuGateway.lookupItem(any())).thenAnswer(invocation -> lookup(invocation.getArgument(0)));

        controller = new DialogueController(
                new IntentClassifier(new ItemMentionExtractor()),
                menuGateway,
                restaurantHoursService,
                new FieldValidationService(new FieldValidator(orderProperties), menuGateway, orderProperties),
                new ReplyTemplates(orderProperties),
                orderProperties,
                clock);
        sessionStore = new SessionStore(new ChatSessionProperties(Duration.ofHours(2)), clock);
        statuses = new ArrayList<>();
    }

    @Test
    void availabilityQuestionShouldAnswerFromCatalogAndOpenInquiry() {
        TurnDecision decision = controller.decide(newSession("s1"), "Is Margherita available?", statuses::add);

        assertThat(decision.stage()).isEqualTo(Stage.ITEM_INQUIRY);
        assertThat(decision.reply().generated()).isFalse();
        assertThat(decision.reply().text()).contains("Margherita is available for AED 31.00");
        assertThat(decision.draft().getItems()).extracting(OrderLine::name).containsExactly("Margherita");
        assertThat(statuses).containsExactly(Fragment.status("Looking up 'Margherita' in the menu..."));
    }

    @Test
    void missShouldBeStatedAsUnavailable() {
        TurnDecision decision = controller.decide(newSession("s1"), "Is Sushi available?", statuses::add);

        assertThat(decision.stage()).isEqualTo(Stage.IDLE);
        assertThat(decision.draft()).isNull();
        assertThat(decision.reply().text()).contains("Sorry, 'Sushi' is not on the menu.");
    }

    @Test
    void everyItemOfMultiItemOrderShouldBeLookedUp() {
        TurnDecision decision = controller.decide(newSession("s1"), "Can I order a pepperoni and margherita pizza", statuses::add);

        verify(menuGateway, times(2)).lookupItem(any());
        assertThat(decision.stage()).isEqualTo(Stage.ORDER_PENDING_CONFIRMATION);
        assertThat(decision.draft().getItems()).extracting(OrderLine::name).containsExactly("Pepperoni", "Margherita");
        assertThat(decision.reply().text()).contains("Total: AED 66.00").contains("Shall I place this order?");
        assertThat(statuses).hasSize(2);
    }

    @Test
    void confirmationShouldAskForIdentifierOnly() {
        Session pending = sessionIn("s1", Stage.ORDER_PENDING_CONFIRMATION);

        TurnDecision decision = controller.decide(pending, "yes", statuses::add);

        assertThat(decision.stage()).isEqualTo(Stage.COLLECTING_RFID);
        assertThat(decision.reply().text())
                .startsWith("Great! Please provide the 8 digits of your ID card")
                .doesNotContain("building")
                .doesNotContain("phone");
    }

    @Test
    void yesAfterInquiryShouldShowSummaryBeforeCollecting() {
        Session inquiry = sessionIn("s1", Stage.ITEM_INQUIRY);

        TurnDecision decision = controller.decide(inquiry, "yes please", statuses::add);

        assertThat(decision.stage()).isEqualTo(Stage.ORDER_PENDING_CONFIRMATION);
        assertThat(decision.reply().text()).contains("- 1x Margherita: AED 31.00 each = AED 31.00");
    }

    @Test
    void orderPhrasingWithoutItemShouldNotConfirm() {
        Session pending = sessionIn("s1", Stage.ORDER_PENDING_CONFIRMATION);

        for (String message : List.of("I need to think about it", "I'd like to know how long delivery takes first")) {
            TurnDecision decision = controller.decide(pending, message, statuses::add);

            assertThat(decision.stage()).as(message).isEqualTo(Stage.ORDER_PENDING_CONFIRMATION);
            assertThat(decision.draft().getItems()).extracting(OrderLine::name).containsExactly("Margherita");
            assertThat(decision.reply().generated()).isFalse();
            assertThat(decision.reply().text())
                    .contains("- 1x Margherita")
                    .endsWith("Please respond with 'yes' to confirm your order or 'no' to cancel.");
        }
        verify(menuGateway, never()).lookupItem(any());
    }

    @Test
    void orderPhrasingWithoutItemShouldKeepInquiryOpen() {
        TurnDecision decision = controller.decide(sessionIn("s1", Stage.ITEM_INQUIRY), "I need to think about it", statuses::add);

        assertThat(decision.stage()).isEqualTo(Stage.ITEM_INQUIRY);
        assertThat(decision.reply().text()).contains("respond with 'yes' to confirm");
    }

    @Test
    void orderOfTheItemUnderDiscussionShouldConfirm() {
        TurnDecision taken = controller.decide(sessionIn("s1", Stage.ORDER_PENDING_CONFIRMATION), "I'll take it", statuses::add);
        TurnDecision summarized = controller.decide(sessionIn("s2", Stage.ITEM_INQUIRY), "I'd like that one please", statuses::add);

        assertThat(taken.stage()).isEqualTo(Stage.COLLECTING_RFID);
        assertThat(summarized.stage()).isEqualTo(Stage.ORDER_PENDING_CONFIRMATION);
    }

    @Test
    void invalidIdentifierShouldRepromptWithReason() {
        Session collecting = sessionIn("s1", Stage.COLLECTING_RFID);

        TurnDecision decision = controller.decide(collecting, "1234", statuses::add);

        assertThat(decision.stage()).isEqualTo(Stage.COLLECTING_RFID);
        assertThat(decision.draft().getField(RequiredField.RFID).validated()).isFalse();
        assertThat(decision.reply().text())
                .contains("Your ID number must be exactly 8 digits, but I got 4.")
                .contains("Please provide the 8 digits of your ID card");
    }

    @Test
    void fullOrderShouldCompleteWithEveryField() {
        String sessionId = "s1";
        Session session = sessionIn(sessionId, Stage.ORDER_PENDING_CONFIRMATION);

        session = step(session, "yes", Stage.COLLECTING_RFID);
        session = step(session, "N12345678", Stage.COLLECTING_BUILDING);
        session = step(session, "a1a", Stage.COLLECTING_PHONE);
        session = step(session, "050 123 4567", Stage.COLLECTING_SPECIAL_REQUEST);

        TurnDecision done = controller.decide(session, "no", statuses::add);

        assertThat(done.stage()).isEqualTo(Stage.IDLE);
        assertThat(done.draft()).isNull();
        assertThat(done.completedOrder()).isNotNull();
        assertThat(done.completedOrder().field(RequiredField.RFID)).isEqualTo("12345678");
        assertThat(done.completedOrder().field(RequiredField.SPECIAL_REQUEST)).isEqualTo("None");
        assertThat(done.completedOrder().total()).isEqualByComparingTo("31.00");
        assertThat(done.reply().text())
                .startsWith("✅ Order confirmed!")
                .contains("- 1x Margherita")
                .contains("Total: AED 31.00")
                .contains("ID: N12345678")
                .contains("Building: A1A")
                .contains("Phone Number: 0501234567")
                .contains("Special Request: None");
    }

    @Test
    void acceptedFieldShouldBeEchoedWithNextPrompt() {
        TurnDecision decision = controller.decide(sessionIn("s1", Stage.COLLECTING_RFID), "12345678", statuses::add);

        assertThat(decision.stage()).isEqualTo(Stage.COLLECTING_BUILDING);
        assertThat(decision.reply().text())
                .isEqualTo("Got it, your ID number is 12345678. "
                        + "Please select your building from the following options: A1A, A2B.");
    }

    @Test
    void implausibleAnswerShouldRepromptForPendingField() {
        TurnDecision decision = controller.decide(sessionIn("s1", Stage.COLLECTING_RFID), "what?", statuses::add);

        assertThat(decision.stage()).isEqualTo(Stage.COLLECTING_RFID);
        assertThat(decision.reply().text()).startsWith("I still need your ID number to place the order.");
    }

    @Test
    void cancellationShouldWinInAnyDraftingStage() {
        for (Stage stage : List.of(Stage.ITEM_INQUIRY, Stage.ORDER_PENDING_CONFIRMATION, Stage.COLLECTING_PHONE)) {
            Session session = sessionIn("s-" + stage, stage);

            TurnDecision decision = controller.decide(session, "cancel, I want a burger instead", statuses::add);

            assertThat(decision.stage()).isEqualTo(Stage.IDLE);
            assertThat(decision.draft()).isNull();
            assertThat(decision.reply().text()).startsWith("Your order has been cancelled.");
        }
        verifyNoInteractions(menuGateway);
    }

    @Test
    void cancellationWithoutDraftShouldChangeNothing() {
        TurnDecision decision = controller.decide(newSession("s1"), "never mind", statuses::add);

        assertThat(decision.stage()).isEqualTo(Stage.IDLE);
        assertThat(decision.reply().text()).startsWith("There is no order in progress to cancel.");
    }

    @Test
    void denialShouldDropUnconfirmedDraft() {
        TurnDecision decision = controller.decide(sessionIn("s1", Stage.ORDER_PENDING_CONFIRMATION), "no thanks", statuses::add);

        assertThat(decision.stage()).isEqualTo(Stage.IDLE);
        assertThat(decision.draft()).isNull();
    }

    @Test
    void newItemShouldReplaceUnconfirmedDraft() {
        TurnDecision decision = controller.decide(sessionIn("s1", Stage.ITEM_INQUIRY), "I'll have a pepperoni", statuses::add);

        assertThat(decision.stage()).isEqualTo(Stage.ORDER_PENDING_CONFIRMATION);
        assertThat(decision.draft().getItems()).extracting(OrderLine::name).containsExactly("Pepperoni");
    }

    @Test
    void newItemShouldNotReplaceDraftOnceCollectionBegan() {
        TurnDecision decision = controller.decide(sessionIn("s1", Stage.COLLECTING_RFID), "I'll have a pepperoni", statuses::add);

        assertThat(decision.stage()).isEqualTo(Stage.COLLECTING_RFID);
        assertThat(decision.draft().getItems()).extracting(OrderLine::name).containsExactly("Margherita");
        verify(menuGateway, never()).lookupItem(any());
    }

    @Test
    void itemQuestionDuringCollectionShouldAnswerAndKeepDraft() {
        Session collecting = sessionIn("s1", Stage.COLLECTING_BUILDING);

        TurnDecision decision = controller.decide(collecting, "How much is the chicken bowl?", statuses::add);

        assertThat(decision.stage()).isEqualTo(Stage.COLLECTING_BUILDING);
        assertThat(decision.draft().getItems()).extracting(OrderLine::name).containsExactly("Margherita");
        assertThat(decision.reply().text())
                .contains("Chicken Bowl is available for AED 28.50.")
                .contains("Your current order is unchanged.")
                .endsWith("Please select your building from the following options: A1A, A2B.");
    }

    @Test
    void unavailableCatalogShouldNeverFallBackToModel() {
        doThrow(new ToolUnavailableException(new IllegalStateException("down"))).when(menuGateway).lookupItem(any());

        TurnDecision decision = controller.decide(newSession("s1"), "Is Margherita available?", statuses::add);

        assertThat(decision.stage()).isEqualTo(Stage.IDLE);
        assertThat(decision.reply().generated()).isFalse();
        assertThat(decision.reply().text()).isEqualTo(ErrorCode.MENU_UNAVAILABLE.getMessage());
    }

    @Test
    void decidingShouldNotMutateTheSnapshot() {
        Session collecting = sessionIn("s1", Stage.COLLECTING_RFID);

        TurnDecision first = controller.decide(collecting, "12345678", statuses::add);
        TurnDecision second = controller.decide(collecting, "12345678", statuses::add);

        assertThat(first.stage()).isEqualTo(second.stage()).isEqualTo(Stage.COLLECTING_BUILDING);
        assertThat(collecting.getStage()).isEqualTo(Stage.COLLECTING_RFID);
        assertThat(collecting.getDraft().getField(RequiredField.RFID).validated()).isFalse();
    }

    @Test
    void menuOverviewShouldGroundGenerationOnFetchedMenu() {
        when(menuGateway.fetchMenu()).thenReturn(List.of(
                new MenuItem("Margherita", new BigDecimal("31.00")),
                new MenuItem("Pepperoni", new BigDecimal("35.00"))));

        TurnDecision decision = controller.decide(newSession("s1"), "What's on the menu?", statuses::add);

        assertThat(decision.stage()).isEqualTo(Stage.BROWSING);
        assertThat(decision.reply().generated()).isTrue();
        assertThat(decision.reply().toolContext())
                .startsWith("[TOOL] Today's menu:")
                .contains("- Margherita: AED 31.00")
                .contains("- Pepperoni: AED 35.00");
        assertThat(statuses).containsExactly(Fragment.status("Fetching menu data..."));
    }

    @Test
    void categoryQuestionShouldListCategoryOrStateItIsMissing() {
        when(menuGateway.lookupCategory("pizza")).thenReturn(CategoryLookupResult.found("pizza",
                List.of(new MenuItem("Margherita", new BigDecimal("31.00")))));
        when(menuGateway.lookupCategory("salad")).thenReturn(CategoryLookupResult.notFound("salad"));

        TurnDecision pizza = controller.decide(newSession("s1"), "what pizzas do you have?", statuses::add);
        TurnDecision salad = controller.decide(newSession("s2"), "do you have salads?", statuses::add);

        assertThat(pizza.reply().toolContext()).contains("Items in category 'pizza'").contains("- Margherita: AED 31.00");
        assertThat(salad.reply().generated()).isFalse();
        assertThat(salad.reply().text()).isEqualTo("Sorry, there is no salad on the menu today.");
    }

    @Test
    void openRestaurantsShouldGroundGenerationOnSchedule() {
        when(restaurantHoursService.findOpenNow()).thenReturn(List.of(
                new RestaurantHours("Marketplace", LocalTime.of(7, 30), LocalTime.of(22, 0))));

        TurnDecision decision = controller.decide(newSession("s1"), "Which restaurants are open?", statuses::add);

        assertThat(decision.reply().toolContext())
                .isEqualTo("[TOOL] Open restaurants right now:\n- Marketplace (Open: 07:30 - 22:00)");
        assertThat(statuses).containsExactly(Fragment.status("Checking which restaurants are open... Please wait."));
    }

    @Test
    void closedCampusShouldSayNothingIsOpen() {
        when(restaurantHoursService.findOpenNow()).thenReturn(List.of());

        TurnDecision decision = controller.decide(newSession("s1"), "what's open now", statuses::add);

        assertThat(decision.reply().toolContext()).isEqualTo("[TOOL] No restaurants are currently open.");
    }

    @Test
    void generalQuestionDuringInquiryShouldCarryDraftContext() {
        TurnDecision decision = controller.decide(sessionIn("s1", Stage.ITEM_INQUIRY), "Tell me a joke", statuses::add);

        assertThat(decision.stage()).isEqualTo(Stage.ITEM_INQUIRY);
        assertThat(decision.reply().generated()).isTrue();
        assertThat(decision.reply().toolContext()).contains("unconfirmed order: 1x Margherita");
    }

    private Session step(Session session, String message, Stage expected) {
        TurnDecision decision = controller.decide(session, message, statuses::add);
        assertThat(decision.stage()).as(decision.reply().text()).isEqualTo(expected);
        sessionStore.apply(session.getSessionId(), stored -> {
            stored.moveTo(decision.stage(), decision.draft());
            return null;
        });
        return sessionStore.snapshot(session.getSessionId());
    }

    private Session newSession(String sessionId) {
        return sessionStore.getOrCreate(sessionId, List.of());
    }

    private Session sessionIn(String sessionId, Stage stage) {
        newSession(sessionId);
        OrderDraft draft = OrderDraft.withItems(List.of(new OrderLine("Margherita", new BigDecimal("31.00"), 1)));
        if (stage.isCollecting()) {
            for (RequiredField field : RequiredField.values()) {
                if (field == stage.getCollectedField()) {
                    break;
                }
                draft.recordValidated(field, COLLECTED.get(field));
            }
        }
        sessionStore.apply(sessionId, session -> {
            session.moveTo(stage, draft);
            return null;
        });
        return sessionStore.snapshot(sessionId);
    }

    private static MenuLookupResult lookup(ItemMention mention) {
        for (String candidate : mention.candidates()) {
            MenuItem item = CATALOG.get(candidate.toLowerCase());
            if (item != null) {
                return MenuLookupResult.found(mention, item);
            }
        }
        return MenuLookupResult.notFound(mention);
    }
}
