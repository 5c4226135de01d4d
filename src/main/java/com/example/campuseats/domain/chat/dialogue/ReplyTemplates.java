package com.example.campuseats.domain.chat.dialogue;

import java.util.List;
import java.util.stream.Collectors;

import org.springframework.stereotype.Component;

import com.example.campuseats.domain.menu.dto.MenuItem;
import com.example.campuseats.domain.menu.service.MenuLookupResult;
import com.example.campuseats.domain.order.OrderDraft;
import com.example.campuseats.domain.order.OrderLine;
import com.example.campuseats.domain.order.OrderProperties;
import com.example.campuseats.domain.order.OrderRecord;
import com.example.campuseats.domain.order.RequiredField;
import com.example.campuseats.domain.order.service.OrderRecordStore;

import lombok.RequiredArgsConstructor;

/**
 * Deterministic replies for the order flow and for verified catalog facts.
 */
@Component
@RequiredArgsConstructor
public class ReplyTemplates {

    private final OrderProperties orderProperties;

    public String promptFor(RequiredField field) {
        return switch (field) {
            case RFID -> String.format(
                "Please provide the %d digits of your ID card after the N (e.g., if your ID is N%s, enter %s).",
                orderProperties.identifierLength(), exampleIdentifier(), exampleIdentifier());
            case BUILDING -> "Please select your building from the following options: "
                + String.join(", ", orderProperties.buildings()) + ".";
            case PHONE -> "Please provide your phone number.";
            case SPECIAL_REQUEST -> "Do you have any special requests for your order? "
                + "(e.g., extra toppings, dietary restrictions) If not, just say 'no' or 'none'.";
        };
    }

    public String fieldAccepted(RequiredField field, String value, RequiredField next) {
        return String.format("Got it, your %s is %s. %s", field.getDisplayName(), value, promptFor(next));
    }

    public String reprompt(RequiredField field) {
        return String.format("I still need your %s to place the order. %s", field.getDisplayName(), promptFor(field));
    }

    public String invalid(String reason, RequiredField field) {
        return reason + " " + promptFor(field);
    }

    public String availability(List<MenuLookupResult> found, List<MenuLookupResult> missing) {
        StringBuilder reply = new StringBuilder();
        for (MenuLookupResult result : found) {
            MenuItem item = result.getItem();
            reply.append(String.format("Yes, %s is available for %s. ", item.name(), money(item)));
        }
        appendMissing(reply, missing);
        reply.append(found.size() == 1 ? "Would you like to order it?" : "Would you like to order them?");
        return reply.toString().trim();
    }

    public String orderSummary(OrderDraft draft, List<MenuLookupResult> missing) {
        StringBuilder reply = new StringBuilder();
        appendMissing(reply, missing);
        reply.append("Here is your order:\n");
        reply.append(itemLines(draft.getItems()));
        reply.append(String.format("Total: %s %s\n", orderProperties.currency(), OrderRecordStore.money(draft.total())));
        reply.append("Shall I place this order? Please respond with 'yes' to confirm or 'no' to cancel.");
        return reply.toString();
    }

    public String awaitingConfirmation(OrderDraft draft) {
        return "Your current order:\n" + itemLines(draft.getItems())
            + "Please respond with 'yes' to confirm your order or 'no' to cancel.";
    }

    public String unavailable(List<MenuLookupResult> missing) {
        StringBuilder reply = new StringBuilder();
        appendMissing(reply, missing);
        reply.append("Is there anything else on the menu I can help you with?");
        return reply.toString();
    }

    public String unavailableWithDraft(List<MenuLookupResult> missing, OrderDraft draft) {
        StringBuilder reply = new StringBuilder();
        appendMissing(reply, missing);
        reply.append("Your current order is unchanged:\n").append(itemLines(draft.getItems()));
        reply.append("Reply 'yes' to continue with it or 'cancel' to drop it.");
        return reply.toString();
    }

    public String categoryMissing(String category) {
        return String.format("Sorry, there is no %s on the menu today.", category);
    }

    public String itemFactsDuringCollection(List<MenuLookupResult> found, List<MenuLookupResult> missing, RequiredField pending) {
        StringBuilder reply = new StringBuilder();
        for (MenuLookupResult result : found) {
            reply.append(String.format("%s is available for %s. ", result.getItem().name(), money(result.getItem())));
        }
        appendMissing(reply, missing);
        reply.append("Your current order is unchanged. ").append(promptFor(pending));
        return reply.toString();
    }

    public String orderConfirmed(OrderRecord order) {
        StringBuilder reply = new StringBuilder("✅ Order confirmed!\n");
        reply.append(itemLines(order.items()));
        reply.append(String.format("Total: %s %s\n", orderProperties.currency(), OrderRecordStore.money(order.total())));
        reply.append("ID: N").append(order.field(RequiredField.RFID)).append('\n');
        reply.append("Building: ").append(order.field(RequiredField.BUILDING)).append('\n');
        reply.append("Phone Number: ").append(order.field(RequiredField.PHONE)).append('\n');
        reply.append("Special Request: ").append(order.field(RequiredField.SPECIAL_REQUEST)).append('\n');
        reply.append("Thank you! How else can I help you today?");
        return reply.toString();
    }

    public String orderCancelled() {
        return "Your order has been cancelled. How else can I help you today?";
    }

    public String nothingToCancel() {
        return "There is no order in progress to cancel. How else can I help you today?";
    }

    private void appendMissing(StringBuilder reply, List<MenuLookupResult> missing) {
        for (MenuLookupResult result : missing) {
            reply.append(String.format("Sorry, '%s' is not on the menu. ", result.getMention().phrase()));
        }
        if (!missing.isEmpty()) {
            reply.setLength(reply.length() - 1);
            reply.append('\n');
        }
    }

    private String itemLines(List<OrderLine> lines) {
        return lines.stream()
            .map(line -> String.format("- %dx %s: %s %s each = %s %s\n",
                line.quantity(), line.name(),
                orderProperties.currency(), OrderRecordStore.money(line.unitPrice()),
                orderProperties.currency(), OrderRecordStore.money(line.lineTotal())))
            .collect(Collectors.joining());
    }

    private String money(MenuItem item) {
        return orderProperties.currency() + " " + OrderRecordStore.money(item.price());
    }

    private String exampleIdentifier() {
        StringBuilder digits = new StringBuilder();
        for (int i = 0; i < orderProperties.identifierLength(); i++) {
            digits.append((i + 1) % 10);
        }
        return digits.toString();
    }
}
