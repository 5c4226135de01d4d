package com.example.campuseats.domain.chat.dialogue;

import java.util.Arrays;

import com.example.campuseats.domain.order.RequiredField;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Where a session is in the order workflow. {@code ORDER_COMPLETE} only exists inside the turn
 * that completes an order; the session itself moves straight back to {@code IDLE}.
 */
@Getter
@AllArgsConstructor
public enum Stage {
    IDLE(false, null),
    BROWSING(false, null),
    ITEM_INQUIRY(true, null),
    ORDER_PENDING_CONFIRMATION(true, null),
    COLLECTING_RFID(true, RequiredField.RFID),
    COLLECTING_BUILDING(true, RequiredField.BUILDING),
    COLLECTING_PHONE(true, RequiredField.PHONE),
    COLLECTING_SPECIAL_REQUEST(true, RequiredField.SPECIAL_REQUEST),
    ORDER_COMPLETE(true, null);

    private final boolean draftRequired;
    private final RequiredField collectedField;

    public boolean isCollecting() {
        return collectedField != null;
    }

    public static Stage collecting(RequiredField field) {
        return Arrays.stream(values())
            .filter(stage -> stage.collectedField == field)
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("No collecting stage for " + field));
    }
}
