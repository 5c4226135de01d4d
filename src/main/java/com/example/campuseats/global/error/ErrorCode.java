package com.example.campuseats.global.error;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * User-facing fallback texts that are streamed inside the chat instead of an HTTP error.
 */
@Getter
@AllArgsConstructor
public enum ErrorCode {
    // generation engine
    GENERATION_FAILED("GEN_001", "Sorry, something went wrong while I was answering. Please try again."),

    // catalog / validation tools
    MENU_UNAVAILABLE("TOOL_001", "Sorry, I can't check the menu right now, so I can't confirm that. Please try again in a moment."),
    VALIDATION_UNAVAILABLE("TOOL_002", "Sorry, I can't verify that detail right now. Please send it again in a moment."),
    RESTAURANTS_UNAVAILABLE("TOOL_003", "Sorry, I can't check restaurant opening hours right now."),

    // order persistence
    ORDER_SAVE_FAILED("ORDER_001", "Sorry, I couldn't save your order. Your details are kept, so please send your last answer again.");

    private final String code;
    private final String message;
}
