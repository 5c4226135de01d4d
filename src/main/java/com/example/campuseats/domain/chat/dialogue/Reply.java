package com.example.campuseats.domain.chat.dialogue;

/**
 * What to stream for a turn: either fixed text, or a model answer grounded on {@code toolContext}.
 */
public record Reply(
	boolean generated,
	String text,
	String toolContext
) {
	public static Reply direct(String text) {
		return new Reply(false, text, null);
	}

	public static Reply generate(String toolContext) {
		return new Reply(true, null, toolContext);
	}
}
