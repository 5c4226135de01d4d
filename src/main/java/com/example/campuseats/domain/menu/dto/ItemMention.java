package com.example.campuseats.domain.menu.dto;

import java.util.List;

/**
 * One noun phrase a user used to refer to a menu item.
 *
 * @param phrase     the phrase as the user wrote it, used when reporting a miss
 * @param quantity   requested quantity, at least 1
 * @param candidates catalog spellings to try, in order
 */
public record ItemMention(
	String phrase,
	int quantity,
	List<String> candidates
) {
	public ItemMention {
		if (quantity < 1) {
			quantity = 1;
		}
		candidates = candidates == null || candidates.isEmpty() ? List.of(phrase) : List.copyOf(candidates);
	}

	public static ItemMention of(String phrase) {
		return new ItemMention(phrase, 1, List.of(phrase));
	}
}
