package com.example.campuseats.domain.chat.dialogue;

import java.util.List;

import com.example.campuseats.domain.menu.dto.ItemMention;

/**
 * @param mentions   items named by an item question or order, possibly empty
 * @param category   the category asked about, only for {@link Intent#CATEGORY}
 * @param refersBack an order with no mentions that points at the item under discussion ("I'll take it")
 */
public record ClassifiedMessage(
	Intent intent,
	List<ItemMention> mentions,
	String category,
	boolean refersBack
) {
	public ClassifiedMessage {
		mentions = mentions == null ? List.of() : List.copyOf(mentions);
	}

	public static ClassifiedMessage of(Intent intent) {
		return new ClassifiedMessage(intent, List.of(), null, false);
	}

	public static ClassifiedMessage ofCategory(String category) {
		return new ClassifiedMessage(Intent.CATEGORY, List.of(), category, false);
	}

	public boolean namesItems() {
		return (intent == Intent.ITEM_QUESTION || intent == Intent.ORDER_ITEM) && !mentions.isEmpty();
	}
}
