package com.example.campuseats.domain.order;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * A completed order, frozen at the moment every field was validated.
 */
public record OrderRecord(
	String sessionId,
	LocalDateTime placedAt,
	List<OrderLine> items,
	BigDecimal total,
	Map<RequiredField, String> fields
) {
	public static OrderRecord from(String sessionId, OrderDraft draft, LocalDateTime placedAt) {
		if (!draft.isComplete()) {
			throw new IllegalStateException("Only a complete draft can become an order record");
		}
		Map<RequiredField, String> values = new EnumMap<>(RequiredField.class);
		draft.getFields().forEach((field, value) -> values.put(field, value.value()));
		return new OrderRecord(sessionId, placedAt, draft.getItems(), draft.total(), Map.copyOf(values));
	}

	public String field(RequiredField field) {
		return fields.get(field);
	}
}
