package com.example.campuseats.domain.order;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import com.example.campuseats.domain.menu.dto.MenuItem;
import com.example.campuseats.domain.order.validation.FieldValidator;

/**
 * The uncommitted order of one session. Items are keyed by name; every required field is
 * present from the start and flips to validated once an accepted value is recorded.
 */
public class OrderDraft {

    private final Map<String, OrderLine> items = new LinkedHashMap<>();
    private final EnumMap<RequiredField, FieldValue> fields = new EnumMap<>(RequiredField.class);

    public OrderDraft() {
        for (RequiredField field : RequiredField.values()) {
            fields.put(field, new FieldValue(null, false));
        }
        fields.put(RequiredField.SPECIAL_REQUEST, new FieldValue(FieldValidator.NO_SPECIAL_REQUEST, false));
    }

    public static OrderDraft withItems(List<OrderLine> lines) {
        OrderDraft draft = new OrderDraft();
        lines.forEach(line -> draft.addItem(line.name(), line.unitPrice(), line.quantity()));
        return draft;
    }

    public void addItem(MenuItem item, int quantity) {
        addItem(item.name(), item.price(), quantity);
    }

    private void addItem(String name, BigDecimal unitPrice, int quantity) {
        items.merge(key(name), new OrderLine(name, unitPrice, quantity),
            (existing, added) -> existing.plus(added.quantity()));
    }

    public void recordValidated(RequiredField field, String value) {
        if (items.isEmpty()) {
            throw new IllegalStateException("Fields cannot be collected before an item is added");
        }
        fields.put(field, new FieldValue(value, true));
    }

    public Optional<RequiredField> firstIncompleteField() {
        for (RequiredField field : RequiredField.values()) {
            if (!fields.get(field).validated()) {
                return Optional.of(field);
            }
        }
        return Optional.empty();
    }

    public boolean isComplete() {
        return !items.isEmpty() && firstIncompleteField().isEmpty();
    }

    public boolean hasItems() {
        return !items.isEmpty();
    }

    public List<OrderLine> getItems() {
        return Collections.unmodifiableList(new ArrayList<>(items.values()));
    }

    public Map<RequiredField, FieldValue> getFields() {
        return Collections.unmodifiableMap(fields);
    }

    public FieldValue getField(RequiredField field) {
        return fields.get(field);
    }

    public BigDecimal total() {
        return items.values().stream()
            .map(OrderLine::lineTotal)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public OrderDraft copy() {
        OrderDraft copy = new OrderDraft();
        copy.items.putAll(items);
        copy.fields.putAll(fields);
        return copy;
    }

    private static String key(String name) {
        return name.trim().toLowerCase(Locale.ROOT);
    }
}
