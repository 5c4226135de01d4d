package com.example.campuseats.domain.menu.service;

import java.util.List;

import com.example.campuseats.domain.menu.dto.MenuItem;

public record CategoryLookupResult(
    String category,
    boolean found,
    List<MenuItem> items
) {
    public static CategoryLookupResult found(String category, List<MenuItem> items) {
        return new CategoryLookupResult(category, true, List.copyOf(items));
    }

    public static CategoryLookupResult notFound(String category) {
        return new CategoryLookupResult(category, false, List.of());
    }
}
