package com.example.campuseats.domain.menu.service;

import com.example.campuseats.domain.menu.dto.ItemMention;
import com.example.campuseats.domain.menu.dto.MenuItem;
import lombok.Getter;

@Getter
public class MenuLookupResult {
    private final ItemMention mention;
    private final MenuItem item;

    private MenuLookupResult(ItemMention mention, MenuItem item) {
        this.mention = mention;
        this.item = item;
    }

    public static MenuLookupResult found(ItemMention mention, MenuItem item) {
        return new MenuLookupResult(mention, item);
    }

    public static MenuLookupResult notFound(ItemMention mention) {
        return new MenuLookupResult(mention, null);
    }

    public boolean isFound() {
        return item != null;
    }
}
