package com.example.campuseats.domain.chat.dialogue;

public enum Intent {
    CANCEL,
    MENU_OVERVIEW,
    OPEN_RESTAURANTS,
    ITEM_QUESTION,
    ORDER_ITEM,
    CATEGORY,
    AFFIRM,
    DENY,
    GENERAL
}
