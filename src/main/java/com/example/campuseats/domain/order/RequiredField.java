package com.example.campuseats.domain.order;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Fields every order needs, declared in the order they are collected.
 */
@Getter
@AllArgsConstructor
public enum RequiredField {
    RFID("ID number", "rfid", true),
    BUILDING("building", "building", true),
    PHONE("phone number", "phone", true),
    SPECIAL_REQUEST("special request", "special-request", false);

    private final String displayName;
    private final String toolName;
    private final boolean remotelyValidatable;
}
