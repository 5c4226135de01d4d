package com.example.campuseats.domain.chat.stream;

public enum FragmentKind {
    STATUS,
    CONTENT
}
