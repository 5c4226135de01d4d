package com.example.campuseats.domain.chat.stream;

/**
 * What a client shows while a reply streams in: a status replaces everything, the first content
 * after a status replaces it, later content appends.
 */
public class VisibleText {

    private final StringBuilder text = new StringBuilder();
    private boolean showingStatus;

    public VisibleText apply(Fragment fragment) {
        if (fragment.isStatus() || showingStatus) {
            text.setLength(0);
        }
        text.append(fragment.isStatus() ? fragment.encode().trim() : fragment.payload());
        showingStatus = fragment.isStatus();
        return this;
    }

    public String text() {
        return text.toString();
    }
}
