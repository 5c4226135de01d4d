package com.example.campuseats.domain.chat.stream;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;

import lombok.extern.slf4j.Slf4j;

/**
 * Writes fragments to the response body, flushing each one. Remembers the content that actually
 * reached the client, which is what a stopped turn keeps in history.
 */
@Slf4j
public class FragmentWriter implements FragmentSink {

    private final String sessionId;
    private final OutputStream out;
    private final StringBuilder deliveredContent = new StringBuilder();
    private boolean contentStarted;
    private boolean cancelled;

    public FragmentWriter(String sessionId, OutputStream out) {
        this.sessionId = sessionId;
        this.out = out;
    }

    @Override
    public void emit(Fragment fragment) {
        if (cancelled) {
            throw new TurnCancelledException(null);
        }
        if (fragment.isStatus() && contentStarted) {
            log.debug("Status after content dropped [{}]: {}", sessionId, fragment.payload());
            return;
        }
        if (fragment.payload() == null || fragment.payload().isEmpty()) {
            return;
        }
        try {
            out.write(fragment.encode().getBytes(StandardCharsets.UTF_8));
            out.flush();
        } catch (IOException e) {
            cancelled = true;
            log.info("Client disconnected [{}] after {} chars", sessionId, deliveredContent.length());
            throw new TurnCancelledException(e);
        }
        if (!fragment.isStatus()) {
            contentStarted = true;
            deliveredContent.append(fragment.payload());
        }
    }

    public String getDeliveredContent() {
        return deliveredContent.toString();
    }
}
