package com.example.campuseats.domain.chat.service;

import java.io.IOException;
import java.io.OutputStream;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicBoolean;

import org.springframework.web.context.request.NativeWebRequest;
import org.springframework.web.context.request.async.CallableProcessingInterceptor;
import org.springframework.web.servlet.mvc.method.annotation.StreamingResponseBody;

import com.example.campuseats.domain.chat.session.TurnLease;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Streamed reply of one turn, holding the session's turn lease. A body that runs releases the lease
 * when it ends. If the async request completes first, e.g. because the stream executor rejected the
 * task, the lease is released there and the body will not run anymore. Register it on the request's
 * {@code WebAsyncManager} for the latter.
 */
@Slf4j
@RequiredArgsConstructor
public class TurnResponseBody implements StreamingResponseBody, CallableProcessingInterceptor {

    private final String sessionId;
    private final TurnLease lease;
    private final StreamingResponseBody body;
    private final AtomicBoolean started = new AtomicBoolean();

    @Override
    public void writeTo(OutputStream out) throws IOException {
        if (!started.compareAndSet(false, true)) {
            log.info("Turn abandoned before it started [{}]", sessionId);
            return;
        }
        try (lease) {
            body.writeTo(out);
        }
    }

    @Override
    public <T> void afterCompletion(NativeWebRequest request, Callable<T> task) {
        if (started.compareAndSet(false, true)) {
            log.warn("Turn never ran, releasing session [{}]", sessionId);
            lease.close();
        }
    }
}
