package com.example.campuseats.domain.chat.controller;

import java.nio.charset.StandardCharsets;

import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.context.request.async.WebAsyncUtils;
import org.springframework.web.servlet.mvc.method.annotation.StreamingResponseBody;

import com.example.campuseats.domain.chat.dto.ChatRequest;
import com.example.campuseats.domain.chat.dto.DialogState;
import com.example.campuseats.domain.chat.service.ChatTurnService;
import com.example.campuseats.domain.chat.service.TurnResponseBody;
import com.example.campuseats.global.error.exception.BusinessException;
import com.example.campuseats.global.response.ApiResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Tag(name = "Chat", description = "Streaming chat and order assistant")
@RestController
@RequiredArgsConstructor
@Slf4j
public class ChatController {

    private final ChatTurnService chatTurnService;

    @Operation(summary = "Send a message", description = "Streams the reply as text/plain. Status lines are bracketed.")
    @PostMapping("/chat")
    public ResponseEntity<StreamingResponseBody> chat(@Valid @RequestBody ChatRequest request, HttpServletRequest servletRequest) {
        TurnResponseBody body = chatTurnService.openTurn(request);
        WebAsyncUtils.getAsyncManager(servletRequest).registerCallableInterceptor(TurnResponseBody.class.getName(), body);
        return ResponseEntity.ok()
            .contentType(new MediaType(MediaType.TEXT_PLAIN, StandardCharsets.UTF_8))
            .header("X-Accel-Buffering", "no")
            .body(body);
    }

    @Operation(summary = "Warm up the language model")
    @GetMapping("/warmup")
    public ResponseEntity<ApiResponse<Void>> warmup() {
        try {
            chatTurnService.warmUp();
            return ResponseEntity.ok(ApiResponse.success("warmed up", null));
        } catch (BusinessException e) {
            log.warn("Warm-up failed: {}", e.getMessage());
            return ResponseEntity.ok(ApiResponse.failure("Warm-up failed: " + e.getMessage(), null));
        }
    }

    @Operation(summary = "Inspect a session's order flow")
    @GetMapping("/chat/sessions/{sessionId}")
    public ResponseEntity<ApiResponse<DialogState>> session(@PathVariable String sessionId) {
        return ResponseEntity.ok(ApiResponse.success(chatTurnService.describe(sessionId)));
    }
}
