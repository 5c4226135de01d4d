package com.example.campuseats.domain.chat.service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;

import com.example.campuseats.domain.chat.session.ChatTurn;
import com.example.campuseats.global.client.GenerationPrompt;
import com.example.campuseats.global.error.exception.BusinessException;
import com.example.campuseats.global.error.exception.ChatExceptionMessage;

import lombok.extern.slf4j.Slf4j;

/**
 * Builds the retrieval-augmented prompt: system instruction, verified tool output, recent history
 * and the new message.
 */
@Slf4j
@Component
public class PromptFactory {

    static final int MAX_HISTORY_TURNS = 20;

    private final String systemPrompt;

    public PromptFactory(@Value("${chat.system-prompt:classpath:prompts/system-prompt.txt}") Resource systemPromptResource) {
        try {
            this.systemPrompt = systemPromptResource.getContentAsString(StandardCharsets.UTF_8).strip();
        } catch (IOException e) {
            log.error("Failed to load system prompt {}: {}", systemPromptResource, e.getMessage());
            throw new BusinessException(ChatExceptionMessage.PROMPT_NOT_LOADED, e);
        }
    }

    public GenerationPrompt build(String toolContext, List<ChatTurn> history, String message) {
        List<GenerationPrompt.Turn> turns = history.stream()
            .filter(turn -> turn.status() != ChatTurn.Status.FAILED)
            .filter(turn -> turn.text() != null && !turn.text().isBlank())
            .map(turn -> new GenerationPrompt.Turn(turn.fromUser(), turn.text()))
            .toList();
        if (turns.size() > MAX_HISTORY_TURNS) {
            turns = turns.subList(turns.size() - MAX_HISTORY_TURNS, turns.size());
        }
        return new GenerationPrompt(systemPrompt, toolContext, turns, message);
    }

    String getSystemPrompt() {
        return systemPrompt;
    }
}
