package com.example.campuseats.global.client.gemini;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.function.Consumer;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import com.example.campuseats.global.client.GenerationEngine;
import com.example.campuseats.global.client.GenerationFailedException;
import com.example.campuseats.global.client.GenerationPrompt;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.extern.slf4j.Slf4j;

@Slf4j
@Service
public class GeminiService implements GenerationEngine {

    private static final String SSE_DATA_PREFIX = "data:";

    private final RestTemplate restTemplate;
    private final GeminiProperties geminiProperties;
    private final ObjectMapper objectMapper;

    public GeminiService(@Qualifier("geminiRestTemplate") RestTemplate restTemplate,
                         GeminiProperties geminiProperties,
                         ObjectMapper objectMapper) {
        this.restTemplate = restTemplate;
        this.geminiProperties = geminiProperties;
        this.objectMapper = objectMapper;
    }

    @Override
    public void stream(GenerationPrompt prompt, Consumer<String> fragmentSink) {
        GeminiRequest request = GeminiRequest.from(prompt);
        log.debug("Streaming from Gemini API with {} content entries", request.contents().size());

        try {
            restTemplate.execute(
                geminiProperties.path() + ":streamGenerateContent?alt=sse&key={key}",
                HttpMethod.POST,
                httpRequest -> {
                    httpRequest.getHeaders().setContentType(MediaType.APPLICATION_JSON);
                    httpRequest.getBody().write(objectMapper.writeValueAsBytes(request));
                },
                httpResponse -> {
                    try (BufferedReader reader = new BufferedReader(
                        new InputStreamReader(httpResponse.getBody(), StandardCharsets.UTF_8))) {
                        String line;
                        while ((line = reader.readLine()) != null) {
                            String text = parseEventLine(line);
                            if (!text.isEmpty()) {
                                fragmentSink.accept(text);
                            }
                        }
                    }
                    return null;
                },
                geminiProperties.key()
            );
        } catch (RestClientException e) {
            log.error("Error streaming from Gemini API: {}", e.getMessage());
            throw new GenerationFailedException(e);
        }
    }

    public String generateText(String prompt) {
        try {
            log.debug("Calling Gemini API with prompt: {}", prompt);

            GeminiResponse response = restTemplate.postForObject(
                geminiProperties.path() + ":generateContent?key={key}",
                GeminiRequest.of(prompt),
                GeminiResponse.class,
                geminiProperties.key()
            );

            String result = response == null ? "" : response.getFirstResponseText();
            log.debug("Received response from Gemini API: {}", result);
            return result;
        } catch (RestClientException e) {
            log.error("Error calling Gemini API: {}", e.getMessage());
            throw new GenerationFailedException(e);
        }
    }

    @Override
    public void warmUp() {
        generateText("Hello!");
        log.info("Gemini warm-up request completed");
    }

    String parseEventLine(String line) {
        if (line == null || !line.startsWith(SSE_DATA_PREFIX)) {
            return "";
        }
        String payload = line.substring(SSE_DATA_PREFIX.length()).trim();
        if (payload.isEmpty()) {
            return "";
        }
        try {
            return objectMapper.readValue(payload, GeminiResponse.class).getFirstResponseText();
        } catch (JsonProcessingException e) {
            throw new GenerationFailedException(e);
        }
    }
}
