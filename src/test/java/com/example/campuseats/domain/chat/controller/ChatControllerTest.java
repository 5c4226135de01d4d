package com.example.campuseats.domain.chat.controller;

import com.example.campuseats.domain.chat.session.SessionStore;
import com.example.campuseats.domain.chat.session.TurnLease;
import com.example.campuseats.domain.menu.dto.ItemMention;
import com.example.campuseats.domain.menu.dto.MenuItem;
import com.example.campuseats.domain.menu.service.MenuGateway;
import com.example.campuseats.domain.menu.service.MenuLookupResult;
import com.example.campuseats.global.client.GenerationEngine;
import com.example.campuseats.global.client.GenerationFailedException;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.io.IOException;
import java.math.BigDecimal;
import java.util.function.Consumer;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.asyncDispatch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.request;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(properties = "order.record-path=${java.io.tmpdir}/campuseats-controller-test-orders.txt")
@AutoConfigureMockMvc
class ChatControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private SessionStore sessionStore;

    @MockBean
    private GenerationEngine generationEngine;

    @MockBean
    private MenuGateway menuGateway;

    @Test
    void chatShouldStreamStatusThenVerifiedAnswer() throws Exception {
        when(menuGateway.lookupItem(any())).thenAnswer(invocation -> MenuLookupResult.found(
                invocation.<ItemMention>getArgument(0), new MenuItem("Margherita", new BigDecimal("31.00"))));

        MvcResult pending = mockMvc.perform(post("/chat")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"message\": \"Is Margherita available?\", \"history\": [], \"session_id\": \"web-1\"}"))
                .andExpect(request().asyncStarted())
                .andExpect(header().string("X-Accel-Buffering", "no"))
                .andReturn();
        pending.getAsyncResult(5_000);

        mockMvc.perform(asyncDispatch(pending))
                .andExpect(status().isOk())
                .andExpect(content().string("[Looking up 'Margherita' in the menu...]\n"
                        + "Yes, Margherita is available for AED 31.00. Would you like to order it?"));

        mockMvc.perform(get("/chat/sessions/web-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.stage").value("ITEM_INQUIRY"))
                .andExpect(jsonPath("$.data.items[0].name").value("Margherita"))
                .andExpect(jsonPath("$.data.historySize").value(2))
                .andExpect(jsonPath("$.data.nextAction").value("Ask whether to order the item"));
    }

    @Test
    void generalQuestionShouldStreamModelOutput() throws Exception {
        doAnswer(invocation -> {
            Consumer<String> sink = invocation.getArgument(1);
            sink.accept("Hi! ");
            sink.accept("Ask me about today's menu.");
            return null;
        }).when(generationEngine).stream(any(), any());

        MvcResult pending = mockMvc.perform(post("/chat")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"message\": \"Tell me a joke\", \"session_id\": \"web-2\"}"))
                .andExpect(request().asyncStarted())
                .andReturn();
        pending.getAsyncResult(5_000);

        mockMvc.perform(asyncDispatch(pending))
                .andExpect(status().isOk())
                .andExpect(content().string("Hi! Ask me about today's menu."));
    }

    @Test
    void blankMessageShouldBeRejected() throws Exception {
        mockMvc.perform(post("/chat")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"message\": \"  \", \"session_id\": \"web-3\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.code").value("ARGUMENT_NOT_VALID_MESSAGE"));
    }

    @Test
    void concurrentTurnForSameSessionShouldConflict() throws Exception {
        try (TurnLease ignored = sessionStore.beginTurn("web-4")) {
            mockMvc.perform(post("/chat")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"message\": \"hello\", \"session_id\": \"web-4\"}"))
                    .andExpect(status().isConflict())
                    .andExpect(jsonPath("$.code").value("SESSION_BUSY"));
        }
    }

    @Test
    void unknownSessionShouldBeNotFound() throws Exception {
        mockMvc.perform(get("/chat/sessions/never-seen"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("SESSION_NOT_FOUND"));
    }

    @Test
    void warmupShouldReportSuccess() throws Exception {
        mockMvc.perform(get("/warmup"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.message").value("warmed up"));
    }

    @Test
    void warmupFailureShouldBeReportedNotThrown() throws Exception {
        doThrow(new GenerationFailedException(new IOException("connection refused"))).when(generationEngine).warmUp();

        mockMvc.perform(get("/warmup"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(false));
    }
}
