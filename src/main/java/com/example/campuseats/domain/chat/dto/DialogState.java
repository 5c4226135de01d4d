package com.example.campuseats.domain.chat.dto;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
@AllArgsConstructor
public class DialogState {
    private String sessionId;
    private String stage;               // IDLE, ITEM_INQUIRY, COLLECTING_RFID, ...
    private List<DraftItem> items;      // items of the current draft
    private Map<String, String> fields; // validated field values only
    private String nextAction;
    private BigDecimal total;
    private int historySize;

    @Getter
    @Builder
    @AllArgsConstructor
    public static class DraftItem {
        private String name;
        private int quantity;
        private BigDecimal unitPrice;
        private BigDecimal lineTotal;
    }
}
