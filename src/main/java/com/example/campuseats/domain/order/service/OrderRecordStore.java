package com.example.campuseats.domain.order.service;

import java.io.IOException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

import org.springframework.stereotype.Service;

import com.example.campuseats.domain.order.OrderLine;
import com.example.campuseats.domain.order.OrderProperties;
import com.example.campuseats.domain.order.OrderRecord;
import com.example.campuseats.domain.order.RequiredField;

import lombok.extern.slf4j.Slf4j;

/**
 * Append-only, human-readable order log. Each order is one block between a header line
 * starting with {@link #HEADER_PREFIX} and a {@link #FOOTER} line.
 */
@Slf4j
@Service
public class OrderRecordStore {

    static final String HEADER_PREFIX = "=== ORDER - ";
    static final String FOOTER = "=".repeat(50);

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final Path recordPath;
    private final String currency;

    public OrderRecordStore(OrderProperties orderProperties) {
        this.recordPath = Path.of(orderProperties.recordPath()).toAbsolutePath();
        this.currency = orderProperties.currency();
    }

    public synchronized void append(OrderRecord order) {
        try {
            Path parent = recordPath.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(recordPath, format(order), StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND);
            log.info("Order saved [{}]: {} line(s), total {} {}",
                order.sessionId(), order.items().size(), currency, money(order.total()));
        } catch (IOException e) {
            log.error("Failed to save order [{}]: {}", order.sessionId(), e.getMessage(), e);
            throw new OrderPersistException(e);
        }
    }

    /**
     * Reads every complete block back, header and footer included.
     */
    public synchronized List<String> readBlocks() {
        if (!Files.exists(recordPath)) {
            return List.of();
        }
        try {
            List<String> blocks = new ArrayList<>();
            StringBuilder current = null;
            for (String line : Files.readAllLines(recordPath, StandardCharsets.UTF_8)) {
                if (line.startsWith(HEADER_PREFIX)) {
                    current = new StringBuilder();
                }
                if (current != null) {
                    current.append(line).append('\n');
                    if (line.equals(FOOTER)) {
                        blocks.add(current.toString());
                        current = null;
                    }
                }
            }
            return blocks;
        } catch (IOException e) {
            throw new OrderPersistException(e);
        }
    }

    String format(OrderRecord order) {
        StringBuilder block = new StringBuilder("\n");
        block.append(HEADER_PREFIX).append(TIMESTAMP.format(order.placedAt())).append(" ===\n");
        block.append("ITEMS:\n");
        for (OrderLine line : order.items()) {
            block.append(String.format("- %dx %s: %s %s each = %s %s\n",
                line.quantity(), line.name(),
                currency, money(line.unitPrice()),
                currency, money(line.lineTotal())));
        }
        block.append(String.format("TOTAL COST: %s %s\n", currency, money(order.total())));
        block.append("ID: ").append(order.field(RequiredField.RFID)).append('\n');
        block.append("Building: ").append(order.field(RequiredField.BUILDING)).append('\n');
        block.append("Phone: ").append(order.field(RequiredField.PHONE)).append('\n');
        block.append("Special Request: ").append(order.field(RequiredField.SPECIAL_REQUEST)).append('\n');
        block.append(FOOTER).append('\n');
        return block.toString();
    }

    public static String money(BigDecimal amount) {
        return amount.setScale(2, RoundingMode.HALF_UP).toPlainString();
    }
}
