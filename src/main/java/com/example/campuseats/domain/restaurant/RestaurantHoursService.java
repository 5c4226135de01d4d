package com.example.campuseats.domain.restaurant;

import java.io.IOException;
import java.io.InputStream;
import java.time.Clock;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.List;

import org.springframework.stereotype.Service;

import com.example.campuseats.domain.menu.service.ToolUnavailableException;
import com.example.campuseats.domain.restaurant.dto.RestaurantHours;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Service
@RequiredArgsConstructor
public class RestaurantHoursService {

    private static final TypeReference<List<RestaurantHours>> SCHEDULE_TYPE = new TypeReference<>() {
    };

    private final RestaurantProperties restaurantProperties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    /**
     * Restaurants open right now. The schedule is re-read on every call so edits apply without a restart.
     */
    public List<RestaurantHours> findOpenNow() {
        LocalTime now = LocalTime.now(clock.withZone(ZoneId.of(restaurantProperties.zone())));
        List<RestaurantHours> open = loadSchedule().stream()
            .filter(restaurant -> restaurant.isOpenAt(now))
            .toList();
        log.info("Open restaurants at {}: {}", now, open.size());
        return open;
    }

    List<RestaurantHours> loadSchedule() {
        try (InputStream in = restaurantProperties.schedule().getInputStream()) {
            return objectMapper.readValue(in, SCHEDULE_TYPE);
        } catch (IOException e) {
            log.error("Failed to load restaurant schedule {}: {}", restaurantProperties.schedule(), e.getMessage());
            throw new ToolUnavailableException(e);
        }
    }
}
