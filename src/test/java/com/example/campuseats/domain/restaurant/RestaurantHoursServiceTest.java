package com.example.campuseats.domain.restaurant;

import com.example.campuseats.domain.menu.service.ToolUnavailableException;
import com.example.campuseats.domain.restaurant.dto.RestaurantHours;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.core.io.ClassPathResource;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RestaurantHoursServiceTest {

    private static final String SCHEDULE = """
            [
              {"name": "Marketplace", "open": "07:30", "close": "22:00"},
              {"name": "Campus Coffee", "open": "07:00", "close": "11:00"},
              {"name": "Late Night Grill", "open": "20:00", "close": "03:00"}
            ]
            """;

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();

    @Test
    void shouldListRestaurantsOpenAtLocalTime() {
        // 08:00 UTC is 12:00 in Dubai
        RestaurantHoursService service = service(SCHEDULE, "2024-05-01T08:00:00Z");

        assertThat(service.findOpenNow()).extracting(RestaurantHours::name).containsExactly("Marketplace");
    }

    @Test
    void closingAfterMidnightShouldStillCountAsOpen() {
        // 21:00 UTC is 01:00 in Dubai
        RestaurantHoursService service = service(SCHEDULE, "2024-05-01T21:00:00Z");

        assertThat(service.findOpenNow()).extracting(RestaurantHours::describe)
                .containsExactly("Late Night Grill (Open: 20:00 - 03:00)");
    }

    @Test
    void missingScheduleShouldMeanToolUnavailable() {
        RestaurantHoursService service = new RestaurantHoursService(
                new RestaurantProperties(new ClassPathResource("does-not-exist.json"), "Asia/Dubai"),
                objectMapper,
                Clock.systemUTC());

        assertThatThrownBy(service::findOpenNow).isInstanceOf(ToolUnavailableException.class);
    }

    private RestaurantHoursService service(String schedule, String instant) {
        return new RestaurantHoursService(
                new RestaurantProperties(new ByteArrayResource(schedule.getBytes(StandardCharsets.UTF_8)), "Asia/Dubai"),
                objectMapper,
                Clock.fixed(Instant.parse(instant), ZoneOffset.UTC));
    }
}
