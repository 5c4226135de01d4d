package com.example.campuseats.config;

import java.util.List;

import io.github.cdimascio.dotenv.Dotenv;
import io.github.cdimascio.dotenv.DotenvException;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Configuration;

/**
 * Copies the deployment settings from a local {@code .env} file into system properties so that
 * {@code application.yml} placeholders can resolve them.
 */
@Slf4j
@Configuration
public class EnvironmentConfig {

    private static final List<String> KEYS = List.of(
            "GEMINI_API_KEY", "CATALOG_BASE_URL", "ORDER_RECORD_PATH", "PORT");

    @PostConstruct
    public void loadEnvironmentVariables() {
        try {
            Dotenv dotenv = Dotenv.configure()
                    .ignoreIfMissing()
                    .load();

            // real environment variables win over .env entries
            for (String key : KEYS) {
                String value = dotenv.get(key, null);
                if (value != null && System.getenv(key) == null) {
                    System.setProperty(key, value);
                    log.info("Loaded {} from .env", key);
                }
            }
        } catch (DotenvException e) {
            log.warn("Could not read .env file, using system environment only: {}", e.getMessage());
        }
    }
}
