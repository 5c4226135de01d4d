package com.example.campuseats.domain.menu.service;

import java.util.Arrays;
import java.util.List;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import com.example.campuseats.domain.menu.dto.ItemMention;
import com.example.campuseats.domain.menu.dto.MenuItem;
import com.example.campuseats.domain.menu.dto.RemoteValidationRequest;
import com.example.campuseats.domain.menu.dto.RemoteValidationResponse;
import com.example.campuseats.domain.order.RequiredField;
import com.example.campuseats.domain.order.validation.ValidationResult;

import lombok.extern.slf4j.Slf4j;

/**
 * The only source of catalog facts. Talks to the external menu service; a 404 is a miss,
 * any other failure is {@link ToolUnavailableException}.
 */
@Slf4j
@Service
public class MenuGateway {

    private final RestTemplate restTemplate;

    public MenuGateway(@Qualifier("catalogRestTemplate") RestTemplate restTemplate) {
        this.restTemplate = restTemplate;
    }

    /**
     * Tries each candidate spelling of the mention in order and returns the first catalog hit.
     */
    public MenuLookupResult lookupItem(ItemMention mention) {
        for (String candidate : mention.candidates()) {
            MenuItem item = fetchItem(candidate);
            if (item != null && item.name() != null && item.price() != null) {
                log.info("Menu lookup hit: '{}' -> {} ({})", mention.phrase(), item.name(), item.price());
                return MenuLookupResult.found(mention, item);
            }
        }
        log.info("Menu lookup miss: '{}' (tried {})", mention.phrase(), mention.candidates());
        return MenuLookupResult.notFound(mention);
    }

    public CategoryLookupResult lookupCategory(String category) {
        try {
            MenuItem[] items = restTemplate.getForObject("/menu/category?category={category}", MenuItem[].class, category);
            return CategoryLookupResult.found(category, items == null ? List.of() : Arrays.asList(items));
        } catch (HttpClientErrorException.NotFound e) {
            log.info("Menu category miss: '{}'", category);
            return CategoryLookupResult.notFound(category);
        } catch (RestClientException e) {
            log.error("Menu category lookup failed for '{}': {}", category, e.getMessage());
            throw new ToolUnavailableException(e);
        }
    }

    public List<MenuItem> fetchMenu() {
        try {
            MenuItem[] items = restTemplate.getForObject("/menu/today", MenuItem[].class);
            return items == null ? List.of() : Arrays.asList(items);
        } catch (RestClientException e) {
            log.error("Full menu fetch failed: {}", e.getMessage());
            throw new ToolUnavailableException(e);
        }
    }

    /**
     * Remote equivalent of the local field predicates, for deployments where the catalog
     * service owns the rules.
     */
    public ValidationResult validateViaTool(RequiredField field, String value) {
        try {
            RemoteValidationResponse response = restTemplate.postForObject(
                "/validate/{field}", new RemoteValidationRequest(value), RemoteValidationResponse.class, field.getToolName());
            if (response == null) {
                throw new ToolUnavailableException(new IllegalStateException("Empty validation response"));
            }
            return response.valid()
                ? ValidationResult.valid(response.value() == null ? value.trim() : response.value())
                : ValidationResult.invalid(response.reason());
        } catch (RestClientException e) {
            log.error("Remote validation of {} failed: {}", field, e.getMessage());
            throw new ToolUnavailableException(e);
        }
    }

    private MenuItem fetchItem(String name) {
        try {
            return restTemplate.getForObject("/menu/item?name={name}", MenuItem.class, name);
        } catch (HttpClientErrorException.NotFound e) {
            return null;
        } catch (RestClientException e) {
            log.error("Menu item lookup failed for '{}': {}", name, e.getMessage());
            throw new ToolUnavailableException(e);
        }
    }
}
