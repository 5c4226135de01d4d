package com.example.campuseats.domain.order;

import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Order validation and persistence settings.
 *
 * @param identifierLength   exact digit count of the campus ID number
 * @param buildings          deliverable building codes
 * @param phoneMinDigits     inclusive lower bound of phone digits after stripping separators
 * @param phoneMaxDigits     inclusive upper bound of phone digits after stripping separators
 * @param currency           currency label used in replies and order records
 * @param recordPath         append-only order record file
 * @param remoteValidation   validate ID, building and phone through the catalog service
 */
@ConfigurationProperties(prefix = "order")
public record OrderProperties(
	@DefaultValue("8") int identifierLength,
	@DefaultValue({"A1A", "A1B", "A1C", "A2A", "A2B", "A2C", "A3", "A4", "A5A", "A5B", "A5C", "A6A", "A6B", "A6C"})
	List<String> buildings,
	@DefaultValue("9") int phoneMinDigits,
	@DefaultValue("15") int phoneMaxDigits,
	@DefaultValue("AED") String currency,
	@DefaultValue("orders.txt") String recordPath,
	@DefaultValue("false") boolean remoteValidation
) {
	public OrderProperties {
		if (identifierLength < 1) {
			throw new IllegalArgumentException("order.identifier-length must be positive");
		}
		if (phoneMinDigits < 1 || phoneMaxDigits < phoneMinDigits) {
			throw new IllegalArgumentException("order.phone-min-digits/phone-max-digits form an empty range");
		}
		buildings = buildings.stream().map(code -> code.trim().toUpperCase()).toList();
	}
}
