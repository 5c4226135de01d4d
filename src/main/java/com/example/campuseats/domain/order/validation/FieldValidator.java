package com.example.campuseats.domain.order.validation;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.springframework.stereotype.Component;

import com.example.campuseats.domain.order.OrderProperties;
import com.example.campuseats.domain.order.RequiredField;

import lombok.RequiredArgsConstructor;

/**
 * Side-effect-free checks for the order fields. Limits come from {@link OrderProperties}.
 */
@Component
@RequiredArgsConstructor
public class FieldValidator {

    public static final String NO_SPECIAL_REQUEST = "None";

    private static final Set<String> NEGATIVE_ANSWERS = Set.of(
        "no", "none", "nope", "nah", "n/a", "na", "nothing", "no thanks", "no thank you",
        "no special requests", "no special request", "not really"
    );

    private static final Pattern TOKEN_EDGE_PUNCTUATION = Pattern.compile("^[\\p{Punct}&&[^+]]+|\\p{Punct}+$");
    private static final Pattern BUILDING_LIKE_TOKEN = Pattern.compile("^[A-Z]\\d[A-Z0-9]*$");
    private static final Pattern PHONE_CANDIDATE = Pattern.compile("\\+?\\d[\\d\\s\\-().]*\\d");
    private static final Pattern PHONE_SEPARATORS = Pattern.compile("[\\s\\-().]");
    private static final int MIN_PLAUSIBLE_PHONE_DIGITS = 7;

    private final OrderProperties orderProperties;

    public ValidationResult validate(RequiredField field, String text) {
        return switch (field) {
            case RFID -> validateIdentifier(text);
            case BUILDING -> validateBuilding(text);
            case PHONE -> validatePhone(text);
            case SPECIAL_REQUEST -> ValidationResult.valid(canonicalizeSpecialRequest(text));
        };
    }

    /**
     * Cheap format pre-filter: could {@code message} be an answer for {@code field} at all?
     */
    public boolean isPlausible(RequiredField field, String message) {
        if (message == null) {
            return field == RequiredField.SPECIAL_REQUEST;
        }
        return switch (field) {
            case RFID -> message.chars().anyMatch(Character::isDigit);
            case BUILDING -> tokens(message).stream().anyMatch(token -> BUILDING_LIKE_TOKEN.matcher(token).matches());
            case PHONE -> message.chars().filter(Character::isDigit).count() >= MIN_PLAUSIBLE_PHONE_DIGITS;
            case SPECIAL_REQUEST -> true;
        };
    }

    /**
     * Takes the first token that is a well-formed identifier; otherwise the first token with a digit
     * decides which reason is reported.
     */
    public ValidationResult validateIdentifier(String text) {
        int length = orderProperties.identifierLength();
        List<String> candidates = tokens(text).stream()
            .filter(token -> token.chars().anyMatch(Character::isDigit))
            .map(FieldValidator::stripIdentifierPrefix)
            .toList();

        if (candidates.isEmpty()) {
            return ValidationResult.invalid(String.format(
                "I couldn't find an ID number. Please send the %d digits of your ID, digits only.", length));
        }

        Optional<String> wellFormed = candidates.stream()
            .filter(candidate -> candidate.length() == length && candidate.chars().allMatch(Character::isDigit))
            .findFirst();
        if (wellFormed.isPresent()) {
            return ValidationResult.valid(wellFormed.get());
        }

        String identifier = candidates.get(0);
        if (!identifier.chars().allMatch(Character::isDigit)) {
            return ValidationResult.invalid(String.format(
                "Your ID number may contain digits only. Please send exactly %d digits.", length));
        }
        return ValidationResult.invalid(String.format(
            "Your ID number must be exactly %d digits, but I got %d.", length, identifier.length()));
    }

    public ValidationResult validateBuilding(String text) {
        List<String> buildings = orderProperties.buildings();
        List<String> tokens = tokens(text);

        for (String token : tokens) {
            if (buildings.contains(token)) {
                return ValidationResult.valid(token);
            }
        }

        String options = String.join(", ", buildings);
        return tokens.stream()
            .filter(token -> BUILDING_LIKE_TOKEN.matcher(token).matches())
            .findFirst()
            .map(token -> ValidationResult.invalid(String.format(
                "Building '%s' is not one we deliver to. Please choose one of: %s.", token, options)))
            .orElseGet(() -> ValidationResult.invalid("Please choose one of these buildings: " + options + "."));
    }

    public ValidationResult validatePhone(String text) {
        int min = orderProperties.phoneMinDigits();
        int max = orderProperties.phoneMaxDigits();
        Matcher matcher = PHONE_CANDIDATE.matcher(text == null ? "" : text);

        if (!matcher.find()) {
            return ValidationResult.invalid(String.format(
                "I couldn't find a phone number. Please send %d to %d digits.", min, max));
        }

        String digits = PHONE_SEPARATORS.matcher(matcher.group()).replaceAll("");
        if (digits.startsWith("+")) {
            digits = digits.substring(1);
        } else if (digits.startsWith("00")) {
            digits = digits.substring(2);
        }
        if (!digits.chars().allMatch(Character::isDigit)) {
            return ValidationResult.invalid("A phone number may only contain digits, with an optional leading + or 00.");
        }
        if (digits.length() < min || digits.length() > max) {
            return ValidationResult.invalid(String.format(
                "A phone number must have between %d and %d digits, but I got %d.", min, max, digits.length()));
        }
        return ValidationResult.valid(digits);
    }

    public String canonicalizeSpecialRequest(String text) {
        if (text == null) {
            return NO_SPECIAL_REQUEST;
        }
        String trimmed = text.trim();
        String normalized = trimmed.toLowerCase(Locale.ROOT).replaceAll("[.!,]+$", "").trim();
        if (normalized.isEmpty() || NEGATIVE_ANSWERS.contains(normalized)) {
            return NO_SPECIAL_REQUEST;
        }
        return trimmed;
    }

    private static String stripIdentifierPrefix(String token) {
        String identifier = token.replace("-", "");
        if (identifier.startsWith("N") && identifier.length() > 1) {
            return identifier.substring(1);
        }
        return identifier;
    }

    private static List<String> tokens(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        return Arrays.stream(text.trim().split("\\s+"))
            .map(token -> TOKEN_EDGE_PUNCTUATION.matcher(token).replaceAll(""))
            .filter(token -> !token.isEmpty())
            .map(token -> token.toUpperCase(Locale.ROOT))
            .toList();
    }
}
