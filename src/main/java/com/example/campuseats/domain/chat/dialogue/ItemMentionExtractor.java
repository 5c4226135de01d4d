package com.example.campuseats.domain.chat.dialogue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.springframework.stereotype.Component;

import com.example.campuseats.domain.menu.dto.ItemMention;

/**
 * Pulls the menu items a message refers to out of common question and order phrasings.
 * Each noun phrase becomes one {@link ItemMention} with the catalog spellings worth trying.
 */
@Component
public class ItemMentionExtractor {

    public enum Kind {
        QUESTION, ORDER
    }

    /**
     * @param refersBack true when no item was named and every phrase was a back reference such as
     *                   "it" or "that one", i.e. the user means the item already under discussion
     */
    public record Extraction(Kind kind, List<ItemMention> mentions, boolean refersBack) {
    }

    private static final List<Pattern> QUESTION_PATTERNS = compile(
        "\\bis (?:there )?(?:any )?(?<item>.+?) (?:still )?available\\b",
        "\\bdo you (?:have|sell|serve) (?<item>.+)",
        "\\bprice (?:of|for) (?<item>.+)",
        "\\bhow much (?:is|are|does|do|for) (?<item>.+?)(?: cost)?$"
    );

    private static final List<Pattern> ORDER_PATTERNS = compile(
        "\\b(?:can|could|may) i (?:please )?(?:get|have|order) (?<item>.+)",
        "\\bi'?ll (?:have|take|get|order) (?<item>.+)",
        "\\bi'?d like (?:to order |to get |to have )?(?<item>.+)",
        "\\bi (?:want|wanna|need) (?:to order |to get |to have )?(?<item>.+)",
        "\\bgive me (?<item>.+)",
        "\\border (?<item>.+)",
        "\\bbuy (?<item>.+)",
        "\\bget (?<item>.+)"
    );

    private static final Pattern CONJUNCTIONS = Pattern.compile("\\s*(?:,|&|\\band\\b|\\bplus\\b)\\s*", Pattern.CASE_INSENSITIVE);
    private static final Pattern LEADING_QUANTITY = Pattern.compile(
        "^(?<qty>\\d+|a couple of|a|an|one|two|three|four|five|six|seven|eight|nine|ten)\\s*(?:x\\s+|\\s+)(?<rest>.+)$",
        Pattern.CASE_INSENSITIVE);
    private static final Pattern LEADING_FILLER = Pattern.compile("^(?:the|some|any|more|another|of)\\s+", Pattern.CASE_INSENSITIVE);
    private static final Pattern TRAILING_FILLER = Pattern.compile(
        "\\s+(?:please|pls|for me|today|now|right now|tonight|thanks|thank you|on the menu|from the menu|too|as well)$",
        Pattern.CASE_INSENSITIVE);
    private static final Pattern PIECE_COUNT = Pattern.compile("\\s*\\(?\\d+\\s*pcs\\)?$", Pattern.CASE_INSENSITIVE);

    private static final Map<String, Integer> NUMBER_WORDS = Map.ofEntries(
        Map.entry("a", 1), Map.entry("an", 1), Map.entry("one", 1), Map.entry("a couple of", 2),
        Map.entry("two", 2), Map.entry("three", 3), Map.entry("four", 4), Map.entry("five", 5),
        Map.entry("six", 6), Map.entry("seven", 7), Map.entry("eight", 8), Map.entry("nine", 9),
        Map.entry("ten", 10)
    );

    // plural -> singular, singulars map to themselves
    private static final Map<String, String> CATEGORY_WORDS = Map.ofEntries(
        Map.entry("pizza", "pizza"), Map.entry("pizzas", "pizza"),
        Map.entry("wings", "wings"), Map.entry("wing", "wings"),
        Map.entry("bowl", "bowl"), Map.entry("bowls", "bowl"),
        Map.entry("sandwich", "sandwich"), Map.entry("sandwiches", "sandwich"),
        Map.entry("wrap", "wrap"), Map.entry("wraps", "wrap"),
        Map.entry("salad", "salad"), Map.entry("salads", "salad"),
        Map.entry("burger", "burger"), Map.entry("burgers", "burger"),
        Map.entry("fries", "fries"),
        Map.entry("drink", "drink"), Map.entry("drinks", "drink"),
        Map.entry("coffee", "coffee"), Map.entry("coffees", "coffee"),
        Map.entry("tea", "tea"), Map.entry("teas", "tea"),
        Map.entry("juice", "juice"), Map.entry("juices", "juice"),
        Map.entry("pasta", "pasta"), Map.entry("pastas", "pasta"),
        Map.entry("soup", "soup"), Map.entry("soups", "soup"),
        Map.entry("dessert", "dessert"), Map.entry("desserts", "dessert")
    );

    private static final Set<String> NOT_AN_ITEM = Set.of(
        "it", "that", "this", "one", "them", "those", "these", "something", "anything", "food",
        "that one", "this one", "the same", "menu", "help", "started", "more", "order", "a look"
    );

    private static final Set<String> BACK_REFERENCES = Set.of(
        "it", "that", "this", "them", "those", "these", "that one", "this one", "same", "the same"
    );

    private static final Set<String> NON_ITEM_LEAD_WORDS = Set.of("to", "in", "on", "at", "with", "from", "my", "your", "you", "me", "us");

    public Optional<Extraction> extract(String message) {
        if (message == null || message.isBlank()) {
            return Optional.empty();
        }
        String text = message.trim().replaceAll("[?!.]+$", "").trim();

        Optional<String> phrase = firstMatch(QUESTION_PATTERNS, text);
        Kind kind = Kind.QUESTION;
        if (phrase.isEmpty()) {
            phrase = firstMatch(ORDER_PATTERNS, text);
            kind = Kind.ORDER;
        }
        if (phrase.isEmpty()) {
            return Optional.empty();
        }
        List<ItemMention> mentions = split(phrase.get());
        return Optional.of(new Extraction(kind, mentions, mentions.isEmpty() && refersBack(phrase.get())));
    }

    /**
     * The singular category a word names, e.g. {@code pizzas -> pizza}.
     */
    public Optional<String> categoryOf(String word) {
        if (word == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(CATEGORY_WORDS.get(word.trim().toLowerCase(Locale.ROOT)));
    }

    List<ItemMention> split(String phrase) {
        List<Part> parts = new ArrayList<>();
        for (String raw : CONJUNCTIONS.split(phrase)) {
            Part part = clean(raw);
            if (part != null) {
                parts.add(part);
            }
        }

        String siblingCategory = parts.stream()
            .map(part -> trailingCategory(part.phrase()))
            .flatMap(Optional::stream)
            .findFirst()
            .orElse(null);

        List<ItemMention> mentions = new ArrayList<>();
        for (Part part : parts) {
            mentions.add(new ItemMention(part.phrase(), part.quantity(), candidates(part.phrase(), siblingCategory)));
        }
        return mentions;
    }

    private boolean refersBack(String phrase) {
        boolean any = false;
        for (String raw : CONJUNCTIONS.split(phrase)) {
            Part part = strip(raw);
            if (part.phrase().isEmpty()) {
                continue;
            }
            if (!BACK_REFERENCES.contains(part.phrase().toLowerCase(Locale.ROOT))) {
                return false;
            }
            any = true;
        }
        return any;
    }

    private Part clean(String raw) {
        Part part = strip(raw);
        String lower = part.phrase().toLowerCase(Locale.ROOT);
        if (lower.isEmpty() || NOT_AN_ITEM.contains(lower) || NON_ITEM_LEAD_WORDS.contains(lower.split(" ")[0])) {
            return null;
        }
        return part;
    }

    // quantity and filler words removed, nothing rejected yet
    private Part strip(String raw) {
        String phrase = raw.trim().replaceAll("^[\"'`]+|[\"'`]+$", "").replaceAll("\\s+", " ");
        int quantity = 1;

        Matcher qty = LEADING_QUANTITY.matcher(phrase);
        if (qty.matches()) {
            quantity = parseQuantity(qty.group("qty"));
            phrase = qty.group("rest");
        }
        String previous;
        do {
            previous = phrase;
            phrase = LEADING_FILLER.matcher(phrase).replaceFirst("");
            phrase = TRAILING_FILLER.matcher(phrase).replaceFirst("");
        } while (!phrase.equals(previous));
        return new Part(phrase.trim(), quantity);
    }

    private List<String> candidates(String phrase, String siblingCategory) {
        Set<String> seen = new LinkedHashSet<>();
        List<String> candidates = new ArrayList<>();
        addCandidate(candidates, seen, phrase);

        String withoutPieces = PIECE_COUNT.matcher(phrase).replaceFirst("").trim();
        addCandidate(candidates, seen, withoutPieces);

        String[] words = withoutPieces.split(" ");
        String last = words[words.length - 1];
        Optional<String> category = categoryOf(last);
        if (category.isPresent()) {
            String head = String.join(" ", Arrays.copyOf(words, words.length - 1)).trim();
            if (!head.isEmpty()) {
                addCandidate(candidates, seen, head + " " + category.get());
                addCandidate(candidates, seen, head);
            }
        } else if (siblingCategory != null) {
            addCandidate(candidates, seen, withoutPieces + " " + siblingCategory);
        }
        return candidates;
    }

    private Optional<String> trailingCategory(String phrase) {
        String[] words = PIECE_COUNT.matcher(phrase).replaceFirst("").trim().split(" ");
        return words.length > 1 ? categoryOf(words[words.length - 1]) : Optional.empty();
    }

    private static void addCandidate(List<String> candidates, Set<String> seen, String candidate) {
        if (!candidate.isBlank() && seen.add(candidate.toLowerCase(Locale.ROOT))) {
            candidates.add(candidate);
        }
    }

    private static int parseQuantity(String token) {
        String lower = token.toLowerCase(Locale.ROOT);
        if (NUMBER_WORDS.containsKey(lower)) {
            return NUMBER_WORDS.get(lower);
        }
        try {
            return Math.max(1, Integer.parseInt(lower));
        } catch (NumberFormatException e) {
            return 1;
        }
    }

    private static Optional<String> firstMatch(List<Pattern> patterns, String text) {
        for (Pattern pattern : patterns) {
            Matcher matcher = pattern.matcher(text);
            if (matcher.find()) {
                return Optional.of(matcher.group("item").trim());
            }
        }
        return Optional.empty();
    }

    private static List<Pattern> compile(String... regexes) {
        List<Pattern> patterns = new ArrayList<>();
        for (String regex : regexes) {
            patterns.add(Pattern.compile(regex, Pattern.CASE_INSENSITIVE));
        }
        return List.copyOf(patterns);
    }

    private record Part(String phrase, int quantity) {
    }
}
