package com.example.campuseats.domain.chat.dialogue;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.springframework.stereotype.Component;

import com.example.campuseats.domain.chat.dialogue.ItemMentionExtractor.Extraction;
import com.example.campuseats.domain.chat.dialogue.ItemMentionExtractor.Kind;
import com.example.campuseats.domain.menu.dto.ItemMention;

import lombok.RequiredArgsConstructor;

/**
 * Stage-independent reading of a message. The dialogue controller decides what the intent means
 * for the current stage.
 */
@Component
@RequiredArgsConstructor
public class IntentClassifier {

    private static final String[] CANCEL_KEYWORDS = {
        "cancel", "never mind", "nevermind", "forget it", "abort", "stop the order", "stop my order"
    };

    private static final String[] AFFIRM_KEYWORDS = {
        "yes", "yeah", "yep", "yup", "sure", "ok", "okay", "confirm", "go ahead", "correct",
        "please do", "sounds good", "absolutely", "of course", "place it"
    };

    private static final String[] DENY_KEYWORDS = {
        "no", "nope", "nah", "not now", "don't", "do not", "not really"
    };

    private static final String[] MENU_KEYWORDS = {
        "what's on the menu", "whats on the menu", "what is on the menu", "show me the menu",
        "today's menu", "todays menu", "full menu", "what's available", "whats available",
        "what is available", "see the menu", "the menu today"
    };

    private static final String[] OPEN_KEYWORDS = {
        "what's open", "whats open", "what is open", "which restaurants are open", "open now",
        "open restaurants", "is anything open", "still open"
    };

    private static final Pattern CATEGORY_QUESTION = Pattern.compile(
        "\\bwhat (?:kinds? of |types? of |sorts? of )?(?<word>[a-z]+) (?:do you|does the menu|are there|can i)",
        Pattern.CASE_INSENSITIVE);
    private static final Pattern CATEGORY_LISTING = Pattern.compile(
        "\\b(?:show me|list|see) (?:the |your |all )?(?:the )?(?<word>[a-z]+)(?: options| menu)?$",
        Pattern.CASE_INSENSITIVE);

    private final ItemMentionExtractor itemMentionExtractor;

    public ClassifiedMessage classify(String message) {
        String text = normalize(message);

        if (containsAny(text, CANCEL_KEYWORDS)) {
            return ClassifiedMessage.of(Intent.CANCEL);
        }
        if (containsAny(text, OPEN_KEYWORDS)) {
            return ClassifiedMessage.of(Intent.OPEN_RESTAURANTS);
        }
        if (containsAny(text, MENU_KEYWORDS)) {
            return ClassifiedMessage.of(Intent.MENU_OVERVIEW);
        }

        Optional<String> category = askedCategory(text);
        if (category.isPresent()) {
            return ClassifiedMessage.ofCategory(category.get());
        }

        Optional<Extraction> extraction = itemMentionExtractor.extract(message);
        if (extraction.isPresent()) {
            List<ItemMention> mentions = extraction.get().mentions();
            if (mentions.size() == 1) {
                Optional<String> bareCategory = itemMentionExtractor.categoryOf(mentions.get(0).phrase());
                if (bareCategory.isPresent()) {
                    return ClassifiedMessage.ofCategory(bareCategory.get());
                }
            }
            Intent intent = extraction.get().kind() == Kind.QUESTION ? Intent.ITEM_QUESTION : Intent.ORDER_ITEM;
            if (!mentions.isEmpty() || intent == Intent.ORDER_ITEM) {
                return new ClassifiedMessage(intent, mentions, null, extraction.get().refersBack());
            }
        }

        if (containsAny(text, AFFIRM_KEYWORDS)) {
            return ClassifiedMessage.of(Intent.AFFIRM);
        }
        if (containsAny(text, DENY_KEYWORDS)) {
            return ClassifiedMessage.of(Intent.DENY);
        }
        return ClassifiedMessage.of(Intent.GENERAL);
    }

    private Optional<String> askedCategory(String text) {
        for (Pattern pattern : List.of(CATEGORY_QUESTION, CATEGORY_LISTING)) {
            Matcher matcher = pattern.matcher(text);
            if (matcher.find()) {
                Optional<String> category = itemMentionExtractor.categoryOf(matcher.group("word"));
                if (category.isPresent()) {
                    return category;
                }
            }
        }
        return Optional.empty();
    }

    private static String normalize(String message) {
        if (message == null) {
            return "";
        }
        return message.toLowerCase(Locale.ROOT)
            .replace('’', '\'')
            .replaceAll("[?!.,]+", " ")
            .replaceAll("\\s+", " ")
            .trim();
    }

    // whole words only, so "ok" does not match "book"
    private static boolean containsAny(String text, String[] keywords) {
        for (String keyword : keywords) {
            if (Pattern.compile("(?<![a-z'])" + Pattern.quote(keyword) + "(?![a-z'])").matcher(text).find()) {
                return true;
            }
        }
        return false;
    }
}
