package com.example.campuseats.domain.chat.dialogue;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class IntentClassifierTest {

    private final IntentClassifier classifier = new IntentClassifier(new ItemMentionExtractor());

    @Test
    void cancellationShouldWinOverEverythingElse() {
        assertThat(classifier.classify("cancel, I want a burger instead").intent()).isEqualTo(Intent.CANCEL);
        assertThat(classifier.classify("Never mind").intent()).isEqualTo(Intent.CANCEL);
        assertThat(classifier.classify("forget it").intent()).isEqualTo(Intent.CANCEL);
    }

    @Test
    void confirmationWordsShouldMatchWholeWordsOnly() {
        assertThat(classifier.classify("Yes, please").intent()).isEqualTo(Intent.AFFIRM);
        assertThat(classifier.classify("okay").intent()).isEqualTo(Intent.AFFIRM);
        assertThat(classifier.classify("no thanks").intent()).isEqualTo(Intent.DENY);
        assertThat(classifier.classify("book a table").intent()).isEqualTo(Intent.GENERAL);
    }

    @Test
    void toolQuestionsShouldBeRecognized() {
        assertThat(classifier.classify("What's on the menu?").intent()).isEqualTo(Intent.MENU_OVERVIEW);
        assertThat(classifier.classify("Which restaurants are open?").intent()).isEqualTo(Intent.OPEN_RESTAURANTS);
    }

    @Test
    void bareCategoryShouldBeACategoryQuestion() {
        ClassifiedMessage listing = classifier.classify("what pizzas do you have?");
        ClassifiedMessage availability = classifier.classify("do you have wings?");

        assertThat(listing.intent()).isEqualTo(Intent.CATEGORY);
        assertThat(listing.category()).isEqualTo("pizza");
        assertThat(availability.intent()).isEqualTo(Intent.CATEGORY);
        assertThat(availability.category()).isEqualTo("wings");
    }

    @Test
    void itemPhrasingShouldCarryMentions() {
        ClassifiedMessage question = classifier.classify("Is Margherita available?");
        ClassifiedMessage order = classifier.classify("Can I order a pepperoni and margherita pizza");

        assertThat(question.intent()).isEqualTo(Intent.ITEM_QUESTION);
        assertThat(question.namesItems()).isTrue();
        assertThat(order.intent()).isEqualTo(Intent.ORDER_ITEM);
        assertThat(order.mentions()).hasSize(2);
    }

    @Test
    void orderOfAPronounShouldHaveNoMentions() {
        ClassifiedMessage classified = classifier.classify("sure, I'll take it");

        assertThat(classified.intent()).isEqualTo(Intent.ORDER_ITEM);
        assertThat(classified.namesItems()).isFalse();
        assertThat(classified.refersBack()).isTrue();
        assertThat(classifier.classify("I'd like to know how long delivery takes first").refersBack()).isFalse();
    }

    @Test
    void anythingElseShouldBeGeneral() {
        assertThat(classifier.classify("Tell me a joke").intent()).isEqualTo(Intent.GENERAL);
    }
}
