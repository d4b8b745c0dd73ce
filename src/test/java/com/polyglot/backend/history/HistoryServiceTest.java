package com.polyglot.backend.history;

import com.polyglot.backend.common.error.InvalidInputException;
import com.polyglot.backend.common.error.NotFoundException;
import com.polyglot.backend.eventstore.model.NewTranslationEvent;
import com.polyglot.backend.eventstore.model.TranslationType;
import com.polyglot.backend.eventstore.service.EventStore;
import com.polyglot.backend.history.service.HistoryService;
import com.polyglot.backend.testsupport.BaseSpringTest;
import com.polyglot.backend.testsupport.MutableClock;
import com.polyglot.backend.testsupport.TestOverridesConfiguration;
import com.polyglot.backend.users.service.UserAccountService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.time.Duration;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class HistoryServiceTest extends BaseSpringTest {

    @Autowired HistoryService history;
    @Autowired EventStore eventStore;
    @Autowired UserAccountService users;
    @Autowired MutableClock clock;

    private String email;

    @BeforeEach
    void setUp() {
        clock.set(TestOverridesConfiguration.START);
        email = "hist-" + UUID.randomUUID() + "@x.com";
        users.touchLogin(email, null);
    }

    private Long append(String original, String translated, TranslationType type) {
        Long id = eventStore.append(new NewTranslationEvent(
                email, "en", "es", original, translated, type,
                original.codePointCount(0, original.length()), 50, null, null, null));
        clock.advance(Duration.ofSeconds(1));
        return id;
    }

    @Test
    void list_filters_by_type_and_reports_pagination() {
        append("one", "uno", TranslationType.TEXT);
        append("two", "dos", TranslationType.SPEECH);
        append("three", "tres", TranslationType.TEXT);

        var all = history.list(email, null, null, null);
        assertEquals(3, all.translations().size());
        assertEquals(1, all.pagination().page());
        assertEquals(20, all.pagination().perPage());
        assertFalse(all.pagination().hasMore());

        var speech = history.list(email, "speech", 1, 20);
        assertEquals(1, speech.translations().size());
        assertEquals("two", speech.translations().get(0).originalText());
        assertEquals("english", speech.translations().get(0).sourceLanguageName());
        assertEquals("spanish", speech.translations().get(0).targetLanguageName());

        var firstPage = history.list(email, null, 1, 2);
        assertTrue(firstPage.pagination().hasMore());
        assertEquals("three", firstPage.translations().get(0).originalText());
    }

    @Test
    void unknown_type_is_invalid_input() {
        InvalidInputException ex = assertThrows(InvalidInputException.class,
                () -> history.list(email, "video", 1, 20));
        assertEquals("INVALID_TRANSLATION_TYPE", ex.code());
    }

    @Test
    void get_returns_own_translation_or_not_found() {
        Long id = append("Hello", "Hola", TranslationType.TEXT);

        assertEquals("Hola", history.get(email, id).translatedText());
        assertThrows(NotFoundException.class, () -> history.get(email, id + 10_000));
    }

    @Test
    void search_ranks_by_relevance_then_recency() {
        Long partialOriginal = append("Say hello to Bob", "Di hola a Bob", TranslationType.TEXT);
        Long exactTranslated = append("hola", "hello", TranslationType.TEXT);
        append("nothing here", "nada", TranslationType.TEXT);
        Long exactOriginal = append("HELLO", "HOLA", TranslationType.TEXT);

        var res = history.search(email, "  Hello ", null);

        assertTrue(res.success());
        assertEquals("Hello", res.query());
        assertEquals(3, res.count());
        assertThat(res.results()).extracting(r -> r.id())
                .containsExactly(exactOriginal, exactTranslated, partialOriginal);
    }

    @Test
    void older_exact_match_outranks_many_newer_weak_matches() {
        Long exact = append("hello", "hola", TranslationType.TEXT);
        for (int i = 0; i < 510; i++) {
            append("x" + i, "say hello " + i, TranslationType.TEXT);
        }

        var res = history.search(email, "hello", 10);

        assertEquals(10, res.count());
        assertEquals(exact, res.results().get(0).id());
        assertEquals("x509", res.results().get(1).originalText());
    }

    @Test
    void search_with_single_match_returns_count_one() {
        append("Good morning", "Buenos días", TranslationType.TEXT);
        append("Good night", "Buenas noches", TranslationType.TEXT);

        var res = history.search(email, "días", 10);

        assertEquals(1, res.count());
        assertEquals("Good morning", res.results().get(0).originalText());
    }

    @Test
    void search_treats_like_wildcards_literally() {
        append("100% sure", "100% seguro", TranslationType.TEXT);
        append("1000 things", "1000 cosas", TranslationType.TEXT);
        append("snake_case", "snake_case", TranslationType.TEXT);
        append("snakeXcase", "snakeXcase", TranslationType.TEXT);

        assertEquals(1, history.search(email, "100%", null).count());
        assertEquals(1, history.search(email, "e_c", null).count());
    }

    @Test
    void search_limit_is_clamped() {
        for (int i = 0; i < 5; i++) append("match " + i, "coincide " + i, TranslationType.TEXT);

        assertEquals(1, history.search(email, "match", 0).count());
        assertEquals(2, history.search(email, "match", 2).count());
        assertEquals(5, history.search(email, "match", 1000).count());
    }

    @Test
    void empty_query_is_invalid_input() {
        InvalidInputException ex = assertThrows(InvalidInputException.class, () -> history.search(email, "   ", 10));
        assertEquals("QUERY_REQUIRED", ex.code());
        assertThrows(InvalidInputException.class, () -> history.search(email, null, 10));
    }

    @Test
    void clear_requires_confirmation_and_is_idempotent() {
        append("a", "b", TranslationType.TEXT);
        append("c", "d", TranslationType.TEXT);

        InvalidInputException ex = assertThrows(InvalidInputException.class, () -> history.clear(email, null));
        assertEquals("CONFIRMATION_REQUIRED", ex.code());
        assertThrows(InvalidInputException.class, () -> history.clear(email, false));
        assertEquals(2, history.list(email, null, 1, 20).translations().size());

        assertEquals(2, history.clear(email, true).deletedCount());
        assertEquals(0, history.clear(email, true).deletedCount());
        assertEquals(0, users.profile(email).totalTranslations());
    }
}
