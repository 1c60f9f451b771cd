package me.golemcore.imbot.domain.service;

import me.golemcore.imbot.domain.model.Message;
import me.golemcore.imbot.testsupport.TestMessages;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MessageCacheTest {

    private MessageCache cache;

    @BeforeEach
    void setUp() {
        cache = new MessageCache(3);
    }

    @Test
    void shouldEvictOldestWhenFull() {
        for (int i = 1; i <= 5; i++) {
            cache.add("s1", TestMessages.text("m" + i, "s1", "text " + i));
        }

        assertEquals(List.of("m3", "m4", "m5"), ids(cache.getAll("s1")));
    }

    @Test
    void shouldReturnMostRecentWithinLimit() {
        for (int i = 1; i <= 3; i++) {
            cache.add("s1", TestMessages.text("m" + i, "s1", "text " + i));
        }

        assertEquals(List.of("m2", "m3"), ids(cache.get("s1", 2)));
        assertEquals(List.of("m1", "m2", "m3"), ids(cache.get("s1", 10)));
    }

    @Test
    void shouldKeepSessionsSeparate() {
        cache.add("s1", TestMessages.text("a", "s1", "one"));
        cache.add("s2", TestMessages.text("b", "s2", "two"));

        assertEquals(List.of("a"), ids(cache.getAll("s1")));
        assertEquals(List.of("b"), ids(cache.getAll("s2")));
        assertTrue(cache.getAll("unknown").isEmpty());
    }

    @Test
    void shouldReturnCopies() {
        cache.add("s1", TestMessages.text("m1", "s1", "hello"));

        List<Message> snapshot = cache.getAll("s1");
        snapshot.clear();

        assertEquals(1, cache.getAll("s1").size());
    }

    @Test
    void shouldRemoveAndClearSessions() {
        cache.add("s1", TestMessages.text("m1", "s1", "hello"));
        cache.add("s2", TestMessages.text("m2", "s2", "hello"));

        cache.remove("s1");
        assertTrue(cache.getAll("s1").isEmpty());

        cache.clear();
        assertTrue(cache.getAll("s2").isEmpty());
    }

    @Test
    void shouldRejectNonPositiveSize() {
        assertThrows(IllegalArgumentException.class, () -> new MessageCache(0));
    }

    private static List<String> ids(List<Message> messages) {
        return messages.stream().map(Message::getId).toList();
    }
}
