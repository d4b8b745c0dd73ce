package com.polyglot.backend.history.service;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class HistorySearchHelpersTest {

    @Test
    void like_pattern_escapes_wildcards_and_escape_char() {
        assertEquals("a!%b!_c!!", HistoryService.escapeLike("a%b_c!"));
        assertEquals("plain", HistoryService.escapeLike("plain"));
        assertEquals("", HistoryService.escapeLike(""));
    }
}
