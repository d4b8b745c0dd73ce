package com.polyglot.backend.translation.provider;

import com.polyglot.backend.translation.config.TranslationProviderProperties;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Status;

import static org.junit.jupiter.api.Assertions.*;

class StubTranslationProviderTest {

    @Test
    void stub_prefixes_target_language() {
        var r = new StubTranslationProvider().translate("Hello", "en", "es");

        assertTrue(r.isOk());
        assertEquals("[es] Hello", r.translatedText());
        assertEquals(StubTranslationProvider.STUB_CONFIDENCE, r.confidence());
    }

    @Test
    void stub_rejects_blank_text_permanently() {
        var r = new StubTranslationProvider().translate(" ", "en", "es");
        assertEquals(TranslationProvider.ProviderResult.Status.PERMANENT, r.status());
    }

    @Test
    void health_is_down_when_base_url_is_not_http() {
        TranslationProviderProperties props = new TranslationProviderProperties();
        props.setBaseUrl("ftp://nope");

        var h = new ProviderHealthIndicator(props).health();

        assertEquals(Status.DOWN, h.getStatus());
        assertEquals("TRANSLATOR_BASE_URL_INVALID", h.getDetails().get("reason"));
    }

    @Test
    void health_never_exposes_api_key() {
        TranslationProviderProperties props = new TranslationProviderProperties();
        props.setBaseUrl("https://translate.example.com");
        props.setApiKey("secret-key");

        var h = new ProviderHealthIndicator(props).health();

        assertEquals(Status.UP, h.getStatus());
        assertEquals(true, h.getDetails().get("apiKeyConfigured"));
        assertFalse(h.getDetails().containsValue("secret-key"));
    }
}
