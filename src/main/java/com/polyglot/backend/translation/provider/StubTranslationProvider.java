package com.polyglot.backend.translation.provider;

/**
 * 不打外網的 provider（provider.enabled=false 時使用）。
 * 回傳「[目標語言] 原文」，方便在 dev / 測試環境看出有走完整條流程。
 */
public class StubTranslationProvider implements TranslationProvider {

    static final double STUB_CONFIDENCE = 0.9;

    @Override
    public ProviderResult translate(String text, String sourceLang, String targetLang) {
        if (text == null || text.isBlank()) {
            return ProviderResult.permanentFailure("PROVIDER_BAD_REQUEST", "empty text");
        }
        return ProviderResult.ok("[" + targetLang + "] " + text, STUB_CONFIDENCE);
    }

    @Override
    public String name() {
        return "STUB";
    }
}
