package com.polyglot.backend.translation.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.polyglot.backend.translation.config.TranslationProviderProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * LibreTranslate 相容 API：
 * POST {baseUrl}/translate  {q, source, target, format, api_key}
 * → {translatedText, detectedLanguage: {confidence: 0..100}}
 */
@Slf4j
public class HttpTranslationProvider implements TranslationProvider {

    /** 內部 code 跟 LibreTranslate 不一致的幾個 */
    private static final Map<String, String> CODE_ALIASES = Map.of(
            "zh-cn", "zh",
            "zh-tw", "zt",
            "iw", "he",
            "jw", "jv"
    );

    private final RestClient http;
    private final TranslationProviderProperties props;

    public HttpTranslationProvider(RestClient http, TranslationProviderProperties props) {
        this.http = http;
        this.props = props;
    }

    @Override
    public ProviderResult translate(String text, String sourceLang, String targetLang) {
        Map<String, Object> req = new LinkedHashMap<>();
        req.put("q", text);
        req.put("source", toProviderCode(sourceLang));
        req.put("target", toProviderCode(targetLang));
        req.put("format", "text");
        String key = props.getApiKey();
        if (key != null && !key.isBlank()) req.put("api_key", key);

        try {
            JsonNode resp = http.post()
                    .uri("/translate")
                    .contentType(MediaType.APPLICATION_JSON)
                    .accept(MediaType.APPLICATION_JSON)
                    .body(req)
                    .retrieve()
                    .body(JsonNode.class);

            String out = (resp == null) ? null : textOrNull(resp.get("translatedText"));
            if (out == null || out.isBlank()) {
                // 空結果當成暫時性錯誤（再試一次通常就好）
                return ProviderResult.transientFailure("PROVIDER_EMPTY_RESULT", "empty translation");
            }
            return ProviderResult.ok(out, confidenceOrNull(resp));
        } catch (Exception e) {
            ProviderErrorMapper.Mapped m = ProviderErrorMapper.map(e);
            log.debug("provider call failed code={} retryable={} msg={}", m.code(), m.retryable(), m.message());
            return m.toResult();
        }
    }

    @Override
    public String name() {
        return "LIBRETRANSLATE";
    }

    static String toProviderCode(String code) {
        String c = code.toLowerCase(Locale.ROOT);
        return CODE_ALIASES.getOrDefault(c, c);
    }

    /** detectedLanguage.confidence 是 0..100，轉成 0..1；沒有就 null */
    private static Double confidenceOrNull(JsonNode resp) {
        JsonNode dl = resp.get("detectedLanguage");
        if (dl == null || !dl.isObject()) return null;
        JsonNode c = dl.get("confidence");
        if (c == null || !c.isNumber()) return null;
        double v = c.asDouble() / 100.0;
        if (Double.isNaN(v)) return null;
        return Math.max(0.0, Math.min(1.0, v));
    }

    private static String textOrNull(JsonNode n) {
        return (n == null || n.isNull()) ? null : n.asText();
    }
}
