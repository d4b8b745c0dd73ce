package com.polyglot.backend.translation.provider;

import com.polyglot.backend.translation.config.TranslationProviderProperties;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * 設定自檢（不打外網）：
 * - baseUrl 不是 http(s) -> DOWN
 * - 其他 -> UP（自架 LibreTranslate 可以不需要 key）
 */
@Component("translationProvider")
@ConditionalOnProperty(prefix = "app.translator.provider", name = "enabled", havingValue = "true")
public class ProviderHealthIndicator implements HealthIndicator {

    private final TranslationProviderProperties props;

    public ProviderHealthIndicator(TranslationProviderProperties props) {
        this.props = props;
    }

    @Override
    public Health health() {
        String baseUrl = props.getBaseUrl();
        String lower = baseUrl == null ? "" : baseUrl.trim().toLowerCase(Locale.ROOT);
        boolean baseOk = lower.startsWith("https://") || lower.startsWith("http://");
        boolean hasKey = props.getApiKey() != null && !props.getApiKey().isBlank();

        Health.Builder b = baseOk
                ? Health.up()
                : Health.down().withDetail("reason", "TRANSLATOR_BASE_URL_INVALID");

        // 不輸出 apiKey 本身
        return b.withDetail("provider", "LIBRETRANSLATE")
                .withDetail("enabled", true)
                .withDetail("baseUrl", baseOk ? baseUrl : null)
                .withDetail("apiKeyConfigured", hasKey)
                .build();
    }
}
