package com.polyglot.backend.translation.config;

import com.polyglot.backend.translation.provider.HttpTranslationProvider;
import com.polyglot.backend.translation.provider.StubTranslationProvider;
import com.polyglot.backend.translation.provider.TranslationProvider;
import com.polyglot.backend.translation.retry.BackoffSleeper;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.net.http.HttpClient;

@Configuration
@EnableConfigurationProperties(TranslationProviderProperties.class)
public class ProviderConfig {

    /**
     * ✅ 只有 enabled=false 才提供 stub，避免 TranslationProvider 變成兩個 Bean
     */
    @Bean
    @ConditionalOnProperty(prefix = "app.translator.provider", name = "enabled", havingValue = "false", matchIfMissing = true)
    public TranslationProvider stubTranslationProvider() {
        return new StubTranslationProvider();
    }

    @Bean
    @ConditionalOnProperty(prefix = "app.translator.provider", name = "enabled", havingValue = "true")
    public RestClient translatorRestClient(TranslationProviderProperties props) {
        HttpClient hc = HttpClient.newBuilder()
                .connectTimeout(props.getConnectTimeout())
                .build();

        JdkClientHttpRequestFactory rf = new JdkClientHttpRequestFactory(hc);
        rf.setReadTimeout(props.getReadTimeout());

        return RestClient.builder()
                .baseUrl(props.getBaseUrl())
                .requestFactory(rf)
                .defaultHeader(HttpHeaders.USER_AGENT, "polyglot-backend/1.0")
                .build();
    }

    @Bean
    @ConditionalOnProperty(prefix = "app.translator.provider", name = "enabled", havingValue = "true")
    public TranslationProvider httpTranslationProvider(RestClient translatorRestClient,
                                                       TranslationProviderProperties props) {
        // ✅ Fail-fast：啟動就抓到設定缺失
        if (props.getBaseUrl() == null || props.getBaseUrl().isBlank()) {
            throw new IllegalStateException("TRANSLATOR_BASE_URL_MISSING");
        }
        return new HttpTranslationProvider(translatorRestClient, props);
    }

    @Bean
    public BackoffSleeper backoffSleeper() {
        return BackoffSleeper.threadSleep();
    }
}
