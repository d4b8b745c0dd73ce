package com.polyglot.backend.translation.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Data
@Component
@ConfigurationProperties(prefix = "app.translator")
public class TranslatorProperties {

    /** 同一使用者兩次翻譯之間的冷卻（從上一次被接受的時間點算） */
    private Duration cooldown = Duration.ofSeconds(20);

    /** 原文上限（以 code point 計） */
    private int maxTextLength = 5000;

    private Admission admission = new Admission();

    @Data
    public static class Admission {
        /** in-memory 冷卻表最多記幾個使用者 */
        private long maxTrackedUsers = 100_000;
    }
}
