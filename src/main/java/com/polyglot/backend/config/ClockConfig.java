package com.polyglot.backend.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * ✅ 全站統一用這個 Clock 取「現在」（UTC）
 * 冷卻、事件時間、今天/本週的邊界都以它為準，測試可以換成可控的 Clock。
 */
@Configuration
public class ClockConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
