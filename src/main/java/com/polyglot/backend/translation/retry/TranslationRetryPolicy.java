package com.polyglot.backend.translation.retry;

import java.time.Duration;

/**
 * Gateway 呼叫 provider 的重試規則：
 * - 最多 5 次（含第一次）
 * - 第 n 次之前等 2^(n-1) 秒：2, 4, 8, 16，總共最多等 30 秒
 * 只有暫時性錯誤（timeout / 5xx / 429 / 連線錯誤）才會走到重試。
 */
public final class TranslationRetryPolicy {

    private TranslationRetryPolicy() {}

    public static final int MAX_ATTEMPTS = 5;

    /**
     * attempt：即將執行的是第幾次（1 起算）；第 1 次不用等。
     */
    public static Duration delayBefore(int attempt) {
        if (attempt <= 1) return Duration.ZERO;
        return Duration.ofSeconds(1L << (attempt - 1));
    }

    public static boolean shouldGiveUp(int attemptsDone) {
        return attemptsDone >= MAX_ATTEMPTS;
    }
}
