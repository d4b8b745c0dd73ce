package com.polyglot.backend.translation.retry;

import java.time.Duration;

/**
 * 退避等待。正式環境就是 Thread.sleep；測試換成記錄用的實作。
 */
@FunctionalInterface
public interface BackoffSleeper {

    void sleep(Duration duration) throws InterruptedException;

    static BackoffSleeper threadSleep() {
        return d -> Thread.sleep(d.toMillis());
    }
}
