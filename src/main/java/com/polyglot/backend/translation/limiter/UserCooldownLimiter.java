package com.polyglot.backend.translation.limiter;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.polyglot.backend.common.error.RateLimitedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;

/**
 * ✅ 每個使用者一個冷卻 slot：
 * - 被接受的那一刻就記下時間（不是完成時），慢的 provider 呼叫不能被拿來連發
 * - 冷卻內再來直接 429，retryAfter 無條件進位到秒（1..cooldown）
 * - 判斷 + 記錄在 Caffeine asMap().compute 內完成，同一 key 原子、不同 key 不互鎖
 * - 鎖只在判斷當下持有，不會跨到 provider I/O 或 backoff
 * 取消請求不會把時間退回去。
 */
@Slf4j
@Service
public class UserCooldownLimiter {

    private final Duration cooldown;
    private final Cache<String, Instant> lastAccepted;

    public UserCooldownLimiter(
            @Value("${app.translator.cooldown:PT20S}") Duration cooldown,
            @Value("${app.translator.admission.max-tracked-users:100000}") long maxTrackedUsers
    ) {
        if (cooldown == null || cooldown.isNegative() || cooldown.isZero()) {
            throw new IllegalArgumentException("COOLDOWN_INVALID");
        }
        this.cooldown = cooldown;
        // 過期時間抓冷卻的兩倍：entry 只是記憶體清理，判斷一律用 Instant 比
        this.lastAccepted = Caffeine.newBuilder()
                .expireAfterWrite(cooldown.multipliedBy(2))
                .maximumSize(Math.max(1, maxTrackedUsers))
                .build();
    }

    /**
     * 通過就把 now 記成這個使用者最後被接受的時間；否則丟 {@link RateLimitedException}。
     */
    public void admitOrThrow(String userKey, Instant now) {
        long[] waitSec = {0};

        lastAccepted.asMap().compute(userKey, (k, last) -> {
            if (last != null) {
                long remainingNanos = Duration.between(now, last.plus(cooldown)).toNanos();
                if (remainingNanos > 0) {
                    waitSec[0] = ceilSeconds(Math.min(remainingNanos, cooldown.toNanos()));
                    return last; // 保留原本的時間，冷卻不會被延長
                }
            }
            return now;
        });

        if (waitSec[0] > 0) {
            log.debug("admission rejected user={} retryAfter={}s", userKey, waitSec[0]);
            throw new RateLimitedException(
                    "Please wait " + waitSec[0] + " seconds before the next translation",
                    (int) waitSec[0],
                    "RETRY_LATER"
            );
        }
        log.debug("admission accepted user={}", userKey);
    }

    public Duration cooldown() {
        return cooldown;
    }

    private static long ceilSeconds(long nanos) {
        long s = nanos / 1_000_000_000L;
        return (nanos % 1_000_000_000L == 0) ? s : s + 1;
    }
}
