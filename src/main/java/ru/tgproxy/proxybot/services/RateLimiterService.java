package ru.tgproxy.proxybot.services;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;

/**
 * Лимит запросов пользователя: фиксированное окно на счётчике в Redis.
 * Скрипт возвращает -1, если запрос в лимите, иначе сколько миллисекунд осталось до конца окна.
 * Ключ без TTL (потерянный PEXPIRE) получает TTL заново, поэтому навсегда не залипает.
 */
@Service
public class RateLimiterService {

    static final String KEY_PREFIX = "rl:user:";

    private static final String WINDOW_SCRIPT = """
            local hits = redis.call('INCR', KEYS[1])
            local left = redis.call('PTTL', KEYS[1])
            if left < 0 then
              redis.call('PEXPIRE', KEYS[1], ARGV[1])
              left = tonumber(ARGV[1])
            end
            if hits > tonumber(ARGV[2]) then
              return left
            end
            return -1
            """;

    private final StringRedisTemplate redis;
    private final DefaultRedisScript<Long> script = new DefaultRedisScript<>(WINDOW_SCRIPT, Long.class);
    private final Duration window;
    private final long maxRequests;

    public RateLimiterService(
            StringRedisTemplate redis,
            @Value("${app.rate-limit.window-seconds:3}") long windowSeconds,
            @Value("${app.rate-limit.max-requests:5}") long maxRequests) {
        this.redis = redis;
        this.window = Duration.ofSeconds(windowSeconds);
        this.maxRequests = maxRequests;
    }

    public Decision check(Long telegramId) {
        Long left = redis.execute(
                script,
                List.of(KEY_PREFIX + telegramId),
                String.valueOf(window.toMillis()),
                String.valueOf(maxRequests)
        );
        if (left == null || left < 0) {
            return Decision.ALLOWED;
        }
        return Decision.retryAfter(Duration.ofMillis(left));
    }

    public record Decision(boolean allowed, Duration retryAfter) {

        static final Decision ALLOWED = new Decision(true, Duration.ZERO);

        static Decision retryAfter(Duration wait) {
            return new Decision(false, wait);
        }

        /** Для текста пользователю: целые секунды, не меньше одной. */
        public long retryAfterSeconds() {
            long seconds = (retryAfter.toMillis() + 999) / 1000;
            return Math.max(1, seconds);
        }
    }
}
