package ru.tgproxy.proxybot.services;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;

/**
 * Одноразовые отметки в Redis (SET NX с TTL).
 * Апдейт с уже виденным update_id повторно не обрабатывается, а кнопка пользователя
 * не запускает то же действие, пока не истечёт короткая отметка предыдущего нажатия.
 */
@Service
public class IdempotencyService {

    static final String UPDATE_KEY = "idemp:update:";
    static final String ACTION_KEY = "idemp:action:";

    private final StringRedisTemplate redis;
    private final Clock clock;
    private final Duration updateTtl;
    private final Duration actionTtl;

    public IdempotencyService(
            StringRedisTemplate redis,
            Clock clock,
            @Value("${app.idempotency.update-ttl-seconds:600}") long updateTtlSeconds,
            @Value("${app.idempotency.ttl-seconds:10}") long actionTtlSeconds) {
        this.redis = redis;
        this.clock = clock;
        this.updateTtl = Duration.ofSeconds(updateTtlSeconds);
        this.actionTtl = Duration.ofSeconds(actionTtlSeconds);
    }

    /** true - апдейт с таким id пришёл впервые. */
    public boolean firstDelivery(Integer updateId) {
        return mark(UPDATE_KEY + updateId, updateTtl);
    }

    /** true - такое же действие этого пользователя сейчас не выполняется. */
    public boolean startAction(String action, Long userId) {
        return mark(ACTION_KEY + action + ":" + userId, actionTtl);
    }

    private boolean mark(String key, Duration ttl) {
        Boolean ok = redis.opsForValue().setIfAbsent(key, clock.instant().toString(), ttl);
        return Boolean.TRUE.equals(ok);
    }
}
