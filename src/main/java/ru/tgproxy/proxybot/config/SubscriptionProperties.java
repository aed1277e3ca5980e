package ru.tgproxy.proxybot.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.math.BigDecimal;
import java.time.Duration;

@ConfigurationProperties(prefix = "subscription")
public record SubscriptionProperties(
        @DefaultValue("5.00") BigDecimal price,
        @DefaultValue("RUB") String currency,
        @DefaultValue("30") int durationDays,
        @DefaultValue("1") int trialDays
) {

    public Duration duration() {
        return Duration.ofDays(durationDays);
    }

    public Duration trialDuration() {
        return Duration.ofDays(trialDays);
    }

    /** Цена в минимальных единицах валюты (копейки/центы), как её ждёт Telegram Payments. */
    public int priceMinorUnits() {
        return price.movePointRight(2).intValueExact();
    }
}
