package ru.tgproxy.proxybot.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "payment")
public record PaymentProperties(
        String providerToken,
        String webhookSecret
) {
}
