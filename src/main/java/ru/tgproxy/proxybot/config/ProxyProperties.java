package ru.tgproxy.proxybot.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;
import java.util.List;

/**
 * servers - адреса вида host[:port], из них заполняется пустой каталог серверов.
 */
@ConfigurationProperties(prefix = "proxy")
public record ProxyProperties(
        @DefaultValue List<String> servers,
        @DefaultValue("8080") int metricsPort,
        @DefaultValue("5s") Duration connectTimeout,
        @DefaultValue("5s") Duration readTimeout
) {
}
