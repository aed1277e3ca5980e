package ru.tgproxy.proxybot;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import ru.tgproxy.proxybot.config.BotProperties;
import ru.tgproxy.proxybot.config.PaymentProperties;
import ru.tgproxy.proxybot.config.ProxyProperties;
import ru.tgproxy.proxybot.config.SubscriptionProperties;

@SpringBootApplication
@EntityScan("ru.tgproxy.proxybot.entities")
@EnableConfigurationProperties({
        BotProperties.class,
        SubscriptionProperties.class,
        PaymentProperties.class,
        ProxyProperties.class
})
public class ProxyBotApplication {
    public static void main(String[] args) {
        SpringApplication.run(ProxyBotApplication.class, args);
    }
}
