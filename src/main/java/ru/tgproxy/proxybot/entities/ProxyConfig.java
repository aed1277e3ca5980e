package ru.tgproxy.proxybot.entities;

import jakarta.persistence.*;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.time.Instant;

@Entity
@Table(
        name = "proxy_configs",
        indexes = {
                @Index(name = "idx_proxy_configs_user_id", columnList = "user_id")
        }
)
@Data
public class ProxyConfig {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "user_id", nullable = false)
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private User user;

    @Column(name = "proxy_secret", nullable = false)
    private String proxySecret;

    /**
     * Адрес сервера на момент выдачи. Ссылка на proxy_servers слабая (по адресу):
     * сервер могут выключить, а выданный конфиг останется до ротации.
     */
    @Column(name = "server_address", nullable = false)
    private String serverAddress;

    @Column(name = "port", nullable = false)
    private int port;

    @Convert(converter = UtcInstantConverter.class)
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public String tgLink() {
        return "tg://proxy?server=" + serverAddress + "&port=" + port + "&secret=" + proxySecret;
    }

    public String shareLink() {
        return "https://t.me/proxy?server=" + serverAddress + "&port=" + port + "&secret=" + proxySecret;
    }
}
