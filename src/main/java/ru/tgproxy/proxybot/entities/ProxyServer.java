package ru.tgproxy.proxybot.entities;

import jakarta.persistence.*;
import lombok.Data;

import java.time.Instant;

@Entity
@Table(name = "proxy_servers")
@Data
public class ProxyServer {

    public static final int DEFAULT_PORT = 443;
    public static final int DEFAULT_MAX_USERS = 1000;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "address", nullable = false, unique = true)
    private String address;

    @Column(name = "port", nullable = false)
    private int port = DEFAULT_PORT;

    @Column(name = "description")
    private String description;

    @Column(name = "location")
    private String location;

    /** Подсказка по ёмкости, на выдачу конфигов не влияет. */
    @Column(name = "max_users", nullable = false)
    private int maxUsers = DEFAULT_MAX_USERS;

    @Column(name = "is_active", nullable = false)
    private boolean active = true;

    @Convert(converter = UtcInstantConverter.class)
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Convert(converter = UtcInstantConverter.class)
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    protected ProxyServer() {}

    public ProxyServer(String address, int port, String description) {
        this.address = address;
        this.port = port;
        this.description = description;
    }
}
