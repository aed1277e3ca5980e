package ru.tgproxy.proxybot.entities;

import jakarta.persistence.*;
import lombok.Data;

import java.time.Instant;

@Entity
@Table(name = "users")
@Data
public class User {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "telegram_id", nullable = false, unique = true)
    private Long telegramId;

    @Column(name = "username")
    private String username;

    @Column(name = "first_name")
    private String firstName;

    /**
     * Конец оплаченного/пробного периода. null - доступ ещё ни разу не выдавался
     * (пользователь может взять пробный период).
     */
    @Convert(converter = UtcInstantConverter.class)
    @Column(name = "subscription_until")
    private Instant subscriptionUntil;

    @Column(name = "is_active", nullable = false)
    private boolean active = true;

    @Convert(converter = UtcInstantConverter.class)
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public String displayName() {
        if (firstName != null && !firstName.isBlank()) return firstName;
        if (username != null && !username.isBlank()) return username;
        return String.valueOf(telegramId);
    }
}
