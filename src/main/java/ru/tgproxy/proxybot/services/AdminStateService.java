package ru.tgproxy.proxybot.services;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Ожидаемый ввод администратора по чату. Живёт в памяти процесса, после рестарта сбрасывается.
 * Брошенный запрос истекает через app.admin.input-timeout-minutes, чтобы случайное
 * сообщение через час не ушло в форму добавления сервера.
 */
@Service
public class AdminStateService {

    private final ConcurrentMap<Long, PendingInput> pendingByChat = new ConcurrentHashMap<>();
    private final Clock clock;
    private final Duration timeout;

    public AdminStateService(
            Clock clock,
            @Value("${app.admin.input-timeout-minutes:10}") long timeoutMinutes) {
        this.clock = clock;
        this.timeout = Duration.ofMinutes(timeoutMinutes);
    }

    public Optional<AdminAction> get(Long chatId) {
        if (chatId == null) return Optional.empty();
        PendingInput input = pendingByChat.get(chatId);
        if (input == null) return Optional.empty();
        if (!clock.instant().isBefore(input.expiresAt())) {
            pendingByChat.remove(chatId, input);
            return Optional.empty();
        }
        return Optional.of(input.action());
    }

    public void set(Long chatId, AdminAction action) {
        if (chatId == null || action == null) return;
        pendingByChat.put(chatId, new PendingInput(action, clock.instant().plus(timeout)));
    }

    public void clear(Long chatId) {
        if (chatId != null) {
            pendingByChat.remove(chatId);
        }
    }

    private record PendingInput(AdminAction action, Instant expiresAt) {
    }
}
