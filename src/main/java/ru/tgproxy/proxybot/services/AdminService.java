package ru.tgproxy.proxybot.services;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

@Slf4j
@Service
public class AdminService {

    private final Set<Long> adminIds;

    public AdminService(@Value("${telegram.admin-ids:}") String adminIdsRaw) {
        if (adminIdsRaw == null || adminIdsRaw.isBlank()) {
            this.adminIds = Collections.emptySet();
            return;
        }
        Set<Long> ids = new LinkedHashSet<>();
        for (String p : adminIdsRaw.split(",")) {
            String t = p.trim();
            if (t.isEmpty()) continue;
            try {
                ids.add(Long.parseLong(t));
            } catch (NumberFormatException e) {
                log.warn("Ignoring malformed admin id '{}'", t);
            }
        }
        this.adminIds = Collections.unmodifiableSet(ids);
    }

    public boolean isAdmin(Long telegramId) {
        return telegramId != null && adminIds.contains(telegramId);
    }

    /**
     * Проверка прав в начале каждой админской операции.
     */
    public AdminAuthorization authorize(Long telegramId) {
        if (telegramId == null) {
            return AdminAuthorization.denied("Не удалось определить пользователя.");
        }
        if (!adminIds.contains(telegramId)) {
            log.warn("Admin access denied for telegramId={}", telegramId);
            return AdminAuthorization.denied("⛔ Доступ только для администраторов.");
        }
        return AdminAuthorization.granted();
    }

    public record AdminAuthorization(boolean allowed, String reason) {
        static AdminAuthorization granted() {
            return new AdminAuthorization(true, null);
        }

        static AdminAuthorization denied(String reason) {
            return new AdminAuthorization(false, reason);
        }
    }
}
