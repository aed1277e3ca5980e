package ru.tgproxy.proxybot.services;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import ru.tgproxy.proxybot.client.ProxyMetricsClient;
import ru.tgproxy.proxybot.entities.Payment;
import ru.tgproxy.proxybot.entities.ProxyServer;
import ru.tgproxy.proxybot.entities.User;
import ru.tgproxy.proxybot.exceptions.InvalidPortException;
import ru.tgproxy.proxybot.exceptions.ProxyBotException;
import ru.tgproxy.proxybot.repositories.PaymentRepository;
import ru.tgproxy.proxybot.repositories.UserRepository;
import ru.tgproxy.proxybot.utils.BotMessageFactory;
import ru.tgproxy.proxybot.utils.BotTextUtils;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Ввод администратора по ожидаемому действию и отчёты админ-панели.
 * Права проверяются в начале каждой операции, а не только при показе меню.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AdminFlowService {

    private final AdminService adminService;
    private final AdminStateService adminStateService;
    private final SubscriptionService subscriptionService;
    private final UserService userService;
    private final ProxyServerService proxyServerService;
    private final ProxyMetricsClient proxyMetricsClient;
    private final BotMenuService botMenuService;
    private final UserRepository userRepository;
    private final PaymentRepository paymentRepository;
    private final Clock clock;

    public List<SendMessage> handleAdminInput(Long chatId, Long adminId, String text, AdminAction action) {
        List<SendMessage> out = new ArrayList<>();
        AdminService.AdminAuthorization auth = adminService.authorize(adminId);
        if (!auth.allowed()) {
            adminStateService.clear(chatId);
            out.add(BotMessageFactory.simpleMessage(chatId, auth.reason()));
            return out;
        }
        String trimmed = text == null ? "" : text.trim();
        try {
            switch (action) {
                case ADD_SERVER -> handleAddServer(chatId, trimmed, out);
                case GRANT_SUBSCRIPTION -> handleGrant(chatId, trimmed, out);
                case DISABLE_USER -> handleSetActive(chatId, trimmed, false, out);
                case ENABLE_USER -> handleSetActive(chatId, trimmed, true, out);
            }
        } catch (ProxyBotException e) {
            // ожидание ввода сохраняем: можно исправить и отправить ещё раз или /cancel
            out.add(BotMessageFactory.simpleMessage(chatId, "❌ " + e.getMessage() + "\n\n/cancel - отмена."));
        }
        return out;
    }

    public SendMessage prompt(Long chatId, Long adminId, AdminAction action) {
        AdminService.AdminAuthorization auth = adminService.authorize(adminId);
        if (!auth.allowed()) {
            return BotMessageFactory.simpleMessage(chatId, auth.reason());
        }
        adminStateService.set(chatId, action);
        String text = switch (action) {
            case ADD_SERVER -> "Отправьте адрес, порт и описание через пробел, например:\n\nproxy.example.com 443 Франкфурт";
            case GRANT_SUBSCRIPTION -> "Отправьте Telegram ID пользователя и количество дней, например:\n\n123456789 30";
            case DISABLE_USER -> "Отправьте Telegram ID пользователя, которого нужно отключить.";
            case ENABLE_USER -> "Отправьте Telegram ID пользователя, которого нужно включить.";
        };
        return BotMessageFactory.simpleMessage(chatId, text + "\n\n/cancel - отмена.");
    }

    public SendMessage serversMessage(Long chatId, Long adminId) {
        AdminService.AdminAuthorization auth = adminService.authorize(adminId);
        if (!auth.allowed()) {
            return BotMessageFactory.simpleMessage(chatId, auth.reason());
        }
        return botMenuService.serversMenu(chatId, proxyServerService.listAllOrSeed());
    }

    public SendMessage toggleServer(Long chatId, Long adminId, String rawId) {
        AdminService.AdminAuthorization auth = adminService.authorize(adminId);
        if (!auth.allowed()) {
            return BotMessageFactory.simpleMessage(chatId, auth.reason());
        }
        Long serverId = parseLong(rawId);
        if (serverId == null) {
            return BotMessageFactory.simpleMessage(chatId, "❌ Не удалось определить сервер.");
        }
        try {
            proxyServerService.toggle(serverId);
        } catch (ProxyBotException e) {
            return BotMessageFactory.simpleMessage(chatId, "❌ " + e.getMessage());
        }
        return botMenuService.serversMenu(chatId, proxyServerService.listAll());
    }

    @Transactional(readOnly = true)
    public SendMessage statsMessage(Long chatId, Long adminId) {
        AdminService.AdminAuthorization auth = adminService.authorize(adminId);
        if (!auth.allowed()) {
            return BotMessageFactory.simpleMessage(chatId, auth.reason());
        }
        long totalUsers = userRepository.count();
        long entitledUsers = userRepository.countBySubscriptionUntilAfter(clock.instant());
        List<ProxyServer> servers = proxyServerService.listAll();
        long activeServers = servers.stream().filter(ProxyServer::isActive).count();
        long completed = paymentRepository.countByStatus(Payment.Status.COMPLETED);
        long pending = paymentRepository.countByStatus(Payment.Status.PENDING);
        BigDecimal revenue = paymentRepository.sumAmountByStatus(Payment.Status.COMPLETED);

        String text = "📈 Статистика\n\n" +
                "👥 Пользователей: " + totalUsers + "\n" +
                "✅ С активной подпиской: " + entitledUsers + "\n" +
                "🖥 Серверов: " + activeServers + " активных из " + servers.size() + "\n" +
                "💳 Платежей: " + completed + " завершённых, " + pending + " в ожидании\n" +
                "💰 Выручка: " + (revenue == null ? BigDecimal.ZERO : revenue).toPlainString();
        return BotMessageFactory.simpleMessage(chatId, text);
    }

    @Transactional(readOnly = true)
    public SendMessage recentUsersMessage(Long chatId, Long adminId) {
        AdminService.AdminAuthorization auth = adminService.authorize(adminId);
        if (!auth.allowed()) {
            return BotMessageFactory.simpleMessage(chatId, auth.reason());
        }
        List<User> users = userService.listRecent();
        StringBuilder sb = new StringBuilder("👥 Последние пользователи (всего ")
                .append(userRepository.count()).append(")\n\n");
        if (users.isEmpty()) {
            sb.append("Пользователей пока нет.");
        }
        for (User u : users) {
            sb.append(subscriptionService.isEntitled(u) ? "✅ " : "▫️ ")
                    .append(u.getTelegramId())
                    .append(u.getUsername() == null ? "" : " @" + u.getUsername())
                    .append(u.isActive() ? "" : " 🚫")
                    .append("\n   до: ").append(BotTextUtils.formatDate(u.getSubscriptionUntil()))
                    .append("\n");
        }
        return BotMessageFactory.simpleMessage(chatId, sb.toString());
    }

    @Transactional(readOnly = true)
    public SendMessage recentPaymentsMessage(Long chatId, Long adminId) {
        AdminService.AdminAuthorization auth = adminService.authorize(adminId);
        if (!auth.allowed()) {
            return BotMessageFactory.simpleMessage(chatId, auth.reason());
        }
        List<Payment> payments = paymentRepository.findTop10ByOrderByCreatedAtDesc();
        BigDecimal revenue = paymentRepository.sumAmountByStatus(Payment.Status.COMPLETED);
        StringBuilder sb = new StringBuilder("💳 Последние платежи (всего ")
                .append(paymentRepository.count())
                .append(", выручка ")
                .append((revenue == null ? BigDecimal.ZERO : revenue).toPlainString())
                .append(")\n\n");
        if (payments.isEmpty()) {
            sb.append("Платежей пока нет.");
        }
        for (Payment p : payments) {
            sb.append(BotTextUtils.formatDate(p.getCreatedAt()))
                    .append(" | ").append(p.getUser().getTelegramId())
                    .append(" | ").append(p.getAmount().toPlainString()).append(" ").append(p.getCurrency())
                    .append(" | ").append(p.getStatus())
                    .append("\n");
        }
        return BotMessageFactory.simpleMessage(chatId, sb.toString());
    }

    public SendMessage proxyStatusMessage(Long chatId, Long adminId) {
        AdminService.AdminAuthorization auth = adminService.authorize(adminId);
        if (!auth.allowed()) {
            return BotMessageFactory.simpleMessage(chatId, auth.reason());
        }
        List<ProxyServer> servers = proxyServerService.listActiveOrSeed();
        if (servers.isEmpty()) {
            return BotMessageFactory.simpleMessage(chatId, "Активных серверов нет.");
        }
        StringBuilder sb = new StringBuilder("📡 Статус прокси\n");
        for (ProxyServer s : servers) {
            sb.append("\n").append(s.getAddress()).append(":\n");
            Map<String, Double> m = proxyMetricsClient.fetchMetrics(s.getAddress());
            if (m.isEmpty()) {
                sb.append(proxyMetricsClient.isHealthy(s.getAddress()) ? "⚠️ Метрик нет\n" : "❌ Недоступен\n");
                continue;
            }
            sb.append("🔌 Подключения клиентов: ").append(counter(m, ProxyMetricsClient.CLIENT_CONNECTIONS)).append("\n")
                    .append("📡 Подключения к Telegram: ").append(counter(m, ProxyMetricsClient.TELEGRAM_CONNECTIONS)).append("\n")
                    .append("🌐 Domain fronting: ").append(counter(m, ProxyMetricsClient.DOMAIN_FRONTING)).append("\n")
                    .append("🛡 Заблокировано replay-атак: ").append(counter(m, ProxyMetricsClient.REPLAY_ATTACKS)).append("\n")
                    .append("⚠️ Ограничено по конкуренции: ").append(counter(m, ProxyMetricsClient.CONCURRENCY_LIMITED)).append("\n");
        }
        return BotMessageFactory.simpleMessage(chatId, sb.toString());
    }

    private void handleAddServer(Long chatId, String text, List<SendMessage> out) {
        String[] parts = text.split("\\s+", 3);
        if (parts.length < 2 || parts[0].isBlank()) {
            out.add(BotMessageFactory.simpleMessage(chatId, "Некорректный формат. Пример: proxy.example.com 443 Франкфурт"));
            return;
        }
        int port;
        try {
            port = Integer.parseInt(parts[1]);
        } catch (NumberFormatException e) {
            throw new InvalidPortException(parts[1]);
        }
        String description = parts.length > 2 ? parts[2] : null;
        ProxyServer server = proxyServerService.add(parts[0], port, description);
        adminStateService.clear(chatId);
        out.add(BotMessageFactory.simpleMessage(chatId,
                "✅ Сервер добавлен: " + server.getAddress() + ":" + server.getPort() + " (" + server.getDescription() + ")"));
    }

    private void handleGrant(Long chatId, String text, List<SendMessage> out) {
        String[] parts = text.split("\\s+");
        Long telegramId = parts.length < 2 ? null : parseLong(parts[0]);
        Long days = parts.length < 2 ? null : parseLong(parts[1]);
        if (telegramId == null || days == null || days > Integer.MAX_VALUE || days < Integer.MIN_VALUE) {
            out.add(BotMessageFactory.simpleMessage(chatId, "Некорректный формат. Пример: 123456789 30"));
            return;
        }
        Entitlement e = subscriptionService.adminGrant(telegramId, days.intValue());
        adminStateService.clear(chatId);
        out.add(BotMessageFactory.simpleMessage(chatId,
                "✅ Подписка выдана на " + days + " дн. Действует до: " + BotTextUtils.formatDate(e.expiresAt())));
    }

    private void handleSetActive(Long chatId, String text, boolean active, List<SendMessage> out) {
        Long telegramId = parseLong(text.split("\\s+")[0]);
        if (telegramId == null) {
            out.add(BotMessageFactory.simpleMessage(chatId, "Нужно указать числовой Telegram ID."));
            return;
        }
        userService.setActive(telegramId, active);
        adminStateService.clear(chatId);
        log.info("User {} {} by admin", telegramId, active ? "enabled" : "disabled");
        out.add(BotMessageFactory.simpleMessage(chatId, active ? "✅ Пользователь включён." : "🚫 Пользователь отключён."));
    }

    private static long counter(Map<String, Double> metrics, String name) {
        return metrics.getOrDefault(name, 0.0).longValue();
    }

    private static Long parseLong(String raw) {
        if (raw == null) return null;
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
