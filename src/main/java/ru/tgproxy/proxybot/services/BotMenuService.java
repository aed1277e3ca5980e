package ru.tgproxy.proxybot.services;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.InlineKeyboardMarkup;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.buttons.InlineKeyboardButton;
import ru.tgproxy.proxybot.config.SubscriptionProperties;
import ru.tgproxy.proxybot.entities.ProxyConfig;
import ru.tgproxy.proxybot.entities.ProxyServer;
import ru.tgproxy.proxybot.entities.User;
import ru.tgproxy.proxybot.utils.BotMessageFactory;
import ru.tgproxy.proxybot.utils.BotTextUtils;

import java.util.ArrayList;
import java.util.List;

@Service
@RequiredArgsConstructor
public class BotMenuService {

    public static final String CB_GET_CONFIG = "get_config";
    public static final String CB_REFRESH_CONFIG = "refresh_config";
    public static final String CB_STATUS = "status";
    public static final String CB_SUBSCRIBE = "subscribe";
    public static final String CB_FREE_TRIAL = "free_trial";

    public static final String CB_ADMIN_MENU = "ADMIN_MENU";
    public static final String CB_ADMIN_SERVERS = "ADMIN_SERVERS";
    public static final String CB_ADMIN_ADD_SERVER = "ADMIN_ADD_SERVER";
    public static final String CB_ADMIN_STATS = "ADMIN_STATS";
    public static final String CB_ADMIN_USERS = "ADMIN_USERS";
    public static final String CB_ADMIN_PAYMENTS = "ADMIN_PAYMENTS";
    public static final String CB_ADMIN_GRANT = "ADMIN_GRANT";
    public static final String CB_ADMIN_DISABLE_USER = "ADMIN_DISABLE_USER";
    public static final String CB_ADMIN_ENABLE_USER = "ADMIN_ENABLE_USER";
    public static final String CB_ADMIN_PROXY_STATUS = "ADMIN_PROXY_STATUS";
    public static final String SERVER_TOGGLE_PREFIX = "SERVER_TOGGLE:";

    private final SubscriptionService subscriptionService;
    private final SubscriptionProperties subscriptionProperties;

    public SendMessage mainMenu(Long chatId, User user, boolean isAdmin) {
        String name = BotTextUtils.escapeHtml(user.displayName());
        boolean entitled = subscriptionService.isEntitled(user);

        List<List<InlineKeyboardButton>> rows = new ArrayList<>();
        String text;
        if (entitled) {
            text = "С возвращением, " + name + "! 🎉\n\n" +
                    "Подписка активна до " + BotTextUtils.formatDate(user.getSubscriptionUntil()) + ".\n" +
                    "Нажмите кнопку ниже или отправьте /config, чтобы получить настройки прокси.";
            rows.add(List.of(button("🔗 Получить прокси", CB_GET_CONFIG)));
            rows.add(List.of(button("📊 Статус подписки", CB_STATUS)));
        } else {
            text = "Добро пожаловать, " + name + "! 🚀\n\n" +
                    "Быстрый доступ к Telegram через наши MTProto прокси-серверы.\n\n" +
                    "💰 Подписка: " + priceLabel() + " / " + subscriptionProperties.durationDays() + " дн.\n" +
                    "🔒 Протокол MTProto\n" +
                    "🌍 Несколько серверов\n\n" +
                    "Выберите вариант ниже:";
            rows.addAll(subscriptionRows(user));
        }
        if (isAdmin) {
            rows.add(List.of(button("🛠 Админ-панель", CB_ADMIN_MENU)));
        }
        return BotMessageFactory.htmlMessage(chatId, text, markup(rows));
    }

    /**
     * Отдельно различаем "подписка истекла" и "подписки не было".
     */
    public SendMessage subscriptionRequired(Long chatId, User user) {
        String text = user.getSubscriptionUntil() == null
                ? "❌ У вас нет подписки.\n\nОформите подписку, чтобы получить настройки прокси."
                : "⌛ Ваша подписка истекла " + BotTextUtils.formatDate(user.getSubscriptionUntil()) + ".\n\n" +
                "Продлите подписку, чтобы снова получить доступ к прокси.";
        return BotMessageFactory.htmlMessage(chatId, text, markup(subscriptionRows(user)));
    }

    public SendMessage configMessage(Long chatId, List<ProxyConfig> configs, boolean rotated) {
        StringBuilder sb = new StringBuilder();
        sb.append(rotated ? "🔄 Конфигурация обновлена, старые ссылки больше не работают.\n\n" : "🔗 Ваши прокси:\n\n");
        int i = 1;
        for (ProxyConfig c : configs) {
            sb.append("<b>Сервер ").append(i++).append(":</b>\n")
                    .append("Адрес: <code>").append(BotTextUtils.escapeHtml(c.getServerAddress())).append("</code>\n")
                    .append("Порт: <code>").append(c.getPort()).append("</code>\n")
                    .append("Секрет: <code>").append(BotTextUtils.escapeHtml(c.getProxySecret())).append("</code>\n")
                    .append("<a href=\"").append(BotTextUtils.escapeHtml(c.shareLink())).append("\">Подключиться</a>\n")
                    .append("<code>").append(BotTextUtils.escapeHtml(c.tgLink())).append("</code>\n\n");
        }
        sb.append("📌 Нажмите «Подключиться» или скопируйте ссылку tg:// в Telegram.");
        return BotMessageFactory.htmlMessage(chatId, sb.toString(),
                markup(List.of(List.of(button("🔄 Обновить конфигурацию", CB_REFRESH_CONFIG)))));
    }

    public SendMessage statusMessage(Long chatId, User user) {
        String text;
        List<List<InlineKeyboardButton>> rows = new ArrayList<>();
        if (subscriptionService.isEntitled(user)) {
            text = "✅ Подписка активна\n\n" +
                    "🗓 До: " + BotTextUtils.formatDate(user.getSubscriptionUntil()) + "\n" +
                    "⏳ Осталось: " + BotTextUtils.formatTimeLeft(subscriptionService.getTimeLeft(user));
            rows.add(List.of(button("🔗 Получить прокси", CB_GET_CONFIG)));
            rows.add(List.of(button("💳 Продлить", CB_SUBSCRIBE)));
        } else if (user.getSubscriptionUntil() != null) {
            text = "⌛ Подписка истекла " + BotTextUtils.formatDate(user.getSubscriptionUntil());
            rows.addAll(subscriptionRows(user));
        } else {
            text = "❌ Подписки нет";
            rows.addAll(subscriptionRows(user));
        }
        return BotMessageFactory.htmlMessage(chatId, text, markup(rows));
    }

    public SendMessage paymentSucceeded(Long chatId, Entitlement entitlement) {
        String text = "✅ Оплата прошла!\n\n" +
                "Подписка активна до " + BotTextUtils.formatDate(entitlement.expiresAt()) + "\n\n" +
                "Нажмите кнопку ниже или отправьте /config, чтобы получить настройки прокси.";
        return BotMessageFactory.htmlMessage(chatId, text,
                markup(List.of(List.of(button("🔗 Получить прокси", CB_GET_CONFIG)))));
    }

    public SendMessage trialActivated(Long chatId, Entitlement entitlement) {
        String text = "🎉 Пробный период активирован!\n\n" +
                "Доступ открыт до " + BotTextUtils.formatDate(entitlement.expiresAt()) + ".";
        return BotMessageFactory.htmlMessage(chatId, text,
                markup(List.of(List.of(button("🔗 Получить прокси", CB_GET_CONFIG)))));
    }

    public SendMessage helpMessage(Long chatId) {
        String text = "📘 Команды:\n\n" +
                "/start - главное меню\n" +
                "/config - получить настройки прокси\n" +
                "/status - статус подписки\n" +
                "/help - эта справка\n\n" +
                "💰 Подписка: " + priceLabel() + " на " + subscriptionProperties.durationDays() + " дн.\n" +
                "🎁 Пробный период: " + subscriptionProperties.trialDays() + " дн. (один раз)";
        return BotMessageFactory.htmlMessage(chatId, text, null);
    }

    public SendMessage adminMenu(Long chatId) {
        List<List<InlineKeyboardButton>> rows = List.of(
                List.of(button("🖥 Серверы", CB_ADMIN_SERVERS), button("➕ Добавить сервер", CB_ADMIN_ADD_SERVER)),
                List.of(button("📈 Статистика", CB_ADMIN_STATS), button("📡 Статус прокси", CB_ADMIN_PROXY_STATUS)),
                List.of(button("👥 Пользователи", CB_ADMIN_USERS), button("💳 Платежи", CB_ADMIN_PAYMENTS)),
                List.of(button("🎁 Выдать подписку", CB_ADMIN_GRANT)),
                List.of(button("🚫 Отключить пользователя", CB_ADMIN_DISABLE_USER)),
                List.of(button("✅ Включить пользователя", CB_ADMIN_ENABLE_USER))
        );
        return BotMessageFactory.htmlMessage(chatId, "🛠 Админ-панель", markup(rows));
    }

    public SendMessage serversMenu(Long chatId, List<ProxyServer> servers) {
        StringBuilder sb = new StringBuilder("🖥 Серверы\n\n");
        List<List<InlineKeyboardButton>> rows = new ArrayList<>();
        if (servers.isEmpty()) {
            sb.append("Серверов нет. Добавьте сервер или укажите proxy.servers в настройках.");
        }
        for (ProxyServer s : servers) {
            sb.append(s.isActive() ? "🟢 " : "🔴 ")
                    .append("<code>").append(BotTextUtils.escapeHtml(s.getAddress())).append(":").append(s.getPort()).append("</code>");
            if (s.getDescription() != null && !s.getDescription().isBlank()) {
                sb.append(" - ").append(BotTextUtils.escapeHtml(s.getDescription()));
            }
            sb.append("\n");
            rows.add(List.of(button(
                    (s.isActive() ? "Выключить " : "Включить ") + s.getAddress(),
                    SERVER_TOGGLE_PREFIX + s.getId())));
        }
        rows.add(List.of(button("➕ Добавить сервер", CB_ADMIN_ADD_SERVER)));
        rows.add(List.of(button("⬅️ Назад", CB_ADMIN_MENU)));
        return BotMessageFactory.htmlMessage(chatId, sb.toString(), markup(rows));
    }

    private List<List<InlineKeyboardButton>> subscriptionRows(User user) {
        List<List<InlineKeyboardButton>> rows = new ArrayList<>();
        rows.add(List.of(button("💳 Оформить за " + priceLabel(), CB_SUBSCRIBE)));
        if (subscriptionService.isTrialEligible(user)) {
            rows.add(List.of(button("🎁 Пробный период", CB_FREE_TRIAL)));
        }
        return rows;
    }

    private String priceLabel() {
        return subscriptionProperties.price().toPlainString() + " " + subscriptionProperties.currency();
    }

    private static InlineKeyboardButton button(String text, String data) {
        return InlineKeyboardButton.builder()
                .text(text)
                .callbackData(data)
                .build();
    }

    private static InlineKeyboardMarkup markup(List<List<InlineKeyboardButton>> rows) {
        return InlineKeyboardMarkup.builder()
                .keyboard(rows)
                .build();
    }
}
