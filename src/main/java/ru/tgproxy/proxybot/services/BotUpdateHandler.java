package ru.tgproxy.proxybot.services;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.telegram.telegrambots.meta.api.methods.BotApiMethod;
import org.telegram.telegrambots.meta.api.objects.CallbackQuery;
import org.telegram.telegrambots.meta.api.objects.Message;
import org.telegram.telegrambots.meta.api.objects.Update;
import ru.tgproxy.proxybot.entities.ProxyConfig;
import ru.tgproxy.proxybot.entities.User;
import ru.tgproxy.proxybot.exceptions.AlreadyEntitledException;
import ru.tgproxy.proxybot.exceptions.NoActiveServersException;
import ru.tgproxy.proxybot.exceptions.NotEntitledException;
import ru.tgproxy.proxybot.exceptions.ProxyBotException;
import ru.tgproxy.proxybot.exceptions.TrialAlreadyUsedException;
import ru.tgproxy.proxybot.utils.BotMessageFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Разбирает апдейт и возвращает список вызовов Bot API. Сам ничего не отправляет.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BotUpdateHandler {

    private static final String DISABLED_TEXT = "🚫 Ваш доступ отключён. Обратитесь к администратору.";
    private static final String GENERIC_ERROR = "⚠️ Что-то пошло не так. Попробуйте ещё раз позже.";

    private final BotMenuService botMenuService;
    private final AdminService adminService;
    private final AdminStateService adminStateService;
    private final AdminFlowService adminFlowService;
    private final UserService userService;
    private final SubscriptionService subscriptionService;
    private final ProxyConfigService proxyConfigService;
    private final PaymentService paymentService;
    private final IdempotencyService idempotencyService;

    public List<BotApiMethod<?>> handle(Update update) {
        if (update == null) return List.of();
        if (update.hasPreCheckoutQuery()) {
            return List.of(paymentService.checkPreCheckout(update.getPreCheckoutQuery()));
        }
        Long chatId = chatIdOf(update);
        try {
            if (update.hasMessage() && update.getMessage().hasSuccessfulPayment()) {
                return handleSuccessfulPayment(update.getMessage());
            }
            if (update.hasMessage() && update.getMessage().hasText()) {
                return handleMessage(update.getMessage());
            }
            if (update.hasCallbackQuery()) {
                return handleCallback(update.getCallbackQuery());
            }
        } catch (DataAccessException e) {
            log.error("Database error while handling update {}", update.getUpdateId(), e);
            return chatId == null ? List.of() : List.of(BotMessageFactory.simpleMessage(chatId, GENERIC_ERROR));
        }
        return List.of();
    }

    private List<BotApiMethod<?>> handleMessage(Message message) {
        List<BotApiMethod<?>> out = new ArrayList<>();
        String text = message.getText().trim();
        Long chatId = message.getChatId();
        var from = message.getFrom();
        boolean isAdmin = adminService.isAdmin(from.getId());

        User user = userService.registerOrUpdate(from);

        if (isAdmin) {
            if ("/admin".equalsIgnoreCase(text)) {
                adminStateService.clear(chatId);
                out.add(botMenuService.adminMenu(chatId));
                return out;
            }
            Optional<AdminAction> pending = adminStateService.get(chatId);
            if (pending.isPresent() && !text.startsWith("/start")) {
                if ("/cancel".equalsIgnoreCase(text)) {
                    adminStateService.clear(chatId);
                    out.add(BotMessageFactory.simpleMessage(chatId, "✅ Действие отменено."));
                    return out;
                }
                out.addAll(adminFlowService.handleAdminInput(chatId, from.getId(), text, pending.get()));
                return out;
            }
        } else if ("/admin".equalsIgnoreCase(text)) {
            out.add(BotMessageFactory.simpleMessage(chatId, adminService.authorize(from.getId()).reason()));
            return out;
        }

        if (!user.isActive() && !isAdmin) {
            out.add(BotMessageFactory.simpleMessage(chatId, DISABLED_TEXT));
            return out;
        }

        String command = commandOf(text);
        switch (command) {
            case "/start" -> out.add(botMenuService.mainMenu(chatId, user, isAdmin));
            case "/help" -> out.add(botMenuService.helpMessage(chatId));
            case "/config" -> sendConfig(out, chatId, user);
            case "/status" -> out.add(botMenuService.statusMessage(chatId, user));
            case "/cancel" -> out.add(BotMessageFactory.simpleMessage(chatId, "Нечего отменять."));
            default -> out.add(botMenuService.helpMessage(chatId));
        }
        return out;
    }

    private List<BotApiMethod<?>> handleCallback(CallbackQuery cq) {
        List<BotApiMethod<?>> out = new ArrayList<>();
        String data = cq.getData() == null ? "" : cq.getData();
        String callbackId = cq.getId();
        if (cq.getMessage() == null) {
            out.add(BotMessageFactory.callbackAnswer(callbackId, null));
            return out;
        }
        Long chatId = cq.getMessage().getChatId();
        Integer messageId = cq.getMessage().getMessageId();
        Long fromId = cq.getFrom().getId();
        boolean isAdmin = adminService.isAdmin(fromId);
        boolean answered = false;

        User user = userService.registerOrUpdate(cq.getFrom());
        if (!user.isActive() && !isAdmin) {
            out.add(BotMessageFactory.simpleMessage(chatId, DISABLED_TEXT));
            out.add(BotMessageFactory.callbackAnswer(callbackId, null));
            return out;
        }

        if (data.startsWith(BotMenuService.SERVER_TOGGLE_PREFIX)) {
            out.add(BotMessageFactory.editFromSendMessage(
                    adminFlowService.toggleServer(chatId, fromId, data.substring(BotMenuService.SERVER_TOGGLE_PREFIX.length())),
                    chatId, messageId));
        } else {
            switch (data) {
                case BotMenuService.CB_GET_CONFIG -> {
                    if (!acquireIdempotency(out, callbackId, BotMenuService.CB_GET_CONFIG, user.getId())) {
                        return out;
                    }
                    sendConfig(out, chatId, user);
                }
                case BotMenuService.CB_REFRESH_CONFIG -> {
                    if (!acquireIdempotency(out, callbackId, BotMenuService.CB_REFRESH_CONFIG, user.getId())) {
                        return out;
                    }
                    answered = refreshConfig(out, chatId, messageId, callbackId, user);
                }
                case BotMenuService.CB_STATUS -> out.add(botMenuService.statusMessage(chatId, user));
                case BotMenuService.CB_SUBSCRIBE -> {
                    if (!acquireIdempotency(out, callbackId, BotMenuService.CB_SUBSCRIBE, user.getId())) {
                        return out;
                    }
                    out.add(paymentService.buildInvoice(chatId, fromId));
                }
                case BotMenuService.CB_FREE_TRIAL -> answered = freeTrial(out, chatId, messageId, callbackId, user);
                case BotMenuService.CB_ADMIN_MENU -> {
                    adminStateService.clear(chatId);
                    if (adminService.authorize(fromId).allowed()) {
                        out.add(BotMessageFactory.editFromSendMessage(botMenuService.adminMenu(chatId), chatId, messageId));
                    }
                }
                case BotMenuService.CB_ADMIN_SERVERS -> out.add(adminFlowService.serversMessage(chatId, fromId));
                case BotMenuService.CB_ADMIN_STATS -> out.add(adminFlowService.statsMessage(chatId, fromId));
                case BotMenuService.CB_ADMIN_USERS -> out.add(adminFlowService.recentUsersMessage(chatId, fromId));
                case BotMenuService.CB_ADMIN_PAYMENTS -> out.add(adminFlowService.recentPaymentsMessage(chatId, fromId));
                case BotMenuService.CB_ADMIN_PROXY_STATUS -> out.add(adminFlowService.proxyStatusMessage(chatId, fromId));
                case BotMenuService.CB_ADMIN_ADD_SERVER -> out.add(adminFlowService.prompt(chatId, fromId, AdminAction.ADD_SERVER));
                case BotMenuService.CB_ADMIN_GRANT -> out.add(adminFlowService.prompt(chatId, fromId, AdminAction.GRANT_SUBSCRIPTION));
                case BotMenuService.CB_ADMIN_DISABLE_USER -> out.add(adminFlowService.prompt(chatId, fromId, AdminAction.DISABLE_USER));
                case BotMenuService.CB_ADMIN_ENABLE_USER -> out.add(adminFlowService.prompt(chatId, fromId, AdminAction.ENABLE_USER));
                default -> log.debug("Unknown callback data '{}' from {}", data, fromId);
            }
        }

        if (!answered) {
            out.add(BotMessageFactory.callbackAnswer(callbackId, null));
        }
        return out;
    }

    private List<BotApiMethod<?>> handleSuccessfulPayment(Message message) {
        Long chatId = message.getChatId();
        Long telegramId = message.getFrom().getId();
        userService.registerOrUpdate(message.getFrom());
        PaymentNotification notification = paymentService.fromSuccessfulPayment(telegramId, message.getSuccessfulPayment());
        try {
            Entitlement entitlement = paymentService.processPayment(notification);
            return List.of(botMenuService.paymentSucceeded(chatId, entitlement));
        } catch (ProxyBotException e) {
            log.error("Payment {} for {} was not applied: {}", notification.providerReference(), telegramId, e.getMessage());
            return List.of(BotMessageFactory.simpleMessage(chatId,
                    "⚠️ Оплата получена, но подписку не удалось продлить. Напишите администратору."));
        }
    }

    private void sendConfig(List<BotApiMethod<?>> out, Long chatId, User user) {
        if (!subscriptionService.isEntitled(user)) {
            out.add(botMenuService.subscriptionRequired(chatId, user));
            return;
        }
        try {
            List<ProxyConfig> configs = proxyConfigService.ensureConfigs(user);
            out.add(botMenuService.configMessage(chatId, configs, false));
        } catch (NotEntitledException e) {
            out.add(botMenuService.subscriptionRequired(chatId, user));
        } catch (NoActiveServersException e) {
            log.warn("No active servers for telegramId={}", user.getTelegramId());
            out.add(BotMessageFactory.simpleMessage(chatId, "⚠️ Сейчас нет доступных серверов. Попробуйте позже."));
        }
    }

    private boolean refreshConfig(List<BotApiMethod<?>> out, Long chatId, Integer messageId, String callbackId, User user) {
        try {
            List<ProxyConfig> configs = proxyConfigService.rotateConfigs(user);
            out.add(BotMessageFactory.editFromSendMessage(
                    botMenuService.configMessage(chatId, configs, true), chatId, messageId));
            out.add(BotMessageFactory.callbackAnswer(callbackId, "Конфигурация обновлена!"));
        } catch (NotEntitledException e) {
            out.add(BotMessageFactory.callbackAlert(callbackId, "Подписка истекла!"));
        } catch (NoActiveServersException e) {
            out.add(BotMessageFactory.callbackAlert(callbackId, "Сейчас нет доступных серверов, старые ссылки сохранены."));
        }
        return true;
    }

    private boolean freeTrial(List<BotApiMethod<?>> out, Long chatId, Integer messageId, String callbackId, User user) {
        try {
            Entitlement e = subscriptionService.grantTrial(user);
            out.add(BotMessageFactory.editFromSendMessage(
                    botMenuService.trialActivated(chatId, e), chatId, messageId));
            out.add(BotMessageFactory.callbackAnswer(callbackId, null));
        } catch (AlreadyEntitledException e) {
            out.add(BotMessageFactory.callbackAlert(callbackId, "У вас уже есть активная подписка!"));
        } catch (TrialAlreadyUsedException e) {
            out.add(BotMessageFactory.callbackAlert(callbackId, "Пробный период уже использован."));
        }
        return true;
    }

    private boolean acquireIdempotency(List<BotApiMethod<?>> out, String callbackId, String action, Long userId) {
        try {
            if (idempotencyService.startAction(action, userId)) {
                return true;
            }
        } catch (Exception e) {
            log.warn("Idempotency check failed: {}", e.getMessage());
            return true;
        }
        out.add(BotMessageFactory.callbackAnswer(callbackId, "Запрос уже выполняется. Подождите немного."));
        return false;
    }

    /** "/config@MyBot arg" -> "/config" */
    private static String commandOf(String text) {
        String first = text.split("\\s+", 2)[0];
        int at = first.indexOf('@');
        return (at > 0 ? first.substring(0, at) : first).toLowerCase();
    }

    private static Long chatIdOf(Update update) {
        if (update.hasMessage()) return update.getMessage().getChatId();
        if (update.hasCallbackQuery() && update.getCallbackQuery().getMessage() != null) {
            return update.getCallbackQuery().getMessage().getChatId();
        }
        return null;
    }
}
