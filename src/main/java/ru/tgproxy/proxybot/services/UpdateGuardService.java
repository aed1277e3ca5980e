package ru.tgproxy.proxybot.services;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.telegram.telegrambots.meta.api.methods.BotApiMethod;
import org.telegram.telegrambots.meta.api.objects.Update;
import ru.tgproxy.proxybot.utils.BotMessageFactory;

import java.util.List;

/**
 * Отсекает повторно доставленные апдейты и слишком частые запросы до бизнес-логики.
 * Если Redis недоступен, апдейт пропускается дальше.
 */
@Slf4j
@Service
public class UpdateGuardService {

    private final RateLimiterService rateLimiterService;
    private final IdempotencyService idempotencyService;

    public UpdateGuardService(RateLimiterService rateLimiterService, IdempotencyService idempotencyService) {
        this.rateLimiterService = rateLimiterService;
        this.idempotencyService = idempotencyService;
    }

    public GuardResult guard(Update update) {
        GuardContext ctx = GuardContext.from(update);
        if (ctx.userId != null && ctx.chatId != null) {
            try {
                RateLimiterService.Decision decision = rateLimiterService.check(ctx.userId);
                if (!decision.allowed()) {
                    String notice = "Слишком часто. Повторите через " + decision.retryAfterSeconds() + " сек.";
                    BotApiMethod<?> response = ctx.callbackId != null
                            ? BotMessageFactory.callbackAnswer(ctx.callbackId, notice)
                            : BotMessageFactory.simpleMessage(ctx.chatId, notice);
                    return GuardResult.blocked(List.of(response));
                }
            } catch (Exception e) {
                log.warn("Rate limit check failed: {}", e.getMessage());
            }
        }

        Integer updateId = update == null ? null : update.getUpdateId();
        if (updateId != null) {
            try {
                if (!idempotencyService.firstDelivery(updateId)) {
                    log.debug("Duplicate update {} dropped", updateId);
                    return GuardResult.blocked(List.of());
                }
            } catch (Exception e) {
                log.warn("Update idempotency check failed: {}", e.getMessage());
            }
        }

        return GuardResult.allowed();
    }

    public record GuardResult(boolean blocked, List<BotApiMethod<?>> responses) {
        public static GuardResult allowed() {
            return new GuardResult(false, List.of());
        }

        public static GuardResult blocked(List<BotApiMethod<?>> responses) {
            return new GuardResult(true, responses == null ? List.of() : responses);
        }
    }

    /**
     * Платёжные апдейты (pre-checkout, successful_payment) лимитом не режем:
     * на pre-checkout Telegram ждёт ответ, а успешную оплату терять нельзя.
     */
    private static final class GuardContext {
        final Long chatId;
        final Long userId;
        final String callbackId;

        private GuardContext(Long chatId, Long userId, String callbackId) {
            this.chatId = chatId;
            this.userId = userId;
            this.callbackId = callbackId;
        }

        static GuardContext from(Update update) {
            if (update == null) return new GuardContext(null, null, null);
            if (update.hasMessage() && update.getMessage().getFrom() != null
                    && !update.getMessage().hasSuccessfulPayment()) {
                return new GuardContext(
                        update.getMessage().getChatId(),
                        update.getMessage().getFrom().getId(),
                        null
                );
            }
            if (update.hasCallbackQuery() && update.getCallbackQuery().getFrom() != null
                    && update.getCallbackQuery().getMessage() != null) {
                return new GuardContext(
                        update.getCallbackQuery().getMessage().getChatId(),
                        update.getCallbackQuery().getFrom().getId(),
                        update.getCallbackQuery().getId()
                );
            }
            return new GuardContext(null, null, null);
        }
    }
}
