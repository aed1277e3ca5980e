package ru.tgproxy.proxybot.services;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.telegram.telegrambots.meta.api.methods.AnswerPreCheckoutQuery;
import org.telegram.telegrambots.meta.api.methods.invoices.SendInvoice;
import org.telegram.telegrambots.meta.api.objects.payments.LabeledPrice;
import org.telegram.telegrambots.meta.api.objects.payments.PreCheckoutQuery;
import org.telegram.telegrambots.meta.api.objects.payments.SuccessfulPayment;
import ru.tgproxy.proxybot.config.PaymentProperties;
import ru.tgproxy.proxybot.config.SubscriptionProperties;
import ru.tgproxy.proxybot.entities.User;
import ru.tgproxy.proxybot.exceptions.NotFoundException;
import ru.tgproxy.proxybot.repositories.PaymentRepository;
import ru.tgproxy.proxybot.repositories.UserRepository;

import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class PaymentService {

    static final String PAYLOAD_PREFIX = "subscription_";

    private final PaymentRepository paymentRepository;
    private final UserRepository userRepository;
    private final SubscriptionService subscriptionService;
    private final SubscriptionProperties subscriptionProperties;
    private final PaymentProperties paymentProperties;

    public SendInvoice buildInvoice(Long chatId, Long telegramId) {
        return SendInvoice.builder()
                .chatId(chatId.toString())
                .title("Подписка на MTProto прокси")
                .description("Доступ к прокси-серверам на " + subscriptionProperties.durationDays() + " дн.")
                .payload(PAYLOAD_PREFIX + telegramId)
                .providerToken(paymentProperties.providerToken())
                .currency(subscriptionProperties.currency())
                .prices(List.of(new LabeledPrice("Подписка", subscriptionProperties.priceMinorUnits())))
                .build();
    }

    /**
     * Подтверждаем только счета, выставленные этим ботом этому же пользователю и по текущей цене.
     */
    public AnswerPreCheckoutQuery checkPreCheckout(PreCheckoutQuery query) {
        String error = null;
        Long fromId = query.getFrom() == null ? null : query.getFrom().getId();
        if (fromId == null || !(PAYLOAD_PREFIX + fromId).equals(query.getInvoicePayload())) {
            error = "Счёт не найден. Попробуйте оформить оплату заново.";
        } else if (!subscriptionProperties.currency().equalsIgnoreCase(query.getCurrency())
                || query.getTotalAmount() == null
                || query.getTotalAmount() != subscriptionProperties.priceMinorUnits()) {
            error = "Цена изменилась. Попробуйте оформить оплату заново.";
        }

        if (error != null) {
            log.warn("Pre-checkout rejected: id={}, from={}, payload={}", query.getId(), fromId, query.getInvoicePayload());
        }
        AnswerPreCheckoutQuery.AnswerPreCheckoutQueryBuilder b = AnswerPreCheckoutQuery.builder()
                .preCheckoutQueryId(query.getId())
                .ok(error == null);
        if (error != null) {
            b.errorMessage(error);
        }
        return b.build();
    }

    public PaymentNotification fromSuccessfulPayment(Long telegramId, SuccessfulPayment payment) {
        String ref = payment.getProviderPaymentChargeId();
        if (ref == null || ref.isBlank()) {
            ref = payment.getTelegramPaymentChargeId();
        }
        return new PaymentNotification(
                telegramId,
                payment.getTotalAmount() == null ? 0 : payment.getTotalAmount(),
                payment.getCurrency(),
                ref
        );
    }

    /**
     * Повторная доставка того же платежа (тот же providerReference) период не продлевает.
     */
    @Transactional
    public Entitlement processPayment(PaymentNotification notification) {
        // проверка на дубликат и запись платежа - под одной блокировкой пользователя
        User user = userRepository.lockUserByTelegramId(notification.externalUserId())
                .orElseThrow(() -> NotFoundException.user(notification.externalUserId()));

        String ref = notification.providerReference();
        if (ref != null && !ref.isBlank() && paymentRepository.existsByProviderPaymentId(ref)) {
            log.warn("Duplicate payment notification ignored: ref={}, telegramId={}", ref, user.getTelegramId());
            return subscriptionService.getEntitlement(user);
        }

        return subscriptionService.applyPayment(
                user,
                notification.amountMajorUnits(),
                notification.currencyCode(),
                ref
        );
    }
}
