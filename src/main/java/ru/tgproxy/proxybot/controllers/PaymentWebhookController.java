package ru.tgproxy.proxybot.controllers;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import ru.tgproxy.proxybot.config.PaymentProperties;
import ru.tgproxy.proxybot.exceptions.NotFoundException;
import ru.tgproxy.proxybot.services.Entitlement;
import ru.tgproxy.proxybot.services.PaymentNotification;
import ru.tgproxy.proxybot.services.PaymentService;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Map;

/**
 * Уведомления об оплате от внешнего провайдера. Повторная доставка безопасна:
 * дубликат по providerReference период не продлевает.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/webhooks/payments")
public class PaymentWebhookController {

    static final String SECRET_HEADER = "X-Webhook-Secret";

    private final PaymentService paymentService;
    private final PaymentProperties properties;

    @PostMapping
    public ResponseEntity<?> handleWebhook(
            @RequestBody PaymentNotification notification,
            @RequestHeader(value = SECRET_HEADER, required = false) String secret) {
        if (!isAuthorized(secret)) {
            log.warn("Payment webhook rejected: bad secret");
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(Map.of("error", "unauthorized"));
        }
        String invalid = validate(notification);
        if (invalid != null) {
            return ResponseEntity.badRequest().body(Map.of("error", invalid));
        }
        try {
            Entitlement entitlement = paymentService.processPayment(notification);
            return ResponseEntity.ok(entitlement);
        } catch (NotFoundException e) {
            log.warn("Payment webhook for unknown user {}", notification.externalUserId());
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", e.getMessage()));
        }
    }

    /**
     * Тело уведомления у провайдера не перепроверяется, поэтому без настроенного секрета
     * эндпоинт закрыт полностью.
     */
    private boolean isAuthorized(String provided) {
        String expected = properties.webhookSecret();
        if (expected == null || expected.isBlank() || provided == null) {
            return false;
        }
        return MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.UTF_8),
                provided.getBytes(StandardCharsets.UTF_8));
    }

    private static String validate(PaymentNotification n) {
        if (n == null || n.externalUserId() == null) return "externalUserId is required";
        if (n.amountMinorUnits() <= 0) return "amountMinorUnits must be positive";
        if (n.currencyCode() == null || n.currencyCode().isBlank()) return "currencyCode is required";
        if (n.providerReference() == null || n.providerReference().isBlank()) return "providerReference is required";
        return null;
    }
}
