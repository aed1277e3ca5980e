package ru.tgproxy.proxybot.controllers;

import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import ru.tgproxy.proxybot.config.PaymentProperties;
import ru.tgproxy.proxybot.exceptions.NotFoundException;
import ru.tgproxy.proxybot.services.Entitlement;
import ru.tgproxy.proxybot.services.PaymentNotification;
import ru.tgproxy.proxybot.services.PaymentService;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class PaymentWebhookControllerTest {

    private final PaymentService paymentService = mock(PaymentService.class);
    private final PaymentNotification notification = new PaymentNotification(42L, 500, "RUB", "ref-1");

    @Test
    void wrongSecretIsUnauthorized() {
        PaymentWebhookController controller = new PaymentWebhookController(paymentService, new PaymentProperties("t", "s3cret"));

        ResponseEntity<?> response = controller.handleWebhook(notification, "nope");

        assertEquals(HttpStatus.UNAUTHORIZED, response.getStatusCode());
        verifyNoInteractions(paymentService);
    }

    @Test
    void missingSecretIsUnauthorizedWhenConfigured() {
        PaymentWebhookController controller = new PaymentWebhookController(paymentService, new PaymentProperties("t", "s3cret"));

        assertEquals(HttpStatus.UNAUTHORIZED, controller.handleWebhook(notification, null).getStatusCode());
    }

    @Test
    void validNotificationReturnsEntitlement() {
        PaymentWebhookController controller = new PaymentWebhookController(paymentService, new PaymentProperties("t", "s3cret"));
        Entitlement e = new Entitlement(true, Instant.parse("2024-04-01T00:00:00Z"));
        when(paymentService.processPayment(notification)).thenReturn(e);

        ResponseEntity<?> response = controller.handleWebhook(notification, "s3cret");

        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertSame(e, response.getBody());
    }

    @Test
    void unknownUserIsNotFound() {
        PaymentWebhookController controller = new PaymentWebhookController(paymentService, new PaymentProperties("t", "s3cret"));
        when(paymentService.processPayment(any())).thenThrow(NotFoundException.user(42L));

        assertEquals(HttpStatus.NOT_FOUND, controller.handleWebhook(notification, "s3cret").getStatusCode());
    }

    @Test
    void endpointIsClosedWithoutConfiguredSecret() {
        PaymentWebhookController blank = new PaymentWebhookController(paymentService, new PaymentProperties("t", ""));
        PaymentWebhookController unset = new PaymentWebhookController(paymentService, new PaymentProperties("t", null));

        assertEquals(HttpStatus.UNAUTHORIZED, blank.handleWebhook(notification, null).getStatusCode());
        assertEquals(HttpStatus.UNAUTHORIZED, blank.handleWebhook(notification, "").getStatusCode());
        assertEquals(HttpStatus.UNAUTHORIZED, unset.handleWebhook(notification, "anything").getStatusCode());
        verifyNoInteractions(paymentService);
    }

    @Test
    void incompleteNotificationsAreBadRequests() {
        PaymentWebhookController controller = new PaymentWebhookController(paymentService, new PaymentProperties("t", "s3cret"));

        assertEquals(HttpStatus.BAD_REQUEST,
                controller.handleWebhook(new PaymentNotification(null, 500, "RUB", "r"), "s3cret").getStatusCode());
        assertEquals(HttpStatus.BAD_REQUEST,
                controller.handleWebhook(new PaymentNotification(42L, 500, null, "r"), "s3cret").getStatusCode());
        assertEquals(HttpStatus.BAD_REQUEST,
                controller.handleWebhook(new PaymentNotification(42L, 500, "RUB", " "), "s3cret").getStatusCode());
        assertEquals(HttpStatus.BAD_REQUEST,
                controller.handleWebhook(new PaymentNotification(42L, 0, "RUB", "r"), "s3cret").getStatusCode());
        verifyNoInteractions(paymentService);
    }
}
