package ru.tgproxy.proxybot.services;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.telegram.telegrambots.meta.api.methods.AnswerPreCheckoutQuery;
import org.telegram.telegrambots.meta.api.methods.invoices.SendInvoice;
import org.telegram.telegrambots.meta.api.objects.payments.PreCheckoutQuery;
import org.telegram.telegrambots.meta.api.objects.payments.SuccessfulPayment;
import ru.tgproxy.proxybot.config.PaymentProperties;
import ru.tgproxy.proxybot.config.SubscriptionProperties;
import ru.tgproxy.proxybot.entities.User;
import ru.tgproxy.proxybot.exceptions.NotFoundException;
import ru.tgproxy.proxybot.repositories.PaymentRepository;
import ru.tgproxy.proxybot.repositories.UserRepository;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class PaymentServiceTest {

    private PaymentRepository paymentRepository;
    private UserRepository userRepository;
    private SubscriptionService subscriptionService;
    private PaymentService service;

    @BeforeEach
    void setUp() {
        paymentRepository = mock(PaymentRepository.class);
        userRepository = mock(UserRepository.class);
        subscriptionService = mock(SubscriptionService.class);
        SubscriptionProperties props = new SubscriptionProperties(new BigDecimal("5.00"), "RUB", 30, 1);
        service = new PaymentService(paymentRepository, userRepository, subscriptionService, props,
                new PaymentProperties("provider-token", "secret"));
    }

    @Test
    void amountIsConvertedFromMinorUnits() {
        assertEquals(new BigDecimal("5.00"), new PaymentNotification(1L, 500, "RUB", "r").amountMajorUnits());
        assertEquals(new BigDecimal("0.99"), new PaymentNotification(1L, 99, "RUB", "r").amountMajorUnits());
    }

    @Test
    void processPaymentAppliesMajorUnits() {
        User user = user();
        Entitlement expected = new Entitlement(true, Instant.parse("2024-04-01T00:00:00Z"));
        when(subscriptionService.applyPayment(eq(user), any(), anyString(), anyString())).thenReturn(expected);

        Entitlement e = service.processPayment(new PaymentNotification(42L, 500, "RUB", "ch_1"));

        assertSame(expected, e);
        verify(userRepository).lockUserByTelegramId(42L);
        verify(userRepository, never()).findUserByTelegramId(any());
        verify(subscriptionService).applyPayment(user, new BigDecimal("5.00"), "RUB", "ch_1");
    }

    @Test
    void duplicateReferenceDoesNotExtendAgain() {
        User user = user();
        when(paymentRepository.existsByProviderPaymentId("ch_1")).thenReturn(true);
        Entitlement current = new Entitlement(true, Instant.parse("2024-04-01T00:00:00Z"));
        when(subscriptionService.getEntitlement(user)).thenReturn(current);

        Entitlement e = service.processPayment(new PaymentNotification(42L, 500, "RUB", "ch_1"));

        assertSame(current, e);
        verify(subscriptionService, never()).applyPayment(any(), any(), any(), any());
    }

    @Test
    void unknownUserFails() {
        when(userRepository.lockUserByTelegramId(7L)).thenReturn(Optional.empty());

        assertThrows(NotFoundException.class,
                () -> service.processPayment(new PaymentNotification(7L, 500, "RUB", "ch_1")));
        verifyNoInteractions(subscriptionService);
    }

    @Test
    void invoiceIsPricedInMinorUnits() {
        SendInvoice invoice = service.buildInvoice(10L, 42L);

        assertEquals("10", invoice.getChatId());
        assertEquals("subscription_42", invoice.getPayload());
        assertEquals("RUB", invoice.getCurrency());
        assertEquals("provider-token", invoice.getProviderToken());
        assertEquals(500, invoice.getPrices().get(0).getAmount());
    }

    @Test
    void preCheckoutApprovedForOwnInvoice() {
        AnswerPreCheckoutQuery answer = service.checkPreCheckout(query(42L, "subscription_42", "RUB", 500));

        assertTrue(answer.getOk());
        assertNull(answer.getErrorMessage());
    }

    @Test
    void preCheckoutRejectsForeignPayload() {
        AnswerPreCheckoutQuery answer = service.checkPreCheckout(query(42L, "subscription_43", "RUB", 500));

        assertFalse(answer.getOk());
        assertNotNull(answer.getErrorMessage());
    }

    @Test
    void preCheckoutRejectsChangedPrice() {
        assertFalse(service.checkPreCheckout(query(42L, "subscription_42", "RUB", 400)).getOk());
        assertFalse(service.checkPreCheckout(query(42L, "subscription_42", "USD", 500)).getOk());
    }

    @Test
    void successfulPaymentFallsBackToTelegramChargeId() {
        SuccessfulPayment sp = new SuccessfulPayment();
        sp.setCurrency("RUB");
        sp.setTotalAmount(500);
        sp.setTelegramPaymentChargeId("tg_1");

        PaymentNotification n = service.fromSuccessfulPayment(42L, sp);

        assertEquals(new PaymentNotification(42L, 500, "RUB", "tg_1"), n);

        sp.setProviderPaymentChargeId("prov_1");
        assertEquals("prov_1", service.fromSuccessfulPayment(42L, sp).providerReference());
    }

    private User user() {
        User u = new User();
        u.setId(1L);
        u.setTelegramId(42L);
        when(userRepository.lockUserByTelegramId(42L)).thenReturn(Optional.of(u));
        return u;
    }

    private static PreCheckoutQuery query(long fromId, String payload, String currency, int amount) {
        PreCheckoutQuery q = new PreCheckoutQuery();
        q.setId("pcq");
        org.telegram.telegrambots.meta.api.objects.User from = new org.telegram.telegrambots.meta.api.objects.User();
        from.setId(fromId);
        q.setFrom(from);
        q.setInvoicePayload(payload);
        q.setCurrency(currency);
        q.setTotalAmount(amount);
        return q;
    }
}
