package ru.tgproxy.proxybot.services;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import ru.tgproxy.proxybot.config.SubscriptionProperties;
import ru.tgproxy.proxybot.entities.Payment;
import ru.tgproxy.proxybot.entities.User;
import ru.tgproxy.proxybot.exceptions.AlreadyEntitledException;
import ru.tgproxy.proxybot.exceptions.InvalidDurationException;
import ru.tgproxy.proxybot.exceptions.NotFoundException;
import ru.tgproxy.proxybot.exceptions.TrialAlreadyUsedException;
import ru.tgproxy.proxybot.repositories.PaymentRepository;
import ru.tgproxy.proxybot.repositories.UserRepository;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class SubscriptionServiceTest {

    private static final Instant T0 = Instant.parse("2024-03-01T12:00:00Z");

    private UserRepository userRepository;
    private PaymentRepository paymentRepository;
    private MutableClock clock;
    private SubscriptionService service;

    @BeforeEach
    void setUp() {
        userRepository = mock(UserRepository.class);
        paymentRepository = mock(PaymentRepository.class);
        clock = new MutableClock(T0);
        SubscriptionProperties props = new SubscriptionProperties(new BigDecimal("5.00"), "RUB", 30, 1);
        service = new SubscriptionService(userRepository, paymentRepository, props, clock);
        when(userRepository.save(any(User.class))).thenAnswer(inv -> inv.getArgument(0));
        when(paymentRepository.save(any(Payment.class))).thenAnswer(inv -> inv.getArgument(0));
    }

    @Test
    void userWithoutSubscriptionIsNotEntitled() {
        User user = user(1L, null);

        assertFalse(service.isEntitled(user));
        assertTrue(service.isTrialEligible(user));
        assertEquals(Duration.ZERO, service.getTimeLeft(user));
    }

    @Test
    void expiryEqualToNowIsNotEntitled() {
        User user = user(1L, T0);

        assertFalse(service.isEntitled(user));

        clock.set(T0.minusSeconds(1));
        assertTrue(service.isEntitled(user));
    }

    @Test
    void trialCanBeTakenOnlyOnce() {
        User user = user(1L, null);

        Entitlement e = service.grantTrial(user);

        assertTrue(e.entitled());
        assertEquals(T0.plus(Duration.ofDays(1)), e.expiresAt());
        assertThrows(AlreadyEntitledException.class, () -> service.grantTrial(user));

        clock.advance(Duration.ofDays(2));
        assertThrows(TrialAlreadyUsedException.class, () -> service.grantTrial(user));
        assertFalse(service.isTrialEligible(user));
    }

    @Test
    void paymentExtendsFromRemainingTime() {
        User user = user(1L, T0.plus(Duration.ofDays(10)));

        Entitlement e = service.applyPayment(user, new BigDecimal("5.00"), "RUB", "ch_1");

        assertEquals(T0.plus(Duration.ofDays(40)), e.expiresAt());
        ArgumentCaptor<Payment> captor = ArgumentCaptor.forClass(Payment.class);
        verify(paymentRepository).save(captor.capture());
        assertEquals(Payment.Status.COMPLETED, captor.getValue().getStatus());
        assertEquals("ch_1", captor.getValue().getProviderPaymentId());
        assertSame(user, captor.getValue().getUser());
    }

    @Test
    void paymentAfterExpiryStartsFromNow() {
        User user = user(1L, T0.minus(Duration.ofDays(5)));

        Entitlement e = service.applyPayment(user, new BigDecimal("5.00"), "RUB", "ch_2");

        assertEquals(T0.plus(Duration.ofDays(30)), e.expiresAt());
    }

    @Test
    void trialThenExpiryThenPayment() {
        User user = user(1L, null);

        service.grantTrial(user);
        clock.advance(Duration.ofDays(1).plusHours(1));
        assertFalse(service.isEntitled(user));
        assertThrows(TrialAlreadyUsedException.class, () -> service.grantTrial(user));

        Entitlement e = service.applyPayment(user, new BigDecimal("5.00"), "RUB", "ch_3");

        assertTrue(e.entitled());
        assertEquals(clock.instant().plus(Duration.ofDays(30)), e.expiresAt());
    }

    @Test
    void detachedCallerCopyReceivesNewExpiry() {
        User detached = user(1L, null);
        User managed = user(1L, null);
        when(userRepository.lockUser(1L)).thenReturn(managed);

        service.grantTrial(detached);

        assertEquals(managed.getSubscriptionUntil(), detached.getSubscriptionUntil());
    }

    @Test
    void adminGrantRejectsNonPositiveDays() {
        assertThrows(InvalidDurationException.class, () -> service.adminGrant(42L, 0));
        assertThrows(InvalidDurationException.class, () -> service.adminGrant(42L, -3));
        verifyNoInteractions(paymentRepository);
    }

    @Test
    void trialWithNonPositiveLengthIsRejected() {
        User user = user(1L, null);

        assertThrows(InvalidDurationException.class, () -> service.grantTrial(user, Duration.ZERO));
        assertThrows(InvalidDurationException.class, () -> service.grantTrial(user, Duration.ofDays(-1)));
        assertNull(user.getSubscriptionUntil());
        assertTrue(service.isTrialEligible(user));
    }

    @Test
    void paymentIsStampedWithServiceClock() {
        User user = user(1L, null);

        service.applyPayment(user, new BigDecimal("5.00"), "RUB", "ch_9");

        ArgumentCaptor<Payment> captor = ArgumentCaptor.forClass(Payment.class);
        verify(paymentRepository).save(captor.capture());
        assertEquals(T0, captor.getValue().getCreatedAt());
    }

    @Test
    void adminGrantForUnknownUserFails() {
        when(userRepository.lockUserByTelegramId(42L)).thenReturn(Optional.empty());

        assertThrows(NotFoundException.class, () -> service.adminGrant(42L, 7));
    }

    @Test
    void adminGrantAddsDaysWithoutPayment() {
        User user = user(1L, T0.plus(Duration.ofDays(3)));
        when(userRepository.lockUserByTelegramId(42L)).thenReturn(Optional.of(user));

        Entitlement e = service.adminGrant(42L, 7);

        assertEquals(T0.plus(Duration.ofDays(10)), e.expiresAt());
        verify(paymentRepository, never()).save(any());
    }

    private User user(Long id, Instant until) {
        User u = new User();
        u.setId(id);
        u.setTelegramId(42L);
        u.setSubscriptionUntil(until);
        when(userRepository.lockUser(id)).thenReturn(u);
        return u;
    }
}
