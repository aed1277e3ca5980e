package ru.tgproxy.proxybot.services;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
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
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Владелец users.subscription_until. Все изменения идут под pessimistic-lock строки пользователя,
 * поэтому параллельные запросы одного пользователя выполняются по очереди.
 */
@Slf4j
@Service
public class SubscriptionService {

    private final UserRepository userRepository;
    private final PaymentRepository paymentRepository;
    private final SubscriptionProperties properties;
    private final Clock clock;

    public SubscriptionService(
            UserRepository userRepository,
            PaymentRepository paymentRepository,
            SubscriptionProperties properties,
            Clock clock) {
        this.userRepository = userRepository;
        this.paymentRepository = paymentRepository;
        this.properties = properties;
        this.clock = clock;
    }

    public boolean isEntitled(User user) {
        if (user == null || user.getSubscriptionUntil() == null) return false;
        return clock.instant().isBefore(user.getSubscriptionUntil());
    }

    public boolean isTrialEligible(User user) {
        return user != null && user.getSubscriptionUntil() == null;
    }

    public Entitlement getEntitlement(User user) {
        return new Entitlement(isEntitled(user), user == null ? null : user.getSubscriptionUntil());
    }

    public Duration getTimeLeft(User user) {
        if (!isEntitled(user)) return Duration.ZERO;
        return Duration.between(clock.instant(), user.getSubscriptionUntil());
    }

    @Transactional
    public Entitlement grantTrial(User user) {
        return grantTrial(user, properties.trialDuration());
    }

    @Transactional
    public Entitlement grantTrial(User user, Duration duration) {
        if (duration == null || duration.isZero() || duration.isNegative()) {
            throw new InvalidDurationException(duration == null ? 0 : duration.toDays());
        }
        User locked = lock(user);

        if (isEntitled(locked)) {
            throw new AlreadyEntitledException();
        }
        // пробный период только для тех, у кого доступа не было никогда (даже истёкшего)
        if (locked.getSubscriptionUntil() != null) {
            throw new TrialAlreadyUsedException();
        }

        locked.setSubscriptionUntil(clock.instant().plus(duration));
        userRepository.save(locked);
        log.info("Trial granted: telegramId={}, until={}", locked.getTelegramId(), locked.getSubscriptionUntil());
        return result(user, locked);
    }

    @Transactional
    public Entitlement applyPayment(User user, BigDecimal amount, String currency, String providerRef) {
        User locked = lock(user);

        Payment payment = new Payment(locked, amount, currency, Payment.Status.COMPLETED);
        payment.setProviderPaymentId(providerRef);
        payment.setCreatedAt(clock.instant());
        paymentRepository.save(payment);

        extend(locked, properties.duration());
        log.info("Payment applied: telegramId={}, amount={} {}, ref={}, until={}",
                locked.getTelegramId(), amount, currency, providerRef, locked.getSubscriptionUntil());
        return result(user, locked);
    }

    @Transactional
    public Entitlement adminGrant(Long telegramId, int days) {
        if (days <= 0) {
            throw new InvalidDurationException(days);
        }
        User user = userRepository.lockUserByTelegramId(telegramId)
                .orElseThrow(() -> NotFoundException.user(telegramId));
        return adminGrant(user, days);
    }

    @Transactional
    public Entitlement adminGrant(User user, int days) {
        if (days <= 0) {
            throw new InvalidDurationException(days);
        }
        User locked = lock(user);
        extend(locked, Duration.ofDays(days));
        log.info("Admin grant: telegramId={}, days={}, until={}",
                locked.getTelegramId(), days, locked.getSubscriptionUntil());
        return result(user, locked);
    }

    /**
     * Неистёкший остаток всегда сохраняется, истёкшее время в новый период не засчитывается.
     */
    private void extend(User locked, Duration period) {
        Instant start = isEntitled(locked) ? locked.getSubscriptionUntil() : clock.instant();
        locked.setSubscriptionUntil(start.plus(period));
        userRepository.save(locked);
    }

    private User lock(User user) {
        if (user == null || user.getId() == null) {
            throw new IllegalArgumentException("User is required");
        }
        User locked = userRepository.lockUser(user.getId());
        if (locked == null) {
            throw NotFoundException.user(user.getTelegramId());
        }
        return locked;
    }

    /** Вызывающий мог держать отсоединённую копию пользователя - возвращаем в неё новое значение. */
    private Entitlement result(User user, User locked) {
        if (user != locked) {
            user.setSubscriptionUntil(locked.getSubscriptionUntil());
        }
        return getEntitlement(locked);
    }
}
