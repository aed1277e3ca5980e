package ru.tgproxy.proxybot.services;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;
import ru.tgproxy.proxybot.entities.User;
import ru.tgproxy.proxybot.exceptions.NotFoundException;
import ru.tgproxy.proxybot.repositories.UserRepository;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

@Slf4j
@Service
public class UserService {

    private final UserRepository userRepository;
    private final Clock clock;
    private final TransactionTemplate insertTx;

    public UserService(UserRepository userRepository, Clock clock, PlatformTransactionManager transactionManager) {
        this.userRepository = userRepository;
        this.clock = clock;
        this.insertTx = new TransactionTemplate(transactionManager);
        this.insertTx.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    /**
     * Пользователь создаётся при первом обращении, telegram_id уникален.
     * Вставка идёт в отдельной транзакции: при гонке двух апдейтов проигравший
     * получает нарушение уникальности и перечитывает уже созданную строку.
     */
    public User registerOrUpdate(org.telegram.telegrambots.meta.api.objects.User tgUser) {
        Long telegramId = tgUser.getId();
        String username = tgUser.getUserName();
        String firstName = tgUser.getFirstName();

        Optional<User> existing = userRepository.findUserByTelegramId(telegramId);
        if (existing.isPresent()) {
            return refreshProfile(existing.get(), username, firstName);
        }

        User u = new User();
        u.setTelegramId(telegramId);
        u.setUsername(username);
        u.setFirstName(firstName);
        u.setCreatedAt(clock.instant());
        try {
            return insertTx.execute(status -> userRepository.saveAndFlush(u));
        } catch (DataIntegrityViolationException e) {
            log.debug("User {} was registered concurrently, re-reading", telegramId);
            return userRepository.findUserByTelegramId(telegramId)
                    .orElseThrow(() -> e);
        }
    }

    @Transactional(readOnly = true)
    public Optional<User> findByTelegramId(Long telegramId) {
        return userRepository.findUserByTelegramId(telegramId);
    }

    @Transactional
    public User setActive(Long telegramId, boolean active) {
        User user = userRepository.findUserByTelegramId(telegramId)
                .orElseThrow(() -> NotFoundException.user(telegramId));
        user.setActive(active);
        return userRepository.save(user);
    }

    @Transactional(readOnly = true)
    public List<User> listRecent() {
        return userRepository.findTop10ByOrderByCreatedAtDesc();
    }

    private User refreshProfile(User user, String username, String firstName) {
        boolean changed = false;
        if (username != null && !Objects.equals(username, user.getUsername())) {
            user.setUsername(username);
            changed = true;
        }
        if (firstName != null && !Objects.equals(firstName, user.getFirstName())) {
            user.setFirstName(firstName);
            changed = true;
        }
        return changed ? userRepository.save(user) : user;
    }
}
