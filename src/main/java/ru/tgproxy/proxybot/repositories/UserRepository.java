package ru.tgproxy.proxybot.repositories;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import ru.tgproxy.proxybot.entities.User;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public interface UserRepository extends JpaRepository<User, Long> {
    Optional<User> findUserByTelegramId(Long telegramId);

    /**
     * Блокировку надо брать до первого чтения пользователя в транзакции: уже загруженную
     * сущность Hibernate вернёт из контекста без перечитывания строки.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select u from User u where u.id = :id")
    User lockUser(@Param("id") Long id);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select u from User u where u.telegramId = :telegramId")
    Optional<User> lockUserByTelegramId(@Param("telegramId") Long telegramId);

    long countBySubscriptionUntilAfter(Instant now);

    List<User> findTop10ByOrderByCreatedAtDesc();
}
