package ru.tgproxy.proxybot.services;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import ru.tgproxy.proxybot.entities.ProxyConfig;
import ru.tgproxy.proxybot.entities.ProxyServer;
import ru.tgproxy.proxybot.entities.User;
import ru.tgproxy.proxybot.exceptions.NoActiveServersException;
import ru.tgproxy.proxybot.exceptions.NotEntitledException;
import ru.tgproxy.proxybot.exceptions.NotFoundException;
import ru.tgproxy.proxybot.repositories.ProxyConfigRepository;
import ru.tgproxy.proxybot.repositories.UserRepository;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Конфиги прокси пользователя: по одному на каждый активный сервер.
 * Набор выдаётся и заменяется только целиком, под блокировкой строки пользователя.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProxyConfigService {

    private final ProxyConfigRepository proxyConfigRepository;
    private final UserRepository userRepository;
    private final SubscriptionService subscriptionService;
    private final ProxyServerService proxyServerService;
    private final ProxySecretGenerator secretGenerator;
    private final Clock clock;

    @Transactional(readOnly = true)
    public List<ProxyConfig> listConfigs(User user) {
        if (user == null || user.getId() == null) return List.of();
        return proxyConfigRepository.findByUserId(user.getId());
    }

    @Transactional
    public List<ProxyConfig> ensureConfigs(User user) {
        return ensureConfigs(user, proxyServerService.listActiveOrSeed());
    }

    /**
     * Идемпотентно: если конфиги уже есть, возвращаются они же без изменений.
     */
    @Transactional
    public List<ProxyConfig> ensureConfigs(User user, List<ProxyServer> servers) {
        User locked = lockEntitled(user);

        List<ProxyConfig> existing = proxyConfigRepository.findByUserId(locked.getId());
        if (!existing.isEmpty()) {
            return existing;
        }
        if (servers == null || servers.isEmpty()) {
            throw new NoActiveServersException();
        }

        List<ProxyConfig> created = issue(locked, servers);
        log.info("Issued {} proxy configs for telegramId={}", created.size(), locked.getTelegramId());
        return created;
    }

    @Transactional
    public List<ProxyConfig> rotateConfigs(User user) {
        return rotateConfigs(user, proxyServerService.listActiveOrSeed());
    }

    /**
     * Удаление старого набора и вставка нового - одна транзакция: параллельный читатель
     * видит либо весь старый набор, либо весь новый.
     */
    @Transactional
    public List<ProxyConfig> rotateConfigs(User user, List<ProxyServer> servers) {
        User locked = lockEntitled(user);
        // без серверов пользователь остался бы вообще без конфигов - старые не трогаем
        if (servers == null || servers.isEmpty()) {
            throw new NoActiveServersException();
        }

        int removed = proxyConfigRepository.deleteByUserId(locked.getId());
        List<ProxyConfig> created = issue(locked, servers);
        log.info("Rotated proxy configs for telegramId={}: removed={}, issued={}",
                locked.getTelegramId(), removed, created.size());
        return created;
    }

    private User lockEntitled(User user) {
        if (user == null || user.getId() == null) {
            throw new IllegalArgumentException("User is required");
        }
        User locked = userRepository.lockUser(user.getId());
        if (locked == null) {
            throw NotFoundException.user(user.getTelegramId());
        }
        // повторная проверка уже под блокировкой: подписка могла истечь после проверки в боте
        if (!subscriptionService.isEntitled(locked)) {
            throw new NotEntitledException();
        }
        return locked;
    }

    private List<ProxyConfig> issue(User owner, List<ProxyServer> servers) {
        List<ProxyConfig> batch = new ArrayList<>(servers.size());
        for (ProxyServer server : servers) {
            ProxyConfig config = new ProxyConfig();
            config.setUser(owner);
            config.setServerAddress(server.getAddress());
            config.setPort(server.getPort());
            config.setProxySecret(secretGenerator.newSecret());
            config.setCreatedAt(clock.instant());
            batch.add(config);
        }
        return proxyConfigRepository.saveAll(batch);
    }
}
