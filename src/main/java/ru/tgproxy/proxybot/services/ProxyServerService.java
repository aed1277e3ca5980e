package ru.tgproxy.proxybot.services;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;
import ru.tgproxy.proxybot.config.ProxyProperties;
import ru.tgproxy.proxybot.entities.ProxyServer;
import ru.tgproxy.proxybot.exceptions.DuplicateAddressException;
import ru.tgproxy.proxybot.exceptions.InvalidPortException;
import ru.tgproxy.proxybot.exceptions.NotFoundException;
import ru.tgproxy.proxybot.repositories.ProxyServerRepository;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

@Slf4j
@Service
public class ProxyServerService {

    private final ProxyServerRepository proxyServerRepository;
    private final ProxyProperties proxyProperties;
    private final Clock clock;
    private final TransactionTemplate seedTx;

    public ProxyServerService(
            ProxyServerRepository proxyServerRepository,
            ProxyProperties proxyProperties,
            Clock clock,
            PlatformTransactionManager transactionManager) {
        this.proxyServerRepository = proxyServerRepository;
        this.proxyProperties = proxyProperties;
        this.clock = clock;
        this.seedTx = new TransactionTemplate(transactionManager);
        this.seedTx.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    @EventListener(ApplicationReadyEvent.class)
    public void seedOnStartup() {
        seedDefaults();
    }

    @Transactional(readOnly = true)
    public List<ProxyServer> listActive() {
        return proxyServerRepository.findByActiveTrueOrderByIdAsc();
    }

    @Transactional(readOnly = true)
    public List<ProxyServer> listAll() {
        return proxyServerRepository.findAllByOrderByIdAsc();
    }

    @Transactional(readOnly = true)
    public Optional<ProxyServer> findById(long serverId) {
        return proxyServerRepository.findById(serverId);
    }

    /**
     * Каталог пустой - заполняем из proxy.servers, иначе ничего не делаем
     * (повторный вызов не должен плодить дубликаты).
     */
    @Transactional
    public int seedFromConfig(List<String> defaults) {
        if (proxyServerRepository.count() > 0 || defaults == null) {
            return 0;
        }
        int added = 0;
        for (String raw : defaults) {
            Optional<HostPort> parsed = HostPort.parse(raw);
            if (parsed.isEmpty()) {
                log.warn("Skipping malformed proxy server entry '{}'", raw);
                continue;
            }
            HostPort hp = parsed.get();
            if (proxyServerRepository.existsByAddress(hp.host())) {
                continue;
            }
            proxyServerRepository.save(newServer(hp.host(), hp.port(), defaultDescription(hp.host())));
            added++;
        }
        if (added > 0) {
            log.info("Seeded {} proxy servers from configuration", added);
        }
        return added;
    }

    @Transactional
    public List<ProxyServer> listActiveOrSeed() {
        seedDefaults();
        return listActive();
    }

    @Transactional
    public List<ProxyServer> listAllOrSeed() {
        seedDefaults();
        return listAll();
    }

    /**
     * Заполнение идёт в своей транзакции: если параллельный запрос успел вставить те же адреса,
     * транзакция вызывающего остаётся рабочей.
     */
    int seedDefaults() {
        if (proxyServerRepository.count() > 0) {
            return 0;
        }
        try {
            Integer added = seedTx.execute(status -> seedFromConfig(proxyProperties.servers()));
            return added == null ? 0 : added;
        } catch (DataIntegrityViolationException e) {
            log.info("Proxy catalog already seeded by a concurrent request: {}", e.getMostSpecificCause().getMessage());
            return 0;
        }
    }

    @Transactional
    public ProxyServer add(String address, int port, String description) {
        if (port < 1 || port > 65535) {
            throw new InvalidPortException(String.valueOf(port));
        }
        String normalized = address == null ? "" : address.trim();
        if (normalized.isEmpty()) {
            throw new IllegalArgumentException("Server address is required");
        }
        if (proxyServerRepository.existsByAddress(normalized)) {
            throw new DuplicateAddressException(normalized);
        }
        String desc = description == null || description.isBlank() ? defaultDescription(normalized) : description.trim();
        ProxyServer saved = proxyServerRepository.save(newServer(normalized, port, desc));
        log.info("Proxy server added: id={}, {}:{}", saved.getId(), saved.getAddress(), saved.getPort());
        return saved;
    }

    /**
     * Уже выданные конфиги не трогаем: доступ к выключенному серверу отзывается только ротацией.
     */
    @Transactional
    public ProxyServer setActive(long serverId, boolean active) {
        ProxyServer server = proxyServerRepository.findById(serverId)
                .orElseThrow(() -> NotFoundException.server(serverId));
        server.setActive(active);
        server.setUpdatedAt(clock.instant());
        ProxyServer saved = proxyServerRepository.save(server);
        log.info("Proxy server {} ({}) {}", serverId, server.getAddress(), active ? "activated" : "deactivated");
        return saved;
    }

    @Transactional
    public ProxyServer toggle(long serverId) {
        ProxyServer server = proxyServerRepository.findById(serverId)
                .orElseThrow(() -> NotFoundException.server(serverId));
        return setActive(serverId, !server.isActive());
    }

    private ProxyServer newServer(String address, int port, String description) {
        ProxyServer server = new ProxyServer(address, port, description);
        server.setCreatedAt(clock.instant());
        server.setUpdatedAt(server.getCreatedAt());
        return server;
    }

    private static String defaultDescription(String host) {
        return "Server " + host;
    }

    record HostPort(String host, int port) {

        static Optional<HostPort> parse(String raw) {
            if (raw == null || raw.isBlank()) return Optional.empty();
            String t = raw.trim();
            int idx = t.lastIndexOf(':');
            if (idx < 0) {
                return Optional.of(new HostPort(t, ProxyServer.DEFAULT_PORT));
            }
            String host = t.substring(0, idx).trim();
            String portPart = t.substring(idx + 1).trim();
            if (host.isEmpty()) return Optional.empty();
            try {
                int port = Integer.parseInt(portPart);
                if (port < 1 || port > 65535) return Optional.empty();
                return Optional.of(new HostPort(host, port));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
    }
}
