package ru.tgproxy.proxybot.services;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.transaction.PlatformTransactionManager;
import ru.tgproxy.proxybot.config.ProxyProperties;
import ru.tgproxy.proxybot.entities.ProxyServer;
import ru.tgproxy.proxybot.exceptions.DuplicateAddressException;
import ru.tgproxy.proxybot.exceptions.InvalidPortException;
import ru.tgproxy.proxybot.exceptions.NotFoundException;
import ru.tgproxy.proxybot.repositories.ProxyServerRepository;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class ProxyServerServiceTest {

    private static final Instant T0 = Instant.parse("2024-03-01T12:00:00Z");

    private ProxyServerRepository repository;
    private MutableClock clock;
    private ProxyServerService service;

    @BeforeEach
    void setUp() {
        repository = mock(ProxyServerRepository.class);
        ProxyProperties props = new ProxyProperties(List.of("a.com:443", "b.com"), 8080,
                Duration.ofSeconds(5), Duration.ofSeconds(5));
        clock = new MutableClock(T0);
        service = new ProxyServerService(repository, props, clock, mock(PlatformTransactionManager.class));
        when(repository.save(any(ProxyServer.class))).thenAnswer(inv -> inv.getArgument(0));
    }

    @Test
    void seedFillsEmptyCatalogWithDefaultPort() {
        when(repository.count()).thenReturn(0L);

        int added = service.seedFromConfig(List.of("a.com:443", "b.com"));

        assertEquals(2, added);
        ArgumentCaptor<ProxyServer> captor = ArgumentCaptor.forClass(ProxyServer.class);
        verify(repository, times(2)).save(captor.capture());
        ProxyServer a = captor.getAllValues().get(0);
        ProxyServer b = captor.getAllValues().get(1);
        assertEquals("a.com", a.getAddress());
        assertEquals(443, a.getPort());
        assertEquals("Server a.com", a.getDescription());
        assertTrue(a.isActive());
        assertEquals("b.com", b.getAddress());
        assertEquals(443, b.getPort());
    }

    @Test
    void seedIsNoOpWhenCatalogHasRows() {
        when(repository.count()).thenReturn(2L);

        assertEquals(0, service.seedFromConfig(List.of("a.com:443", "b.com")));
        verify(repository, never()).save(any());
    }

    @Test
    void seedSkipsMalformedEntries() {
        when(repository.count()).thenReturn(0L);

        int added = service.seedFromConfig(List.of("c.com:notaport", ":443", "d.com:70000", "e.com:8443"));

        assertEquals(1, added);
        ArgumentCaptor<ProxyServer> captor = ArgumentCaptor.forClass(ProxyServer.class);
        verify(repository).save(captor.capture());
        assertEquals("e.com", captor.getValue().getAddress());
        assertEquals(8443, captor.getValue().getPort());
    }

    @Test
    void listActiveOrSeedSeedsFromProperties() {
        when(repository.count()).thenReturn(0L);
        List<ProxyServer> active = List.of(new ProxyServer("a.com", 443, "Server a.com"));
        when(repository.findByActiveTrueOrderByIdAsc()).thenReturn(active);

        assertEquals(active, service.listActiveOrSeed());
        verify(repository, times(2)).save(any(ProxyServer.class));
    }

    @Test
    void concurrentSeedingConflictStillListsServers() {
        when(repository.count()).thenReturn(0L);
        when(repository.save(any(ProxyServer.class)))
                .thenThrow(new DataIntegrityViolationException("ux_proxy_servers_address"));
        List<ProxyServer> active = List.of(new ProxyServer("a.com", 443, "Server a.com"));
        when(repository.findByActiveTrueOrderByIdAsc()).thenReturn(active);

        assertEquals(active, service.listActiveOrSeed());
    }

    @Test
    void startupSeedingSkipsFilledCatalog() {
        when(repository.count()).thenReturn(3L);

        service.seedOnStartup();

        verify(repository, never()).save(any());
    }

    @Test
    void timestampsComeFromClock() {
        ProxyServer saved = service.add("c.com", 443, null);
        assertEquals(T0, saved.getCreatedAt());
        assertEquals(T0, saved.getUpdatedAt());

        saved.setId(7L);
        when(repository.findById(7L)).thenReturn(Optional.of(saved));
        clock.advance(Duration.ofHours(1));
        service.setActive(7L, false);

        assertEquals(T0, saved.getCreatedAt());
        assertEquals(T0.plus(Duration.ofHours(1)), saved.getUpdatedAt());
    }

    @Test
    void addRejectsDuplicateAddress() {
        when(repository.existsByAddress("a.com")).thenReturn(true);

        assertThrows(DuplicateAddressException.class, () -> service.add("a.com", 443, null));
        verify(repository, never()).save(any());
    }

    @Test
    void addRejectsPortOutOfRange() {
        assertThrows(InvalidPortException.class, () -> service.add("a.com", 0, null));
        assertThrows(InvalidPortException.class, () -> service.add("a.com", 65536, null));
        verify(repository, never()).existsByAddress(anyString());
    }

    @Test
    void addUsesDefaultDescription() {
        ProxyServer saved = service.add("  c.com ", 8443, " ");

        assertEquals("c.com", saved.getAddress());
        assertEquals(8443, saved.getPort());
        assertEquals("Server c.com", saved.getDescription());
    }

    @Test
    void toggleFlipsActiveFlag() {
        ProxyServer server = new ProxyServer("a.com", 443, "x");
        server.setId(5L);
        when(repository.findById(5L)).thenReturn(Optional.of(server));

        assertFalse(service.toggle(5L).isActive());
        assertTrue(service.toggle(5L).isActive());
    }

    @Test
    void toggleUnknownServerFails() {
        when(repository.findById(99L)).thenReturn(Optional.empty());

        assertThrows(NotFoundException.class, () -> service.toggle(99L));
        assertThrows(NotFoundException.class, () -> service.setActive(99L, true));
    }

    @Test
    void findByIdDelegatesToRepository() {
        ProxyServer server = new ProxyServer("a.com", 443, "x");
        when(repository.findById(5L)).thenReturn(Optional.of(server));

        assertEquals(Optional.of(server), service.findById(5L));
        assertTrue(service.findById(6L).isEmpty());
    }

    @Test
    void hostPortParsing() {
        assertEquals(Optional.of(new ProxyServerService.HostPort("h", 443)), ProxyServerService.HostPort.parse("h"));
        assertEquals(Optional.of(new ProxyServerService.HostPort("h", 8443)), ProxyServerService.HostPort.parse(" h:8443 "));
        assertTrue(ProxyServerService.HostPort.parse("h:").isEmpty());
        assertTrue(ProxyServerService.HostPort.parse("  ").isEmpty());
    }
}
