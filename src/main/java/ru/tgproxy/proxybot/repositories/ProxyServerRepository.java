package ru.tgproxy.proxybot.repositories;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import ru.tgproxy.proxybot.entities.ProxyServer;

import java.util.List;

@Repository
public interface ProxyServerRepository extends JpaRepository<ProxyServer, Long> {
    List<ProxyServer> findByActiveTrueOrderByIdAsc();

    List<ProxyServer> findAllByOrderByIdAsc();

    boolean existsByAddress(String address);

    long countByActiveTrue();
}
