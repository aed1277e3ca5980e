package ru.tgproxy.proxybot.repositories;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import ru.tgproxy.proxybot.entities.ProxyConfig;

import java.util.List;

@Repository
public interface ProxyConfigRepository extends JpaRepository<ProxyConfig, Long> {

    @Query("""
           select c from ProxyConfig c
           where c.user.id = :userId
           order by c.id asc
           """)
    List<ProxyConfig> findByUserId(@Param("userId") long userId);

    @Modifying(flushAutomatically = true)
    @Query("delete from ProxyConfig c where c.user.id = :userId")
    int deleteByUserId(@Param("userId") long userId);
}
