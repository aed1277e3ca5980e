package ru.tgproxy.proxybot.repositories;

import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import ru.tgproxy.proxybot.entities.Payment;

import java.math.BigDecimal;
import java.util.List;

@Repository
public interface PaymentRepository extends JpaRepository<Payment, Long> {
    boolean existsByProviderPaymentId(String providerPaymentId);

    long countByStatus(Payment.Status status);

    @Query("select coalesce(sum(p.amount), 0) from Payment p where p.status = :status")
    BigDecimal sumAmountByStatus(@Param("status") Payment.Status status);

    @EntityGraph(attributePaths = "user")
    List<Payment> findTop10ByOrderByCreatedAtDesc();
}
