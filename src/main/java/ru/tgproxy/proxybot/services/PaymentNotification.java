package ru.tgproxy.proxybot.services;

import java.math.BigDecimal;

/**
 * Сообщение провайдера об успешной оплате. Сумма всегда в минимальных единицах валюты.
 */
public record PaymentNotification(
        Long externalUserId,
        long amountMinorUnits,
        String currencyCode,
        String providerReference
) {

    public BigDecimal amountMajorUnits() {
        return BigDecimal.valueOf(amountMinorUnits, 2);
    }
}
