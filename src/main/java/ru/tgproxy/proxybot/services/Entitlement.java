package ru.tgproxy.proxybot.services;

import java.time.Instant;

/**
 * Что видит слой бота: есть ли доступ и до какого момента (null - доступ не выдавался).
 */
public record Entitlement(boolean entitled, Instant expiresAt) {
}
