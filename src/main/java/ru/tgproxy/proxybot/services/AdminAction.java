package ru.tgproxy.proxybot.services;

public enum AdminAction {
    ADD_SERVER,
    GRANT_SUBSCRIPTION,
    DISABLE_USER,
    ENABLE_USER
}
