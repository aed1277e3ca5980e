package ru.tgproxy.proxybot.services;

import org.springframework.stereotype.Component;

import java.security.SecureRandom;

/**
 * Секреты прокси - bearer-токены, поэтому только SecureRandom.
 */
@Component
public class ProxySecretGenerator {

    public static final int SECRET_LENGTH = 32;
    static final String ALPHABET = "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789";

    private final SecureRandom random = new SecureRandom();

    public String newSecret() {
        StringBuilder sb = new StringBuilder(SECRET_LENGTH);
        for (int i = 0; i < SECRET_LENGTH; i++) {
            sb.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
        }
        return sb.toString();
    }
}
