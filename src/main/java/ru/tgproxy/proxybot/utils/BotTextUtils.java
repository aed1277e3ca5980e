package ru.tgproxy.proxybot.utils;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

public final class BotTextUtils {

    private static final DateTimeFormatter DT_FMT =
            DateTimeFormatter.ofPattern("dd.MM.yyyy HH:mm").withZone(ZoneOffset.UTC);

    private BotTextUtils() {
    }

    public static String escapeHtml(String s) {
        if (s == null) return "";
        return s
                .replace("&", "&amp;")
                .replace("<", "&lt;")
                .replace(">", "&gt;")
                .replace("\"", "&quot;");
    }

    /** Время всегда показываем в UTC. */
    public static String formatDate(Instant instant) {
        return instant == null ? "-" : DT_FMT.format(instant) + " UTC";
    }

    public static String formatTimeLeft(Duration left) {
        if (left == null || left.isNegative() || left.isZero()) return "0 ч.";
        long days = left.toDays();
        long hours = left.minusDays(days).toHours();
        if (days > 0) return days + " дн. " + hours + " ч.";
        long minutes = left.minusHours(left.toHours()).toMinutes();
        return hours + " ч. " + minutes + " мин.";
    }
}
