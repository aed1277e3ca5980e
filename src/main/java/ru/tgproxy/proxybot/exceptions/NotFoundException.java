package ru.tgproxy.proxybot.exceptions;

public class NotFoundException extends ProxyBotException {

    public NotFoundException(String what, Object id) {
        super(what + " не найден: " + id);
    }

    public static NotFoundException user(Object telegramId) {
        return new NotFoundException("Пользователь", telegramId);
    }

    public static NotFoundException server(Object serverId) {
        return new NotFoundException("Сервер", serverId);
    }
}
