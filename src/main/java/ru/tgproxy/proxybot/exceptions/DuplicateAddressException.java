package ru.tgproxy.proxybot.exceptions;

public class DuplicateAddressException extends ProxyBotException {

    public DuplicateAddressException(String address) {
        super("Сервер " + address + " уже существует");
    }
}
