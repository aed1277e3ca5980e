package ru.tgproxy.proxybot.exceptions;

public class TrialAlreadyUsedException extends ProxyBotException {

    public TrialAlreadyUsedException() {
        super("Пробный период уже был использован");
    }
}
