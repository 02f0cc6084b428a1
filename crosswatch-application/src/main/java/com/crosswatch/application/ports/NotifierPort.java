package com.crosswatch.application.ports;

/** Human-readable operator notifications (Telegram, console). */
public interface NotifierPort {
    void send(String message);
}
