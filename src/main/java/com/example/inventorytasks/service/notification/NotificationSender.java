package com.example.inventorytasks.service.notification;

import java.util.List;

/**
 * Delivers a rendered notification. Implementations throw on delivery failure.
 */
public interface NotificationSender {

    void send(String subject, List<String> recipients, String body);
}
