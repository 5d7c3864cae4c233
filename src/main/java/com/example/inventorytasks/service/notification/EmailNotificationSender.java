package com.example.inventorytasks.service.notification;

import com.example.inventorytasks.config.NotificationProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Sends notifications as a single plain-text e-mail addressed to all recipients.
 * Mail failures surface as {@link org.springframework.mail.MailException}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EmailNotificationSender implements NotificationSender {

    private final JavaMailSender mailSender;
    private final NotificationProperties properties;

    @Override
    public void send(String subject, List<String> recipients, String body) {
        var message = new SimpleMailMessage();
        message.setFrom(properties.getFromAddress());
        message.setTo(recipients.toArray(new String[0]));
        message.setSubject(subject);
        message.setText(body);

        mailSender.send(message);
        log.info("Sent '{}' to {} recipient(s)", subject, recipients.size());
    }
}
