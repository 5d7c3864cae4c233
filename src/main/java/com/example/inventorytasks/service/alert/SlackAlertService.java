package com.example.inventorytasks.service.alert;

import com.example.inventorytasks.config.SlackProperties;
import com.example.inventorytasks.domain.entity.OffloadedTask;
import com.slack.api.Slack;
import com.slack.api.model.Attachment;
import com.slack.api.model.Field;
import com.slack.api.webhook.Payload;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Operator alerts through a Slack incoming webhook. Alerts are sent on the
 * async executor and never fail the caller.
 */
@Slf4j
@Service
public class SlackAlertService {

    private final SlackProperties properties;
    private final Slack slack;

    @Value("${spring.application.name:inventory-task-service}")
    private String applicationName;

    @Autowired
    public SlackAlertService(SlackProperties properties) {
        this(properties, Slack.getInstance());
    }

    SlackAlertService(SlackProperties properties, Slack slack) {
        this.properties = properties;
        this.slack = slack;
    }

    @Async
    public void taskRetriesExhausted(OffloadedTask task) {
        var fields = new ArrayList<Field>();
        fields.add(field("Task", String.valueOf(task.getId()), true));
        fields.add(field("Reference", task.getReferenceId(), true));
        fields.add(field("Attempts", String.valueOf(task.getRetryCount()), true));
        fields.add(field("Queued", task.getCreatedAt() != null ? task.getCreatedAt().toString() : "-", true));
        fields.add(field("Last error", "```" + abbreviate(task.getLastError(), 400) + "```", false));

        send(":rotating_light:", "danger",
                "Offloaded task gave up, manual intervention required",
                task.getTaskType().getDisplayName() + " - " + task.getReferenceId(),
                fields);
    }

    @Async
    public void jobFailed(String jobName, String error) {
        send(":warning:", "warning",
                "Periodic job " + jobName + " failed",
                jobName,
                List.of(field("Error", abbreviate(error, 500), false)));
    }

    private void send(String emoji, String color, String headline, String title, List<Field> fields) {
        if (!properties.isEnabled() || properties.getWebhookUrl() == null || properties.getWebhookUrl().isBlank()) {
            log.warn("Slack alerting is off, alert not sent: {} ({})", headline, title);
            return;
        }

        var payload = Payload.builder()
                .channel(properties.getChannel())
                .username(applicationName)
                .iconEmoji(emoji)
                .text(emoji + " *" + headline + "*")
                .attachments(List.of(Attachment.builder()
                        .color(color)
                        .title(title)
                        .fields(fields)
                        .footer(applicationName)
                        .ts(String.valueOf(Instant.now().getEpochSecond()))
                        .build()))
                .build();

        try {
            var response = slack.send(properties.getWebhookUrl(), payload);
            if (response.getCode() != 200) {
                log.error("Slack rejected alert '{}': HTTP {} {}", headline, response.getCode(), response.getBody());
            }
        } catch (IOException e) {
            log.error("Could not post alert '{}' to Slack: {}", headline, e.getMessage(), e);
        }
    }

    private static Field field(String title, String value, boolean shortValue) {
        return Field.builder().title(title).value(value != null ? value : "").valueShortEnough(shortValue).build();
    }

    private static String abbreviate(String text, int maxLength) {
        if (text == null) {
            return "";
        }
        return text.length() <= maxLength ? text : text.substring(0, maxLength - 3) + "...";
    }
}
