package com.example.inventorytasks.service.notification;

import com.example.inventorytasks.config.NotificationProperties;
import com.example.inventorytasks.domain.entity.Part;
import com.example.inventorytasks.domain.enums.TaskType;
import com.example.inventorytasks.domain.repository.PartRepository;
import com.example.inventorytasks.domain.repository.PartSubscriptionRepository;
import com.example.inventorytasks.exception.PartNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * E-mails the subscribers of a part that its stock has fallen below the minimum.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LowStockNotifier {

    public static final String EVENT_KEY = TaskType.NOTIFY_LOW_STOCK.getCode();

    private final PartRepository partRepository;
    private final PartSubscriptionRepository subscriptionRepository;
    private final ThrottledNotifier throttledNotifier;
    private final NotificationSender notificationSender;
    private final NotificationProperties properties;

    /**
     * Runs in its own transaction so that a failed send rolls back only the
     * throttle check, not the caller's task bookkeeping.
     *
     * @throws PartNotFoundException if the part no longer exists
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public NotificationOutcome notifyLowStock(Long partId) {
        var part = partRepository.findById(partId).orElseThrow(() -> new PartNotFoundException(partId));

        log.debug("Checking low stock notification for part {}", part.getFullName());

        return throttledNotifier.notifyIfDue(
                EVENT_KEY,
                String.valueOf(part.getId()),
                properties.getLowStockThrottle(),
                () -> buildMessage(part),
                () -> resolveRecipients(part),
                notificationSender);
    }

    /**
     * Subscribers of the part or of any part above it in the hierarchy
     */
    List<String> resolveRecipients(Part part) {
        var partIds = part.ancestorsIncludingSelf().stream().map(Part::getId).toList();
        return subscriptionRepository.findEmailsByPartIds(partIds);
    }

    NotificationMessage buildMessage(Part part) {
        var subject = properties.getSubjectPrefix() + " Low stock notification";
        var link = stripTrailingSlash(properties.getSiteUrl()) + "/part/" + part.getId() + "/";
        var body = String.format("""
                The available stock for %s has fallen below the configured minimum level.

                In stock: %s
                Minimum stock: %s

                %s
                """,
                part.getFullName(),
                part.getInStock().stripTrailingZeros().toPlainString(),
                part.getMinimumStock().stripTrailingZeros().toPlainString(),
                link);

        return NotificationMessage.builder().subject(subject).body(body).build();
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
