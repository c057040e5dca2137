package com.feedwatch.engine.domain.routing;

import com.feedwatch.common.event.ChangeEvent;
import com.feedwatch.engine.domain.subscription.Subscription;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Sends change events to the targets a subscription references.
 *
 * <p>Events are dispatched in order; for each event the references are visited in declared order.
 * Every target is attempted independently: a failing target is logged and counted, it never stops
 * delivery to the others. Failed deliveries are not retried.
 */
@Slf4j
@Component
public class NotificationRouter {

    private final NotifyTargetCatalog targets;
    private final Map<ChannelKind, NotificationChannel> channels = new EnumMap<>(ChannelKind.class);

    public NotificationRouter(NotifyTargetCatalog targets, List<NotificationChannel> channels) {
        this.targets = targets;
        channels.forEach(channel -> this.channels.put(channel.kind(), channel));
    }

    public DeliveryReport route(Subscription subscription, List<ChangeEvent> events) {
        return route(subscription.key(), subscription.notifyRefs(), events);
    }

    public DeliveryReport route(String origin, List<NotifyRef> refs, List<ChangeEvent> events) {
        var report = DeliveryReport.EMPTY;
        for (ChangeEvent event : events) {
            for (NotifyRef ref : refs) {
                report = report.plus(dispatch(origin, ref, event));
            }
        }
        return report;
    }

    private DeliveryReport dispatch(String origin, NotifyRef ref, ChangeEvent event) {
        try {
            var target = targets.require(ref.target()).resolve(ref);
            if (!target.notifications().allows(event.kind())) {
                log.debug("Suppressed {} for {} to {}", event.kind(), origin, target.name());
                return DeliveryReport.SUPPRESSED;
            }
            var channel = channels.get(target.channel());
            if (channel == null) {
                throw new IllegalStateException("No channel registered for " + target.channel().id());
            }
            channel.deliver(target.parameters(), channel.render(event), MessageRenderer.media(event));
            log.info("Delivered {} {} for {} to {}", event.kind(), event.eventId(), origin, target.name());
            return DeliveryReport.DELIVERED;
        } catch (RuntimeException e) {
            log.error("Delivery failed: subscription={}, target={}, event={}: {}",
                    origin, ref.target(), event.kind(), e.getMessage());
            return DeliveryReport.FAILED;
        }
    }
}
