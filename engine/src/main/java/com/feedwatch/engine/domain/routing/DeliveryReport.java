package com.feedwatch.engine.domain.routing;

public record DeliveryReport(int delivered, int failed, int suppressed) {

    public static final DeliveryReport EMPTY = new DeliveryReport(0, 0, 0);

    static final DeliveryReport DELIVERED = new DeliveryReport(1, 0, 0);
    static final DeliveryReport FAILED = new DeliveryReport(0, 1, 0);
    static final DeliveryReport SUPPRESSED = new DeliveryReport(0, 0, 1);

    public DeliveryReport plus(DeliveryReport other) {
        return new DeliveryReport(delivered + other.delivered, failed + other.failed, suppressed + other.suppressed);
    }
}
