package com.feedwatch.engine.domain.exceptions;

public class DeliveryException extends RuntimeException {

    private DeliveryException(String message, Throwable cause) {
        super(message, cause);
    }

    public static DeliveryException of(String channel, String reason) {
        return new DeliveryException("Delivery via " + channel + " failed: " + reason, null);
    }

    public static DeliveryException of(String channel, String reason, Throwable cause) {
        return new DeliveryException("Delivery via " + channel + " failed: " + reason, cause);
    }

    public static DeliveryException missingParameter(String channel, String parameter) {
        return new DeliveryException("Delivery via " + channel + " is missing parameter '" + parameter + "'", null);
    }
}
