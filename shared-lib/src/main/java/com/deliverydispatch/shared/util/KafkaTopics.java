package com.deliverydispatch.shared.util;

/**
 * Central registry of all Kafka topic names.
 */
public final class KafkaTopics {

    private KafkaTopics() {}

    public static final String DRIVER_LOCATION_UPDATED  = "driver.location.updated";
    public static final String DELIVERY_ASSIGNED        = "delivery.assigned";
    public static final String DELIVERY_UNMATCHED       = "delivery.unmatched";
    public static final String DELIVERY_CLAIM_CHANGED   = "delivery.claim.changed";
}
