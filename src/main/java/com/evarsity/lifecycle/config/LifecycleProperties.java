package com.evarsity.lifecycle.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.ZoneId;

@ConfigurationProperties(prefix = "lifecycle")
public record LifecycleProperties(Double completionThreshold,
                                  Integer defaultCourseDurationDays,
                                  String certificateUrlPrefix,
                                  String zone) {
    public LifecycleProperties {
        if (completionThreshold == null) completionThreshold = 90.0;
        if (defaultCourseDurationDays == null || defaultCourseDurationDays <= 0) defaultCourseDurationDays = 180;
        if (certificateUrlPrefix == null || certificateUrlPrefix.isBlank()) certificateUrlPrefix = "/certs/";
        if (zone == null || zone.isBlank()) zone = "UTC";
    }

    public ZoneId zoneId() {
        return ZoneId.of(zone);
    }
}
