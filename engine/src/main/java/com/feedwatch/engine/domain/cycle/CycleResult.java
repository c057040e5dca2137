package com.feedwatch.engine.domain.cycle;

import com.feedwatch.engine.domain.routing.DeliveryReport;

public record CycleResult(int events, boolean baseline, DeliveryReport delivery) {}
