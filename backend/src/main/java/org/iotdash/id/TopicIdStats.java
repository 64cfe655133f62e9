package org.iotdash.id;

public record TopicIdStats(int totalGenerated, long memoryUsage, boolean isHealthy) { }
