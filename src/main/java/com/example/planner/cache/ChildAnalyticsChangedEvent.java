package com.example.planner.cache;

/**
 * Published inside the transaction that changed a child's analytics inputs.
 */
public record ChildAnalyticsChangedEvent(String childId, String cause) {
}
