package com.example.planner.domain.model;

public record TopicFrequency(String subject, long count) {
}
