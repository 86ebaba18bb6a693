package com.example.planner.domain.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Typed payload of an activity event, discriminated by the {@code type} property.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = PageAccessDetail.class, name = "page_access"),
    @JsonSubTypes.Type(value = HelpRequestDetail.class, name = "help_request"),
    @JsonSubTypes.Type(value = ProgressDetail.class, name = "progress")
})
public interface ActivityDetail {
}
