package com.example.planner.domain.model;

import jakarta.validation.constraints.Size;

/**
 * Raw device information sent by the client at login.
 */
public record DeviceDescriptor(
    @Size(max = 512) String userAgent,
    @Size(max = 64) String platform,
    Boolean isMobile,
    @Size(max = 32) String screenResolution,
    @Size(max = 35) String language,
    @Size(max = 64) String timezone
) {
}
