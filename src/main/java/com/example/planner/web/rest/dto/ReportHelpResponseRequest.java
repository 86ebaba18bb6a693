package com.example.planner.web.rest.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record ReportHelpResponseRequest(
    @NotBlank @Size(max = 255) String reason,
    @Size(max = 2000) String details
) {
}
