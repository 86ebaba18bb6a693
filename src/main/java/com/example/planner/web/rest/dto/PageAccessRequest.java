package com.example.planner.web.rest.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record PageAccessRequest(@NotBlank @Size(max = 512) String path) {
}
