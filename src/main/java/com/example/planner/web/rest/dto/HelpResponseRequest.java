package com.example.planner.web.rest.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record HelpResponseRequest(@NotBlank @Size(max = 8000) String response) {
}
