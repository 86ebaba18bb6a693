package com.example.planner.domain.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record PageAccessDetail(@NotBlank @Size(max = 512) String path) implements ActivityDetail {
}
