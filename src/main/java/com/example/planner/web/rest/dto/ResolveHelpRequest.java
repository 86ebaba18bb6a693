package com.example.planner.web.rest.dto;

import jakarta.validation.constraints.NotNull;

public record ResolveHelpRequest(@NotNull Boolean wasHelpful) {
}
