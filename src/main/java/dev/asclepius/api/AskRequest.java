package dev.asclepius.api;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/** Body of {@code POST /api/agent/ask}. */
public record AskRequest(@NotBlank @Size(max = 4000) String question) {}
