package dev.clarityhub.api;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import org.jspecify.annotations.Nullable;

/** JSON body of {@code POST /api/documents}. */
public record RegisterDocumentRequest(
    @NotBlank String name, @NotBlank String documentType, @Nullable @PositiveOrZero Long sizeBytes) {}
