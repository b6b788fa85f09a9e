package com.shinobi.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

/**
 * {@code chakraCost} falls back to the default cost when omitted; {@code characterId} is optional.
 */
public record JutsuCreateRequest(
        @NotBlank @Size(max = 100) String name,
        @NotBlank @Size(max = 50) String type,
        @Min(1) Integer chakraCost,
        @Positive Long characterId
) {
}
