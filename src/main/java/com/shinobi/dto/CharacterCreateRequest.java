package com.shinobi.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record CharacterCreateRequest(
        @NotBlank @Size(max = 100) String name,
        @NotBlank @Size(max = 50) String village,
        @Size(max = 50) String rank
) {
}
