package com.shinobi.dto;

import com.shinobi.domain.enums.TaskPriority;
import com.shinobi.domain.enums.TaskStatus;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record TaskCreateRequest(
        @NotBlank @Size(max = 100) String title,
        @Size(max = 1000) String description,
        TaskStatus status,
        TaskPriority priority
) {
}
