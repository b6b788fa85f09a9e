package com.shinobi.dto;

import com.shinobi.domain.enums.TaskPriority;
import com.shinobi.domain.enums.TaskStatus;
import com.shinobi.domain.model.Task;

import java.time.OffsetDateTime;

public record TaskDto(
        Long id,
        String title,
        String description,
        TaskStatus status,
        TaskPriority priority,
        OffsetDateTime startDate,
        OffsetDateTime endDate,
        OffsetDateTime createdAt
) {
    public static TaskDto from(Task task) {
        return new TaskDto(
                task.getId(),
                task.getTitle(),
                task.getDescription(),
                task.getStatus(),
                task.getPriority(),
                task.getStartDate(),
                task.getEndDate(),
                task.getCreatedAt()
        );
    }
}
