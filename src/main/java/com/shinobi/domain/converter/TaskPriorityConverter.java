package com.shinobi.domain.converter;

import com.shinobi.domain.enums.TaskPriority;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter(autoApply = true)
public class TaskPriorityConverter implements AttributeConverter<TaskPriority, Integer> {

    @Override
    public Integer convertToDatabaseColumn(TaskPriority priority) {
        return priority == null ? null : priority.getLevel();
    }

    @Override
    public TaskPriority convertToEntityAttribute(Integer level) {
        return level == null ? null : TaskPriority.fromLevel(level);
    }
}
