package com.shinobi.dto;

import com.shinobi.domain.enums.TaskPriority;
import com.shinobi.domain.enums.TaskStatus;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.Getter;

/**
 * Start and end dates are not writable here; they follow {@code status}.
 */
@Getter
public class TaskUpdateRequest extends PatchRequest {

    @Size(min = 1, max = 100)
    @Pattern(regexp = NOT_BLANK, message = "must not be blank")
    private String title;

    @Size(max = 1000)
    private String description;

    private TaskStatus status;

    private TaskPriority priority;

    public void setTitle(String title) {
        this.title = title;
        markPresent("title");
    }

    public void setDescription(String description) {
        this.description = description;
        markPresent("description");
    }

    public void setStatus(TaskStatus status) {
        this.status = status;
        markPresent("status");
    }

    public void setPriority(TaskPriority priority) {
        this.priority = priority;
        markPresent("priority");
    }
}
