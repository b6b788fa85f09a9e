package com.shinobi.service;

import com.shinobi.domain.enums.TaskPriority;
import com.shinobi.domain.enums.TaskStatus;
import com.shinobi.domain.model.Task;
import com.shinobi.dto.PageResponse;
import com.shinobi.dto.TaskCreateRequest;
import com.shinobi.dto.TaskDto;
import com.shinobi.dto.TaskUpdateRequest;
import com.shinobi.error.ErrorCode;
import com.shinobi.error.exception.InternalServerException;
import com.shinobi.error.exception.InvalidRequestException;
import com.shinobi.error.exception.ResourceNotFoundException;
import com.shinobi.repository.TaskRepository;
import com.shinobi.util.Paging;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Page;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class TaskService {

    private final TaskRepository taskRepository;

    @Transactional
    public TaskDto create(TaskCreateRequest request) {
        Task task = new Task();
        task.setTitle(request.title());
        task.setDescription(request.description());
        task.setPriority(request.priority() == null ? TaskPriority.MEDIUM : request.priority());
        applyStatus(task, request.status() == null ? TaskStatus.PENDING : request.status());
        try {
            Task saved = taskRepository.saveAndFlush(task);
            log.info("Created task {}: {}", saved.getId(), saved.getTitle());
            return TaskDto.from(saved);
        } catch (DataAccessException e) {
            log.error("Error creating task: {}", e.getMessage(), e);
            throw new InvalidRequestException(ErrorCode.CREATE_FAILED, e, "task");
        }
    }

    @Transactional(readOnly = true)
    public PageResponse<TaskDto> list(int page, int size, String search) {
        try {
            if (Paging.isBeyondOffsetRange(page, size)) {
                long total = Paging.hasSearch(search)
                        ? taskRepository.countByTitleContainingIgnoreCase(search)
                        : taskRepository.count();
                return PageResponse.of(List.of(), total, page, size);
            }
            Page<Task> result = Paging.hasSearch(search)
                    ? taskRepository.findByTitleContainingIgnoreCase(search, Paging.byId(page, size))
                    : taskRepository.findAll(Paging.byId(page, size));
            return PageResponse.from(result, page, size, TaskDto::from);
        } catch (DataAccessException e) {
            log.error("Error retrieving tasks: {}", e.getMessage(), e);
            throw new InternalServerException(ErrorCode.RETRIEVE_FAILED, e, "tasks");
        }
    }

    @Transactional(readOnly = true)
    public TaskDto get(Long id) {
        return TaskDto.from(findTask(id));
    }

    /**
     * Applies only the fields present in the request. A status change stamps
     * {@code start_date} (in progress) or {@code end_date} (completed, cancelled).
     */
    @Transactional
    public TaskDto update(Long id, TaskUpdateRequest request) {
        Task task = findTask(id);

        if (request.isPresent("title")) {
            task.setTitle(required(request.getTitle(), id));
        }
        if (request.isPresent("description")) {
            task.setDescription(request.getDescription());
        }
        if (request.isPresent("priority")) {
            task.setPriority(required(request.getPriority(), id));
        }
        if (request.isPresent("status")) {
            applyStatus(task, required(request.getStatus(), id));
        }

        try {
            Task saved = taskRepository.saveAndFlush(task);
            log.info("Updated task: {}", id);
            return TaskDto.from(saved);
        } catch (DataAccessException e) {
            log.error("Error updating task {}: {}", id, e.getMessage(), e);
            throw new InvalidRequestException(ErrorCode.UPDATE_FAILED, e, "task");
        }
    }

    @Transactional
    public void delete(Long id) {
        Task task = findTask(id);
        try {
            taskRepository.delete(task);
            taskRepository.flush();
            log.info("Deleted task: {}", id);
        } catch (DataAccessException e) {
            log.error("Error deleting task {}: {}", id, e.getMessage(), e);
            throw new InternalServerException(ErrorCode.DELETE_FAILED, e, "task");
        }
    }

    private Task findTask(Long id) {
        try {
            return taskRepository.findById(id).orElseThrow(() -> {
                log.warn("Task not found: {}", id);
                return new ResourceNotFoundException("Task");
            });
        } catch (DataAccessException e) {
            log.error("Error retrieving task {}: {}", id, e.getMessage(), e);
            throw new InternalServerException(ErrorCode.RETRIEVE_FAILED, e, "task");
        }
    }

    private void applyStatus(Task task, TaskStatus status) {
        task.setStatus(status);
        if (status == TaskStatus.IN_PROGRESS) {
            task.setStartDate(OffsetDateTime.now(ZoneOffset.UTC));
        } else if (status.isTerminal()) {
            task.setEndDate(OffsetDateTime.now(ZoneOffset.UTC));
        }
    }

    private <T> T required(T value, Long id) {
        if (value == null) {
            log.warn("Rejected null for a required field of task {}", id);
            throw new InvalidRequestException(ErrorCode.UPDATE_FAILED, "task");
        }
        return value;
    }
}
