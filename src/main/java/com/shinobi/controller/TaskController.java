package com.shinobi.controller;

import com.shinobi.dto.PageResponse;
import com.shinobi.dto.TaskCreateRequest;
import com.shinobi.dto.TaskDto;
import com.shinobi.dto.TaskUpdateRequest;
import com.shinobi.service.TaskService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Size;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

@Validated
@RestController
@RequiredArgsConstructor
@RequestMapping("${app.api-prefix:}/tasks")
public class TaskController {

    private final TaskService taskService;

    @PostMapping({"", "/"})
    public ResponseEntity<TaskDto> create(@Valid @RequestBody TaskCreateRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(taskService.create(request));
    }

    @GetMapping({"", "/"})
    public ResponseEntity<PageResponse<TaskDto>> list(
            @RequestParam(value = "page", defaultValue = "1") @Min(1) int page,
            @RequestParam(value = "size", defaultValue = "10") @Min(1) @Max(100) int size,
            @RequestParam(value = "search", required = false) @Size(min = 3, max = 50) String search
    ) {
        return ResponseEntity.ok(taskService.list(page, size, search));
    }

    @GetMapping("/{id}")
    public ResponseEntity<TaskDto> get(@PathVariable("id") @Min(1) Long id) {
        return ResponseEntity.ok(taskService.get(id));
    }

    @PatchMapping("/{id}")
    public ResponseEntity<TaskDto> update(
            @PathVariable("id") @Min(1) Long id,
            @Valid @RequestBody TaskUpdateRequest request
    ) {
        return ResponseEntity.ok(taskService.update(id, request));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable("id") @Min(1) Long id) {
        taskService.delete(id);
        return ResponseEntity.noContent().build();
    }
}
