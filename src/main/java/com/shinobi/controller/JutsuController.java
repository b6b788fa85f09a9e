package com.shinobi.controller;

import com.shinobi.dto.JutsuCreateRequest;
import com.shinobi.dto.JutsuDto;
import com.shinobi.dto.JutsuUpdateRequest;
import com.shinobi.dto.PageResponse;
import com.shinobi.service.JutsuService;
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
@RequestMapping("${app.api-prefix:}/jutsus")
public class JutsuController {

    private final JutsuService jutsuService;

    @PostMapping({"", "/"})
    public ResponseEntity<JutsuDto> create(@Valid @RequestBody JutsuCreateRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(jutsuService.create(request));
    }

    @GetMapping({"", "/"})
    public ResponseEntity<PageResponse<JutsuDto>> list(
            @RequestParam(value = "page", defaultValue = "1") @Min(1) int page,
            @RequestParam(value = "size", defaultValue = "10") @Min(1) @Max(100) int size,
            @RequestParam(value = "search", required = false) @Size(min = 3, max = 50) String search,
            @RequestParam(value = "character_id", required = false) @Min(1) Long characterId
    ) {
        return ResponseEntity.ok(jutsuService.list(page, size, search, characterId));
    }

    @GetMapping("/{id}")
    public ResponseEntity<JutsuDto> get(@PathVariable("id") @Min(1) Long id) {
        return ResponseEntity.ok(jutsuService.get(id));
    }

    @PatchMapping("/{id}")
    public ResponseEntity<JutsuDto> update(
            @PathVariable("id") @Min(1) Long id,
            @Valid @RequestBody JutsuUpdateRequest request
    ) {
        return ResponseEntity.ok(jutsuService.update(id, request));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable("id") @Min(1) Long id) {
        jutsuService.delete(id);
        return ResponseEntity.noContent().build();
    }
}
