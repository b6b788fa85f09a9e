package com.shinobi.controller;

import com.shinobi.dto.CharacterCreateRequest;
import com.shinobi.dto.CharacterDto;
import com.shinobi.dto.CharacterUpdateRequest;
import com.shinobi.dto.JutsuCreateRequest;
import com.shinobi.dto.JutsuDto;
import com.shinobi.dto.PageResponse;
import com.shinobi.service.CharacterService;
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
@RequestMapping("${app.api-prefix:}/characters")
public class CharacterController {

    private final CharacterService characterService;
    private final JutsuService jutsuService;

    @PostMapping({"", "/"})
    public ResponseEntity<CharacterDto> create(@Valid @RequestBody CharacterCreateRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(characterService.create(request));
    }

    @GetMapping({"", "/"})
    public ResponseEntity<PageResponse<CharacterDto>> list(
            @RequestParam(value = "page", defaultValue = "1") @Min(1) int page,
            @RequestParam(value = "size", defaultValue = "10") @Min(1) @Max(100) int size,
            @RequestParam(value = "search", required = false) @Size(min = 3, max = 50) String search
    ) {
        return ResponseEntity.ok(characterService.list(page, size, search));
    }

    @GetMapping("/{id}")
    public ResponseEntity<CharacterDto> get(@PathVariable("id") @Min(1) Long id) {
        return ResponseEntity.ok(characterService.get(id));
    }

    @PatchMapping("/{id}")
    public ResponseEntity<CharacterDto> update(
            @PathVariable("id") @Min(1) Long id,
            @Valid @RequestBody CharacterUpdateRequest request
    ) {
        return ResponseEntity.ok(characterService.update(id, request));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable("id") @Min(1) Long id) {
        characterService.delete(id);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{id}/jutsus")
    public ResponseEntity<JutsuDto> addJutsu(
            @PathVariable("id") @Min(1) Long id,
            @Valid @RequestBody JutsuCreateRequest request
    ) {
        return ResponseEntity.status(HttpStatus.CREATED).body(jutsuService.addToCharacter(id, request));
    }

    @GetMapping("/{id}/jutsus")
    public ResponseEntity<PageResponse<JutsuDto>> listJutsus(
            @PathVariable("id") @Min(1) Long id,
            @RequestParam(value = "page", defaultValue = "1") @Min(1) int page,
            @RequestParam(value = "size", defaultValue = "10") @Min(1) @Max(100) int size,
            @RequestParam(value = "search", required = false) @Size(min = 3, max = 50) String search
    ) {
        return ResponseEntity.ok(jutsuService.listForCharacter(id, page, size, search));
    }
}
