package com.shinobi.controller;

import com.shinobi.config.AppProperties;
import com.shinobi.dto.AppInfoDto;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class RootController {

    private final AppProperties appProperties;

    @GetMapping("/")
    public ResponseEntity<AppInfoDto> info() {
        return ResponseEntity.ok(AppInfoDto.from(appProperties));
    }
}
