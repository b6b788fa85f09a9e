package com.shinobi.controller;

import com.shinobi.dto.DatabaseHealthDto;
import com.shinobi.dto.HealthDto;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.ResponseEntity;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Collection;

@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/health")
public class HealthController {

    private final MeterRegistry meterRegistry;
    private final JdbcTemplate jdbcTemplate;

    @GetMapping
    public ResponseEntity<HealthDto> health() {
        return ResponseEntity.ok(new HealthDto("running",
                new HealthDto.SystemUsage(cpuUsage(), heapUsage())));
    }

    @GetMapping("/db")
    public ResponseEntity<DatabaseHealthDto> database() {
        try {
            jdbcTemplate.queryForObject("SELECT 1", Integer.class);
            return ResponseEntity.ok(DatabaseHealthDto.connected());
        } catch (DataAccessException e) {
            log.error("Database health check failed: {}", e.getMessage(), e);
            return ResponseEntity.ok(DatabaseHealthDto.disconnected());
        }
    }

    private double cpuUsage() {
        Gauge gauge = meterRegistry.find("system.cpu.usage").gauge();
        if (gauge == null) {
            return 0.0;
        }
        double value = gauge.value();
        return Double.isNaN(value) || value < 0 ? 0.0 : round(value * 100);
    }

    // summed over heap pools; pools without a defined max report -1
    private double heapUsage() {
        double used = sumPositive(meterRegistry.find("jvm.memory.used").tag("area", "heap").gauges());
        double max = sumPositive(meterRegistry.find("jvm.memory.max").tag("area", "heap").gauges());
        if (max <= 0) {
            Runtime runtime = Runtime.getRuntime();
            used = runtime.totalMemory() - runtime.freeMemory();
            max = runtime.maxMemory();
        }
        return round(used / max * 100);
    }

    private double sumPositive(Collection<Gauge> gauges) {
        return gauges.stream()
                .mapToDouble(Gauge::value)
                .filter(value -> !Double.isNaN(value) && value > 0)
                .sum();
    }

    private double round(double value) {
        return Math.round(value * 10) / 10.0;
    }
}
