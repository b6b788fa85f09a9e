package com.shinobi.dto;

public record HealthDto(String status, SystemUsage system) {

    public record SystemUsage(double cpuUsage, double memoryUsage) {
    }
}
