package com.shinobi.dto;

public record DatabaseHealthDto(String status, String database) {

    public static DatabaseHealthDto connected() {
        return new DatabaseHealthDto("healthy", "connected");
    }

    public static DatabaseHealthDto disconnected() {
        return new DatabaseHealthDto("unhealthy", "disconnected");
    }
}
