package com.shinobi.dto;

import com.shinobi.config.AppProperties;

public record AppInfoDto(String appName, String version, String description) {

    public static AppInfoDto from(AppProperties properties) {
        return new AppInfoDto(properties.name(), properties.safeVersion(), properties.description());
    }
}
