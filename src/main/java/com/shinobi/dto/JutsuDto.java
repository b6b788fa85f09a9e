package com.shinobi.dto;

import com.shinobi.domain.model.Jutsu;

import java.time.OffsetDateTime;

public record JutsuDto(
        Long id,
        String name,
        String type,
        Integer chakraCost,
        Long characterId,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {
    public static JutsuDto from(Jutsu jutsu) {
        return new JutsuDto(
                jutsu.getId(),
                jutsu.getName(),
                jutsu.getType(),
                jutsu.getChakraCost(),
                jutsu.getCharacter() == null ? null : jutsu.getCharacter().getId(),
                jutsu.getCreatedAt(),
                jutsu.getUpdatedAt()
        );
    }
}
