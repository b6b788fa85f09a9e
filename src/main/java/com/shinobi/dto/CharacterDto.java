package com.shinobi.dto;

import com.shinobi.domain.model.Character;

import java.time.OffsetDateTime;

public record CharacterDto(
        Long id,
        String name,
        String village,
        String rank,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {
    public static CharacterDto from(Character character) {
        return new CharacterDto(
                character.getId(),
                character.getName(),
                character.getVillage(),
                character.getRank(),
                character.getCreatedAt(),
                character.getUpdatedAt()
        );
    }
}
