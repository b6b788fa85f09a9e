package com.shinobi.service;

import com.shinobi.domain.model.Character;
import com.shinobi.dto.CharacterCreateRequest;
import com.shinobi.dto.CharacterDto;
import com.shinobi.dto.CharacterUpdateRequest;
import com.shinobi.dto.PageResponse;
import com.shinobi.error.ErrorCode;
import com.shinobi.error.exception.InternalServerException;
import com.shinobi.error.exception.InvalidRequestException;
import com.shinobi.error.exception.ResourceNotFoundException;
import com.shinobi.repository.CharacterRepository;
import com.shinobi.repository.JutsuRepository;
import com.shinobi.util.Paging;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Page;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class CharacterService {

    private final CharacterRepository characterRepository;
    private final JutsuRepository jutsuRepository;

    @Transactional
    public CharacterDto create(CharacterCreateRequest request) {
        Character character = new Character();
        character.setName(request.name());
        character.setVillage(request.village());
        character.setRank(request.rank());
        try {
            Character saved = characterRepository.saveAndFlush(character);
            log.info("Created character {}: {}", saved.getId(), saved.getName());
            return CharacterDto.from(saved);
        } catch (DataAccessException e) {
            log.error("Error creating character: {}", e.getMessage(), e);
            throw new InvalidRequestException(ErrorCode.CREATE_FAILED, e, "character");
        }
    }

    /**
     * Search matches name or village, ignoring case.
     */
    @Transactional(readOnly = true)
    public PageResponse<CharacterDto> list(int page, int size, String search) {
        try {
            if (Paging.isBeyondOffsetRange(page, size)) {
                long total = Paging.hasSearch(search)
                        ? characterRepository.countByNameContainingIgnoreCaseOrVillageContainingIgnoreCase(search, search)
                        : characterRepository.count();
                return PageResponse.of(List.of(), total, page, size);
            }
            Page<Character> result = Paging.hasSearch(search)
                    ? characterRepository.findByNameContainingIgnoreCaseOrVillageContainingIgnoreCase(
                            search, search, Paging.byId(page, size))
                    : characterRepository.findAll(Paging.byId(page, size));
            return PageResponse.from(result, page, size, CharacterDto::from);
        } catch (DataAccessException e) {
            log.error("Error retrieving characters: {}", e.getMessage(), e);
            throw new InternalServerException(ErrorCode.RETRIEVE_FAILED, e, "characters");
        }
    }

    @Transactional(readOnly = true)
    public CharacterDto get(Long id) {
        return CharacterDto.from(findCharacter(id));
    }

    @Transactional
    public CharacterDto update(Long id, CharacterUpdateRequest request) {
        Character character = findCharacter(id);
        if (request.isEmpty()) {
            return CharacterDto.from(character);
        }

        if (request.isPresent("name")) {
            character.setName(required(request.getName(), id));
        }
        if (request.isPresent("village")) {
            character.setVillage(required(request.getVillage(), id));
        }
        if (request.isPresent("rank")) {
            character.setRank(request.getRank());
        }
        character.setUpdatedAt(OffsetDateTime.now(ZoneOffset.UTC));

        try {
            Character saved = characterRepository.saveAndFlush(character);
            log.info("Updated character: {}", id);
            return CharacterDto.from(saved);
        } catch (DataAccessException e) {
            log.error("Error updating character {}: {}", id, e.getMessage(), e);
            throw new InvalidRequestException(ErrorCode.UPDATE_FAILED, e, "character");
        }
    }

    /**
     * Deletes the character and leaves its jutsus unowned.
     */
    @Transactional
    public void delete(Long id) {
        Character character = findCharacter(id);
        try {
            int detached = jutsuRepository.detachFromCharacter(id, OffsetDateTime.now(ZoneOffset.UTC));
            characterRepository.delete(character);
            characterRepository.flush();
            log.info("Deleted character: {} ({} jutsus detached)", id, detached);
        } catch (DataAccessException e) {
            log.error("Error deleting character {}: {}", id, e.getMessage(), e);
            throw new InternalServerException(ErrorCode.DELETE_FAILED, e, "character");
        }
    }

    private Character findCharacter(Long id) {
        try {
            return characterRepository.findById(id).orElseThrow(() -> {
                log.warn("Character not found: {}", id);
                return new ResourceNotFoundException("Character");
            });
        } catch (DataAccessException e) {
            log.error("Error retrieving character {}: {}", id, e.getMessage(), e);
            throw new InternalServerException(ErrorCode.RETRIEVE_FAILED, e, "character");
        }
    }

    private <T> T required(T value, Long id) {
        if (value == null) {
            log.warn("Rejected null for a required field of character {}", id);
            throw new InvalidRequestException(ErrorCode.UPDATE_FAILED, "character");
        }
        return value;
    }
}
