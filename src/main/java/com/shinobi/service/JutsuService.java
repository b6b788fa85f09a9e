package com.shinobi.service;

import com.shinobi.domain.model.Character;
import com.shinobi.domain.model.Jutsu;
import com.shinobi.dto.JutsuCreateRequest;
import com.shinobi.dto.JutsuDto;
import com.shinobi.dto.JutsuUpdateRequest;
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
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;

/**
 * Jutsu CRUD plus the character association: a jutsu may reference an existing character or none.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JutsuService {

    private final JutsuRepository jutsuRepository;
    private final CharacterRepository characterRepository;

    @Transactional
    public JutsuDto create(JutsuCreateRequest request) {
        Character owner = request.characterId() == null ? null : resolveReference(request.characterId());
        Jutsu saved = persistNew(request, owner, ErrorCode.CREATE_FAILED);
        log.info("Created jutsu {}: {}", saved.getId(), saved.getName());
        return JutsuDto.from(saved);
    }

    /**
     * Creates a jutsu owned by the character in the path; a {@code character_id} in the body is ignored.
     */
    @Transactional
    public JutsuDto addToCharacter(Long characterId, JutsuCreateRequest request) {
        Character owner = findCharacter(characterId);
        Jutsu saved = persistNew(request, owner, ErrorCode.JUTSU_ASSIGN_FAILED);
        log.info("Added jutsu {} to character {}", saved.getName(), characterId);
        return JutsuDto.from(saved);
    }

    @Transactional(readOnly = true)
    public PageResponse<JutsuDto> list(int page, int size, String search, Long characterId) {
        try {
            if (Paging.isBeyondOffsetRange(page, size)) {
                return PageResponse.of(List.of(), count(search, characterId), page, size);
            }
            Pageable pageable = Paging.byId(page, size);
            Page<Jutsu> result;
            if (characterId != null) {
                result = Paging.hasSearch(search)
                        ? jutsuRepository.findByCharacter_IdAndNameContainingIgnoreCase(characterId, search, pageable)
                        : jutsuRepository.findByCharacter_Id(characterId, pageable);
            } else {
                result = Paging.hasSearch(search)
                        ? jutsuRepository.findByNameContainingIgnoreCase(search, pageable)
                        : jutsuRepository.findAll(pageable);
            }
            return PageResponse.from(result, page, size, JutsuDto::from);
        } catch (DataAccessException e) {
            log.error("Error retrieving jutsus: {}", e.getMessage(), e);
            throw new InternalServerException(ErrorCode.RETRIEVE_FAILED, e, "jutsus");
        }
    }

    @Transactional(readOnly = true)
    public PageResponse<JutsuDto> listForCharacter(Long characterId, int page, int size, String search) {
        findCharacter(characterId);
        return list(page, size, search, characterId);
    }

    @Transactional(readOnly = true)
    public JutsuDto get(Long id) {
        return JutsuDto.from(findJutsu(id));
    }

    @Transactional
    public JutsuDto update(Long id, JutsuUpdateRequest request) {
        Jutsu jutsu = findJutsu(id);
        if (request.isEmpty()) {
            return JutsuDto.from(jutsu);
        }

        if (request.isPresent("characterId")) {
            jutsu.setCharacter(request.getCharacterId() == null ? null : resolveReference(request.getCharacterId()));
        }
        if (request.isPresent("name")) {
            jutsu.setName(required(request.getName(), id));
        }
        if (request.isPresent("type")) {
            jutsu.setType(required(request.getType(), id));
        }
        if (request.isPresent("chakraCost")) {
            jutsu.setChakraCost(required(request.getChakraCost(), id));
        }
        jutsu.setUpdatedAt(OffsetDateTime.now(ZoneOffset.UTC));

        try {
            Jutsu saved = jutsuRepository.saveAndFlush(jutsu);
            log.info("Updated jutsu: {}", id);
            return JutsuDto.from(saved);
        } catch (DataAccessException e) {
            log.error("Error updating jutsu {}: {}", id, e.getMessage(), e);
            throw new InvalidRequestException(ErrorCode.UPDATE_FAILED, e, "jutsu");
        }
    }

    @Transactional
    public void delete(Long id) {
        Jutsu jutsu = findJutsu(id);
        try {
            jutsuRepository.delete(jutsu);
            jutsuRepository.flush();
            log.info("Deleted jutsu: {}", id);
        } catch (DataAccessException e) {
            log.error("Error deleting jutsu {}: {}", id, e.getMessage(), e);
            throw new InternalServerException(ErrorCode.DELETE_FAILED, e, "jutsu");
        }
    }

    private Jutsu persistNew(JutsuCreateRequest request, Character owner, ErrorCode failure) {
        Jutsu jutsu = new Jutsu();
        jutsu.setName(request.name());
        jutsu.setType(request.type());
        jutsu.setChakraCost(request.chakraCost() == null ? Jutsu.DEFAULT_CHAKRA_COST : request.chakraCost());
        jutsu.setCharacter(owner);
        try {
            return jutsuRepository.saveAndFlush(jutsu);
        } catch (DataAccessException e) {
            log.error("Error creating jutsu: {}", e.getMessage(), e);
            throw new InvalidRequestException(failure, e, "jutsu");
        }
    }

    private long count(String search, Long characterId) {
        if (characterId != null) {
            return Paging.hasSearch(search)
                    ? jutsuRepository.countByCharacter_IdAndNameContainingIgnoreCase(characterId, search)
                    : jutsuRepository.countByCharacter_Id(characterId);
        }
        return Paging.hasSearch(search)
                ? jutsuRepository.countByNameContainingIgnoreCase(search)
                : jutsuRepository.count();
    }

    private Jutsu findJutsu(Long id) {
        try {
            return jutsuRepository.findById(id).orElseThrow(() -> {
                log.warn("Jutsu not found: {}", id);
                return new ResourceNotFoundException("Jutsu");
            });
        } catch (DataAccessException e) {
            log.error("Error retrieving jutsu {}: {}", id, e.getMessage(), e);
            throw new InternalServerException(ErrorCode.RETRIEVE_FAILED, e, "jutsu");
        }
    }

    // character addressed by the URL
    private Character findCharacter(Long characterId) {
        try {
            return characterRepository.findById(characterId).orElseThrow(() -> {
                log.warn("Character not found: {}", characterId);
                return new ResourceNotFoundException("Character");
            });
        } catch (DataAccessException e) {
            log.error("Error retrieving character {}: {}", characterId, e.getMessage(), e);
            throw new InternalServerException(ErrorCode.RETRIEVE_FAILED, e, "character");
        }
    }

    // character named in the body
    private Character resolveReference(Long characterId) {
        try {
            return characterRepository.findById(characterId).orElseThrow(() -> {
                log.warn("Rejected jutsu referencing missing character {}", characterId);
                return new InvalidRequestException(ErrorCode.RELATED_RESOURCE_NOT_FOUND, "Character");
            });
        } catch (DataAccessException e) {
            log.error("Error retrieving character {}: {}", characterId, e.getMessage(), e);
            throw new InternalServerException(ErrorCode.RETRIEVE_FAILED, e, "character");
        }
    }

    private <T> T required(T value, Long id) {
        if (value == null) {
            log.warn("Rejected null for a required field of jutsu {}", id);
            throw new InvalidRequestException(ErrorCode.UPDATE_FAILED, "jutsu");
        }
        return value;
    }
}
