package com.shinobi.service;

import com.shinobi.domain.model.Character;
import com.shinobi.dto.CharacterCreateRequest;
import com.shinobi.dto.CharacterDto;
import com.shinobi.dto.CharacterUpdateRequest;
import com.shinobi.dto.PageResponse;
import com.shinobi.error.exception.InternalServerException;
import com.shinobi.error.exception.InvalidRequestException;
import com.shinobi.error.exception.ResourceNotFoundException;
import com.shinobi.repository.CharacterRepository;
import com.shinobi.repository.JutsuRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.Pageable;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@Tag("unit")
@ExtendWith(MockitoExtension.class)
@DisplayName("CharacterService")
class CharacterServiceTest {

    private static final OffsetDateTime CREATED = OffsetDateTime.of(2024, 1, 1, 0, 0, 0, 0, ZoneOffset.UTC);

    @Mock
    private CharacterRepository characterRepository;

    @Mock
    private JutsuRepository jutsuRepository;

    @InjectMocks
    private CharacterService characterService;

    private Character naruto() {
        Character character = new Character();
        character.setId(1L);
        character.setName("Naruto Uzumaki");
        character.setVillage("Konoha");
        character.setRank("Genin");
        character.setCreatedAt(CREATED);
        character.setUpdatedAt(CREATED);
        return character;
    }

    @Test
    @DisplayName("create stores every field")
    void create() {
        given(characterRepository.saveAndFlush(any(Character.class))).willAnswer(inv -> {
            Character saved = inv.getArgument(0);
            saved.setId(1L);
            return saved;
        });

        CharacterDto dto = characterService.create(new CharacterCreateRequest("Gaara", "Suna", "Kazekage"));

        assertThat(dto.id()).isEqualTo(1L);
        assertThat(dto.village()).isEqualTo("Suna");
        assertThat(dto.rank()).isEqualTo("Kazekage");
    }

    @Test
    @DisplayName("search matches name or village with the same term")
    void listWithSearch() {
        given(characterRepository.findByNameContainingIgnoreCaseOrVillageContainingIgnoreCase(
                eq("kon"), eq("kon"), any(Pageable.class)))
                .willReturn(new PageImpl<>(List.of(naruto()), Pageable.ofSize(10), 1));

        PageResponse<CharacterDto> page = characterService.list(1, 10, "kon");

        assertThat(page.items()).extracting(CharacterDto::name).containsExactly("Naruto Uzumaki");
        verify(characterRepository, never()).findAll(any(Pageable.class));
    }

    @Test
    @DisplayName("unreachable page counts all characters without fetching rows")
    void listFarPastTheEnd() {
        given(characterRepository.count()).willReturn(12L);

        PageResponse<CharacterDto> page = characterService.list(Integer.MAX_VALUE, 5, null);

        assertThat(page.items()).isEmpty();
        assertThat(page.pages()).isEqualTo(3);
        verify(characterRepository, never()).findAll(any(Pageable.class));
    }

    @Test
    @DisplayName("update merges present fields and refreshes updated_at")
    void update() {
        Character character = naruto();
        given(characterRepository.findById(1L)).willReturn(Optional.of(character));
        given(characterRepository.saveAndFlush(character)).willReturn(character);

        CharacterUpdateRequest request = new CharacterUpdateRequest();
        request.setRank("Hokage");

        CharacterDto dto = characterService.update(1L, request);

        assertThat(dto.rank()).isEqualTo("Hokage");
        assertThat(dto.name()).isEqualTo("Naruto Uzumaki");
        assertThat(dto.updatedAt()).isAfter(CREATED);
        assertThat(dto.createdAt()).isEqualTo(CREATED);
    }

    @Test
    @DisplayName("empty update returns the character without writing")
    void emptyUpdate() {
        given(characterRepository.findById(1L)).willReturn(Optional.of(naruto()));

        CharacterDto dto = characterService.update(1L, new CharacterUpdateRequest());

        assertThat(dto.updatedAt()).isEqualTo(CREATED);
        verify(characterRepository, never()).saveAndFlush(any());
    }

    @Test
    @DisplayName("explicit null village is rejected")
    void nullVillage() {
        given(characterRepository.findById(1L)).willReturn(Optional.of(naruto()));

        CharacterUpdateRequest request = new CharacterUpdateRequest();
        request.setVillage(null);

        assertThatThrownBy(() -> characterService.update(1L, request))
                .isInstanceOf(InvalidRequestException.class)
                .hasMessage("Could not update character");
    }

    @Test
    @DisplayName("delete detaches jutsus before removing the character")
    void deleteDetachesJutsus() {
        Character character = naruto();
        given(characterRepository.findById(1L)).willReturn(Optional.of(character));
        given(jutsuRepository.detachFromCharacter(eq(1L), any(OffsetDateTime.class))).willReturn(2);

        characterService.delete(1L);

        InOrder order = inOrder(jutsuRepository, characterRepository);
        order.verify(jutsuRepository).detachFromCharacter(eq(1L), any(OffsetDateTime.class));
        order.verify(characterRepository).delete(character);
    }

    @Test
    @DisplayName("delete of an unknown character is a 404 and touches no jutsu")
    void deleteMissing() {
        given(characterRepository.findById(5L)).willReturn(Optional.empty());

        assertThatThrownBy(() -> characterService.delete(5L))
                .isInstanceOf(ResourceNotFoundException.class)
                .hasMessage("Character not found");
        verifyNoInteractions(jutsuRepository);
    }

    @Test
    @DisplayName("store failure while deleting becomes a 500")
    void deleteFailure() {
        given(characterRepository.findById(1L)).willReturn(Optional.of(naruto()));
        given(jutsuRepository.detachFromCharacter(eq(1L), any(OffsetDateTime.class)))
                .willThrow(new CannotAcquireLockException("locked"));

        assertThatThrownBy(() -> characterService.delete(1L))
                .isInstanceOf(InternalServerException.class)
                .hasMessage("Could not delete character");
    }
}
