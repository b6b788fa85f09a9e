package com.shinobi.repository;

import com.shinobi.domain.model.Jutsu;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.OffsetDateTime;

public interface JutsuRepository extends JpaRepository<Jutsu, Long> {
    Page<Jutsu> findByNameContainingIgnoreCase(String name, Pageable pageable);

    Page<Jutsu> findByCharacter_Id(Long characterId, Pageable pageable);

    Page<Jutsu> findByCharacter_IdAndNameContainingIgnoreCase(Long characterId, String name, Pageable pageable);

    long countByNameContainingIgnoreCase(String name);

    long countByCharacter_Id(Long characterId);

    long countByCharacter_IdAndNameContainingIgnoreCase(Long characterId, String name);

    @Modifying(flushAutomatically = true)
    @Query("update Jutsu j set j.character = null, j.updatedAt = :now where j.character.id = :characterId")
    int detachFromCharacter(@Param("characterId") Long characterId, @Param("now") OffsetDateTime now);
}
