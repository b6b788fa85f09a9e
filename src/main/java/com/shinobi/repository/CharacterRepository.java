package com.shinobi.repository;

import com.shinobi.domain.model.Character;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

public interface CharacterRepository extends JpaRepository<Character, Long> {
    Page<Character> findByNameContainingIgnoreCaseOrVillageContainingIgnoreCase(String name, String village, Pageable pageable);

    long countByNameContainingIgnoreCaseOrVillageContainingIgnoreCase(String name, String village);
}
