package com.example.epubgloss.repository;

import com.example.epubgloss.model.StardictEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface StardictEntryRepository extends JpaRepository<StardictEntry, Long> {

    Optional<StardictEntry> findFirstByWordOrderByIdAsc(String word);
}
