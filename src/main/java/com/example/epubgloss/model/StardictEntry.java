package com.example.epubgloss.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Row of the ECDICT {@code stardict} table. Only the columns used for glossing are mapped.
 */
@Entity
@Table(name = "stardict")
@Data
@NoArgsConstructor
@AllArgsConstructor
public class StardictEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "word", nullable = false, length = 64)
    private String word;

    @Column(name = "phonetic", length = 64)
    private String phonetic;

    @Column(name = "definition", length = 4000)
    private String definition;

    @Column(name = "translation", length = 4000)
    private String translation; // multi-line, one part of speech per line

    @Column(name = "exchange", length = 4000)
    private String exchange; // e.g. "p:ran/d:ran/i:running/3:runs/0:run"
}
