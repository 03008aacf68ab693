package com.example.epubgloss.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class AnnotationReport {
    private int fragmentsProcessed;
    private int fragmentsModified;
    private int wordsAnnotated;
}
