package dev.lexiglow.dto;

import dev.lexiglow.entity.PartOfSpeech;
import dev.lexiglow.entity.ProficiencyLevel;
import dev.lexiglow.entity.VocabularyItemStatus;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Partial update: null fields keep their stored value.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VocabularyItemUpdateRequest {

    @Size(min = 1, max = 255, message = "Term must be between 1 and 255 characters")
    private String term;

    @Size(max = 255, message = "Lemma must not exceed 255 characters")
    private String lemma;

    @Size(max = 255, message = "Stem must not exceed 255 characters")
    private String stem;

    private PartOfSpeech partOfSpeech;

    @DecimalMin(value = "0.0", message = "Frequency must not be negative")
    private Double frequency;

    private VocabularyItemStatus status;

    private ProficiencyLevel confidenceLevel;

    @Size(max = 2000, message = "Notes must not exceed 2000 characters")
    private String notes;
}
