package dev.lexiglow.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import dev.lexiglow.entity.PartOfSpeech;
import dev.lexiglow.entity.ProficiencyLevel;
import dev.lexiglow.entity.VocabularyItemStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class VocabularyItemResponse {
    private String id;
    private String userVocabularyId;
    private String term;
    private String lemma;
    private String stem;
    private PartOfSpeech partOfSpeech;
    private Double frequency;
    private VocabularyItemStatus status;
    private Integer timesReviewed;
    private ProficiencyLevel confidenceLevel;
    private String notes;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
