package dev.lexiglow.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

import java.time.LocalDateTime;

@Getter
@Setter
@ToString
@EqualsAndHashCode(of = "id")
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class UserVocabularyItem {

    private String id;

    private String userVocabularyId;

    private String term;

    private String lemma;

    private String stem;

    private PartOfSpeech partOfSpeech;

    private Double frequency;

    @Builder.Default
    private VocabularyItemStatus status = VocabularyItemStatus.NEW;

    @Builder.Default
    private Integer timesReviewed = 0;

    @Builder.Default
    private ProficiencyLevel confidenceLevel = ProficiencyLevel.A1;

    private String notes;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;
}
