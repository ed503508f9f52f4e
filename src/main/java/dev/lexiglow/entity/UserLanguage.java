package dev.lexiglow.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

import java.time.LocalDateTime;

/**
 * A language a user is learning, identified by the (userId, languageId) pair.
 */
@Getter
@Setter
@ToString
@EqualsAndHashCode(of = {"userId", "languageId"})
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class UserLanguage {

    private String userId;

    private String languageId;

    @Builder.Default
    private ProficiencyLevel proficiencyLevel = ProficiencyLevel.A1;

    private LocalDateTime startedAt;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;
}
