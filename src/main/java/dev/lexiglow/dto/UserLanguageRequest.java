package dev.lexiglow.dto;

import dev.lexiglow.entity.ProficiencyLevel;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserLanguageRequest {

    @NotNull(message = "Proficiency level is required")
    private ProficiencyLevel proficiencyLevel;

    /** Defaults to now. */
    private LocalDateTime startedAt;
}
