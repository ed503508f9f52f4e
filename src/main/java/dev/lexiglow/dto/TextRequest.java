package dev.lexiglow.dto;

import dev.lexiglow.entity.ProficiencyLevel;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TextRequest {

    @NotBlank(message = "Title is required")
    @Size(max = 255, message = "Title must not exceed 255 characters")
    private String title;

    @NotBlank(message = "Content is required")
    private String content;

    @NotBlank(message = "Language is required")
    private String languageId;

    /** Owner; omit for system content. */
    private String userId;

    @NotNull(message = "Proficiency level is required")
    private ProficiencyLevel proficiencyLevel;

    /** Computed from the content when omitted. */
    @Min(value = 0, message = "Word count must not be negative")
    private Integer wordCount;

    @Builder.Default
    private Boolean isPublic = true;

    @Size(max = 500, message = "Source must not exceed 500 characters")
    private String source;
}
