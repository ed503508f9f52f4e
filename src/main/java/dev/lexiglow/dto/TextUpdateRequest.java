package dev.lexiglow.dto;

import dev.lexiglow.entity.ProficiencyLevel;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TextUpdateRequest {

    @Size(min = 1, max = 255, message = "Title must be between 1 and 255 characters")
    private String title;

    @Size(min = 1, message = "Content must not be empty")
    private String content;

    private String languageId;

    private ProficiencyLevel proficiencyLevel;

    @Min(value = 0, message = "Word count must not be negative")
    private Integer wordCount;

    private Boolean isPublic;

    @Size(max = 500, message = "Source must not exceed 500 characters")
    private String source;
}
