package dev.lexiglow.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import dev.lexiglow.entity.ProficiencyLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TextResponse {
    private String id;
    private String title;
    private String content;
    private String languageId;
    private String userId;
    private ProficiencyLevel proficiencyLevel;
    private Integer wordCount;
    private Boolean isPublic;
    private String source;
    /** Only filled on single-text lookups. */
    private List<String> tagIds;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
