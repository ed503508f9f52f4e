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
@ToString(exclude = {"content"})
@EqualsAndHashCode(of = "id")
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Text {

    private String id;

    private String title;

    private String content;

    private String languageId;

    /** Owner; null for system-provided content. */
    private String userId;

    private ProficiencyLevel proficiencyLevel;

    private Integer wordCount;

    @Builder.Default
    private Boolean isPublic = true;

    private String source;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;
}
