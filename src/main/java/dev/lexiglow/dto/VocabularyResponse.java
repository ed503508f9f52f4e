package dev.lexiglow.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VocabularyResponse {
    private String id;
    private String userId;
    private String languageId;
    private String name;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
