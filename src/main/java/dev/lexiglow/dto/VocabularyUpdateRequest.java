package dev.lexiglow.dto;

import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VocabularyUpdateRequest {

    @Size(min = 1, max = 255, message = "Name must be between 1 and 255 characters")
    private String name;
}
