package dev.lexiglow.dto;

import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Partial update: null fields keep their stored value.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LanguageUpdateRequest {

    @Size(min = 1, max = 100, message = "Name must be between 1 and 100 characters")
    private String name;

    @Size(min = 2, max = 16, message = "Code must be between 2 and 16 characters")
    private String code;

    @Size(min = 1, max = 100, message = "Native name must be between 1 and 100 characters")
    private String nativeName;
}
