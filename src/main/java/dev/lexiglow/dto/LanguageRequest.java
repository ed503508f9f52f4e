package dev.lexiglow.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LanguageRequest {

    @NotBlank(message = "Name is required")
    @Size(max = 100, message = "Name must not exceed 100 characters")
    private String name;

    @NotBlank(message = "Code is required")
    @Size(min = 2, max = 16, message = "Code must be between 2 and 16 characters")
    private String code;

    @NotBlank(message = "Native name is required")
    @Size(max = 100, message = "Native name must not exceed 100 characters")
    private String nativeName;
}
