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
public class LanguageResponse {
    private String id;
    private String name;
    private String code;
    private String nativeName;
    private LocalDateTime createdAt;
}
