package dev.lexiglow.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

import java.time.LocalDateTime;

/**
 * A user's vocabulary collection for one language. At most one per (user, language).
 */
@Getter
@Setter
@ToString
@EqualsAndHashCode(of = "id")
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class UserVocabulary {

    private String id;

    private String userId;

    private String languageId;

    private String name;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;
}
