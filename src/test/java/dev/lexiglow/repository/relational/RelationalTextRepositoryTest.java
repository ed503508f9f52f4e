package dev.lexiglow.repository.relational;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class RelationalTextRepositoryTest {

    @Test
    @DisplayName("Should escape LIKE wildcards with a backslash")
    void shouldEscapeWildcards() {
        assertThat(RelationalTextRepository.escapeLike("100%_done")).isEqualTo("100\\%\\_done");
    }

    @Test
    @DisplayName("Should escape the escape character first")
    void shouldEscapeBackslash() {
        assertThat(RelationalTextRepository.escapeLike("a\\%")).isEqualTo("a\\\\\\%");
    }

    @Test
    @DisplayName("Should leave ordinary text alone")
    void shouldKeepPlainText() {
        assertThat(RelationalTextRepository.escapeLike("el viaje")).isEqualTo("el viaje");
    }
}
