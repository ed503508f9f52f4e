package dev.lexiglow;

import dev.lexiglow.dto.LanguageRequest;
import dev.lexiglow.dto.LanguageResponse;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.AutoConfigureWebTestClient;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpStatus;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.reactive.server.WebTestClient;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@AutoConfigureWebTestClient
@ActiveProfiles("test")
class LexiGlowApplicationTest {

    @Autowired
    private WebTestClient webTestClient;

    @Test
    @DisplayName("Should report the relational store as healthy")
    void shouldReportHealthy() {
        webTestClient.get().uri("/api/health")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.status").isEqualTo("UP")
                .jsonPath("$.database").isEqualTo("relational");
    }

    @Test
    @DisplayName("Should create a language and read it back by code")
    void shouldCreateAndReadLanguage() {
        LanguageResponse created = webTestClient.post().uri("/api/v1/languages")
                .bodyValue(new LanguageRequest("Portuguese", "pt-BR", "Português"))
                .exchange()
                .expectStatus().isCreated()
                .expectBody(LanguageResponse.class)
                .returnResult()
                .getResponseBody();

        assertThat(created).isNotNull();
        assertThat(created.getId()).hasSize(26);

        webTestClient.get().uri("/api/v1/languages/code/{code}", "pt-BR")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.id").isEqualTo(created.getId())
                .jsonPath("$.nativeName").isEqualTo("Português");

        webTestClient.post().uri("/api/v1/languages")
                .bodyValue(new LanguageRequest("Portuguese", "pt-BR", "Português"))
                .exchange()
                .expectStatus().isEqualTo(HttpStatus.CONFLICT);
    }
}
