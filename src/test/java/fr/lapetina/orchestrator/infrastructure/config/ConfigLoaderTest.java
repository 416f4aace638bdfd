package fr.lapetina.orchestrator.infrastructure.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConfigLoaderTest {

    private final ConfigLoader loader = new ConfigLoader("unused.yaml");

    private static InputStream yaml(String content) {
        return new ByteArrayInputStream(content.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("should load configuration from the classpath")
    void shouldLoadFromClasspath() {
        OrchestratorConfig config = new ConfigLoader("test-config.yaml").load();

        assertThat(config.getProviders()).extracting(OrchestratorConfig.ProviderConfig::getId)
                .containsExactly("primary", "secondary", "tertiary", "disabled");
        assertThat(config.getGateway().getDefaultModel()).isEqualTo("test-model");
        assertThat(config.getCache().getMaxSize()).isEqualTo(2);
        assertThat(config.getHealthCheck().isEnabled()).isFalse();
        assertThat(config.getProviders().get(1).getModels().getFast()).isEqualTo("secondary-fast");
        assertThat(config.getProviders().get(1).getModels().getAdvanced()).isNull();
        assertThat(config.getProviders().get(0).getModels().getStandard()).isNull();
    }

    @Test
    @DisplayName("should prefer a file on disk")
    void shouldLoadFromFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("orchestrator.yaml");
        Files.writeString(file, """
                providers:
                  - id: "openai"
                    routingPath: "openai"
                retry:
                  maxAttempts: 5
                """);

        OrchestratorConfig config = new ConfigLoader(file.toString()).load();

        assertThat(config.getProviders()).hasSize(1);
        assertThat(config.getRetry().getMaxAttempts()).isEqualTo(5);
        assertThat(config.getRetry().getInitialDelayMs()).isEqualTo(100);
    }

    @Test
    @DisplayName("should fail when the file exists nowhere")
    void shouldFailOnMissingFile() {
        assertThatThrownBy(() -> new ConfigLoader("does-not-exist.yaml").load())
                .isInstanceOf(ConfigLoader.ConfigurationException.class)
                .hasMessageContaining("not found");
    }

    @Test
    @DisplayName("should apply defaults to an empty document")
    void shouldApplyDefaultsToEmptyDocument() {
        OrchestratorConfig config = loader.loadFromStream(yaml(""));

        assertThat(config.getCache().getTtlMs()).isEqualTo(300000);
        assertThat(config.getCache().getMaxSize()).isEqualTo(50);
        assertThat(config.getFallback().isEnabled()).isTrue();
        assertThat(config.getGateway().getApiKeyEnv()).isEqualTo("OPENROUTER_API_KEY");
    }

    @Test
    @DisplayName("should reject duplicate provider ids")
    void shouldRejectDuplicateIds() {
        assertThatThrownBy(() -> loader.loadFromStream(yaml("""
                providers:
                  - id: "openai"
                  - id: "openai"
                """)))
                .isInstanceOf(ConfigLoader.ConfigurationException.class)
                .hasMessageContaining("Duplicate provider id: openai");
    }

    @Test
    @DisplayName("should reject providers without id")
    void shouldRejectMissingId() {
        assertThatThrownBy(() -> loader.loadFromStream(yaml("""
                providers:
                  - name: "Nameless"
                """)))
                .isInstanceOf(ConfigLoader.ConfigurationException.class);
    }

    @Test
    @DisplayName("should reject invalid retry and cache settings")
    void shouldRejectInvalidLimits() {
        assertThatThrownBy(() -> loader.loadFromStream(yaml("retry:\n  maxAttempts: 0\n")))
                .isInstanceOf(ConfigLoader.ConfigurationException.class)
                .hasMessageContaining("retry.maxAttempts");
        assertThatThrownBy(() -> loader.loadFromStream(yaml("cache:\n  maxSize: 0\n")))
                .isInstanceOf(ConfigLoader.ConfigurationException.class)
                .hasMessageContaining("cache");
    }

    @Test
    @DisplayName("should wrap malformed YAML")
    void shouldWrapMalformedYaml() {
        assertThatThrownBy(() -> loader.loadFromStream(yaml("retry: [unclosed")))
                .isInstanceOf(ConfigLoader.ConfigurationException.class)
                .hasMessageStartingWith("Invalid configuration");
    }
}
