package de.mirkosertic.mcp.memoryindex.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ApplicationConfig")
class ApplicationConfigTest {

    private static final String PRIMARY = "memoryindex.test.primary";
    private static final String FALLBACK = "memoryindex.test.fallback";

    @AfterEach
    void clearProperties() {
        System.clearProperty(PRIMARY);
        System.clearProperty(FALLBACK);
    }

    private static InputStream yaml(final String content) {
        return new ByteArrayInputStream(content.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("Classpath defaults match the documented values")
    void classpathDefaults() {
        final ApplicationConfig config = ApplicationConfig.defaults();

        assertThat(config.getSnippetContextChars()).isEqualTo(150);
        assertThat(config.getSnippetFallbackChars()).isEqualTo(300);
        assertThat(config.getFullContentMaxChars()).isEqualTo(500);
        assertThat(config.getTimelineWindowSeconds()).isEqualTo(5.0);
        assertThat(config.getTimelineProbeChars()).isEqualTo(50);
        assertThat(config.getFuzzyMinLength()).isEqualTo(3);
        assertThat(config.getFuzzyMaxLength()).isEqualTo(8);
        assertThat(config.getCandidateLimit()).isEqualTo(10000);
        assertThat(config.getKeywordThreads()).isEqualTo(4);
        assertThat(config.getCategoryExpansions()).isEmpty();
        assertThat(config.isDeployedMode()).isFalse();
    }

    @Test
    @DisplayName("YAML values override the current settings")
    void yamlOverrides() {
        final ApplicationConfig config = ApplicationConfig.defaults();

        config.applyYaml(yaml("""
                memoryindex:
                  storage:
                    index-path: /tmp/memory-index
                    nrt-refresh-interval-ms: 250
                  search:
                    snippet-context-chars: 80
                    keyword-threads: 2
                    category-expansions:
                      FISH: [salmon*, tuna*]
                """));

        assertThat(config.getIndexPath()).isEqualTo("/tmp/memory-index");
        assertThat(config.getNrtRefreshIntervalMs()).isEqualTo(250);
        assertThat(config.getKeywordThreads()).isEqualTo(2);
        assertThat(config.getSnippetContextChars()).isEqualTo(80);
        assertThat(config.getSnippetFallbackChars()).isEqualTo(300);
        assertThat(config.getCategoryExpansions()).containsEntry("fish", List.of("salmon*", "tuna*"));
    }

    @Test
    @DisplayName("Documents without a memoryindex section are ignored")
    void unrelatedYamlIsIgnored() {
        final ApplicationConfig config = ApplicationConfig.defaults();

        config.applyYaml(yaml("other:\n  snippet-context-chars: 1\n"));
        config.applyYaml(yaml(""));

        assertThat(config.getSnippetContextChars()).isEqualTo(150);
    }

    @Test
    @DisplayName("Variables resolve from system properties with defaults")
    void resolvesVariables() {
        assertThat(ApplicationConfig.resolveVariables("plain")).isEqualTo("plain");
        assertThat(ApplicationConfig.resolveVariables("${" + PRIMARY + ":fallback}/x")).isEqualTo("fallback/x");

        System.setProperty(PRIMARY, "set");
        assertThat(ApplicationConfig.resolveVariables("${" + PRIMARY + ":fallback}/x")).isEqualTo("set/x");
    }

    @Test
    @DisplayName("Defaults may contain further variables")
    void resolvesNestedDefaults() {
        System.setProperty(FALLBACK, "/data");

        assertThat(ApplicationConfig.resolveVariables("${" + PRIMARY + ":${" + FALLBACK + ":/none}/index}"))
                .isEqualTo("/data/index");
        assertThat(ApplicationConfig.resolveVariables("jdbc:h2:file:${" + FALLBACK + "}/store"))
                .isEqualTo("jdbc:h2:file:/data/store");
    }
}
