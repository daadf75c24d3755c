package com.vclient.core.util;

import com.vclient.core.model.ClientConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class YamlConfigLoaderTest {

    @TempDir
    Path dir;

    private Path write(String yaml) throws IOException {
        Path p = dir.resolve("vclient.yml");
        Files.writeString(p, yaml);
        return p;
    }

    @Test
    void reads_every_key() throws IOException {
        Path p = write(String.join("\n",
                "baseUrl: https://api.test/",
                "apiKey: abc123",
                "timeoutMs: 5000",
                "defaultCompanyId: comp-1",
                "headers:",
                "  User-Agent: my-app/1.0",
                "retry:",
                "  maxRetries: 5",
                "  delayMs: 250",
                "  autoRetryRateLimit: false",
                "  statuses: [502, 503]",
                "idempotency:",
                "  autoKeys: true",
                ""));

        ClientConfig c = YamlConfigLoader.load(p);

        assertThat(c.getBaseUrl()).isEqualTo("https://api.test");
        assertThat(c.getApiKey()).isEqualTo("abc123");
        assertThat(c.getTimeout()).isEqualTo(Duration.ofSeconds(5));
        assertThat(c.getDefaultCompanyId()).isEqualTo("comp-1");
        assertThat(c.getHeaders()).containsEntry("User-Agent", "my-app/1.0");
        assertThat(c.getMaxRetries()).isEqualTo(5);
        assertThat(c.getRetryDelay()).isEqualTo(Duration.ofMillis(250));
        assertThat(c.isAutoRetryRateLimit()).isFalse();
        assertThat(c.getRetryStatuses()).containsExactly(502, 503);
        assertThat(c.isAutoIdempotencyKeys()).isTrue();
    }

    @Test
    void missing_keys_keep_defaults() throws IOException {
        ClientConfig c = YamlConfigLoader.load(write("baseUrl: https://api.test\napiKey: k\n"));

        assertThat(c.getMaxRetries()).isEqualTo(ClientConfig.DEFAULT_MAX_RETRIES);
        assertThat(c.getRetryStatuses()).isEqualTo(ClientConfig.DEFAULT_RETRY_STATUSES);
    }

    @Test
    void statuses_accept_comma_separated_text() {
        ClientConfig c = YamlConfigLoader.fromMap(Map.of(
                "baseUrl", "https://api.test", "apiKey", "k",
                "retry", Map.of("statuses", "500, 504")), Map.of());

        assertThat(c.getRetryStatuses()).containsExactly(500, 504);
    }

    @Test
    void env_placeholders_are_resolved() {
        ClientConfig c = YamlConfigLoader.fromMap(Map.of(
                "baseUrl", "https://api.test", "apiKey", "${VALENTINA_API_KEY}"),
                Map.of("VALENTINA_API_KEY", "from-env"));

        assertThat(c.getApiKey()).isEqualTo("from-env");
    }

    @Test
    void unset_env_placeholder_fails_validation() {
        assertThatThrownBy(() -> YamlConfigLoader.fromMap(Map.of(
                "baseUrl", "https://api.test", "apiKey", "${NOPE}"), Map.of()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("apiKey");
    }

    @Test
    void bad_number_is_reported_with_its_key() throws IOException {
        Path p = write("baseUrl: https://api.test\napiKey: k\nretry:\n  maxRetries: lots\n");

        assertThatThrownBy(() -> YamlConfigLoader.load(p))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("maxRetries");
    }

    @Test
    void missing_file_is_an_io_error() {
        assertThatThrownBy(() -> YamlConfigLoader.load(dir.resolve("nope.yml")))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("not found");
    }

    @Test
    void empty_file_fails_for_missing_base_url() throws IOException {
        Path p = write("");
        assertThatThrownBy(() -> YamlConfigLoader.load(p))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("baseUrl");
    }
}
