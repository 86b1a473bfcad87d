package org.elogsync.pipeline.resources.source;

import com.typesafe.config.ConfigFactory;
import org.elogsync.pipeline.api.source.AuthenticationException;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class TokenCredentialProviderTest {

    @TempDir
    Path tempDir;

    @Test
    void schemeNoneSendsNoHeader() throws Exception {
        TokenCredentialProvider provider = TokenCredentialProvider.fromConfig(ConfigFactory.empty());

        assertThat(provider.isEnabled()).isFalse();
        assertThat(provider.authorizationHeader()).isEmpty();
    }

    @Test
    void inlineTokenIsPrefixedWithScheme() throws Exception {
        TokenCredentialProvider provider = TokenCredentialProvider.fromConfig(
            ConfigFactory.parseMap(Map.of("scheme", "Negotiate", "token", " abc123 ")));

        assertThat(provider.authorizationHeader()).contains("Negotiate abc123");
    }

    @Test
    void tokenFileIsReloadedAfterRefresh() throws Exception {
        Path file = tempDir.resolve("token");
        Files.writeString(file, "first\n");
        TokenCredentialProvider provider = new TokenCredentialProvider("Bearer", null, file);
        assertThat(provider.authorizationHeader()).contains("Bearer first");

        Files.writeString(file, "second");
        assertThat(provider.authorizationHeader()).contains("Bearer first");

        provider.refresh();
        assertThat(provider.authorizationHeader()).contains("Bearer second");
    }

    @Test
    void missingCredentialIsRejected() {
        TokenCredentialProvider provider = new TokenCredentialProvider("Negotiate", null, tempDir.resolve("absent"));

        assertThatThrownBy(provider::authorizationHeader)
            .isInstanceOf(AuthenticationException.class)
            .hasMessageContaining("absent");
    }

    @Test
    void emptyTokenFileIsRejected() throws Exception {
        Path file = tempDir.resolve("token");
        Files.writeString(file, "  \n");
        TokenCredentialProvider provider = new TokenCredentialProvider("Negotiate", "", file);

        assertThatThrownBy(provider::authorizationHeader)
            .isInstanceOf(AuthenticationException.class)
            .hasMessageContaining("No Negotiate credential");
    }
}
