package org.elogsync.pipeline.resources.source;

import com.typesafe.config.Config;
import org.elogsync.pipeline.api.source.AuthenticationException;
import org.elogsync.pipeline.api.source.ICredentialProvider;
import org.elogsync.pipeline.utils.PathExpansion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Credential provider for tokens obtained outside this process (e.g. a SPNEGO token produced by a
 * Kerberos helper).
 * <p>
 * The token comes either inline ({@code token}) or from a file ({@code token-file}). File tokens
 * are re-read on {@link #refresh()}, so an external helper can renew them while a run is active.
 * The scheme {@code none} disables authentication.
 * <pre>
 * auth {
 *   scheme = "Negotiate"
 *   token = ${?ELOGSYNC_AUTH_TOKEN}
 *   token-file = ${?ELOGSYNC_AUTH_TOKEN_FILE}
 * }
 * </pre>
 */
public class TokenCredentialProvider implements ICredentialProvider {

    private static final Logger log = LoggerFactory.getLogger(TokenCredentialProvider.class);
    public static final String SCHEME_NONE = "none";

    private final String scheme;
    private final String inlineToken;
    private final Path tokenFile;
    private volatile String cachedHeader;

    public TokenCredentialProvider(String scheme, String inlineToken, Path tokenFile) {
        this.scheme = scheme == null || scheme.isBlank() ? SCHEME_NONE : scheme.trim();
        this.inlineToken = inlineToken == null || inlineToken.isBlank() ? null : inlineToken.trim();
        this.tokenFile = tokenFile;
    }

    /**
     * Creates a provider from an {@code auth} config block.
     */
    public static TokenCredentialProvider fromConfig(Config auth) {
        String scheme = auth.hasPath("scheme") ? auth.getString("scheme") : SCHEME_NONE;
        String token = auth.hasPath("token") ? auth.getString("token") : null;
        Path file = auth.hasPath("token-file") && !auth.getString("token-file").isBlank()
            ? PathExpansion.toPath(auth.getString("token-file"))
            : null;
        return new TokenCredentialProvider(scheme, token, file);
    }

    public boolean isEnabled() {
        return !SCHEME_NONE.equalsIgnoreCase(scheme);
    }

    @Override
    public Optional<String> authorizationHeader() throws AuthenticationException {
        if (!isEnabled()) {
            return Optional.empty();
        }
        String header = cachedHeader;
        if (header == null) {
            header = scheme + " " + loadToken();
            cachedHeader = header;
        }
        return Optional.of(header);
    }

    @Override
    public void refresh() {
        log.debug("Dropping cached credential");
        cachedHeader = null;
    }

    private String loadToken() throws AuthenticationException {
        if (inlineToken != null) {
            return inlineToken;
        }
        if (tokenFile != null) {
            try {
                String token = Files.readString(tokenFile, StandardCharsets.UTF_8).trim();
                if (!token.isEmpty()) {
                    return token;
                }
            } catch (IOException e) {
                throw new AuthenticationException("Cannot read credential from " + tokenFile + ": " + e.getMessage());
            }
        }
        throw new AuthenticationException("No " + scheme + " credential available. "
            + "Set elogsync.source.auth.token (ELOGSYNC_AUTH_TOKEN) or elogsync.source.auth.token-file.");
    }
}
