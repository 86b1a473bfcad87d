package org.elogsync.pipeline.api.source;

import java.util.Optional;

/**
 * Supplies the authorization header for authenticated remote calls. Obtaining the underlying
 * token (Kerberos handshake, token exchange) happens outside this process.
 */
public interface ICredentialProvider {

    /**
     * @return The value of the {@code Authorization} header, or empty if calls go out unauthenticated.
     * @throws AuthenticationException if a credential is required but unavailable.
     */
    Optional<String> authorizationHeader() throws AuthenticationException;

    /**
     * Drops any cached credential so that the next call to {@link #authorizationHeader()} reloads it.
     * Called once after a 401 response.
     */
    void refresh();
}
