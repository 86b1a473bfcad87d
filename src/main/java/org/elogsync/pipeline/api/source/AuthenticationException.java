package org.elogsync.pipeline.api.source;

import org.elogsync.pipeline.api.resources.SyncException;

/**
 * No usable credential is available for authenticated remote calls.
 */
public class AuthenticationException extends SyncException {

    public AuthenticationException(String message) {
        super(message);
    }
}
