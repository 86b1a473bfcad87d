package org.elogsync.cli;

import org.elogsync.pipeline.services.SyncService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Registers a JVM shutdown hook that cancels a running sync and waits for it to close its store
 * and flush its ledger. Closing this object removes the hook.
 */
public final class ShutdownCancellation implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ShutdownCancellation.class);
    private static final Duration GRACE_PERIOD = Duration.ofSeconds(60);

    private final Thread hook;

    private ShutdownCancellation(SyncService service) {
        this.hook = new Thread(() -> {
            log.info("Shutdown requested, cancelling sync");
            service.cancel();
            try {
                if (!service.awaitRunFinished(GRACE_PERIOD)) {
                    log.warn("Sync did not finish within {} seconds of shutdown", GRACE_PERIOD.toSeconds());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "elogsync-shutdown");
    }

    public static ShutdownCancellation register(SyncService service) {
        ShutdownCancellation cancellation = new ShutdownCancellation(service);
        Runtime.getRuntime().addShutdownHook(cancellation.hook);
        return cancellation;
    }

    @Override
    public void close() {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            log.debug("JVM is shutting down, hook stays registered");
        }
    }
}
