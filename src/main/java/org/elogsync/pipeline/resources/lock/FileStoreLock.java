package org.elogsync.pipeline.resources.lock;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.elogsync.pipeline.api.resources.AlreadyRunningException;
import org.elogsync.pipeline.api.resources.IStoreLock;
import org.elogsync.pipeline.resources.AbstractResource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Advisory file lock backed by {@link FileChannel#tryLock()}.
 * <p>
 * The operating system releases the lock when the owning process exits, so a crashed run never
 * blocks later runs. Holders within the same JVM are tracked in a process-wide set of lock paths
 * and rejected before a second channel is opened: POSIX record locks belong to the process, and
 * closing any descriptor on the file would drop the lock the first holder still relies on.
 * The lock file itself is left in place after release; only the lock state matters.
 */
public class FileStoreLock extends AbstractResource implements IStoreLock {

    private static final Logger log = LoggerFactory.getLogger(FileStoreLock.class);
    private static final Set<Path> HELD_IN_THIS_JVM = ConcurrentHashMap.newKeySet();

    private final AtomicLong acquiredCount = new AtomicLong(0);
    private final AtomicLong contendedCount = new AtomicLong(0);

    public FileStoreLock(String name, Config options) {
        super(name, options);
    }

    public FileStoreLock() {
        this("store-lock", ConfigFactory.empty());
    }

    /**
     * {@inheritDoc}
     * <p>
     * A holder in the same JVM is always reported as {@link AlreadyRunningException}, even when
     * {@code blocking} is set, since waiting on it from this process could never succeed.
     */
    @Override
    public Lease acquire(Path lockFile, boolean blocking) throws AlreadyRunningException, IOException {
        Path parent = lockFile.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path key = canonical(lockFile);
        if (!HELD_IN_THIS_JVM.add(key)) {
            contendedCount.incrementAndGet();
            log.debug("Lock {} is held by another run in this process", lockFile);
            throw new AlreadyRunningException(lockFile);
        }

        FileChannel channel = null;
        try {
            channel = FileChannel.open(lockFile,
                StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.READ);
            FileLock lock = blocking ? channel.lock() : channel.tryLock();
            if (lock == null) {
                contendedCount.incrementAndGet();
                log.debug("Lock {} is held by another process", lockFile);
                throw new AlreadyRunningException(lockFile);
            }
            writeOwner(channel);
            acquiredCount.incrementAndGet();
            log.debug("Acquired lock {}", lockFile);
            return new FileLease(lockFile, key, channel, lock);
        } catch (AlreadyRunningException | IOException | RuntimeException e) {
            HELD_IN_THIS_JVM.remove(key);
            if (channel != null) {
                channel.close();
            }
            throw e;
        }
    }

    private static Path canonical(Path lockFile) throws IOException {
        Path absolute = lockFile.toAbsolutePath().normalize();
        Path parent = absolute.getParent();
        return parent == null ? absolute : parent.toRealPath().resolve(absolute.getFileName());
    }

    private static void writeOwner(FileChannel channel) throws IOException {
        byte[] owner = (ProcessHandle.current().pid() + "\n").getBytes(StandardCharsets.US_ASCII);
        channel.truncate(0);
        channel.write(ByteBuffer.wrap(owner), 0);
        channel.force(false);
    }

    @Override
    protected void addCustomMetrics(Map<String, Number> metrics) {
        super.addCustomMetrics(metrics);
        metrics.put("acquired_count", acquiredCount.get());
        metrics.put("contended_count", contendedCount.get());
    }

    private static final class FileLease implements Lease {
        private final Path lockFile;
        private final Path key;
        private final FileChannel channel;
        private final FileLock lock;
        private final AtomicBoolean released = new AtomicBoolean(false);

        private FileLease(Path lockFile, Path key, FileChannel channel, FileLock lock) {
            this.lockFile = lockFile;
            this.key = key;
            this.channel = channel;
            this.lock = lock;
        }

        @Override
        public Path lockFile() {
            return lockFile;
        }

        @Override
        public void close() throws IOException {
            if (!released.compareAndSet(false, true)) {
                return;
            }
            try {
                if (lock.isValid()) {
                    lock.release();
                }
            } finally {
                try {
                    channel.close();
                } finally {
                    HELD_IN_THIS_JVM.remove(key);
                    log.debug("Released lock {}", lockFile);
                }
            }
        }
    }
}
