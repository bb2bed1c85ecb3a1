package in.tickforge.infrastructure.persistence;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.channels.Channels;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.UUID;
import java.util.function.UnaryOperator;

/**
 * Crash-safe file replacement.
 *
 * Protocol: temp file in the target directory → write → fsync → close → atomic rename.
 * The temp file is removed on every path that does not reach the rename.
 *
 * <pre>
 * try (AtomicFileWriter.PendingWrite pending = AtomicFileWriter.begin(target)) {
 *     pending.stream().write(bytes);
 *     pending.commit();
 * }
 * </pre>
 */
public final class AtomicFileWriter {
    private static final Logger log = LoggerFactory.getLogger(AtomicFileWriter.class);

    static final String TEMP_PREFIX = ".tmp-";

    public static void write(Path target, byte[] data) throws IOException {
        try (PendingWrite pending = begin(target)) {
            pending.stream().write(data);
            pending.commit();
        }
    }

    public static PendingWrite begin(Path target) throws IOException {
        return begin(target, UnaryOperator.identity());
    }

    /**
     * @param decorator wraps the temp file stream (fault injection in tests)
     */
    static PendingWrite begin(Path target, UnaryOperator<OutputStream> decorator) throws IOException {
        Path dir = target.toAbsolutePath().getParent();
        Files.createDirectories(dir);
        Path temp = dir.resolve(TEMP_PREFIX + UUID.randomUUID() + "-" + target.getFileName());
        FileChannel channel = FileChannel.open(temp, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
        return new PendingWrite(target, temp, channel, decorator.apply(Channels.newOutputStream(channel)));
    }

    public static boolean isTempFile(Path file) {
        return file.getFileName().toString().startsWith(TEMP_PREFIX);
    }

    /**
     * An uncommitted write. Closing it without {@link #commit()} discards the temp file.
     */
    public static final class PendingWrite implements Closeable {
        private final Path target;
        private final Path temp;
        private final FileChannel channel;
        private final OutputStream stream;
        private boolean committed = false;

        private PendingWrite(Path target, Path temp, FileChannel channel, OutputStream stream) {
            this.target = target;
            this.temp = temp;
            this.channel = channel;
            this.stream = stream;
        }

        public OutputStream stream() {
            return stream;
        }

        public void commit() throws IOException {
            stream.flush();
            channel.force(true);
            stream.close();
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            committed = true;
        }

        @Override
        public void close() throws IOException {
            if (committed) {
                return;
            }
            try {
                channel.close();
            } finally {
                if (Files.deleteIfExists(temp)) {
                    log.debug("Discarded uncommitted write {}", temp.getFileName());
                }
            }
        }
    }

    private AtomicFileWriter() {}
}
