package dev.pbxsort.writer;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.PosixFileAttributeView;
import java.nio.file.attribute.PosixFilePermission;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Replaces a file's content through a sibling temporary file and an atomic rename, so the target either keeps its
 * old content or holds the complete new content.
 */
public class AtomicFileWriter {

    private static final Logger LOGGER = LoggerFactory.getLogger(AtomicFileWriter.class);

    public void write(Path target, String content) {
        if (target == null || content == null) {
            throw new IllegalArgumentException("target and content must be provided");
        }
        Path absoluteTarget = target.toAbsolutePath();
        Path directory = absoluteTarget.getParent();
        Path temp = null;
        try {
            temp = Files.createTempFile(directory, "." + absoluteTarget.getFileName() + ".", ".tmp");
            writeAndForce(temp, content);
            copyPermissions(absoluteTarget, temp);
            moveIntoPlace(temp, absoluteTarget);
            temp = null;
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to write " + target, ex);
        } finally {
            if (temp != null) {
                deleteQuietly(temp);
            }
        }
    }

    private void writeAndForce(Path temp, String content) throws IOException {
        ByteBuffer buffer = ByteBuffer.wrap(content.getBytes(StandardCharsets.UTF_8));
        try (FileChannel channel = FileChannel.open(temp, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING)) {
            while (buffer.hasRemaining()) {
                channel.write(buffer);
            }
            channel.force(true);
        }
    }

    /**
     * Atomically renames {@code temp} over {@code target}.
     */
    protected void moveIntoPlace(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException ex) {
            throw new IOException("Atomic rename is not supported for " + target, ex);
        }
    }

    private void copyPermissions(Path source, Path temp) throws IOException {
        if (!Files.exists(source)) {
            return;
        }
        PosixFileAttributeView view = Files.getFileAttributeView(source, PosixFileAttributeView.class);
        if (view == null) {
            return;
        }
        Set<PosixFilePermission> permissions = view.readAttributes().permissions();
        Files.setPosixFilePermissions(temp, permissions);
    }

    private void deleteQuietly(Path temp) {
        try {
            Files.deleteIfExists(temp);
        } catch (IOException ex) {
            LOGGER.warn("Could not remove temporary file {}", temp, ex);
        }
    }
}
