package io.sm2env.infrastructure.output;

import io.sm2env.application.port.OutputPort;
import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFilePermission;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link OutputPort} writing to the local filesystem and the process console.
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Write files through a temporary sibling and an atomic rename so a failed write leaves the old file intact.</li>
 *   <li>Restrict written files to owner read/write where the filesystem supports POSIX permissions.</li>
 *   <li>Terminate console output with a newline when the rendered bytes lack one.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Single CLI thread; console writes are flushed per call.</p>
 *
 * @since 0.1.0
 */
public final class LocalOutputAdapter implements OutputPort {
  private static final Logger log = LoggerFactory.getLogger(LocalOutputAdapter.class);
  private static final Set<PosixFilePermission> OWNER_ONLY =
      EnumSet.of(PosixFilePermission.OWNER_READ, PosixFilePermission.OWNER_WRITE);

  private final OutputStream console;

  /**
   * Creates an adapter whose console is the process stdout descriptor.
   */
  public LocalOutputAdapter() {
    this(new FileOutputStream(FileDescriptor.out));
  }

  /**
   * Creates an adapter with an explicit console stream.
   *
   * @param console stream receiving console output; not closed by this adapter
   */
  public LocalOutputAdapter(OutputStream console) {
    this.console = Objects.requireNonNull(console, "console");
  }

  @Override
  public void writeFile(Path path, byte[] bytes) throws IOException {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(bytes, "bytes");
    Path target = path.toAbsolutePath().normalize();
    Path dir = target.getParent();
    if (dir == null || !Files.isDirectory(dir)) {
      throw new IOException("Directory does not exist: " + dir);
    }
    Path tmp = Files.createTempFile(dir, "." + target.getFileName() + ".", ".tmp");
    boolean moved = false;
    try {
      restrictPermissions(tmp);
      Files.write(tmp, bytes);
      try {
        Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
      } catch (AtomicMoveNotSupportedException ex) {
        log.debug("Atomic move not supported in {}; falling back to replace", dir);
        Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
      }
      moved = true;
      log.debug("Wrote {} bytes to {}", bytes.length, target);
    } finally {
      if (!moved) {
        deleteQuietly(tmp);
      }
    }
  }

  @Override
  public void writeConsole(byte[] bytes) throws IOException {
    Objects.requireNonNull(bytes, "bytes");
    console.write(bytes);
    if (bytes.length == 0 || bytes[bytes.length - 1] != '\n') {
      console.write('\n');
    }
    console.flush();
  }

  private static void restrictPermissions(Path file) throws IOException {
    try {
      Files.setPosixFilePermissions(file, OWNER_ONLY);
    } catch (UnsupportedOperationException ex) {
      log.debug("POSIX permissions not supported for {}", file);
    }
  }

  private static void deleteQuietly(Path tmp) {
    try {
      Files.deleteIfExists(tmp);
    } catch (IOException ex) {
      log.warn("Failed to delete temporary file {}", tmp, ex);
    }
  }
}
