package ca.gc.cra.safekeeper.validation;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;

/**
 * <strong>What:</strong> Filesystem validation for the ledger state file.
 * <p><strong>Why:</strong> A deploy must not silently replace an existing ledger, and every command must fail
 * early when the state location cannot be written.</p>
 * <p><strong>Thread-safety:</strong> Stateless; results may be invalidated by concurrent filesystem changes.</p>
 * <p><strong>Observability:</strong> Emits no logs; callers surface the exceptions.</p>
 *
 * @implNote Checks use {@link LinkOption#NOFOLLOW_LINKS} so a symlinked state file is rejected rather than
 * followed.
 * @since 0.1.0
 * @see Strings
 */
public final class Paths {
  private Paths() {
    // Utility
  }

  /**
   * Validates a location for the state file.
   *
   * @param path candidate file path
   * @param createParents whether missing parent directories may be created
   * @param allowOverwrite when {@code false}, an existing file is rejected
   * @return absolute normalized path
   * @throws IllegalArgumentException if the path is malformed, not a regular file, or its directory is not writable
   */
  public static Path validateStateFile(Path path, boolean createParents, boolean allowOverwrite) {
    if (path == null) {
      throw new IllegalArgumentException("state path must not be null");
    }
    String raw = path.toString();
    for (int i = 0; i < raw.length(); i++) {
      if (raw.charAt(i) == '\0' || Character.isISOControl(raw.charAt(i))) {
        throw new IllegalArgumentException("state path must not contain control characters");
      }
    }
    Path normalized = path.toAbsolutePath().normalize();
    Path parent = normalized.getParent();
    if (parent == null) {
      throw new IllegalArgumentException("state path has no parent directory: " + normalized);
    }
    try {
      if (!Files.exists(parent, LinkOption.NOFOLLOW_LINKS)) {
        if (!createParents) {
          throw new IllegalArgumentException("state directory does not exist: " + parent);
        }
        Files.createDirectories(parent);
      }
      if (!Files.isDirectory(parent)) {
        throw new IllegalArgumentException("state parent is not a directory: " + parent);
      }
      if (!Files.isWritable(parent)) {
        throw new IllegalArgumentException("state directory is not writable: " + parent);
      }
      if (Files.exists(normalized, LinkOption.NOFOLLOW_LINKS)) {
        if (!Files.isRegularFile(normalized, LinkOption.NOFOLLOW_LINKS)) {
          throw new IllegalArgumentException("state path is not a regular file: " + normalized);
        }
        if (!allowOverwrite) {
          throw new IllegalArgumentException(
              "state file " + normalized + " already exists; re-run with --allow-overwrite to replace it");
        }
      }
      return normalized;
    } catch (IOException ex) {
      throw new IllegalArgumentException("unable to prepare state directory " + parent + ": " + ex.getMessage(), ex);
    }
  }
}
