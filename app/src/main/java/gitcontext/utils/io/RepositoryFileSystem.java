package gitcontext.utils.io;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.List;

/**
 * The read-only file system operations the repository reader needs. Directory
 * discovery and ref resolution go through this interface rather than through
 * {@link java.nio.file.Files} directly, so they can run against a simulated
 * tree.
 */
public interface RepositoryFileSystem {

    /**
     * Checks if a path exists and is a directory.
     */
    boolean isDirectory(Path path);

    /**
     * Checks if a path exists and is a regular file.
     */
    boolean isFile(Path path);

    /**
     * Reads the whole file as UTF-8 text.
     */
    String readString(Path path) throws IOException;

    /**
     * Opens the file for streaming. The caller closes the stream.
     */
    InputStream open(Path path) throws IOException;

    /**
     * Lists the regular files directly inside a directory. Subdirectories are
     * not descended into and are not part of the result.
     */
    List<Path> listFiles(Path directory) throws IOException;

    /**
     * The file system backed by the local disk.
     */
    static RepositoryFileSystem local() {
        return LocalFileSystem.INSTANCE;
    }
}
