package gitcontext.utils.io;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * {@link RepositoryFileSystem} backed by the local disk.
 */
final class LocalFileSystem implements RepositoryFileSystem {
    static final LocalFileSystem INSTANCE = new LocalFileSystem();

    private LocalFileSystem() {
    }

    @Override
    public boolean isDirectory(Path path) {
        return FileUtils.isDirectory(path);
    }

    @Override
    public boolean isFile(Path path) {
        return FileUtils.isFile(path);
    }

    @Override
    public String readString(Path path) throws IOException {
        return FileUtils.readString(path);
    }

    @Override
    public InputStream open(Path path) throws IOException {
        return Files.newInputStream(path);
    }

    @Override
    public List<Path> listFiles(Path directory) throws IOException {
        return FileUtils.listFiles(directory);
    }
}
