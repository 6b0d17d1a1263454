package gitcontext.utils.io;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * Utility class for file operations.
 */
public class FileUtils {

    /**
     * Reads the content of a file as UTF-8 text.
     */
    public static String readString(Path path) throws IOException {
        return new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
    }

    /**
     * Checks if a path is a directory.
     */
    public static boolean isDirectory(Path path) {
        return Files.isDirectory(path);
    }

    /**
     * Checks if a path is a file.
     */
    public static boolean isFile(Path path) {
        return Files.isRegularFile(path);
    }

    /**
     * Lists the regular files directly inside a directory.
     */
    public static List<Path> listFiles(Path directory) throws IOException {
        List<Path> files = new ArrayList<>();
        try (Stream<Path> children = Files.list(directory)) {
            children.filter(Files::isRegularFile).forEach(files::add);
        }
        return files;
    }
}
