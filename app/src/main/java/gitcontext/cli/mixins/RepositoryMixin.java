package gitcontext.cli.mixins;

import java.nio.file.Path;
import java.nio.file.Paths;

import gitcontext.core.repository.ErrorMode;
import gitcontext.core.repository.GitRepositoryReader;
import picocli.CommandLine.Option;

/**
 * Mixin for commands that read a Git repository.
 *
 * The search for {@code .git} starts from the current working directory, or
 * from the directory given with {@code -C}, and walks up from there.
 */
public class RepositoryMixin {

    @Option(names = {
            "-C" }, paramLabel = "<path>", description = "Start looking for the repository in <path> instead of the current working directory")
    private Path startDirectory;

    @Option(names = { "--strict" }, description = "Fail instead of printing empty values when metadata cannot be read")
    private boolean strict;

    public GitRepositoryReader getReader() {
        Path searchPath = startDirectory != null ? startDirectory : Paths.get(".");
        return GitRepositoryReader.builder()
                .startDirectory(searchPath)
                .errorMode(getErrorMode())
                .build();
    }

    public ErrorMode getErrorMode() {
        return strict ? ErrorMode.STRICT : ErrorMode.LENIENT;
    }
}
