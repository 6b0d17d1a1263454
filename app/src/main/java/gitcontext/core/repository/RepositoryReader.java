package gitcontext.core.repository;

import java.nio.file.Path;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Version-control metadata for the commit currently checked out.
 *
 * Every accessor is asynchronous. In lenient mode a value that could not be
 * read completes with its default (null, false or an empty list); in strict
 * mode the future completes exceptionally with the
 * {@link gitcontext.exceptions.GitException} as cause.
 */
public interface RepositoryReader {
    /**
     * The 40-character hash HEAD resolves to.
     */
    CompletableFuture<String> getCommitHash();

    /**
     * The checked-out branch, or null when HEAD is detached.
     */
    CompletableFuture<String> getBranch();

    CompletableFuture<Boolean> isDetached();

    /**
     * The commit author as {@code "name <email>"}.
     */
    CompletableFuture<String> getCommitAuthor();

    /**
     * The authorship time, reported at the author's own UTC offset.
     */
    CompletableFuture<OffsetDateTime> getCommitDate();

    CompletableFuture<String> getCommitMessage();

    CompletableFuture<List<String>> getCommitParents();

    /**
     * Names of the tags pointing at the HEAD commit.
     */
    CompletableFuture<List<String>> getTags();

    /**
     * The {@code .git} directory found at construction, if any.
     */
    Optional<Path> getGitDirectory();
}
