package gitcontext.core.repository;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Function;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import gitcontext.core.commit.CommitInfo;
import gitcontext.core.commit.CommitParser;
import gitcontext.core.objects.FileObjectStore;
import gitcontext.core.refs.HeadInfo;
import gitcontext.core.refs.ReferenceResolver;
import gitcontext.core.tags.TagInfo;
import gitcontext.core.tags.TagResolver;
import gitcontext.exceptions.GitException;
import gitcontext.exceptions.NotFoundException;
import gitcontext.utils.io.RepositoryFileSystem;

/**
 * Reads HEAD, the HEAD commit and its tags straight from the {@code .git}
 * directory.
 *
 * HEAD is resolved at most once, the commit object is decoded at most once
 * and the tags directory is scanned at most once per instance, however many
 * accessors are called and from however many threads. The commit and the tag
 * list both build on the shared HEAD result.
 *
 * By default computations run on the calling thread; pass an
 * {@link Executor} to the builder to run them elsewhere.
 */
public final class GitRepositoryReader implements RepositoryReader {
    private static final Logger logger = LoggerFactory.getLogger(GitRepositoryReader.class);

    private final ErrorMode errorMode;
    private final Executor executor;
    private final Path gitDirectory;
    private final ReferenceResolver referenceResolver;
    private final CommitParser commitParser;
    private final TagResolver tagResolver;

    private final LazyValue<HeadInfo> head;
    private final LazyValue<CommitInfo> commit;
    private final LazyValue<List<TagInfo>> tags;

    private GitRepositoryReader(Builder builder) {
        this.errorMode = builder.errorMode;
        this.executor = builder.executor;

        RepositoryFileSystem fileSystem = builder.fileSystem;
        this.referenceResolver = new ReferenceResolver(fileSystem);
        this.gitDirectory = referenceResolver.findGitDirectory(builder.startDirectory).orElse(null);

        FileObjectStore objectStore = gitDirectory != null
                ? new FileObjectStore(fileSystem, gitDirectory.resolve(ReferenceResolver.OBJECTS_DIR))
                : null;
        this.commitParser = new CommitParser(objectStore);
        this.tagResolver = new TagResolver(fileSystem, objectStore);

        this.head = new LazyValue<>("HEAD", () -> CompletableFuture
                .supplyAsync(() -> report("HEAD", Result.of(this::readHead)), executor));
        this.commit = new LazyValue<>("commit", () -> head.get()
                .thenApplyAsync(headInfo -> report("commit", headInfo.then(commitParser::parse)), executor));
        this.tags = new LazyValue<>("tags", () -> head.get()
                .thenApplyAsync(headInfo -> report("tags", headInfo.then(this::readTags)), executor));

        if (gitDirectory == null) {
            logger.debug("No git directory found above {}", builder.startDirectory);
        }
    }

    /**
     * A lenient reader starting from the working directory.
     */
    public static GitRepositoryReader open() {
        return builder().build();
    }

    /**
     * A lenient reader starting from {@code startDirectory}.
     */
    public static GitRepositoryReader open(Path startDirectory) {
        return builder().startDirectory(startDirectory).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public CompletableFuture<String> getCommitHash() {
        return read(head, HeadInfo::getCommitHash, null);
    }

    @Override
    public CompletableFuture<String> getBranch() {
        return read(head, headInfo -> headInfo.getBranch().orElse(null), null);
    }

    @Override
    public CompletableFuture<Boolean> isDetached() {
        return read(head, HeadInfo::isDetached, false);
    }

    @Override
    public CompletableFuture<String> getCommitAuthor() {
        return read(commit, CommitInfo::getAuthor, null);
    }

    @Override
    public CompletableFuture<OffsetDateTime> getCommitDate() {
        return read(commit, CommitInfo::getDate, null);
    }

    @Override
    public CompletableFuture<String> getCommitMessage() {
        return read(commit, CommitInfo::getMessage, null);
    }

    @Override
    public CompletableFuture<List<String>> getCommitParents() {
        return read(commit, CommitInfo::getParents, List.of());
    }

    @Override
    public CompletableFuture<List<String>> getTags() {
        return read(tags, tagInfos -> tagInfos.stream().map(TagInfo::getTag).collect(Collectors.toUnmodifiableList()),
                List.of());
    }

    /**
     * The tags pointing at HEAD, including annotated tag messages.
     */
    public CompletableFuture<List<TagInfo>> getTagInfos() {
        return read(tags, Function.identity(), List.of());
    }

    @Override
    public Optional<Path> getGitDirectory() {
        return Optional.ofNullable(gitDirectory);
    }

    LazyValue<HeadInfo> headValue() {
        return head;
    }

    LazyValue<CommitInfo> commitValue() {
        return commit;
    }

    LazyValue<List<TagInfo>> tagsValue() {
        return tags;
    }

    private <T, V> CompletableFuture<V> read(LazyValue<T> value, Function<T, V> getter, V fallback) {
        return value.get().thenApply(result -> {
            T settled = errorMode.apply(result);
            return settled != null ? getter.apply(settled) : fallback;
        });
    }

    private HeadInfo readHead() throws GitException {
        return referenceResolver.resolveHead(requireGitDirectory());
    }

    private List<TagInfo> readTags(HeadInfo headInfo) throws GitException {
        return tagResolver.resolveTags(requireGitDirectory(), headInfo.getCommitHash());
    }

    private Path requireGitDirectory() throws NotFoundException {
        if (gitDirectory == null) {
            throw new NotFoundException("Git directory not found");
        }
        return gitDirectory;
    }

    private <T> Result<T> report(String name, Result<T> result) {
        if (result.isError() && errorMode == ErrorMode.LENIENT) {
            logger.warn("Could not read {}: {}", name, result.getError().getMessage());
        }
        return result;
    }

    public static final class Builder {
        private Path startDirectory = Paths.get(System.getProperty("user.dir"));
        private ErrorMode errorMode = ErrorMode.LENIENT;
        private Executor executor = Runnable::run;
        private RepositoryFileSystem fileSystem = RepositoryFileSystem.local();

        private Builder() {
        }

        public Builder startDirectory(Path startDirectory) {
            this.startDirectory = Objects.requireNonNull(startDirectory, "startDirectory");
            return this;
        }

        public Builder errorMode(ErrorMode errorMode) {
            this.errorMode = Objects.requireNonNull(errorMode, "errorMode");
            return this;
        }

        public Builder strict(boolean strict) {
            return errorMode(strict ? ErrorMode.STRICT : ErrorMode.LENIENT);
        }

        public Builder executor(Executor executor) {
            this.executor = Objects.requireNonNull(executor, "executor");
            return this;
        }

        public Builder fileSystem(RepositoryFileSystem fileSystem) {
            this.fileSystem = Objects.requireNonNull(fileSystem, "fileSystem");
            return this;
        }

        public GitRepositoryReader build() {
            return new GitRepositoryReader(this);
        }
    }
}
