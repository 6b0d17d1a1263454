package gitcontext.core.refs;

import java.io.IOException;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import gitcontext.exceptions.GitException;
import gitcontext.exceptions.MalformedObjectException;
import gitcontext.exceptions.NotFoundException;
import gitcontext.utils.crypto.HashUtils;
import gitcontext.utils.io.RepositoryFileSystem;

// @formatter:off
/**
 * Finds the {@code .git} directory and resolves HEAD.
 *
 * The parts of the metadata directory that are read:
 * ┌─ <working-directory>/
 * │ ├─ .git/
 * │ │ ├─ HEAD ← "ref: refs/heads/<branch>" or a bare commit hash
 * │ │ ├─ objects/ ← must exist for the directory to count
 * │ │ └─ refs/
 * │ │    ├─ heads/<branch> ← bare commit hash
 * │ │    └─ tags/<name> ← see TagResolver
 * │ └─ ...
 */
// @formatter:on
public class ReferenceResolver {
    private static final Logger logger = LoggerFactory.getLogger(ReferenceResolver.class);

    public static final String GIT_DIR = ".git";
    public static final String HEAD_FILE = "HEAD";
    public static final String OBJECTS_DIR = "objects";
    public static final String HEADS_DIR = "refs/heads";
    public static final String TAGS_DIR = "refs/tags";

    private static final String SYMBOLIC_REF_PREFIX = "ref: ";

    private final RepositoryFileSystem fileSystem;

    public ReferenceResolver(RepositoryFileSystem fileSystem) {
        this.fileSystem = fileSystem;
    }

    /**
     * Find the metadata directory by walking up the directory tree from
     * {@code startPath}. The first {@code .git} directory that holds both a
     * HEAD file and an objects directory wins.
     */
    public Optional<Path> findGitDirectory(Path startPath) {
        Path current = startPath.toAbsolutePath().normalize();

        while (current != null) {
            Path candidate = current.resolve(GIT_DIR);
            if (isGitDirectory(candidate)) {
                logger.debug("Found git directory {}", candidate);
                return Optional.of(candidate);
            }
            current = current.getParent();
        }

        logger.debug("No git directory above {}", startPath);
        return Optional.empty();
    }

    /**
     * Resolve HEAD to a branch and commit, or to a detached commit.
     */
    public HeadInfo resolveHead(Path gitDirectory) throws GitException {
        Path headPath = gitDirectory.resolve(HEAD_FILE);
        if (!fileSystem.isFile(headPath)) {
            throw new NotFoundException("HEAD file not found: " + headPath);
        }

        String headContent = read(headPath).trim();

        if (headContent.startsWith(SYMBOLIC_REF_PREFIX)) {
            return resolveBranch(gitDirectory, headContent);
        }

        if (!HashUtils.isValidHash(headContent)) {
            throw new MalformedObjectException("Invalid HEAD format: " + headContent);
        }
        return HeadInfo.detached(headContent);
    }

    private HeadInfo resolveBranch(Path gitDirectory, String headContent) throws GitException {
        String refPath = headContent.substring(SYMBOLIC_REF_PREFIX.length()).trim();
        if (!refPath.startsWith(HEADS_DIR + "/") || refPath.length() == HEADS_DIR.length() + 1) {
            throw new MalformedObjectException("Invalid HEAD format: " + headContent);
        }

        String branch = refPath.substring(HEADS_DIR.length() + 1);

        Path headsDirectory;
        Path refFile;
        try {
            headsDirectory = gitDirectory.resolve(HEADS_DIR).normalize();
            refFile = gitDirectory.resolve(refPath).normalize();
        } catch (InvalidPathException e) {
            throw new MalformedObjectException("Invalid HEAD format: " + headContent, e);
        }
        if (!refFile.startsWith(headsDirectory)) {
            throw new MalformedObjectException("Invalid HEAD format: " + headContent);
        }
        if (!fileSystem.isFile(refFile)) {
            throw new NotFoundException("Ref file not found for branch " + branch + ": " + refFile);
        }

        String commitHash = read(refFile).trim();
        if (!HashUtils.isValidHash(commitHash)) {
            throw new MalformedObjectException("Invalid commit hash in " + refPath + ": " + commitHash);
        }
        return HeadInfo.onBranch(headContent, branch, commitHash);
    }

    private boolean isGitDirectory(Path candidate) {
        return fileSystem.isDirectory(candidate)
                && fileSystem.isFile(candidate.resolve(HEAD_FILE))
                && fileSystem.isDirectory(candidate.resolve(OBJECTS_DIR));
    }

    private String read(Path path) throws MalformedObjectException {
        try {
            return fileSystem.readString(path);
        } catch (IOException e) {
            throw new MalformedObjectException("Failed to read " + path, e);
        }
    }
}
