package gitcontext.core.objects;

import java.io.IOException;
import java.nio.file.Path;

import gitcontext.exceptions.GitException;
import gitcontext.exceptions.MalformedObjectException;
import gitcontext.exceptions.NotFoundException;
import gitcontext.utils.crypto.HashUtils;
import gitcontext.utils.io.RepositoryFileSystem;

// @formatter:off
/**
 * Read-only view of Git's loose object database.
 *
 * Directory Structure:
 * ┌─ .git/objects/
 * │ ├─ ab/ ← First 2 characters of SHA
 * │ │ └─ cdef123... ← Remaining 38 characters of SHA
 * │ ├─ cd/
 * │ │ └─ ef456789...
 * │ └─ ...
 *
 * Example for SHA "abcdef1234567890abcdef1234567890abcdef12":
 * File path: .git/objects/ab/cdef1234567890abcdef1234567890abcdef12
 *
 * Packed objects are not read; an object that only exists inside a packfile
 * is reported as not found.
 */
// @formatter:on
public class FileObjectStore implements ObjectStore {
    private final RepositoryFileSystem fileSystem;
    private final Path objectsPath;

    public FileObjectStore(RepositoryFileSystem fileSystem, Path objectsPath) {
        this.fileSystem = fileSystem;
        this.objectsPath = objectsPath;
    }

    @Override
    public LooseObjectReader open(String sha) throws GitException {
        if (!HashUtils.isValidHash(sha)) {
            throw new MalformedObjectException("Invalid object hash: " + sha);
        }

        Path filePath = resolveObjectPath(sha);
        if (!fileSystem.isFile(filePath)) {
            throw new NotFoundException("Object not found: " + sha);
        }

        try {
            return new LooseObjectReader(sha, fileSystem.open(filePath));
        } catch (IOException e) {
            throw new MalformedObjectException("Failed to open object: " + sha, e);
        }
    }

    /**
     * Converts a SHA-1 hash to the corresponding file path in Git's object storage
     * structure.
     */
    Path resolveObjectPath(String sha) {
        String dirName = sha.substring(0, 2);
        String fileName = sha.substring(2);

        return objectsPath.resolve(dirName).resolve(fileName);
    }
}
