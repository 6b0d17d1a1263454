package gitcontext.core.tags;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import gitcontext.core.objects.LooseObjectReader;
import gitcontext.core.objects.ObjectField;
import gitcontext.core.objects.ObjectStore;
import gitcontext.core.objects.ObjectType;
import gitcontext.core.refs.ReferenceResolver;
import gitcontext.exceptions.GitException;
import gitcontext.exceptions.MalformedObjectException;
import gitcontext.utils.crypto.HashUtils;
import gitcontext.utils.io.RepositoryFileSystem;

// @formatter:off
/**
 * Collects the tags that point at a given commit.
 *
 * A file under refs/tags holds either the commit hash itself (lightweight tag)
 * or the hash of a tag object (annotated tag):
 * ┌──────────────────────────────────────────────────────────────┐
 * │ object 1f7a7a472abf3dd9643fd615f6da379c4acb3e3a              │
 * │ type commit                                                  │
 * │ tag v1.0                                                     │
 * │ tagger A U Thor <a@b.c> 1700000000 +0200                     │
 * │                                                              │
 * │ Tag message                                                  │
 * └──────────────────────────────────────────────────────────────┘
 *
 * Tags that point elsewhere, at non-commit objects, or that cannot be read
 * are left out of the result. Only files directly inside refs/tags are
 * considered, so tags named like "release/1.0" are not seen.
 */
// @formatter:on
public class TagResolver {
    private static final Logger logger = LoggerFactory.getLogger(TagResolver.class);

    private static final String OBJECT = "object";
    private static final String TYPE = "type";

    private final RepositoryFileSystem fileSystem;
    private final ObjectStore objectStore;

    public TagResolver(RepositoryFileSystem fileSystem, ObjectStore objectStore) {
        this.fileSystem = fileSystem;
        this.objectStore = objectStore;
    }

    /**
     * Tags pointing at {@code commitHash}, sorted by name.
     */
    public List<TagInfo> resolveTags(Path gitDirectory, String commitHash) throws GitException {
        Path tagsDirectory = gitDirectory.resolve(ReferenceResolver.TAGS_DIR);
        if (!fileSystem.isDirectory(tagsDirectory)) {
            return List.of();
        }

        List<Path> tagFiles;
        try {
            tagFiles = new ArrayList<>(fileSystem.listFiles(tagsDirectory));
        } catch (IOException e) {
            throw new MalformedObjectException("Failed to list tags in " + tagsDirectory, e);
        }
        tagFiles.sort(Comparator.comparing(path -> path.getFileName().toString()));

        List<TagInfo> tags = new ArrayList<>();
        for (Path tagFile : tagFiles) {
            resolveTag(tagFile, commitHash).ifPresent(tags::add);
        }
        return tags;
    }

    /**
     * Resolve one tag ref file against the commit it is expected to point at.
     * Returns empty when the tag points elsewhere or cannot be read.
     */
    public Optional<TagInfo> resolveTag(Path tagFile, String commitHash) {
        String tagName = tagFile.getFileName().toString();
        try {
            return readTag(tagFile, tagName, commitHash);
        } catch (GitException e) {
            logger.debug("Skipping tag {}: {}", tagName, e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<TagInfo> readTag(Path tagFile, String tagName, String commitHash) throws GitException {
        String target;
        try {
            target = fileSystem.readString(tagFile).trim();
        } catch (IOException e) {
            throw new MalformedObjectException("Failed to read tag " + tagName, e);
        }

        if (target.equals(commitHash)) {
            return Optional.of(TagInfo.lightweight(commitHash, tagName));
        }

        if (!HashUtils.isValidHash(target)) {
            throw new MalformedObjectException("Invalid tag hash: " + target);
        }

        try (LooseObjectReader reader = objectStore.open(target)) {
            String type = reader.readHeader();
            if (!ObjectType.TAG.matches(type)) {
                logger.debug("Tag {} points at a {} object, not this commit", tagName, type);
                return Optional.empty();
            }

            String commit = null;
            Optional<ObjectField> field;
            while ((field = reader.readField()).isPresent()) {
                String value = field.get().getValue();
                switch (field.get().getKey()) {
                    case OBJECT:
                        if (!HashUtils.isValidHash(value)) {
                            throw new MalformedObjectException("Invalid object hash in tag " + tagName + ": " + value);
                        }
                        if (!value.equals(commitHash)) {
                            logger.debug("Tag {} points at {}", tagName, value);
                            return Optional.empty();
                        }
                        commit = value;
                        break;
                    case TYPE:
                        if (!ObjectType.COMMIT.matches(value)) {
                            logger.debug("Tag {} points at a {} object", tagName, value);
                            return Optional.empty();
                        }
                        break;
                    default:
                        break;
                }
            }

            String message = reader.readBody();

            if (commit == null) {
                throw new MalformedObjectException("Invalid tag format: no object in " + tagName);
            }
            return Optional.of(TagInfo.annotated(commit, tagName, message));
        }
    }
}
