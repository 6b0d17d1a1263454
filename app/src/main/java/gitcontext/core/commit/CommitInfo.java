package gitcontext.core.commit;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Objects;

/**
 * The published parts of the HEAD commit. The date keeps the author's own UTC
 * offset.
 */
public final class CommitInfo {
    private final String hash;
    private final String author;
    private final OffsetDateTime date;
    private final String message;
    private final List<String> parents;

    public CommitInfo(String hash, String author, OffsetDateTime date, String message, List<String> parents) {
        this.hash = Objects.requireNonNull(hash, "hash");
        this.author = Objects.requireNonNull(author, "author");
        this.date = Objects.requireNonNull(date, "date");
        this.message = Objects.requireNonNull(message, "message");
        this.parents = List.copyOf(parents);
    }

    public String getHash() {
        return hash;
    }

    /**
     * Display form {@code "name <email>"}.
     */
    public String getAuthor() {
        return author;
    }

    public OffsetDateTime getDate() {
        return date;
    }

    public String getMessage() {
        return message;
    }

    /**
     * Parent hashes in the order they appear in the commit; the first is the
     * first parent of a merge.
     */
    public List<String> getParents() {
        return parents;
    }

    @Override
    public String toString() {
        return "CommitInfo{hash=" + hash + ", author=" + author + ", date=" + date + ", parents=" + parents + "}";
    }
}
