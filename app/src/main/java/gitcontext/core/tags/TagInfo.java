package gitcontext.core.tags;

import java.util.Objects;
import java.util.Optional;

/**
 * A tag pointing at a commit. Only annotated tags carry a message.
 */
public final class TagInfo {
    private final String commit;
    private final String tag;
    private final String message;

    private TagInfo(String commit, String tag, String message) {
        this.commit = Objects.requireNonNull(commit, "commit");
        this.tag = Objects.requireNonNull(tag, "tag");
        this.message = message;
    }

    public static TagInfo lightweight(String commit, String tag) {
        return new TagInfo(commit, tag, null);
    }

    public static TagInfo annotated(String commit, String tag, String message) {
        return new TagInfo(commit, tag, Objects.requireNonNull(message, "message"));
    }

    public String getCommit() {
        return commit;
    }

    public String getTag() {
        return tag;
    }

    public Optional<String> getMessage() {
        return Optional.ofNullable(message);
    }

    public boolean isAnnotated() {
        return message != null;
    }

    @Override
    public String toString() {
        return "TagInfo{tag=" + tag + ", commit=" + commit + ", annotated=" + isAnnotated() + "}";
    }
}
