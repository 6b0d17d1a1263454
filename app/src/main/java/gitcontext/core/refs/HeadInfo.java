package gitcontext.core.refs;

import java.util.Objects;
import java.util.Optional;

/**
 * What HEAD points at. A branch is present exactly when HEAD is not detached.
 */
public final class HeadInfo {
    private final String ref;
    private final String branch;
    private final String commitHash;

    private HeadInfo(String ref, String branch, String commitHash) {
        this.ref = Objects.requireNonNull(ref, "ref");
        this.branch = branch;
        this.commitHash = Objects.requireNonNull(commitHash, "commitHash");
    }

    public static HeadInfo onBranch(String ref, String branch, String commitHash) {
        return new HeadInfo(ref, Objects.requireNonNull(branch, "branch"), commitHash);
    }

    public static HeadInfo detached(String commitHash) {
        return new HeadInfo(commitHash, null, commitHash);
    }

    /**
     * The trimmed content of the HEAD file.
     */
    public String getRef() {
        return ref;
    }

    public Optional<String> getBranch() {
        return Optional.ofNullable(branch);
    }

    public String getCommitHash() {
        return commitHash;
    }

    public boolean isDetached() {
        return branch == null;
    }

    @Override
    public String toString() {
        return isDetached()
                ? "HeadInfo{detached at " + commitHash + "}"
                : "HeadInfo{branch=" + branch + ", commit=" + commitHash + "}";
    }
}
