package gitcontext.cli.utils;

import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import gitcontext.core.repository.RepositoryReader;
import gitcontext.exceptions.GitException;

/**
 * The eight published values, read once from a {@link RepositoryReader}.
 */
public final class ContextValues {
    public static final String HASH = "git.hash";
    public static final String BRANCH = "git.branch";
    public static final String DETACHED = "git.detached";
    public static final String AUTHOR = "git.author";
    public static final String DATE = "git.date";
    public static final String MESSAGE = "git.message";
    public static final String PARENTS = "git.parents";
    public static final String TAGS = "git.tags";

    private final String hash;
    private final String branch;
    private final boolean detached;
    private final String author;
    private final OffsetDateTime date;
    private final String message;
    private final List<String> parents;
    private final List<String> tags;

    private ContextValues(String hash, String branch, boolean detached, String author, OffsetDateTime date,
            String message, List<String> parents, List<String> tags) {
        this.hash = hash;
        this.branch = branch;
        this.detached = detached;
        this.author = author;
        this.date = date;
        this.message = message;
        this.parents = parents;
        this.tags = tags;
    }

    /**
     * Waits for all eight accessors.
     *
     * @throws GitException if the reader is strict and a value could not be read
     */
    public static ContextValues read(RepositoryReader reader) throws GitException {
        return new ContextValues(
                await(reader.getCommitHash()),
                await(reader.getBranch()),
                await(reader.isDetached()),
                await(reader.getCommitAuthor()),
                await(reader.getCommitDate()),
                await(reader.getCommitMessage()),
                await(reader.getCommitParents()),
                await(reader.getTags()));
    }

    /**
     * Label to display value, in the order the values are printed. Absent
     * values are shown as empty strings.
     */
    public Map<String, String> toDisplayMap() {
        Map<String, String> values = new LinkedHashMap<>();
        values.put("Hash", orEmpty(hash));
        values.put("Author", orEmpty(author));
        values.put("Date", date != null ? date.format(DateTimeFormatter.ISO_OFFSET_DATE_TIME) : "");
        values.put("IsDetached", Boolean.toString(detached));
        values.put("Branch", orEmpty(branch));
        values.put("Tags", String.join(", ", tags));
        values.put("Parents", String.join(", ", parents));
        values.put("Message", orEmpty(message).trim());
        return values;
    }

    /**
     * The values as {@code git.*} properties. Absent values are left out.
     */
    public Properties toProperties() {
        Properties properties = new Properties();
        putIfPresent(properties, HASH, hash);
        putIfPresent(properties, BRANCH, branch);
        properties.setProperty(DETACHED, Boolean.toString(detached));
        putIfPresent(properties, AUTHOR, author);
        putIfPresent(properties, DATE, date != null ? date.format(DateTimeFormatter.ISO_OFFSET_DATE_TIME) : null);
        putIfPresent(properties, MESSAGE, message);
        properties.setProperty(PARENTS, String.join(",", parents));
        properties.setProperty(TAGS, String.join(",", tags));
        return properties;
    }

    private static <T> T await(CompletableFuture<T> future) throws GitException {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof GitException) {
                throw (GitException) e.getCause();
            }
            throw e;
        }
    }

    private static void putIfPresent(Properties properties, String key, String value) {
        if (value != null) {
            properties.setProperty(key, value);
        }
    }

    private static String orEmpty(String value) {
        return value != null ? value : "";
    }
}
