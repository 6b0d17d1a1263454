package gitcontext.core.commit;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import gitcontext.core.objects.LooseObjectReader;
import gitcontext.core.objects.ObjectField;
import gitcontext.core.objects.ObjectStore;
import gitcontext.core.objects.ObjectType;
import gitcontext.core.refs.HeadInfo;
import gitcontext.exceptions.GitException;
import gitcontext.exceptions.MalformedObjectException;
import gitcontext.utils.crypto.HashUtils;

// @formatter:off
/**
 * Decodes the commit HEAD points at.
 *
 * Commit object content (after the "commit <size>\0" header):
 * ┌──────────────────────────────────────────────────────────────┐
 * │ tree 4b825dc642cb6eb9a060e54bf8d69288fbee4904                │
 * │ parent 1f7a7a472abf3dd9643fd615f6da379c4acb3e3a              │
 * │ author A U Thor <a@b.c> 1700000000 +0200                     │
 * │ committer A U Thor <a@b.c> 1700000000 +0200                  │
 * │                                                              │
 * │ Commit message                                               │
 * └──────────────────────────────────────────────────────────────┘
 *
 * Only author and parent are read; tree, committer and any other field are
 * skipped.
 */
// @formatter:on
public class CommitParser {
    private static final Pattern AUTHOR_PATTERN = Pattern
            .compile("^(?<name>.*) <(?<email>.*)> (?<date>\\d+) (?<offset>[+-]?\\d{4})$");

    private static final String AUTHOR = "author";
    private static final String PARENT = "parent";

    private final ObjectStore objectStore;

    public CommitParser(ObjectStore objectStore) {
        this.objectStore = objectStore;
    }

    public CommitInfo parse(HeadInfo head) throws GitException {
        String hash = head.getCommitHash();

        try (LooseObjectReader reader = objectStore.open(hash)) {
            String type = reader.readHeader();
            if (!ObjectType.COMMIT.matches(type)) {
                throw new MalformedObjectException("Expected commit object at " + hash + ", got: " + type);
            }

            String author = null;
            OffsetDateTime date = null;
            List<String> parents = new ArrayList<>();

            Optional<ObjectField> field;
            while ((field = reader.readField()).isPresent()) {
                String value = field.get().getValue();
                switch (field.get().getKey()) {
                    case AUTHOR:
                        Matcher match = matchAuthor(value);
                        author = match.group("name") + " <" + match.group("email") + ">";
                        date = parseDate(match.group("date"), match.group("offset"));
                        break;
                    case PARENT:
                        if (!HashUtils.isValidHash(value)) {
                            throw new MalformedObjectException("Invalid parent hash in " + hash + ": " + value);
                        }
                        parents.add(value);
                        break;
                    default:
                        break;
                }
            }

            String message = reader.readBody();

            if (author == null) {
                throw new MalformedObjectException("Invalid commit format: no author in " + hash);
            }
            return new CommitInfo(hash, author, date, message, parents);
        }
    }

    static Matcher matchAuthor(String value) throws MalformedObjectException {
        Matcher match = AUTHOR_PATTERN.matcher(value);
        if (!match.matches()) {
            throw new MalformedObjectException("Invalid author format: " + value);
        }
        return match;
    }

    /**
     * The instant comes from the epoch seconds alone; the offset only sets how
     * that instant is reported.
     */
    static OffsetDateTime parseDate(String epochSeconds, String offset) throws MalformedObjectException {
        try {
            boolean negative = offset.charAt(0) == '-';
            String digits = offset.charAt(0) == '+' || negative ? offset.substring(1) : offset;
            int hours = Integer.parseInt(digits.substring(0, 2));
            int minutes = Integer.parseInt(digits.substring(2, 4));
            ZoneOffset zone = negative
                    ? ZoneOffset.ofHoursMinutes(-hours, -minutes)
                    : ZoneOffset.ofHoursMinutes(hours, minutes);

            return OffsetDateTime.ofInstant(Instant.ofEpochSecond(Long.parseLong(epochSeconds)), zone);
        } catch (NumberFormatException | DateTimeException e) {
            throw new MalformedObjectException("Invalid author date: " + epochSeconds + " " + offset, e);
        }
    }
}
