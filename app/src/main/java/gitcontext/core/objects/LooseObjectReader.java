package gitcontext.core.objects;

import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

import gitcontext.exceptions.MalformedObjectException;
import gitcontext.utils.crypto.CompressionUtils;

// @formatter:off
/**
 * Sequential, single-pass decoder for one loose object.
 *
 * Inflated layout of a commit or tag object:
 * ┌──────────────────────────────────────────────────┐
 * │ type SPACE size NULL          ← readHeader()      │
 * │ key SPACE value LF            ← readField()       │
 * │ SPACE continuation LF           (folded in value) │
 * │ ...                                               │
 * │ LF                            ← end of fields     │
 * │ free text ...                 ← readBody()        │
 * └──────────────────────────────────────────────────┘
 *
 * The three reads must be called in that order. The declared size in the
 * header is not checked against the actual content length.
 */
// @formatter:on
public final class LooseObjectReader implements AutoCloseable {
    private static final int MAX_HEADER_LENGTH = 64;

    private enum Phase {
        HEADER, FIELDS, BODY, DONE
    }

    private final String sha;
    private final InputStream inflated;
    private BufferedReader reader;
    private Phase phase = Phase.HEADER;
    private String type;
    private String pendingLine;
    private boolean closed;

    LooseObjectReader(String sha, InputStream compressed) {
        this.sha = sha;
        this.inflated = CompressionUtils.inflating(compressed);
    }

    /**
     * Reads {@code "<type> <size>\0"} and returns the type name.
     */
    public String readHeader() throws MalformedObjectException {
        expectPhase(Phase.HEADER, "readHeader");

        ByteArrayOutputStream header = new ByteArrayOutputStream(MAX_HEADER_LENGTH);
        try {
            int b;
            while ((b = inflated.read()) != 0) {
                if (b == -1) {
                    throw new MalformedObjectException("Invalid object format: no null terminator in " + sha);
                }
                if (header.size() == MAX_HEADER_LENGTH) {
                    throw new MalformedObjectException("Invalid object format: header too long in " + sha);
                }
                header.write(b);
            }
        } catch (IOException e) {
            throw new MalformedObjectException("Failed to inflate object: " + sha, e);
        }

        String text = new String(header.toByteArray(), StandardCharsets.UTF_8);
        int spaceIndex = text.indexOf(' ');
        if (spaceIndex <= 0) {
            throw new MalformedObjectException("Invalid object header format in " + sha + ": " + text);
        }

        type = text.substring(0, spaceIndex);
        reader = new BufferedReader(new InputStreamReader(inflated, StandardCharsets.UTF_8));
        phase = Phase.FIELDS;
        return type;
    }

    /**
     * Reads the next header field. Returns empty when the blank line that
     * separates fields from the body has been reached.
     */
    public Optional<ObjectField> readField() throws MalformedObjectException {
        expectPhase(Phase.FIELDS, "readField");

        String line = pendingLine != null ? pendingLine : nextLine();
        pendingLine = null;

        if (line.isEmpty()) {
            phase = Phase.BODY;
            return Optional.empty();
        }

        int spaceIndex = line.indexOf(' ');
        if (spaceIndex == 0) {
            throw new MalformedObjectException("Continuation line without a field in " + sha);
        }
        if (spaceIndex < 0) {
            throw new MalformedObjectException("Invalid field line in " + sha + ": " + line);
        }

        String key = line.substring(0, spaceIndex);
        StringBuilder value = new StringBuilder(line.substring(spaceIndex + 1));

        // gpgsig and mergetag values span several lines, each continuation indented by one space
        String next = nextLine();
        while (next.startsWith(" ")) {
            value.append('\n').append(next, 1, next.length());
            next = nextLine();
        }
        pendingLine = next;

        return Optional.of(new ObjectField(key, value.toString()));
    }

    /**
     * Reads everything after the blank line. May be empty, never null.
     */
    public String readBody() throws MalformedObjectException {
        expectPhase(Phase.BODY, "readBody");

        StringWriter body = new StringWriter();
        try {
            reader.transferTo(body);
        } catch (IOException e) {
            throw new MalformedObjectException("Failed to read body of object: " + sha, e);
        }
        phase = Phase.DONE;
        return body.toString();
    }

    /**
     * The type read by {@link #readHeader()}, or null before it has been read.
     */
    public String getType() {
        return type;
    }

    @Override
    public void close() throws MalformedObjectException {
        if (closed) {
            return;
        }
        closed = true;
        try {
            if (reader != null) {
                reader.close();
            } else {
                inflated.close();
            }
        } catch (IOException e) {
            throw new MalformedObjectException("Failed to close object: " + sha, e);
        }
    }

    private String nextLine() throws MalformedObjectException {
        String line;
        try {
            line = reader.readLine();
        } catch (IOException e) {
            throw new MalformedObjectException("Failed to inflate object: " + sha, e);
        }
        if (line == null) {
            throw new MalformedObjectException("Invalid object format: unexpected end of fields in " + sha);
        }
        return line;
    }

    private void expectPhase(Phase expected, String operation) {
        if (closed) {
            throw new IllegalStateException(operation + " called on a closed object reader");
        }
        if (phase != expected) {
            throw new IllegalStateException(operation + " called out of order (reader is at " + phase + ")");
        }
    }
}
