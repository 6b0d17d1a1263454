package gitcontext.testing;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.zip.Deflater;

/**
 * Writes a minimal {@code .git} directory with real loose objects, the way
 * git itself lays them out.
 */
public final class RepositoryFixture {
    public static final String AUTHOR = "A U Thor <a@b.c> 1700000000 +0200";
    public static final String TREE = "4b825dc642cb6eb9a060e54bf8d69288fbee4904";

    private final Path workTree;
    private final Path gitDir;

    private RepositoryFixture(Path workTree) {
        this.workTree = workTree;
        this.gitDir = workTree.resolve(".git");
    }

    /**
     * Creates {@code .git/objects}, {@code .git/refs/heads} and a HEAD on
     * {@code main}.
     */
    public static RepositoryFixture init(Path workTree) throws IOException {
        RepositoryFixture fixture = new RepositoryFixture(workTree);
        Files.createDirectories(fixture.gitDir.resolve("objects"));
        Files.createDirectories(fixture.gitDir.resolve("refs/heads"));
        fixture.writeHead("ref: refs/heads/main\n");
        return fixture;
    }

    public Path workTree() {
        return workTree;
    }

    public Path gitDir() {
        return gitDir;
    }

    public Path objectsDir() {
        return gitDir.resolve("objects");
    }

    public void writeHead(String content) throws IOException {
        write(gitDir.resolve("HEAD"), content.getBytes(StandardCharsets.UTF_8));
    }

    public void writeBranch(String branch, String hash) throws IOException {
        write(gitDir.resolve("refs/heads").resolve(branch), (hash + "\n").getBytes(StandardCharsets.UTF_8));
    }

    public void writeTagRef(String name, String content) throws IOException {
        write(gitDir.resolve("refs/tags").resolve(name), (content + "\n").getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Stores {@code "<type> <size>\0<content>"} deflated under its SHA-1 and
     * returns the hash.
     */
    public String writeObject(String type, String content) throws IOException {
        byte[] body = content.getBytes(StandardCharsets.UTF_8);
        byte[] header = (type + " " + body.length + "\0").getBytes(StandardCharsets.UTF_8);
        byte[] raw = new byte[header.length + body.length];
        System.arraycopy(header, 0, raw, 0, header.length);
        System.arraycopy(body, 0, raw, header.length, body.length);
        return writeRawObject(sha1Hex(raw), raw);
    }

    /**
     * Stores arbitrary inflated bytes under the given hash.
     */
    public String writeRawObject(String sha, byte[] inflated) throws IOException {
        write(objectPath(sha), deflate(inflated));
        return sha;
    }

    public Path objectPath(String sha) {
        return objectsDir().resolve(sha.substring(0, 2)).resolve(sha.substring(2));
    }

    public String writeCommit(String message, String... parents) throws IOException {
        return writeObject("commit", commitContent(AUTHOR, message, parents));
    }

    public static String commitContent(String author, String message, String... parents) {
        StringBuilder content = new StringBuilder("tree ").append(TREE).append('\n');
        for (String parent : parents) {
            content.append("parent ").append(parent).append('\n');
        }
        content.append("author ").append(author).append('\n');
        content.append("committer ").append(author).append('\n');
        content.append('\n').append(message);
        return content.toString();
    }

    public String writeAnnotatedTag(String name, String target, String targetType, String message)
            throws IOException {
        String content = "object " + target + "\n"
                + "type " + targetType + "\n"
                + "tag " + name + "\n"
                + "tagger " + AUTHOR + "\n"
                + "\n"
                + message;
        return writeObject("tag", content);
    }

    public static byte[] deflate(byte[] data) {
        Deflater deflater = new Deflater();
        deflater.setInput(data);
        deflater.finish();

        ByteArrayOutputStream outputStream = new ByteArrayOutputStream(data.length + 16);
        byte[] buffer = new byte[1024];
        while (!deflater.finished()) {
            int count = deflater.deflate(buffer);
            outputStream.write(buffer, 0, count);
        }
        deflater.end();
        return outputStream.toByteArray();
    }

    public static String sha1Hex(byte[] data) {
        try {
            byte[] hash = MessageDigest.getInstance("SHA-1").digest(data);
            StringBuilder result = new StringBuilder();
            for (byte b : hash) {
                result.append(String.format("%02x", b));
            }
            return result.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-1 algorithm not available", e);
        }
    }

    private static void write(Path path, byte[] content) throws IOException {
        Files.createDirectories(path.getParent());
        Files.write(path, content);
    }
}
