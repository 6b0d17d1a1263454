package gitcontext.core.commit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Path;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import gitcontext.core.objects.FileObjectStore;
import gitcontext.core.refs.HeadInfo;
import gitcontext.exceptions.MalformedObjectException;
import gitcontext.exceptions.NotFoundException;
import gitcontext.testing.RepositoryFixture;
import gitcontext.utils.io.RepositoryFileSystem;

class CommitParserTest {
    private static final String FIRST_PARENT = "1111111111111111111111111111111111111111";
    private static final String SECOND_PARENT = "2222222222222222222222222222222222222222";

    @TempDir
    Path tempDir;

    private RepositoryFixture fixture;
    private CommitParser parser;

    @BeforeEach
    void setUp() throws Exception {
        fixture = RepositoryFixture.init(tempDir);
        parser = new CommitParser(new FileObjectStore(RepositoryFileSystem.local(), fixture.objectsDir()));
    }

    @Test
    void parsesAuthorAndKeepsTheAuthorsOffset() throws Exception {
        String sha = fixture.writeCommit("Initial commit\n");

        CommitInfo commit = parser.parse(HeadInfo.detached(sha));

        assertThat(commit.getHash()).isEqualTo(sha);
        assertThat(commit.getAuthor()).isEqualTo("A U Thor <a@b.c>");
        assertThat(commit.getDate().toInstant()).isEqualTo(Instant.ofEpochSecond(1700000000L));
        assertThat(commit.getDate().getOffset()).isEqualTo(ZoneOffset.ofHours(2));
        assertThat(commit.getDate()).isEqualTo(OffsetDateTime.parse("2023-11-15T00:13:20+02:00"));
        assertThat(commit.getMessage()).isEqualTo("Initial commit\n");
        assertThat(commit.getParents()).isEmpty();
    }

    @Test
    void negativeOffsetsAreReportedAsGiven() throws Exception {
        String sha = fixture.writeObject("commit",
                RepositoryFixture.commitContent("Jane Doe <jane@example.com> 1700000000 -0530", "msg"));

        CommitInfo commit = parser.parse(HeadInfo.detached(sha));

        assertThat(commit.getAuthor()).isEqualTo("Jane Doe <jane@example.com>");
        assertThat(commit.getDate().getOffset()).isEqualTo(ZoneOffset.ofHoursMinutes(-5, -30));
        assertThat(commit.getDate().toInstant()).isEqualTo(Instant.ofEpochSecond(1700000000L));
    }

    @Test
    void parentsKeepFileOrder() throws Exception {
        String sha = fixture.writeCommit("Merge branch 'topic'\n", FIRST_PARENT, SECOND_PARENT);

        CommitInfo commit = parser.parse(HeadInfo.detached(sha));

        assertThat(commit.getParents()).containsExactly(FIRST_PARENT, SECOND_PARENT);
    }

    @Test
    void messageMayBeEmpty() throws Exception {
        String sha = fixture.writeCommit("");

        assertThat(parser.parse(HeadInfo.detached(sha)).getMessage()).isEmpty();
    }

    @Test
    void signedCommitsParse() throws Exception {
        String content = "tree " + RepositoryFixture.TREE + "\n"
                + "parent " + FIRST_PARENT + "\n"
                + "author " + RepositoryFixture.AUTHOR + "\n"
                + "committer " + RepositoryFixture.AUTHOR + "\n"
                + "gpgsig -----BEGIN PGP SIGNATURE-----\n"
                + " \n"
                + " wsBcBAABCAAQBQJlVPgACRBK7hj4Ov3rIwAAdHIIAKqT\n"
                + " -----END PGP SIGNATURE-----\n"
                + "\n"
                + "Signed commit\n";
        String sha = fixture.writeObject("commit", content);

        CommitInfo commit = parser.parse(HeadInfo.detached(sha));

        assertThat(commit.getParents()).containsExactly(FIRST_PARENT);
        assertThat(commit.getMessage()).isEqualTo("Signed commit\n");
    }

    @Test
    void headCommitHashIsUsedForBranchHeads() throws Exception {
        String sha = fixture.writeCommit("On a branch\n");

        CommitInfo commit = parser.parse(HeadInfo.onBranch("ref: refs/heads/main", "main", sha));

        assertThat(commit.getHash()).isEqualTo(sha);
    }

    @Test
    void missingAuthorIsMalformed() throws Exception {
        String sha = fixture.writeObject("commit", "tree " + RepositoryFixture.TREE + "\n\nNo author\n");

        assertThatThrownBy(() -> parser.parse(HeadInfo.detached(sha)))
                .isInstanceOf(MalformedObjectException.class)
                .hasMessageContaining("no author");
    }

    @Test
    void unparsableAuthorIsMalformed() throws Exception {
        String sha = fixture.writeObject("commit",
                RepositoryFixture.commitContent("A U Thor a@b.c 1700000000 +0200", "msg"));

        assertThatThrownBy(() -> parser.parse(HeadInfo.detached(sha)))
                .isInstanceOf(MalformedObjectException.class)
                .hasMessageContaining("Invalid author format");
    }

    @Test
    void outOfRangeOffsetIsMalformed() throws Exception {
        String sha = fixture.writeObject("commit",
                RepositoryFixture.commitContent("A U Thor <a@b.c> 1700000000 +9960", "msg"));

        assertThatThrownBy(() -> parser.parse(HeadInfo.detached(sha)))
                .isInstanceOf(MalformedObjectException.class)
                .hasMessageContaining("Invalid author date");
    }

    @Test
    void invalidParentIsMalformed() throws Exception {
        String sha = fixture.writeCommit("msg", "HEAD~1");

        assertThatThrownBy(() -> parser.parse(HeadInfo.detached(sha)))
                .isInstanceOf(MalformedObjectException.class)
                .hasMessageContaining("Invalid parent hash");
    }

    @Test
    void nonCommitObjectIsRejected() throws Exception {
        String sha = fixture.writeObject("blob", "just a file\n");

        assertThatThrownBy(() -> parser.parse(HeadInfo.detached(sha)))
                .isInstanceOf(MalformedObjectException.class)
                .hasMessageContaining("blob");
    }

    @Test
    void missingCommitObjectIsNotFound() {
        assertThatThrownBy(() -> parser.parse(HeadInfo.detached(FIRST_PARENT)))
                .isInstanceOf(NotFoundException.class);
    }

    @Test
    void parsesDateWithoutSign() throws Exception {
        assertThat(CommitParser.parseDate("0", "0100").getOffset()).isEqualTo(ZoneOffset.ofHours(1));
        assertThat(CommitParser.parseDate("0", "-0000").toInstant()).isEqualTo(Instant.EPOCH);
    }
}
