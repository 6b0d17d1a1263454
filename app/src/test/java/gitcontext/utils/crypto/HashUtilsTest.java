package gitcontext.utils.crypto;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class HashUtilsTest {

    @Test
    void acceptsFortyLowercaseHexCharacters() {
        assertThat(HashUtils.isValidHash("0123456789abcdef0123456789abcdef01234567")).isTrue();
        assertThat(HashUtils.isValidHash("4b825dc642cb6eb9a060e54bf8d69288fbee4904")).isTrue();
    }

    @Test
    void rejectsWrongLength() {
        assertThat(HashUtils.isValidHash("")).isFalse();
        assertThat(HashUtils.isValidHash("4b825dc642cb6eb9a060e54bf8d69288fbee490")).isFalse();
        assertThat(HashUtils.isValidHash("4b825dc642cb6eb9a060e54bf8d69288fbee49044")).isFalse();
    }

    @Test
    void rejectsUppercaseAndNonHexCharacters() {
        assertThat(HashUtils.isValidHash("4B825DC642CB6EB9A060E54BF8D69288FBEE4904")).isFalse();
        assertThat(HashUtils.isValidHash("4b825dc642cb6eb9a060e54bf8d69288fbee490g")).isFalse();
        assertThat(HashUtils.isValidHash("4b825dc642cb6eb9a060e54bf8d69288fbee490 ")).isFalse();
    }

    @Test
    void rejectsPathTraversal() {
        assertThat(HashUtils.isValidHash("../../../../../../../../../../etc/passwd")).isFalse();
        assertThat(HashUtils.isValidHash(null)).isFalse();
    }
}
