package gitcontext.utils.crypto;

/**
 * Utility class for checking SHA-1 object identifiers.
 */
public class HashUtils {

    public static final int HASH_LENGTH = 40;

    /**
     * Returns true if the given string is a full 40-character lowercase hex
     * object id. Every hash read from refs or objects goes through this before
     * it is used as a path component.
     */
    public static boolean isValidHash(String hash) {
        if (hash == null || hash.length() != HASH_LENGTH) {
            return false;
        }
        for (int i = 0; i < hash.length(); i++) {
            char c = hash.charAt(i);
            boolean hex = (c >= '0' && c <= '9') || (c >= 'a' && c <= 'f');
            if (!hex) {
                return false;
            }
        }
        return true;
    }
}
