package gitcontext.exceptions;

/**
 * The two ways reading repository metadata can fail.
 */
public enum ErrorKind {
    /** Git directory, HEAD, ref file or object file is absent. */
    NOT_FOUND,
    /** Content exists but violates the expected format. */
    MALFORMED_OBJECT
}
