package gitcontext.core.repository;

import java.util.concurrent.CompletionException;

/**
 * How failures reach the caller of an accessor. Fixed when the reader is
 * built.
 */
public enum ErrorMode {
    /** Failures become absent values; accessors return their defaults. */
    LENIENT,
    /** Failures complete the accessor's future exceptionally. */
    STRICT;

    /**
     * Applies this mode to a settled result. Returns null for an absent value.
     *
     * @throws CompletionException wrapping the failure, in strict mode only
     */
    <T> T apply(Result<T> result) {
        if (result.isError() && this == STRICT) {
            throw new CompletionException(result.getError());
        }
        return result.orElse(null);
    }
}
