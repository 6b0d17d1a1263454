package gitcontext.exceptions;

public class MalformedObjectException extends GitException {
    public MalformedObjectException(String message) {
        super(ErrorKind.MALFORMED_OBJECT, message);
    }

    public MalformedObjectException(String message, Throwable cause) {
        super(ErrorKind.MALFORMED_OBJECT, message, cause);
    }
}
