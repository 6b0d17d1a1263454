package gitcontext.exceptions;

public class GitException extends Exception {
    private final ErrorKind kind;

    public GitException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public GitException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
