package gitcontext.cli.exceptions;

import gitcontext.exceptions.GitException;
import picocli.CommandLine;
import picocli.CommandLine.IExecutionExceptionHandler;

/**
 * Custom exception handler for execution exceptions
 */
public class GitExecutionExceptionHandler implements IExecutionExceptionHandler {

    @Override
    public int handleExecutionException(
            Exception ex,
            CommandLine commandLine,
            CommandLine.ParseResult parseResult) {

        if (ex instanceof GitException) {
            GitException gitException = (GitException) ex;
            commandLine.getErr().println("fatal: " + gitException.getMessage()
                    + " (" + gitException.getKind().name().toLowerCase().replace('_', ' ') + ")");
            return 1;
        }

        commandLine.getErr().println("error: " + ex.getMessage());
        if (debugRequested(parseResult)) {
            ex.printStackTrace(commandLine.getErr());
        }

        return 1;
    }

    private static boolean debugRequested(CommandLine.ParseResult parseResult) {
        for (CommandLine.ParseResult current = parseResult; current != null; current = current.subcommand()) {
            if (current.hasMatchedOption("--debug")) {
                return true;
            }
        }
        return false;
    }
}
