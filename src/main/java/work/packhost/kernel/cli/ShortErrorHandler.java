package work.packhost.kernel.cli;

import picocli.CommandLine;
import work.packhost.kernel.error.HostErrors;
import work.packhost.kernel.error.PackHostException;

/**
 * Prints one line per failure: the kernel error code and message of the innermost
 * {@link PackHostException}, or the exception message for anything else.
 */
final class ShortErrorHandler implements CommandLine.IExecutionExceptionHandler {
    static final String DEBUG_PROPERTY = "packhost.debug";

    @Override
    public int handleExecutionException(Exception ex, CommandLine commandLine, CommandLine.ParseResult parseResult) {
        var err = commandLine.getErr();
        err.println(commandLine.getColorScheme().errorText(describe(ex)));
        if (Boolean.getBoolean(DEBUG_PROPERTY)) {
            ex.printStackTrace(err);
        }
        err.flush();
        return commandLine.getCommandSpec().exitCodeOnExecutionException();
    }

    static String describe(Throwable failure) {
        PackHostException hostFailure = null;
        for (Throwable current = failure; current != null; current = current.getCause()) {
            if (current instanceof PackHostException candidate) {
                hostFailure = candidate;
            }
            if (current.getCause() == current) {
                break;
            }
        }
        var normalized = hostFailure != null ? hostFailure : HostErrors.normalize(failure);
        var message = normalized.getMessage() == null || normalized.getMessage().isBlank()
            ? failure.getClass().getSimpleName()
            : normalized.getMessage();
        var line = normalized.code() + ": " + message;
        return normalized.securityFailure() ? line + " (security check failed)" : line;
    }
}
