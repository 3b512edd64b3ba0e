package work.rescuekit.module;

/**
 * A module process could not be started or did not exit normally.
 * Carries whatever the process printed before failing.
 */
public final class ModuleRunFailureException extends Exception {
    private final String output;

    public ModuleRunFailureException(String message, String output) {
        super(message);
        this.output = output == null ? "" : output;
    }

    public ModuleRunFailureException(String message, String output, Throwable cause) {
        super(message, cause);
        this.output = output == null ? "" : output;
    }

    public String output() {
        return output;
    }
}
