package work.rescuekit.api;

/**
 * A prediagnostic module failed; the run stops before any diagnostic module is scheduled.
 */
public final class PrediagnosticFailureException extends RuntimeException {
    private final String moduleName;

    public PrediagnosticFailureException(String moduleName, String message) {
        super("Prediagnostic check '" + moduleName + "' failed: " + message);
        this.moduleName = moduleName;
    }

    public PrediagnosticFailureException(String moduleName, String message, Throwable cause) {
        super("Prediagnostic check '" + moduleName + "' failed: " + message, cause);
        this.moduleName = moduleName;
    }

    public String moduleName() {
        return moduleName;
    }
}
