package work.rescuekit.module;

/**
 * One of the required constraint axes is absent from a module document.
 */
public final class ModuleConstraintKeyException extends ModuleException {
    private final String constraintKey;

    public ModuleConstraintKeyException(String module, String constraintKey) {
        super("Module file " + module + " missing constraint key: " + constraintKey);
        this.constraintKey = constraintKey;
    }

    public String constraintKey() {
        return constraintKey;
    }
}
