package work.rescuekit.constraint;

/**
 * Raised when a {@link Constraint} is updated from something that is not map-shaped.
 */
public final class ConstraintTypeException extends IllegalArgumentException {
    public ConstraintTypeException(Object offending) {
        super(describe(offending) + " is not a map or Constraint mapping");
    }

    private static String describe(Object value) {
        if (value == null) {
            return "null";
        }
        return "'" + value + "' (" + value.getClass().getSimpleName() + ")";
    }
}
