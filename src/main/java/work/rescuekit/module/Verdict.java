package work.rescuekit.module;

/**
 * Outcome reported by a module through its stdout contract.
 */
public enum Verdict {
    UNKNOWN,
    SUCCESS,
    WARN,
    FAILURE
}
