package work.rescuekit.module;

/**
 * Why a module was excluded from a run. Only the tracked reasons feed the run summary histogram.
 */
public enum SkipReason {
    NOT_AN_EC2_INSTANCE(false),
    NOT_APPLICABLE_TO_DISTRO(false),
    PERFORMANCE_IMPACT(true),
    REQUIRES_SUDO(true),
    NOT_SELECTED(false),
    MISSING_SOFTWARE(true),
    MISSING_ARGUMENT(true);

    private final boolean tracked;

    SkipReason(boolean tracked) {
        this.tracked = tracked;
    }

    public boolean tracked() {
        return tracked;
    }
}
