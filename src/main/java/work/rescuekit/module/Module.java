package work.rescuekit.module;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import work.rescuekit.config.RunOptions;
import work.rescuekit.constraint.Constraint;

/**
 * One diagnostic unit: metadata, its {@link Constraint}, applicability and the verdict of its last run.
 *
 * <p>Instances are created once at load time through {@link #builder()}. Applicability is changed by the
 * pruning phases on the control thread, run results by the single worker executing the module.</p>
 */
public final class Module {
    public static final List<String> REQUIRED_CONSTRAINTS = List.of(
        "domain", "sudo", "required", "perfimpact", "software",
        "optional", "class", "parallelexclusive", "distro", "requires_ec2"
    );

    private final String name;
    private final String version;
    private final String title;
    private final String helpText;
    private final Placement placement;
    private final List<String> packages;
    private final Language language;
    private final String content;
    private final Path path;
    private final Constraint constraint;

    private boolean applicable = true;
    private String whySkipping = "";
    private SkipReason skipReason;

    private String output = "";
    private Verdict verdict;
    private String summary = "";
    private List<String> details = List.of();

    private Module(Builder builder) {
        this.name = builder.name;
        this.version = builder.version;
        this.title = builder.title;
        this.helpText = builder.helpText;
        this.placement = builder.placement;
        this.packages = List.copyOf(builder.packages);
        this.language = builder.language;
        this.content = builder.content;
        this.path = builder.path;
        // own copy; registry indices are keyed on it
        this.constraint = new Constraint();
        this.constraint.update(builder.constraint);
    }

    public static Builder builder() {
        return new Builder();
    }

    public String name() {
        return name;
    }

    public String version() {
        return version;
    }

    public String title() {
        return title;
    }

    public String helpText() {
        return helpText;
    }

    public Placement placement() {
        return placement;
    }

    public List<String> packages() {
        return packages;
    }

    public Language language() {
        return language;
    }

    public String content() {
        return content;
    }

    public Optional<Path> path() {
        return Optional.ofNullable(path);
    }

    public Constraint constraint() {
        return constraint;
    }

    /**
     * Shorthand used in log lines, e.g. {@code run/arpcache}.
     */
    public String qualifiedName() {
        return placement.id() + "/" + name;
    }

    public boolean requiresSudo() {
        return isTrue(constraint.first("sudo"));
    }

    public boolean requiresPerfImpact() {
        return isTrue(constraint.first("perfimpact"));
    }

    public boolean requiresInstance() {
        return isTrue(constraint.first("requires_ec2"));
    }

    private static boolean isTrue(String value) {
        return "true".equalsIgnoreCase(value);
    }

    public boolean isApplicable() {
        return applicable;
    }

    public String whySkipping() {
        return whySkipping;
    }

    public Optional<SkipReason> skipReason() {
        return Optional.ofNullable(skipReason);
    }

    /**
     * Records that the module will not run and why. The first recorded reason is kept.
     */
    public void markNotApplicable(SkipReason reason, String message) {
        if (!applicable) {
            return;
        }
        this.applicable = false;
        this.skipReason = Objects.requireNonNull(reason, "reason");
        this.whySkipping = message == null ? "" : message;
    }

    /**
     * Records that the user's selection excludes the module, replacing any earlier reason.
     */
    public void markOutOfScope(String message) {
        this.applicable = false;
        this.skipReason = SkipReason.NOT_SELECTED;
        this.whySkipping = message == null ? "" : message;
    }

    public String output() {
        return output;
    }

    /**
     * Verdict of the last successful run; empty until the module has run to completion.
     */
    public Optional<Verdict> verdict() {
        return Optional.ofNullable(verdict);
    }

    public String summary() {
        return summary;
    }

    public List<String> details() {
        return details;
    }

    /**
     * Stores captured output and the verdict parsed from it.
     */
    public ModuleOutput recordOutput(String captured) {
        ModuleOutput parsed = ModuleOutputParser.parse(captured);
        this.output = captured;
        this.verdict = parsed.verdict();
        this.summary = parsed.summary();
        this.details = parsed.details();
        return parsed;
    }

    /**
     * Runs the module with the allow-listed variables of the current process environment.
     */
    public String run(RunOptions options) throws ModuleRunFailureException {
        return run(options, HostEnvironment.fromSystem(), Optional.empty());
    }

    /**
     * Runs the module as a child process and blocks until it exits.
     *
     * @return the combined stdout/stderr of the process
     * @throws ModuleRunFailureException when the process cannot start, exits non-zero or times out
     */
    public String run(RunOptions options, HostEnvironment environment, Optional<Duration> timeout)
        throws ModuleRunFailureException {
        String captured = ModuleProcess.execute(this, options, environment, timeout);
        recordOutput(captured);
        return captured;
    }

    /**
     * Fixed-width catalog line: sudo and perf-impact markers, name, classes, domains, title.
     */
    public String listLine() {
        return String.format(
            "%1.1s%1.1s%-20.18s%-10.8s%-13.11s%-77.75s",
            requiresSudo() ? "*" : "",
            requiresPerfImpact() ? "+" : "",
            name,
            String.join(",", constraint.get("class")),
            String.join(",", constraint.get("domain")),
            title
        );
    }

    public String help() {
        return name + ":" + System.lineSeparator()
            + helpText + System.lineSeparator()
            + "Requires sudo: " + constraint.first("sudo");
    }

    @Override
    public String toString() {
        return "Module[" + qualifiedName() + "]";
    }

    public static final class Builder {
        private String name;
        private String version;
        private String title;
        private String helpText;
        private String placementRaw;
        private Placement placement;
        private List<String> packages;
        private String languageRaw;
        private Language language;
        private String content;
        private Path path;
        private Constraint constraint;

        private Builder() {}

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder version(String version) {
            this.version = version;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder helpText(String helpText) {
            this.helpText = helpText;
            return this;
        }

        public Builder placement(String placement) {
            this.placementRaw = placement;
            return this;
        }

        public Builder placement(Placement placement) {
            this.placementRaw = placement == null ? null : placement.id();
            return this;
        }

        public Builder packages(List<String> packages) {
            this.packages = packages;
            return this;
        }

        public Builder language(String language) {
            this.languageRaw = language;
            return this;
        }

        public Builder language(Language language) {
            this.languageRaw = language == null ? null : language.id();
            return this;
        }

        public Builder content(String content) {
            this.content = content;
            return this;
        }

        public Builder path(Path path) {
            this.path = path;
            return this;
        }

        public Builder constraint(Constraint constraint) {
            this.constraint = constraint;
            return this;
        }

        /**
         * Validates the metadata and creates the module.
         *
         * @throws ModuleParseException when an attribute is missing or has an unsupported value
         * @throws ModuleConstraintKeyException when a required constraint axis is absent
         */
        public Module build() {
            String label = name == null || name.isBlank() ? String.valueOf(path) : name;
            if (isBlank(placementRaw)) {
                throw ModuleParseException.missing(label, "placement");
            }
            placement = Placement.from(label, placementRaw);
            if (isBlank(name)) {
                throw ModuleParseException.missing(label, "name");
            }
            if (isBlank(version)) {
                throw ModuleParseException.missing(name, "version");
            }
            if (isBlank(title)) {
                throw ModuleParseException.missing(name, "title");
            }
            if (isBlank(helpText)) {
                throw ModuleParseException.missing(name, "helptext");
            }
            if (packages == null || packages.isEmpty()) {
                throw ModuleParseException.missing(name, "package");
            }
            if (isBlank(languageRaw)) {
                throw ModuleParseException.missing(name, "language");
            }
            language = Language.from(name, languageRaw);
            if (content == null || (language != Language.BINARY && content.isBlank())) {
                throw ModuleParseException.missing(name, "content");
            }
            if (constraint == null) {
                throw ModuleParseException.missing(name, "constraint");
            }
            String fileLabel = path == null ? name : String.valueOf(path.getFileName());
            for (String key : REQUIRED_CONSTRAINTS) {
                if (!constraint.hasKey(key)) {
                    throw new ModuleConstraintKeyException(fileLabel, key);
                }
            }
            List<String> cleaned = new ArrayList<>();
            for (String pkg : packages) {
                if (pkg != null && !pkg.isBlank() && !cleaned.contains(pkg.trim())) {
                    cleaned.add(pkg.trim());
                }
            }
            packages = cleaned;
            return new Module(this);
        }

        private static boolean isBlank(String value) {
            return value == null || value.isBlank();
        }
    }
}
