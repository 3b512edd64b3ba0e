package work.rescuekit.module;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The allow-listed host variables every module process receives.
 */
public final class HostEnvironment {
    public static final String PATH = "PATH";
    public static final String WORKDIR = "RESCUEKIT_WORKDIR";
    public static final String RUNDIR = "RESCUEKIT_RUNDIR";
    public static final String LOGDIR = "RESCUEKIT_LOGDIR";
    public static final String GATHEREDDIR = "RESCUEKIT_GATHEREDDIR";
    public static final String DISTRO = "RESCUEKIT_DISTRO";
    public static final String NET_DRIVER = "RESCUEKIT_NET_DRIVER";
    public static final String VIRT_TYPE = "RESCUEKIT_VIRT_TYPE";
    public static final String SUDO = "RESCUEKIT_SUDO";
    public static final String PERFIMPACT = "RESCUEKIT_PERFIMPACT";
    public static final String CALLPATH = "RESCUEKIT_CALLPATH";

    public static final List<String> ALLOWED = List.of(
        PATH, WORKDIR, RUNDIR, LOGDIR, GATHEREDDIR, DISTRO, NET_DRIVER, VIRT_TYPE, SUDO, PERFIMPACT, CALLPATH
    );

    private final Map<String, String> values;

    private HostEnvironment(Map<String, String> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    /**
     * Picks the allow-listed variables out of {@code source}; anything else is ignored.
     */
    public static HostEnvironment of(Map<String, String> source) {
        Map<String, String> filtered = new LinkedHashMap<>();
        if (source != null) {
            for (String name : ALLOWED) {
                String value = source.get(name);
                if (value != null) {
                    filtered.put(name, value);
                }
            }
        }
        return new HostEnvironment(filtered);
    }

    public static HostEnvironment fromSystem() {
        return of(System.getenv());
    }

    public Optional<String> get(String name) {
        return Optional.ofNullable(values.get(name));
    }

    public Map<String, String> asMap() {
        return values;
    }

    public HostEnvironment with(String name, String value) {
        Map<String, String> copy = new LinkedHashMap<>(values);
        copy.put(name, value);
        return of(copy);
    }
}
