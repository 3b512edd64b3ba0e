package work.rescuekit.prune;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.rescuekit.config.RunOptions;

/**
 * {@link HostFacts} read from the local machine: release files under {@code /etc}, {@code /sys/class/net}
 * and the PATH of the current process.
 */
public final class SystemHostFacts implements HostFacts {
    private static final Logger log = LoggerFactory.getLogger(SystemHostFacts.class);

    public static final String UNKNOWN_DISTRO = "unknown";

    private static final Pattern ALAMI = Pattern.compile("^Amazon Linux AMI release [0-9]{4}\\.[0-9]{2}");
    private static final Pattern ALAMI2 = Pattern.compile("^Amazon Linux (release )?2( |$)");
    private static final Pattern AL2023 = Pattern.compile("^Amazon Linux release 2023");
    private static final Pattern RHEL = Pattern.compile(
        "^(Red Hat Enterprise Linux( Server)? release [0-9]+\\.[0-9]+|CentOS Linux release [0-9]\\.[0-9])"
    );
    private static final Pattern SUSE = Pattern.compile("^SUSE Linux Enterprise Server [0-9]{2}");
    private static final Pattern UBUNTU = Pattern.compile("^DISTRIB_ID=Ubuntu");
    private static final Pattern OS_RELEASE_SUSE = Pattern.compile("^PRETTY_NAME=\"SUSE Linux Enterprise Server [0-9]{2}");
    private static final Pattern OS_RELEASE_ALAMI = Pattern.compile("^PRETTY_NAME=\"Amazon Linux AMI [0-9]{4}\\.[0-9]{2}");
    private static final Pattern OS_RELEASE_ALAMI2 = Pattern.compile("^PRETTY_NAME=\"Amazon Linux 2\"");
    private static final Pattern OS_RELEASE_AL2023 = Pattern.compile("^PRETTY_NAME=\"Amazon Linux 2023");

    private final Path root;
    private final String path;
    private final boolean perfImpactAllowed;
    private final boolean instance;
    private String distro;

    public SystemHostFacts(RunOptions options) {
        this(options, Paths.get("/"), System.getenv("PATH"));
    }

    /**
     * @param root filesystem root the {@code etc} and {@code sys} lookups are resolved against
     * @param path PATH string used for executable lookups
     */
    SystemHostFacts(RunOptions options, Path root, String path) {
        Objects.requireNonNull(options, "options");
        this.root = root;
        this.path = path == null ? "" : path;
        this.perfImpactAllowed = options.isTrue(RunOptions.PERF_IMPACT);
        this.instance = !options.isTrue(RunOptions.NOT_AN_INSTANCE);
    }

    @Override
    public synchronized String distro() {
        if (distro == null) {
            distro = detectDistro();
            log.debug("Detected distro '{}'", distro);
        }
        return distro;
    }

    private String detectDistro() {
        Path systemRelease = root.resolve("etc/system-release");
        if (Files.isRegularFile(systemRelease)) {
            String line = firstLine(systemRelease);
            if (AL2023.matcher(line).find()) {
                return "al2023";
            }
            if (ALAMI2.matcher(line).find()) {
                return "alami2";
            }
            if (ALAMI.matcher(line).find()) {
                return "alami";
            }
            if (RHEL.matcher(line).find()) {
                return "rhel";
            }
            return UNKNOWN_DISTRO;
        }
        Path suseRelease = root.resolve("etc/SuSE-release");
        if (Files.isRegularFile(suseRelease)) {
            return SUSE.matcher(firstLine(suseRelease)).find() ? "suse" : UNKNOWN_DISTRO;
        }
        Path lsbRelease = root.resolve("etc/lsb-release");
        if (Files.isRegularFile(lsbRelease)) {
            return lines(lsbRelease).stream().anyMatch(line -> UBUNTU.matcher(line).find()) ? "ubuntu" : UNKNOWN_DISTRO;
        }
        Path osRelease = root.resolve("etc/os-release");
        if (Files.isRegularFile(osRelease)) {
            for (String line : lines(osRelease)) {
                if (OS_RELEASE_SUSE.matcher(line).find()) {
                    return "suse";
                }
                if (OS_RELEASE_AL2023.matcher(line).find()) {
                    return "al2023";
                }
                if (OS_RELEASE_ALAMI2.matcher(line).find()) {
                    return "alami2";
                }
                if (OS_RELEASE_ALAMI.matcher(line).find()) {
                    return "alami";
                }
            }
        }
        return UNKNOWN_DISTRO;
    }

    private static String firstLine(Path file) {
        List<String> lines = lines(file);
        return lines.isEmpty() ? "" : lines.get(0);
    }

    private static List<String> lines(Path file) {
        try {
            return Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            log.warn("Unable to read {}: {}", file, ex.getMessage());
            return List.of();
        }
    }

    @Override
    public boolean isRoot() {
        return "root".equals(System.getProperty("user.name"));
    }

    @Override
    public boolean isInstance() {
        return instance;
    }

    @Override
    public boolean perfImpactAllowed() {
        return perfImpactAllowed;
    }

    @Override
    public boolean isExecutable(String software) {
        if (software == null || software.isBlank()) {
            return false;
        }
        if (software.contains(File.separator)) {
            return executable(Paths.get(software));
        }
        for (String dir : path.split(File.pathSeparator)) {
            if (!dir.isEmpty() && executable(Paths.get(dir, software))) {
                return true;
            }
        }
        return false;
    }

    private static boolean executable(Path candidate) {
        return Files.isRegularFile(candidate) && Files.isExecutable(candidate);
    }

    /**
     * Driver of the first non-virtual network interface in name order.
     */
    @Override
    public String netDriver() {
        Path net = root.resolve("sys/class/net");
        if (!Files.isDirectory(net)) {
            return "Unknown";
        }
        try (Stream<Path> devices = Files.list(net)) {
            List<Path> physical = devices
                .filter(device -> !resolvesThroughVirtual(device))
                .sorted(Comparator.comparing((Path device) -> device.getFileName().toString()))
                .collect(Collectors.toList());
            if (physical.isEmpty()) {
                return "Unknown";
            }
            Path module = physical.get(0).resolve("device/driver/module");
            return module.toRealPath().getFileName().toString();
        } catch (IOException ex) {
            log.debug("Unable to determine network driver: {}", ex.getMessage());
            return "Unknown";
        }
    }

    private static boolean resolvesThroughVirtual(Path device) {
        try {
            return device.toRealPath().toString().contains("virtual");
        } catch (IOException ex) {
            return true;
        }
    }
}
