package work.rescuekit.cli;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import picocli.CommandLine;
import work.rescuekit.api.LogLevel;
import work.rescuekit.api.RunConfiguration;
import work.rescuekit.config.ConfigFile;
import work.rescuekit.config.RunConfigurationLoader;
import work.rescuekit.config.RunOptions;
import work.rescuekit.shared.DurationParser;

/**
 * Options shared by every subcommand. Values given here override those of {@code --config}.
 */
final class ModuleOptions {
    @CommandLine.Spec(CommandLine.Spec.Target.MIXEE)
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(
        names = "--modules-dir",
        paramLabel = "DIR",
        description = "Directory holding pre.d, mod.d, post.d and bin (default: current directory)."
    )
    private Path modulesDir;

    @CommandLine.Option(
        names = "--work-dir",
        paramLabel = "DIR",
        description = "Parent directory of per-run output (default: /var/tmp/rescuekit)."
    )
    private Path workDir;

    @CommandLine.Option(names = "--config", paramLabel = "FILE", description = "TOML configuration file.")
    private Path configFile;

    @CommandLine.Option(names = "--only-modules", paramLabel = "A,B", description = "Run only these modules.")
    private String onlyModules;

    @CommandLine.Option(names = "--only-domains", paramLabel = "A,B", description = "Run only modules in these domains.")
    private String onlyDomains;

    @CommandLine.Option(names = "--only-classes", paramLabel = "A,B", description = "Run only modules in these classes.")
    private String onlyClasses;

    @CommandLine.Option(names = "--no", split = ",", paramLabel = "MODULE", description = "Exclude these modules.")
    private List<String> excluded = new ArrayList<>();

    @CommandLine.Option(names = "--perfimpact", description = "Allow modules that may impact host performance.")
    private boolean perfImpact;

    @CommandLine.Option(names = "--not-an-instance", description = "The host is not a cloud instance.")
    private boolean notAnInstance;

    @CommandLine.Option(names = "--concurrency", paramLabel = "N", description = "Modules run at once (default: 10).")
    private Integer concurrency;

    @CommandLine.Option(
        names = "--timeout",
        paramLabel = "DURATION",
        description = "Per-module timeout (e.g. 30s, 5m); none by default."
    )
    private String timeoutRaw;

    @CommandLine.Option(names = "--arg", paramLabel = "KEY=VALUE", description = "Argument passed to every module.")
    private Map<String, String> globalArgs = new LinkedHashMap<>();

    @CommandLine.Option(
        names = "--module-arg",
        paramLabel = "MODULE.KEY=VALUE",
        description = "Argument passed to a single module."
    )
    private Map<String, String> moduleArgs = new LinkedHashMap<>();

    @CommandLine.Option(
        names = "--log-level",
        paramLabel = "LEVEL",
        description = "Console log threshold (trace|debug|info|warn|error|off)."
    )
    private String logLevelRaw;

    LogLevel logLevel() {
        try {
            return LogLevel.from(logLevelRaw);
        } catch (IllegalArgumentException ex) {
            throw new CommandLine.ParameterException(spec.commandLine(), ex.getMessage());
        }
    }

    RunConfiguration toConfiguration() {
        RunConfiguration.Builder builder = RunConfiguration.builder()
            .modulesRoot(Paths.get("").toAbsolutePath())
            .logLevel(logLevel());
        RunOptions fileOptions = RunOptions.empty();
        if (configFile != null) {
            ConfigFile file = RunConfigurationLoader.load(configFile);
            builder.apply(file);
            fileOptions = file.options();
        }
        if (modulesDir != null) {
            builder.modulesRoot(modulesDir.toAbsolutePath());
        }
        if (workDir != null) {
            builder.workDir(workDir.toAbsolutePath());
        }
        if (concurrency != null) {
            builder.concurrency(concurrency);
        }
        Optional<Duration> timeout = parseTimeout();
        if (timeout.isPresent()) {
            builder.timeout(timeout);
        }
        builder.options(fileOptions.toBuilder().merge(commandLineOptions()).build());
        return builder.build();
    }

    private Optional<Duration> parseTimeout() {
        try {
            return DurationParser.parseLimit(timeoutRaw);
        } catch (IllegalArgumentException ex) {
            throw new CommandLine.ParameterException(spec.commandLine(), "--timeout: " + ex.getMessage());
        }
    }

    RunOptions commandLineOptions() {
        RunOptions.Builder options = RunOptions.builder();
        options.global(RunOptions.ONLY_MODULES, onlyModules);
        options.global(RunOptions.ONLY_DOMAINS, onlyDomains);
        options.global(RunOptions.ONLY_CLASSES, onlyClasses);
        if (perfImpact) {
            options.global(RunOptions.PERF_IMPACT, "True");
        }
        if (notAnInstance) {
            options.global(RunOptions.NOT_AN_INSTANCE, "True");
        }
        if (concurrency != null) {
            options.global(RunOptions.CONCURRENCY, concurrency);
        }
        for (String module : excluded) {
            if (!module.isBlank()) {
                options.global(module.trim(), "False");
            }
        }
        options.globals(globalArgs);
        moduleArgs.forEach((qualified, value) -> {
            int dot = qualified.indexOf('.');
            if (dot <= 0 || dot == qualified.length() - 1) {
                throw new CommandLine.ParameterException(
                    spec.commandLine(),
                    "--module-arg expects MODULE.KEY=VALUE but got '" + qualified + "'"
                );
            }
            options.module(qualified.substring(0, dot), qualified.substring(dot + 1), value);
        });
        return options.build();
    }
}
