package work.rescuekit.cli;

import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.rescuekit.api.DiagnosticRunner;
import work.rescuekit.api.RunConfiguration;

@CommandLine.Command(
    name = "software-check",
    description = "Report packages that provide software required by modules but missing on this host.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class
)
final class SoftwareCheckCommand implements Callable<Integer> {
    @CommandLine.Mixin
    private ModuleOptions moduleOptions;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        RunConfiguration configuration = moduleOptions.toConfiguration();
        configuration.logLevel().apply();
        spec.commandLine().getOut().print(new DiagnosticRunner(configuration).softwareCheck());
        spec.commandLine().getOut().flush();
        return 0;
    }
}
