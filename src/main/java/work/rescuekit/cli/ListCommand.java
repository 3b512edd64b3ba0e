package work.rescuekit.cli;

import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.rescuekit.api.DiagnosticRunner;
import work.rescuekit.api.RunConfiguration;

@CommandLine.Command(
    name = "list",
    description = "List the modules that apply to this host.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class
)
final class ListCommand implements Callable<Integer> {
    @CommandLine.Mixin
    private ModuleOptions moduleOptions;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        RunConfiguration configuration = moduleOptions.toConfiguration();
        configuration.logLevel().apply();
        spec.commandLine().getOut().print(new DiagnosticRunner(configuration).list());
        spec.commandLine().getOut().flush();
        return 0;
    }
}
