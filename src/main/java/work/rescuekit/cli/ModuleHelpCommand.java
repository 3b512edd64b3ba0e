package work.rescuekit.cli;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.rescuekit.api.DiagnosticRunner;
import work.rescuekit.api.RunConfiguration;

@CommandLine.Command(
    name = "help",
    description = "Show the help text of modules.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class
)
final class ModuleHelpCommand implements Callable<Integer> {
    @CommandLine.Mixin
    private ModuleOptions moduleOptions;

    @CommandLine.Parameters(paramLabel = "MODULE", arity = "0..*", description = "Module names.")
    private List<String> modules = new ArrayList<>();

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        RunConfiguration configuration = moduleOptions.toConfiguration();
        configuration.logLevel().apply();
        spec.commandLine().getOut().print(new DiagnosticRunner(configuration).help(modules));
        spec.commandLine().getOut().flush();
        return 0;
    }
}
