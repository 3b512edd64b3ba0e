package work.rescuekit.cli;

import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.rescuekit.api.DiagnosticRunner;
import work.rescuekit.api.RunConfiguration;
import work.rescuekit.api.RunResult;

@CommandLine.Command(
    name = "run",
    description = "Run prediagnostics, every applicable diagnostic module, then postdiagnostics.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class
)
final class RunCommand implements Callable<Integer> {
    @CommandLine.Mixin
    private ModuleOptions moduleOptions;

    @CommandLine.Option(names = "--json", description = "Print the run result as JSON instead of text.")
    private boolean json;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        RunConfiguration configuration = moduleOptions.toConfiguration();
        configuration.logLevel().apply();
        RunResult result = new DiagnosticRunner(configuration).run();
        spec.commandLine().getOut().print(json ? result.toPrettyJson() + System.lineSeparator() : result.toText());
        spec.commandLine().getOut().flush();
        return result.status().exitCode();
    }
}
