package work.rescuekit.cli;

import picocli.CommandLine;

@CommandLine.Command(
    name = "rescuekit",
    description = "Run diagnostic modules against the local host and summarize their verdicts.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    subcommands = {
        RunCommand.class,
        ListCommand.class,
        ModuleHelpCommand.class,
        SoftwareCheckCommand.class
    }
)
final class RescueCommand implements Runnable {
    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public void run() {
        throw new CommandLine.ParameterException(spec.commandLine(), "Missing subcommand (run, list, help, software-check).");
    }
}
