package org.permafrost.cli.commands;

import org.permafrost.cli.CommandLineInterface;
import picocli.CommandLine.Command;
import picocli.CommandLine.ParentCommand;

@Command(
    name = "inspect",
    description = "Inspect region archives and world files",
    subcommands = {
        InspectArchiveSubcommand.class,
        InspectWorldSubcommand.class
    }
)
public class InspectCommand {
    @ParentCommand
    private CommandLineInterface parent;

    public CommandLineInterface getParent() {
        return parent;
    }
}
