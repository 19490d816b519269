package org.permafrost.cli.commands;

import org.permafrost.archive.storage.ArchiveStore;
import org.permafrost.config.PermafrostSettings;
import org.permafrost.runtime.model.Creature;
import org.permafrost.runtime.model.Faction;
import org.permafrost.runtime.model.ManualTickClock;
import org.permafrost.runtime.model.World;
import org.permafrost.runtime.model.WorldRegistry;
import org.permafrost.world.SideRegistry;
import org.permafrost.world.WorldStateStore;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.concurrent.Callable;

@Command(
    name = "world",
    description = "Print the world registry and side table of a world file"
)
public class InspectWorldSubcommand implements Callable<Integer> {

    @Option(
        names = {"-w", "--world"},
        description = "World id (default: permafrost.world-id)"
    )
    private String worldId;

    @Option(
        names = {"-v", "--verbose"},
        description = "List every creature held by the side table"
    )
    private boolean verbose;

    @ParentCommand
    private InspectCommand parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        try {
            PermafrostSettings settings = parent.getParent().getSettings();
            ArchiveStore store = settings.createStore();
            if (store == null) {
                err.println("No storage root configured (permafrost.storage.root)");
                return 1;
            }
            String id = worldId != null ? worldId : settings.getWorldId();
            World world = new World(id, new ManualTickClock());
            if (!new WorldStateStore(store).load(world)) {
                err.println("No world file for " + id + " under " + store.getRoot());
                return 1;
            }
            printSummary(out, world);
            return 0;
        } catch (Exception e) {
            err.println("Error inspecting world: " + e.getMessage());
            return 1;
        }
    }

    private void printSummary(PrintWriter out, World world) {
        WorldRegistry registry = world.getWorldRegistry();
        out.println("=== World Summary ===");
        out.println("World: " + world.getWorldId());
        out.println("Tick: " + world.getClock().currentTick());
        out.print("Factions:");
        for (Faction faction : world.getFactions()) {
            out.print(" " + faction.getName() + (faction.isPlayer() ? " (player)" : ""));
        }
        out.println();
        out.println("World registry: " + registry.getAlive().size() + " alive, " + registry.getDead().size()
            + " dead, " + registry.getForcedRetention().size() + " force-retained");

        out.println();
        out.println("=== Side Table (" + world.getSideTable().size() + " region(s)) ===");
        for (SideRegistry side : world.getSideTable().all()) {
            out.println(side);
            if (verbose) {
                for (Creature creature : side.allCreatures()) {
                    out.printf("  %s %s%s%n", creature.getUniqueLoadId(), creature.getDefName(),
                        creature.isPlayerAffiliated() ? " (player)" : "");
                }
            }
        }
    }
}
