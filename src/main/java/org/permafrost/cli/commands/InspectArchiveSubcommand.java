package org.permafrost.cli.commands;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.permafrost.archive.ArchiveStatistics;
import org.permafrost.archive.RegionArchiver;
import org.permafrost.archive.codec.ArchiveRecordCodec;
import org.permafrost.archive.ArchiveRecord;
import org.permafrost.archive.session.IArchiveReader;
import org.permafrost.archive.session.JsonArchiveSession;
import org.permafrost.archive.session.SessionMode;
import org.permafrost.archive.storage.ArchiveStore;
import org.permafrost.config.PermafrostSettings;
import org.permafrost.runtime.model.Entity;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.Callable;

@Command(
    name = "archive",
    description = "Print the contents of a region archive"
)
public class InspectArchiveSubcommand implements Callable<Integer> {

    @Option(
        names = {"-r", "--region"},
        required = true,
        description = "Region id"
    )
    private int regionId;

    @Option(
        names = {"-w", "--world"},
        description = "World id (default: permafrost.world-id)"
    )
    private String worldId;

    @Option(
        names = {"-f", "--format"},
        description = "Output format: summary, json (default: summary)"
    )
    private String format = "summary";

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
            String world = worldId != null ? worldId : settings.getWorldId();
            Path file = store.locateRegion(world, regionId).orElse(null);
            if (file == null) {
                err.println("No archive for region " + regionId + " of world " + world + " under " + store.getRoot());
                return 1;
            }
            byte[] document = store.readRegion(world, regionId);

            switch (format.toLowerCase()) {
                case "json":
                    ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
                    out.println(mapper.writeValueAsString(mapper.readTree(document)));
                    return 0;
                case "summary":
                    printSummary(out, file, document);
                    return 0;
                default:
                    err.println("Unknown format: " + format + ". Supported formats: summary, json");
                    return 1;
            }
        } catch (Exception e) {
            err.println("Error inspecting archive: " + e.getMessage());
            return 1;
        }
    }

    private void printSummary(PrintWriter out, Path file, byte[] document) throws Exception {
        JsonArchiveSession session = new JsonArchiveSession();
        ArchiveRecord record;
        try {
            IArchiveReader root = session.beginLoad(document);
            record = root.readDeep(RegionArchiver.RECORD_KEY, ArchiveRecordCodec.INSTANCE);
        } finally {
            if (session.getMode() != SessionMode.INACTIVE) {
                session.reset();
            }
        }
        if (record == null) {
            throw new IllegalStateException("Archive has no " + RegionArchiver.RECORD_KEY + " record");
        }

        Map<String, Integer> kinds = new TreeMap<>();
        Map<String, Integer> categories = new TreeMap<>();
        for (Entity entity : record.getEntities()) {
            kinds.merge(entity.getClass().getSimpleName(), 1, Integer::sum);
            categories.merge(entity.getCategory().name(), 1, Integer::sum);
        }

        out.println("=== Region Archive Summary ===");
        out.println("File: " + file);
        out.println("Size on disk: " + ArchiveStatistics.formatBytes(Files.size(file)));
        out.println("Abandoned at tick: " + record.getAbandonedAtTick());
        out.println("Entities: " + record.getEntities().size() + " " + kinds);
        out.println("Categories: " + categories);
        out.println("Group controllers: " + record.getGroupLeaders().size());
        out.println("Grids: terrain=" + size(record.getTerrain())
            + ", roof=" + size(record.getRoof())
            + ", snow=" + size(record.getSnow())
            + ", pollution=" + size(record.getPollution())
            + ", fog=" + size(record.getFog()));
        out.println("Components: " + componentKeys(document));
    }

    private static String size(byte[] grid) {
        return grid == null ? "absent" : ArchiveStatistics.formatBytes(grid.length);
    }

    private static List<String> componentKeys(byte[] document) throws Exception {
        List<String> keys = new ArrayList<>();
        Iterator<String> names = new ObjectMapper().readTree(document).fieldNames();
        while (names.hasNext()) {
            String name = names.next();
            if (!name.equals(JsonArchiveSession.FORMAT_FIELD) && !name.equals(RegionArchiver.RECORD_KEY)) {
                keys.add(name);
            }
        }
        return keys;
    }
}
