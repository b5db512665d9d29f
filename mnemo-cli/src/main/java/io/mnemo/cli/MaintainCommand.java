package io.mnemo.cli;

import io.mnemo.core.graph.KnowledgeGraphStore;
import io.mnemo.core.partition.MaintenanceReport;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;

@Command(name = "maintain", description = "Run one partition maintenance pass")
public final class MaintainCommand implements Callable<Integer> {
    private final CliContext context;

    public MaintainCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try (KnowledgeGraphStore store = context.openStore()) {
            MaintenanceReport report = store.runMaintenance().orElseThrow();
            System.out.println("Moved to intermediate: " + report.movedToIntermediate());
            System.out.println("Moved to archive: " + report.movedToArchive());
            System.out.println("Entity types summarized: " + report.entityTypes());
            System.out.println("Relation types summarized: " + report.relationTypes());
            System.out.println("Duration: " + report.durationMillis() + " ms");
            return 0;
        } catch (Exception e) {
            System.err.println("Maintain command failed: " + e.getMessage());
            return 1;
        }
    }
}
