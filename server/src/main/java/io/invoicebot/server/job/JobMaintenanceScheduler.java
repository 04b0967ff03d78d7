package io.invoicebot.server.job;

import io.invoicebot.server.checkpoint.CheckpointStore;
import io.invoicebot.server.checkpoint.SnapshotStore;
import io.invoicebot.server.claim.ClaimStore;
import io.invoicebot.server.config.InvoiceBotProperties;
import java.util.function.IntSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class JobMaintenanceScheduler {

    private static final Logger log = LoggerFactory.getLogger(JobMaintenanceScheduler.class);

    private final InvoiceBotProperties properties;
    private final ClaimStore claimStore;
    private final CheckpointStore checkpointStore;
    private final SnapshotStore snapshotStore;

    public JobMaintenanceScheduler(
        InvoiceBotProperties properties,
        ClaimStore claimStore,
        CheckpointStore checkpointStore,
        SnapshotStore snapshotStore
    ) {
        this.properties = properties;
        this.claimStore = claimStore;
        this.checkpointStore = checkpointStore;
        this.snapshotStore = snapshotStore;
    }

    @Scheduled(fixedDelayString = "${invoicebot.maintenance.interval-ms:3600000}")
    public void runMaintenance() {
        InvoiceBotProperties.Claim claim = properties.getClaim();
        int retentionDays = properties.getCheckpoint().getRetentionDays();

        int timedOut = sweep("stale claims", () -> claimStore.cleanupStale(claim.getStaleRetentionHours()));
        int purged = sweep("terminal jobs", () -> claimStore.purgeTerminal(claim.getTerminalRetentionDays()));
        int checkpoints = sweep("checkpoints", () -> checkpointStore.cleanupOlderThan(retentionDays));
        int snapshots = sweep("snapshots", () -> snapshotStore.cleanupOlderThan(retentionDays));

        if (timedOut + purged + checkpoints + snapshots > 0) {
            log.info("Maintenance: {} jobs timed out, {} jobs purged, {} checkpoints and {} snapshots removed",
                timedOut, purged, checkpoints, snapshots);
        }
    }

    private int sweep(String name, IntSupplier sweep) {
        try {
            return sweep.getAsInt();
        } catch (RuntimeException e) {
            log.warn("Maintenance sweep of {} failed", name, e);
            return 0;
        }
    }
}
