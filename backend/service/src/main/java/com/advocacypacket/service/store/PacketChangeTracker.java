package com.advocacypacket.service.store;

import com.advocacypacket.core.model.AwardRecord;
import com.advocacypacket.core.model.ChangeRecord;
import com.advocacypacket.core.model.ChangeType;
import com.advocacypacket.core.model.ComputedEntityContext;
import com.advocacypacket.core.model.HazardObservation;
import com.advocacypacket.core.model.ProgramRecord;
import com.advocacypacket.core.model.Snapshot;
import com.advocacypacket.core.util.JsonUtils;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Persists one snapshot per entity under the state directory and reports what changed between generations.
 *
 * <p>Assumes a single writer per entity id.
 */
public class PacketChangeTracker {
    private static final Logger LOGGER = Logger.getLogger(PacketChangeTracker.class.getName());
    private static final ObjectMapper MAPPER = JsonUtils.objectMapper();

    public static final long MAX_STATE_FILE_BYTES = 10L * 1024 * 1024;
    static final int TOP_HAZARD_LIMIT = 5;
    private static final double OBLIGATION_EPSILON = 0.01;

    private final Path stateDir;
    private final Clock clock;

    public PacketChangeTracker(Path stateDir, Clock clock) {
        this.stateDir = stateDir;
        this.clock = clock;
    }

    public Path stateDir() {
        return stateDir;
    }

    public SnapshotLoad load(String entityId) {
        Path file = stateFile(entityId);
        if (!Files.exists(file)) {
            LOGGER.fine("No previous snapshot for " + entityId);
            return SnapshotLoad.absent();
        }
        try {
            long size = Files.size(file);
            if (size > MAX_STATE_FILE_BYTES) {
                return unreadable(entityId, "snapshot exceeds " + MAX_STATE_FILE_BYTES + " bytes (" + size + ")");
            }
            JsonNode root;
            try (InputStream in = Files.newInputStream(file)) {
                root = MAPPER.readTree(in);
            }
            if (root == null || !root.isObject()) {
                return unreadable(entityId, "snapshot is not a JSON object");
            }
            return SnapshotLoad.loaded(MAPPER.treeToValue(root, Snapshot.class));
        } catch (IOException e) {
            return unreadable(entityId, "snapshot could not be read: " + e.getMessage());
        }
    }

    public Optional<Snapshot> loadPrevious(String entityId) {
        return load(entityId).asOptional();
    }

    public Snapshot computeCurrent(ComputedEntityContext context, Map<String, ProgramRecord> programs) {
        Map<String, String> programStates = new LinkedHashMap<>();
        for (Map.Entry<String, ProgramRecord> entry : programs.entrySet()) {
            String status = entry.getValue().ciStatus();
            if (status != null && !status.isEmpty()) {
                programStates.put(entry.getKey(), status);
            }
        }

        List<AwardRecord> awards = context.awards();
        double totalObligation = 0.0;
        for (AwardRecord award : awards) {
            if (award.hasUsableObligation()) {
                totalObligation += award.obligation();
            }
        }

        List<String> topHazards = new ArrayList<>();
        for (HazardObservation hazard : context.hazardProfile().topHazards()) {
            if (topHazards.size() == TOP_HAZARD_LIMIT) {
                break;
            }
            topHazards.add(hazard.type() == null ? "Unknown" : hazard.type());
        }

        return new Snapshot(
                context.entityId(),
                clock.instant(),
                programStates,
                awards.size(),
                totalObligation,
                topHazards,
                awards.isEmpty() ? Snapshot.GOAL_NEW_APPLICANT : Snapshot.GOAL_RENEWAL
        );
    }

    public List<ChangeRecord> diff(Snapshot previous, Snapshot current) {
        List<ChangeRecord> changes = new ArrayList<>();

        for (Map.Entry<String, String> entry : current.programStates().entrySet()) {
            String before = Objects.requireNonNullElse(previous.programStates().get(entry.getKey()), "");
            if (!before.isEmpty() && !before.equals(entry.getValue())) {
                changes.add(new ChangeRecord(ChangeType.CI_STATUS_CHANGE,
                        "Program " + entry.getKey() + ": CI status changed from '" + before
                                + "' to '" + entry.getValue() + "'"));
            }
        }

        if (current.totalAwards() > previous.totalAwards()) {
            int added = current.totalAwards() - previous.totalAwards();
            changes.add(new ChangeRecord(ChangeType.NEW_AWARD,
                    added + " new award(s) recorded (total: " + previous.totalAwards() + " -> "
                            + current.totalAwards() + ")"));
        }

        if (Math.abs(current.totalObligation() - previous.totalObligation()) > OBLIGATION_EPSILON) {
            changes.add(new ChangeRecord(ChangeType.AWARD_TOTAL_CHANGE,
                    "Total obligation changed: " + dollars(previous.totalObligation()) + " -> "
                            + dollars(current.totalObligation())));
        }

        String previousGoal = previous.advocacyGoal();
        String currentGoal = current.advocacyGoal();
        if (!previousGoal.isEmpty() && !currentGoal.isEmpty() && !previousGoal.equals(currentGoal)) {
            changes.add(new ChangeRecord(ChangeType.ADVOCACY_GOAL_SHIFT,
                    "Advocacy goal shifted from '" + previousGoal + "' to '" + currentGoal + "'"));
        }

        Set<String> newHazards = new TreeSet<>(current.topHazards());
        newHazards.removeAll(previous.topHazards());
        for (String hazard : newHazards) {
            changes.add(new ChangeRecord(ChangeType.NEW_THREAT, "New hazard threat detected: " + hazard));
        }
        return changes;
    }

    public void saveCurrent(String entityId, Snapshot snapshot) {
        Path file = stateFile(entityId);
        Path tmp = null;
        try {
            Files.createDirectories(stateDir);
            tmp = Files.createTempFile(stateDir, entityId + "-", ".json.tmp");
            MAPPER.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), snapshot);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            LOGGER.fine("Saved snapshot for " + entityId + " to " + file);
        } catch (IOException e) {
            deleteQuietly(tmp);
            throw new IllegalStateException("Unable to write snapshot " + file, e);
        }
    }

    private Path stateFile(String entityId) {
        return stateDir.resolve(EntityIds.requireSafe(entityId) + ".json");
    }

    private static SnapshotLoad unreadable(String entityId, String reason) {
        LOGGER.warning("Ignoring snapshot for " + entityId + ": " + reason);
        return SnapshotLoad.unreadable(reason);
    }

    private static String dollars(double amount) {
        return "$" + String.format(Locale.US, "%,.0f", amount);
    }

    private static void deleteQuietly(Path tmp) {
        if (tmp == null) {
            return;
        }
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException cleanup) {
            LOGGER.log(Level.WARNING, "Unable to remove temporary snapshot " + tmp, cleanup);
        }
    }
}
