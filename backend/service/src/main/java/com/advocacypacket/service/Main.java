package com.advocacypacket.service;

import com.advocacypacket.core.bus.EventBus;
import com.advocacypacket.core.events.ChangesDetected;
import com.advocacypacket.core.events.RegionAggregated;
import com.advocacypacket.core.events.SnapshotDegraded;
import com.advocacypacket.core.model.ComputedEntityContext;
import com.advocacypacket.core.model.Entity;
import com.advocacypacket.core.model.ProgramRecord;
import com.advocacypacket.core.model.RegionalContext;
import com.advocacypacket.scoring.config.EconomicConfig;
import com.advocacypacket.scoring.config.RelevanceConfig;
import com.advocacypacket.scoring.confidence.ConfidenceScorer;
import com.advocacypacket.scoring.economic.EconomicImpactCalculator;
import com.advocacypacket.scoring.geo.GeoClassifier;
import com.advocacypacket.scoring.relevance.ProgramRelevanceFilter;
import com.advocacypacket.service.config.ConfigLoader;
import com.advocacypacket.service.config.EngineSettings;
import com.advocacypacket.service.ingest.EntityCacheReader;
import com.advocacypacket.service.region.RegionalAggregator;
import com.advocacypacket.service.registry.EntityRegistry;
import com.advocacypacket.service.runtime.EntityGeneration;
import com.advocacypacket.service.runtime.PacketPipeline;
import com.advocacypacket.service.store.PacketChangeTracker;

import java.nio.file.Path;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.logging.Logger;

public final class Main {
    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());

    private Main() {
    }

    public static void main(String[] args) {
        Path configDir = Path.of(args.length > 0 ? args[0] : "config");
        Path baseDir = Path.of(args.length > 1 ? args[1] : ".");
        Clock clock = Clock.systemUTC();

        Map<String, ProgramRecord> programs = ConfigLoader.loadPrograms(configDir);
        GeoClassifier geoClassifier = ConfigLoader.loadGeoClassifier(configDir);
        EntityRegistry registry = new EntityRegistry(ConfigLoader.loadRegistry(configDir));
        EngineSettings settings = ConfigLoader.loadEngineSettings(configDir);

        EventBus eventBus = new EventBus();
        subscribeLogging(eventBus);

        RegionalAggregator aggregator = new RegionalAggregator(ConfigLoader.loadRegions(configDir), registry, clock);
        PacketPipeline pipeline = new PacketPipeline(
                programs,
                geoClassifier,
                new ProgramRelevanceFilter(programs, RelevanceConfig.defaults(), geoClassifier),
                new EconomicImpactCalculator(EconomicConfig.defaults()),
                new ConfidenceScorer(settings.confidenceConfig(), clock),
                new PacketChangeTracker(settings.stateDirectory(baseDir), clock),
                aggregator,
                eventBus,
                clock
        );
        EntityCacheReader cacheReader = new EntityCacheReader(settings.cacheDirectory(baseDir));

        Map<String, ComputedEntityContext> contexts = new LinkedHashMap<>();
        int changed = 0;
        for (Entity entity : registry.getAll()) {
            EntityGeneration generation = pipeline.generate(cacheReader.read(entity));
            contexts.put(entity.id(), generation.context());
            if (!generation.changes().isEmpty()) {
                changed++;
            }
        }
        LOGGER.info("Generated " + contexts.size() + " entity context(s); " + changed + " with changes");

        for (String regionId : aggregator.regionIds()) {
            RegionalContext regional = pipeline.aggregateRegion(regionId, contexts);
            LOGGER.info(regionSummary(regional));
        }
    }

    static String regionSummary(RegionalContext regional) {
        return String.format(Locale.US, "Region %s: %d entities, composite risk %.2f, impact $%,.0f-$%,.0f",
                regional.regionId(),
                regional.entityCount(),
                regional.compositeRiskScore(),
                regional.economicImpact().totalLow(),
                regional.economicImpact().totalHigh());
    }

    static void subscribeLogging(EventBus eventBus) {
        eventBus.subscribe(SnapshotDegraded.class, event ->
                LOGGER.warning("Snapshot for " + event.entityId() + " unusable: " + event.reason()));
        eventBus.subscribe(ChangesDetected.class, event ->
                LOGGER.info(event.entityId() + ": " + event.changes().size() + " change(s) since "
                        + event.previousGeneratedAt()));
        eventBus.subscribe(RegionAggregated.class, event ->
                LOGGER.fine("Aggregated region " + event.regionId() + " (" + event.entityCount() + " entities, "
                        + event.overlappingMembers() + " shared member(s))"));
    }
}
