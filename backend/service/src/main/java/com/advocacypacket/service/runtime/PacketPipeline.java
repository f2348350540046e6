package com.advocacypacket.service.runtime;

import com.advocacypacket.core.bus.EventBus;
import com.advocacypacket.core.events.ChangesDetected;
import com.advocacypacket.core.events.RegionAggregated;
import com.advocacypacket.core.events.SnapshotDegraded;
import com.advocacypacket.core.model.ChangeRecord;
import com.advocacypacket.core.model.ComputedEntityContext;
import com.advocacypacket.core.model.ConfidenceAnnotation;
import com.advocacypacket.core.model.EconomicSummary;
import com.advocacypacket.core.model.Entity;
import com.advocacypacket.core.model.EntityInputs;
import com.advocacypacket.core.model.ProgramRecord;
import com.advocacypacket.core.model.RegionalContext;
import com.advocacypacket.core.model.ScoredProgram;
import com.advocacypacket.core.model.Snapshot;
import com.advocacypacket.scoring.confidence.ConfidenceScorer;
import com.advocacypacket.scoring.economic.EconomicImpactCalculator;
import com.advocacypacket.scoring.geo.GeoClassifier;
import com.advocacypacket.scoring.relevance.ProgramRelevanceFilter;
import com.advocacypacket.service.region.RegionalAggregator;
import com.advocacypacket.service.store.PacketChangeTracker;
import com.advocacypacket.service.store.SnapshotLoad;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.logging.Logger;

/**
 * Runs the per-entity scoring steps, records the generation against the previous snapshot and
 * rolls computed contexts up by region. Progress is reported on the {@link EventBus}.
 */
public class PacketPipeline {
    private static final Logger LOGGER = Logger.getLogger(PacketPipeline.class.getName());

    private final Map<String, ProgramRecord> programs;
    private final GeoClassifier geoClassifier;
    private final ProgramRelevanceFilter relevanceFilter;
    private final EconomicImpactCalculator economicCalculator;
    private final ConfidenceScorer confidenceScorer;
    private final PacketChangeTracker changeTracker;
    private final RegionalAggregator regionalAggregator;
    private final EventBus eventBus;
    private final Clock clock;

    public PacketPipeline(
            Map<String, ProgramRecord> programs,
            GeoClassifier geoClassifier,
            ProgramRelevanceFilter relevanceFilter,
            EconomicImpactCalculator economicCalculator,
            ConfidenceScorer confidenceScorer,
            PacketChangeTracker changeTracker,
            RegionalAggregator regionalAggregator,
            EventBus eventBus,
            Clock clock
    ) {
        this.programs = new LinkedHashMap<>(programs);
        this.geoClassifier = geoClassifier;
        this.relevanceFilter = relevanceFilter;
        this.economicCalculator = economicCalculator;
        this.confidenceScorer = confidenceScorer;
        this.changeTracker = changeTracker;
        this.regionalAggregator = regionalAggregator;
        this.eventBus = eventBus;
        this.clock = clock;
    }

    public ComputedEntityContext computeContext(EntityInputs inputs) {
        Entity entity = inputs.entity();
        List<String> geoClassifications = entity.geoClassifications().isEmpty()
                ? geoClassifier.classify(entity.jurisdictions())
                : entity.geoClassifications();

        List<ScoredProgram> relevant = relevanceFilter.filter(inputs.hazardProfile(), geoClassifications, List.of());
        List<ProgramRecord> omitted = relevanceFilter.omitted(relevant);
        EconomicSummary economics = economicCalculator.compute(entity.id(), inputs.awards(), inputs.districts(), programs);

        Map<String, ConfidenceAnnotation> confidence = new TreeMap<>();
        for (Map.Entry<String, String> entry : inputs.sourceTimestamps().entrySet()) {
            confidence.put(entry.getKey(), confidenceScorer.annotate(entry.getKey(), entry.getValue()));
        }

        LOGGER.fine("Computed context for " + entity.id() + ": " + relevant.size() + " relevant program(s), "
                + inputs.awards().size() + " award(s)");
        return new ComputedEntityContext(
                inputs,
                geoClassifications,
                relevant,
                omitted,
                economics,
                confidence,
                clock.instant()
        );
    }

    public EntityGeneration generate(EntityInputs inputs) {
        ComputedEntityContext context = computeContext(inputs);
        String entityId = context.entityId();

        SnapshotLoad previous = changeTracker.load(entityId);
        if (previous.unreadable()) {
            eventBus.publish(new SnapshotDegraded(clock.instant(), entityId, previous.reason()));
        }

        Snapshot current = changeTracker.computeCurrent(context, programs);
        List<ChangeRecord> changes = previous.asOptional()
                .map(snapshot -> changeTracker.diff(snapshot, current))
                .orElse(List.of());
        changeTracker.saveCurrent(entityId, current);

        Snapshot prior = previous.snapshot();
        if (!changes.isEmpty()) {
            eventBus.publish(new ChangesDetected(clock.instant(), entityId, prior.generatedAt(), changes));
        }
        return new EntityGeneration(context, changes, prior == null ? null : prior.generatedAt(), current);
    }

    /**
     * Aggregates the region's members that have a computed context; members without one are skipped.
     */
    public RegionalContext aggregateRegion(String regionId, Map<String, ComputedEntityContext> contextsById) {
        List<ComputedEntityContext> members = new ArrayList<>();
        for (String entityId : regionalAggregator.entityIdsForRegion(regionId)) {
            ComputedEntityContext context = contextsById.get(entityId);
            if (context != null) {
                members.add(context);
            }
        }
        RegionalContext regional = regionalAggregator.aggregate(regionId, members);
        eventBus.publish(new RegionAggregated(
                clock.instant(),
                regionId,
                regional.entityCount(),
                regional.awardCoverage(),
                regional.delegationOverlap().size()
        ));
        return regional;
    }
}
