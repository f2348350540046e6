package com.advocacypacket.service.region;

import com.advocacypacket.core.model.AwardRecord;
import com.advocacypacket.core.model.ComputedEntityContext;
import com.advocacypacket.core.model.CoverageGaps;
import com.advocacypacket.core.model.DelegationMember;
import com.advocacypacket.core.model.DelegationOverlap;
import com.advocacypacket.core.model.EconomicAggregate;
import com.advocacypacket.core.model.EconomicSummary;
import com.advocacypacket.core.model.Entity;
import com.advocacypacket.core.model.HazardObservation;
import com.advocacypacket.core.model.HazardProfile;
import com.advocacypacket.core.model.RegionDefinition;
import com.advocacypacket.core.model.RegionalContext;
import com.advocacypacket.core.model.SharedHazard;
import com.advocacypacket.service.registry.EntityRegistry;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/**
 * Rolls per-entity contexts up into a region-level view. Regions with no jurisdictions match every entity.
 */
public class RegionalAggregator {
    private static final Logger LOGGER = Logger.getLogger(RegionalAggregator.class.getName());
    static final int SHARED_HAZARD_LIMIT = 5;

    private final Map<String, RegionDefinition> regions;
    private final EntityRegistry registry;
    private final Clock clock;
    private final Map<String, List<String>> membershipCache = new ConcurrentHashMap<>();

    public RegionalAggregator(Map<String, RegionDefinition> regions, EntityRegistry registry, Clock clock) {
        this.regions = new LinkedHashMap<>(regions);
        this.registry = registry;
        this.clock = clock;
    }

    public List<String> regionIds() {
        return List.copyOf(regions.keySet());
    }

    public List<String> entityIdsForRegion(String regionId) {
        RegionDefinition region = regions.get(regionId);
        if (region == null) {
            LOGGER.warning("Unknown region id " + regionId);
            return List.of();
        }
        return membershipCache.computeIfAbsent(regionId, ignored -> members(region));
    }

    public RegionalContext aggregate(String regionId, List<ComputedEntityContext> contexts) {
        RegionDefinition region = regions.get(regionId);
        if (region == null) {
            region = new RegionDefinition(regionId, regionId, regionId, List.of(), List.of(), "");
        }

        AwardTotals awards = aggregateAwards(contexts);
        int hazardCoverage = 0;
        int congressionalCoverage = 0;
        List<RegionalContext.EntitySummary> entities = new ArrayList<>();
        for (ComputedEntityContext context : contexts) {
            if (context.hazardProfile().hasCompositeScore()) {
                hazardCoverage++;
            }
            if (!context.delegation().isEmpty()) {
                congressionalCoverage++;
            }
            Entity entity = context.entity();
            entities.add(new RegionalContext.EntitySummary(entity.id(), entity.name(), entity.jurisdictions()));
        }
        DelegationSummary delegation = delegationOverlap(contexts);

        return new RegionalContext(
                regionId,
                region.name() == null ? regionId : region.name(),
                region.shortName() == null ? regionId : region.shortName(),
                region.coreFrame(),
                region.priorityPrograms(),
                region.jurisdictions(),
                contexts.size(),
                entities,
                awards.totalObligation(),
                awards.coverage(),
                hazardCoverage,
                congressionalCoverage,
                sharedHazards(contexts),
                compositeRisk(contexts),
                aggregateEconomics(contexts),
                delegation.overlaps(),
                delegation.totalSenators(),
                delegation.totalRepresentatives(),
                coverageGaps(contexts),
                clock.instant()
        );
    }

    public AwardTotals aggregateAwards(List<ComputedEntityContext> contexts) {
        double total = 0.0;
        int coverage = 0;
        for (ComputedEntityContext context : contexts) {
            for (AwardRecord award : context.awards()) {
                if (award.hasUsableObligation()) {
                    total += award.obligation();
                }
            }
            if (!context.awards().isEmpty()) {
                coverage++;
            }
        }
        return new AwardTotals(total, coverage);
    }

    /**
     * Hazard types ranked by how many entities carry them in their top five, ties broken by mean risk score.
     */
    public List<SharedHazard> sharedHazards(List<ComputedEntityContext> contexts) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        Map<String, List<Double>> scores = new LinkedHashMap<>();
        for (ComputedEntityContext context : contexts) {
            Set<String> seen = new HashSet<>();
            List<HazardObservation> top = context.hazardProfile().topHazards();
            for (HazardObservation hazard : top.subList(0, Math.min(SHARED_HAZARD_LIMIT, top.size()))) {
                String type = hazard.type();
                if (type == null || type.isBlank() || !seen.add(type)) {
                    continue;
                }
                counts.merge(type, 1, Integer::sum);
                List<Double> typeScores = scores.computeIfAbsent(type, ignored -> new ArrayList<>());
                if (hazard.riskScore() != null && Double.isFinite(hazard.riskScore())) {
                    typeScores.add(hazard.riskScore());
                }
            }
        }

        List<SharedHazard> ranked = new ArrayList<>();
        for (Map.Entry<String, Integer> entry : counts.entrySet()) {
            ranked.add(new SharedHazard(entry.getKey(), entry.getValue(), mean(scores.get(entry.getKey()))));
        }
        ranked.sort(Comparator.comparingInt(SharedHazard::entityCount)
                .thenComparingDouble(SharedHazard::meanScore)
                .reversed());

        List<SharedHazard> result = new ArrayList<>();
        for (SharedHazard hazard : ranked.subList(0, Math.min(SHARED_HAZARD_LIMIT, ranked.size()))) {
            result.add(new SharedHazard(hazard.type(), hazard.entityCount(), round2(hazard.meanScore())));
        }
        return result;
    }

    public double compositeRisk(List<ComputedEntityContext> contexts) {
        List<Double> positive = new ArrayList<>();
        for (ComputedEntityContext context : contexts) {
            HazardProfile profile = context.hazardProfile();
            Double score = profile.compositeRiskScore();
            if (score != null && score > 0) {
                positive.add(score);
            }
        }
        return positive.isEmpty() ? 0.0 : round2(mean(positive));
    }

    public DelegationSummary delegationOverlap(List<ComputedEntityContext> contexts) {
        Map<String, Set<String>> entitiesByMember = new LinkedHashMap<>();
        Map<String, DelegationMember> firstSeen = new LinkedHashMap<>();
        Set<String> senators = new HashSet<>();
        Set<String> representatives = new HashSet<>();

        for (ComputedEntityContext context : contexts) {
            track(context.entityId(), context.delegation().senators(), entitiesByMember, firstSeen, senators);
            track(context.entityId(), context.delegation().representatives(), entitiesByMember, firstSeen,
                    representatives);
        }

        List<DelegationOverlap> overlaps = new ArrayList<>();
        for (Map.Entry<String, Set<String>> entry : entitiesByMember.entrySet()) {
            Set<String> entityIds = entry.getValue();
            if (entityIds.size() < 2) {
                continue;
            }
            DelegationMember member = firstSeen.get(entry.getKey());
            String name = member.name() == null || member.name().isBlank() ? entry.getKey() : member.name();
            String role = member.role() == null ? "Unknown" : member.role().displayName();
            overlaps.add(new DelegationOverlap(name, role, entityIds.size(), new ArrayList<>(entityIds),
                    member.committees()));
        }
        overlaps.sort(Comparator.comparingInt(DelegationOverlap::entityCount).reversed());
        return new DelegationSummary(overlaps, senators.size(), representatives.size());
    }

    public EconomicAggregate aggregateEconomics(List<ComputedEntityContext> contexts) {
        double low = 0.0;
        double high = 0.0;
        double jobsLow = 0.0;
        double jobsHigh = 0.0;
        for (ComputedEntityContext context : contexts) {
            EconomicSummary summary = context.economicSummary();
            low += summary.totalImpactLow();
            high += summary.totalImpactHigh();
            jobsLow += summary.totalJobsLow();
            jobsHigh += summary.totalJobsHigh();
        }
        return new EconomicAggregate(round2(low), round2(high), round2(jobsLow), round2(jobsHigh));
    }

    public CoverageGaps coverageGaps(List<ComputedEntityContext> contexts) {
        List<String> withoutAwards = new ArrayList<>();
        List<String> withoutHazards = new ArrayList<>();
        List<String> withoutDelegation = new ArrayList<>();
        for (ComputedEntityContext context : contexts) {
            if (context.awards().isEmpty()) {
                withoutAwards.add(context.entityId());
            }
            if (!context.hazardProfile().hasCompositeScore()) {
                withoutHazards.add(context.entityId());
            }
            if (context.delegation().isEmpty()) {
                withoutDelegation.add(context.entityId());
            }
        }
        return new CoverageGaps(withoutAwards, withoutHazards, withoutDelegation);
    }

    private List<String> members(RegionDefinition region) {
        List<String> ids = new ArrayList<>();
        Set<String> wanted = new HashSet<>(region.jurisdictions());
        for (Entity entity : registry.getAll()) {
            if (region.wildcard() || entity.jurisdictions().stream().anyMatch(wanted::contains)) {
                ids.add(entity.id());
            }
        }
        LOGGER.fine("Region " + region.id() + " has " + ids.size() + " member(s)");
        return List.copyOf(ids);
    }

    private static void track(
            String entityId,
            List<DelegationMember> members,
            Map<String, Set<String>> entitiesByMember,
            Map<String, DelegationMember> firstSeen,
            Set<String> roleTotals
    ) {
        for (DelegationMember member : members) {
            String key = member.identity();
            if (key.isBlank()) {
                continue;
            }
            entitiesByMember.computeIfAbsent(key, ignored -> new TreeSet<>()).add(entityId);
            firstSeen.putIfAbsent(key, member);
            roleTotals.add(key);
        }
    }

    private static double mean(List<Double> values) {
        if (values == null || values.isEmpty()) {
            return 0.0;
        }
        double sum = 0.0;
        for (double value : values) {
            sum += value;
        }
        return sum / values.size();
    }

    private static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }

    public record AwardTotals(double totalObligation, int coverage) {
    }

    public record DelegationSummary(List<DelegationOverlap> overlaps, int totalSenators, int totalRepresentatives) {
        public DelegationSummary {
            overlaps = overlaps == null ? List.of() : List.copyOf(overlaps);
        }
    }
}
