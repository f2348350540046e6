package com.advocacypacket.service.region;

import com.advocacypacket.core.model.ComputedEntityContext;
import com.advocacypacket.core.model.CoverageGaps;
import com.advocacypacket.core.model.Delegation;
import com.advocacypacket.core.model.DelegationOverlap;
import com.advocacypacket.core.model.EconomicAggregate;
import com.advocacypacket.core.model.EconomicSummary;
import com.advocacypacket.core.model.RegionDefinition;
import com.advocacypacket.core.model.RegionalContext;
import com.advocacypacket.core.model.SharedHazard;
import com.advocacypacket.service.registry.EntityRegistry;
import com.advocacypacket.service.support.Contexts;
import com.advocacypacket.service.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RegionalAggregatorTest {
    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private final EntityRegistry registry = new EntityRegistry(List.of(
            Contexts.entity("epa_a", "WA", "OR"),
            Contexts.entity("epa_b", "ID"),
            Contexts.entity("epa_c", "TX"),
            Contexts.entity("epa_d", "MT", "WY")
    ));

    @Test
    void membershipUsesJurisdictionOverlapAndWildcard() {
        RegionalAggregator aggregator = aggregator();

        assertEquals(List.of("epa_a", "epa_b", "epa_d"), aggregator.entityIdsForRegion("pnw"));
        assertEquals(List.of("epa_a", "epa_b", "epa_c", "epa_d"), aggregator.entityIdsForRegion("crosscutting"));
        assertEquals(List.of(), aggregator.entityIdsForRegion("atlantis"));
        assertEquals(List.of("pnw", "crosscutting"), aggregator.regionIds());
    }

    @Test
    void membershipIsCachedPerRegion() {
        RegionalAggregator aggregator = aggregator();

        List<String> first = aggregator.entityIdsForRegion("pnw");

        assertSame(first, aggregator.entityIdsForRegion("pnw"));
    }

    @Test
    void sharedSenatorAppearsOnceWithBothEntities() {
        RegionalAggregator aggregator = aggregator();
        ComputedEntityContext a = Contexts.context(Contexts.entity("epa_a", "WA"), null, List.of(),
                Contexts.delegation(List.of(Contexts.senator("S001", "Sen. Shared")),
                        List.of(Contexts.representative("R001", "Rep. One"))));
        ComputedEntityContext b = Contexts.context(Contexts.entity("epa_b", "WA"), null, List.of(),
                Contexts.delegation(List.of(Contexts.senator("S001", "Sen. Shared")),
                        List.of(Contexts.representative("R002", "Rep. Two"))));

        RegionalAggregator.DelegationSummary summary = aggregator.delegationOverlap(List.of(a, b));

        assertEquals(1, summary.overlaps().size());
        DelegationOverlap overlap = summary.overlaps().get(0);
        assertEquals("Sen. Shared", overlap.memberName());
        assertEquals("Senator", overlap.role());
        assertEquals(2, overlap.entityCount());
        assertEquals(List.of("epa_a", "epa_b"), overlap.entityIds());
        assertEquals(1, summary.totalSenators());
        assertEquals(2, summary.totalRepresentatives());
    }

    @Test
    void membersWithoutIdAreMatchedByName() {
        RegionalAggregator aggregator = aggregator();
        ComputedEntityContext a = Contexts.context(Contexts.entity("epa_a", "WA"), null, List.of(),
                Contexts.delegation(List.of(), List.of(Contexts.representative(null, "Rep. Nameonly"))));
        ComputedEntityContext b = Contexts.context(Contexts.entity("epa_b", "WA"), null, List.of(),
                Contexts.delegation(List.of(), List.of(Contexts.representative("", "Rep. Nameonly"))));
        ComputedEntityContext c = Contexts.context(Contexts.entity("epa_c", "WA"), null, List.of(),
                Contexts.delegation(List.of(), List.of(Contexts.representative(null, null))));

        RegionalAggregator.DelegationSummary summary = aggregator.delegationOverlap(List.of(a, b, c));

        assertEquals(1, summary.overlaps().size());
        assertEquals("Representative", summary.overlaps().get(0).role());
        assertEquals(1, summary.totalRepresentatives());
    }

    @Test
    void sharedHazardsRankByEntityCountThenMeanScore() {
        RegionalAggregator aggregator = aggregator();
        List<ComputedEntityContext> contexts = List.of(
                Contexts.context(Contexts.entity("epa_a", "WA"), Contexts.hazards(30.0,
                        Contexts.hazard("Wildfire", 80.0), Contexts.hazard("Drought", 40.0),
                        Contexts.hazard("Flood", 90.0)), List.of(), Delegation.empty()),
                Contexts.context(Contexts.entity("epa_b", "WA"), Contexts.hazards(10.0,
                        Contexts.hazard("Wildfire", 60.0), Contexts.hazard("Drought", 50.0),
                        Contexts.hazard("Wildfire", 99.0)), List.of(), Delegation.empty()),
                Contexts.context(Contexts.entity("epa_c", "WA"), Contexts.hazards(null,
                        Contexts.hazard("Drought", 45.0), Contexts.hazard("", 100.0)), List.of(), Delegation.empty())
        );

        List<SharedHazard> shared = aggregator.sharedHazards(contexts);

        assertEquals(List.of(
                new SharedHazard("Drought", 3, 45.0),
                new SharedHazard("Wildfire", 2, 70.0),
                new SharedHazard("Flood", 1, 90.0)
        ), shared);
    }

    @Test
    void sharedHazardsKeepFiveAndRoundMeans() {
        RegionalAggregator aggregator = aggregator();
        List<ComputedEntityContext> contexts = List.of(
                Contexts.context(Contexts.entity("epa_a", "WA"), Contexts.hazards(null,
                        Contexts.hazard("A", 1.0), Contexts.hazard("B", 2.0), Contexts.hazard("C", 3.0),
                        Contexts.hazard("D", 4.0), Contexts.hazard("E", 5.0), Contexts.hazard("F", 99.0)),
                        List.of(), Delegation.empty()),
                Contexts.context(Contexts.entity("epa_b", "WA"), Contexts.hazards(null,
                        Contexts.hazard("A", 2.115), Contexts.hazard("G", 6.0)), List.of(), Delegation.empty())
        );

        List<SharedHazard> shared = aggregator.sharedHazards(contexts);

        assertEquals(5, shared.size());
        assertEquals(new SharedHazard("A", 2, 1.56), shared.get(0));
        assertEquals("G", shared.get(1).type());
        assertTrue(shared.stream().noneMatch(h -> h.type().equals("F")));
    }

    @Test
    void compositeRiskAveragesOnlyPositiveScores() {
        RegionalAggregator aggregator = aggregator();
        List<ComputedEntityContext> contexts = List.of(
                Contexts.context(Contexts.entity("epa_a", "WA"), Contexts.hazards(10.0), List.of(), Delegation.empty()),
                Contexts.context(Contexts.entity("epa_b", "WA"), Contexts.hazards(20.555), List.of(), Delegation.empty()),
                Contexts.context(Contexts.entity("epa_c", "WA"), Contexts.hazards(0.0), List.of(), Delegation.empty()),
                Contexts.context(Contexts.entity("epa_d", "WA"), null, List.of(), Delegation.empty())
        );

        assertEquals(15.28, aggregator.compositeRisk(contexts), 1e-9);
        assertEquals(0.0, aggregator.compositeRisk(contexts.subList(2, 4)), 1e-9);
    }

    @Test
    void economicsAreSummedAndRounded() {
        RegionalAggregator aggregator = aggregator();
        List<ComputedEntityContext> contexts = List.of(
                Contexts.context(Contexts.entity("epa_a", "WA"), null, List.of(), Delegation.empty(),
                        economics("epa_a", 1000.004, 2000.0, 1.111, 2.0)),
                Contexts.context(Contexts.entity("epa_b", "WA"), null, List.of(), Delegation.empty(),
                        economics("epa_b", 500.0, 700.0, 0.5, 1.0)),
                Contexts.context(Contexts.entity("epa_c", "WA"), null, List.of(), Delegation.empty())
        );

        assertEquals(new EconomicAggregate(1500.0, 2700.0, 1.61, 3.0), aggregator.aggregateEconomics(contexts));
        assertEquals(EconomicAggregate.ZERO, aggregator.aggregateEconomics(List.of()));
    }

    @Test
    void aggregateBuildsRegionalContext() {
        RegionalAggregator aggregator = aggregator();
        ComputedEntityContext a = Contexts.context(Contexts.entity("epa_a", "WA", "OR"),
                Contexts.hazards(12.0, Contexts.hazard("Wildfire", 50.0)),
                List.of(Contexts.award("bia_tcr", 100_000.0), Contexts.award("epa_gap", 25_000.0)),
                Contexts.delegation(List.of(Contexts.senator("S001", "Sen. Shared")), List.of()));
        ComputedEntityContext b = Contexts.context(Contexts.entity("epa_b", "ID"), null, List.of(),
                Contexts.delegation(List.of(Contexts.senator("S001", "Sen. Shared")), List.of()));
        ComputedEntityContext d = Contexts.context(Contexts.entity("epa_d", "MT"), null,
                List.of(Contexts.award("usbr_tap", null)), Delegation.empty());

        RegionalContext regional = aggregator.aggregate("pnw", List.of(a, b, d));

        assertEquals("pnw", regional.regionId());
        assertEquals("Pacific Northwest", regional.regionName());
        assertEquals("PNW", regional.shortName());
        assertEquals(3, regional.entityCount());
        assertEquals(125_000.0, regional.totalAwards(), 1e-9);
        assertEquals(2, regional.awardCoverage());
        assertEquals(1, regional.hazardCoverage());
        assertEquals(2, regional.congressionalCoverage());
        assertEquals(12.0, regional.compositeRiskScore(), 1e-9);
        assertEquals(1, regional.delegationOverlap().size());
        assertEquals(1, regional.totalSenators());
        assertEquals(0, regional.totalRepresentatives());
        assertEquals(new CoverageGaps(List.of("epa_b"), List.of("epa_b", "epa_d"), List.of("epa_d")),
                regional.coverageGaps());
        assertEquals(List.of("epa_a", "epa_b", "epa_d"),
                regional.entities().stream().map(RegionalContext.EntitySummary::entityId).toList());
        assertEquals(NOW, regional.generatedAt());
    }

    @Test
    void aggregatingUnknownRegionFallsBackToItsId() {
        RegionalContext regional = aggregator().aggregate("atlantis", List.of());

        assertEquals("atlantis", regional.regionName());
        assertEquals(0, regional.entityCount());
        assertEquals(0.0, regional.compositeRiskScore(), 1e-9);
        assertEquals(EconomicAggregate.ZERO, regional.economicImpact());
    }

    private RegionalAggregator aggregator() {
        Map<String, RegionDefinition> regions = new LinkedHashMap<>();
        regions.put("pnw", new RegionDefinition("pnw", "Pacific Northwest", "PNW", List.of("WA", "OR", "ID", "MT"),
                List.of("bia_tcr"), "Salmon and wildfire"));
        regions.put("crosscutting", new RegionDefinition("crosscutting", "National", null, List.of(), List.of(), null));
        return new RegionalAggregator(regions, registry, new MutableClock(NOW));
    }

    private static EconomicSummary economics(String id, double low, double high, double jobsLow, double jobsHigh) {
        return new EconomicSummary(id, 0.0, low, high, jobsLow, jobsHigh, List.of(), Map.of());
    }
}
