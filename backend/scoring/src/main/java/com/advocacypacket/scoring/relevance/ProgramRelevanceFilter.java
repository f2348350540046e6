package com.advocacypacket.scoring.relevance;

import com.advocacypacket.core.model.HazardObservation;
import com.advocacypacket.core.model.HazardProfile;
import com.advocacypacket.core.model.ProgramRecord;
import com.advocacypacket.core.model.ScoredProgram;
import com.advocacypacket.scoring.config.RelevanceConfig;
import com.advocacypacket.scoring.geo.GeoClassifier;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.ToDoubleFunction;

/**
 * Ranks the program catalog for one entity from hazard exposure, geography and static priority.
 *
 * <p>Scoring ({@link #score}) is total over the catalog; selection ({@link #select}) clamps the
 * ranked list to the configured size bounds. Critical-tier programs are never trimmed, so the
 * result exceeds the maximum when the critical tier alone is larger than it.
 */
public class ProgramRelevanceFilter {
    private static final Comparator<ScoredProgram> BY_SCORE_DESC =
            Comparator.comparingDouble(ScoredProgram::score).reversed();

    private final Map<String, ProgramRecord> catalog;
    private final RelevanceConfig config;
    private final GeoClassifier geoClassifier;
    private final HazardCodeResolver hazardCodeResolver;

    public ProgramRelevanceFilter(Map<String, ProgramRecord> catalog) {
        this(catalog, RelevanceConfig.defaults(), GeoClassifier.empty());
    }

    public ProgramRelevanceFilter(Map<String, ProgramRecord> catalog, RelevanceConfig config, GeoClassifier geoClassifier) {
        this.catalog = new LinkedHashMap<>(catalog);
        this.config = config;
        this.geoClassifier = geoClassifier;
        this.hazardCodeResolver = new HazardCodeResolver(config);
    }

    public List<ScoredProgram> filter(
            HazardProfile hazardProfile,
            Collection<String> geoClassifications,
            Collection<String> overridePriorityPrograms
    ) {
        return select(score(hazardProfile, geoClassifications, overridePriorityPrograms));
    }

    /**
     * Scores every catalog program, in catalog order.
     */
    public List<ScoredProgram> score(
            HazardProfile hazardProfile,
            Collection<String> geoClassifications,
            Collection<String> overridePriorityPrograms
    ) {
        Map<String, Double> scores = new LinkedHashMap<>();
        for (ProgramRecord program : catalog.values()) {
            scores.put(program.id(), (double) config.weightOf(program.priority()));
        }

        for (String programId : config.alwaysRelevant()) {
            scores.computeIfPresent(programId, (id, current) -> current + config.alwaysRelevantBonus());
        }

        for (ProgramRecord program : catalog.values()) {
            if (program.critical()) {
                scores.computeIfPresent(program.id(), (id, current) -> current + config.criticalBonus());
            }
        }

        List<HazardObservation> hazards = hazardProfile == null ? List.of() : hazardProfile.topHazards();
        for (int rank = 0; rank < hazards.size(); rank++) {
            Optional<String> code = hazardCodeResolver.resolve(hazards.get(rank));
            if (code.isEmpty()) {
                continue;
            }
            double bonus = config.hazardBonus(rank);
            for (String programId : config.hazardProgramMap().getOrDefault(code.get(), List.of())) {
                scores.computeIfPresent(programId, (id, current) -> current + bonus);
            }
        }

        for (String programId : geoPriorityPrograms(geoClassifications, overridePriorityPrograms)) {
            scores.computeIfPresent(programId, (id, current) -> current + config.geoPriorityBonus());
        }

        List<ScoredProgram> scored = new ArrayList<>(scores.size());
        for (ProgramRecord program : catalog.values()) {
            scored.add(new ScoredProgram(program, scores.get(program.id())));
        }
        return scored;
    }

    /**
     * Clamps scored programs to the configured bounds and returns them ranked by score.
     */
    public List<ScoredProgram> select(List<ScoredProgram> scored) {
        List<ScoredProgram> ranked = new ArrayList<>(scored);
        ranked.sort(BY_SCORE_DESC);

        List<ScoredProgram> result = ranked;
        if (ranked.size() > config.maxPrograms()) {
            List<ScoredProgram> kept = new ArrayList<>();
            for (ScoredProgram candidate : ranked) {
                if (candidate.program().critical()) {
                    kept.add(candidate);
                }
            }
            for (ScoredProgram candidate : ranked) {
                if (!candidate.program().critical() && kept.size() < config.maxPrograms()) {
                    kept.add(candidate);
                }
            }
            result = kept;
        }

        if (result.size() < config.minPrograms()) {
            pad(result, config.minPrograms(), program -> config.weightOf(program.priority()));
        }
        if (result.size() < config.absoluteMinPrograms() && catalog.size() >= config.absoluteMinPrograms()) {
            pad(result, config.absoluteMinPrograms(), program -> 1.0);
        }

        result.sort(BY_SCORE_DESC);
        return result;
    }

    /**
     * Catalog programs absent from {@code included}, highest priority tier first.
     */
    public List<ProgramRecord> omitted(Collection<ScoredProgram> included) {
        Set<String> includedIds = new HashSet<>();
        for (ScoredProgram program : included) {
            includedIds.add(program.programId());
        }
        List<ProgramRecord> omitted = new ArrayList<>();
        for (ProgramRecord program : catalog.values()) {
            if (!includedIds.contains(program.id())) {
                omitted.add(program);
            }
        }
        omitted.sort(Comparator.comparingInt((ProgramRecord program) -> config.weightOf(program.priority())).reversed());
        return omitted;
    }

    private Set<String> geoPriorityPrograms(Collection<String> geoClassifications, Collection<String> overrides) {
        Set<String> programs = new LinkedHashSet<>();
        if (geoClassifications != null) {
            for (String classification : geoClassifications) {
                programs.addAll(geoClassifier.priorityPrograms(classification));
            }
        }
        if (overrides != null) {
            programs.addAll(overrides);
        }
        return programs;
    }

    private void pad(List<ScoredProgram> result, int target, ToDoubleFunction<ProgramRecord> padScore) {
        Set<String> includedIds = new HashSet<>();
        for (ScoredProgram program : result) {
            includedIds.add(program.programId());
        }
        for (ProgramRecord program : catalog.values()) {
            if (result.size() >= target) {
                return;
            }
            if (includedIds.add(program.id())) {
                result.add(new ScoredProgram(program, padScore.applyAsDouble(program)));
            }
        }
    }
}
