package com.wingman.core.model;

import com.wingman.core.resolve.PilotIdentity;
import com.wingman.core.resolve.ResolvedCampaign;
import com.wingman.core.resolve.ResolvedPilot;
import com.wingman.core.stats.CampaignStatistics;

import java.time.LocalDate;
import java.time.Period;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Builds the {@link UnifiedCampaignModel} from resolved records, computed statistics and a snapshot
 * of the annotation store. Performs no I/O.
 */
public final class UnifiedCampaignModelAssembler {

    public UnifiedCampaignModel assemble(ResolvedCampaign resolved,
                                         CampaignStatistics statistics,
                                         Map<String, AnnotationRecord> annotations) {
        Map<String, Optional<String>> squadronNames = new HashMap<>();
        resolved.squadrons().forEach(s -> squadronNames.put(s.id(), s.name()));
        Optional<LocalDate> lastCampaignMission = lastMissionDate(resolved.missions());

        List<Pilot> pilots = new ArrayList<>();
        for (ResolvedPilot resolvedPilot : resolved.pilots()) {
            PilotIdentity identity = resolvedPilot.identity();
            String name = identity.name()
                .orElse(resolvedPilot.referencePilot() ? resolved.campaign().name() : identity.serialNumber());
            Optional<String> squadronName = identity.squadronName()
                .or(() -> identity.squadronId().flatMap(id -> squadronNames.getOrDefault(id, Optional.empty())));
            Optional<AnnotationRecord> annotation = Optional.ofNullable(annotations.get(identity.serialNumber()));

            Optional<LocalDate> lastMission = lastReportDate(resolvedPilot.reports());
            if (lastMission.isEmpty() && resolvedPilot.referencePilot()) {
                lastMission = lastCampaignMission;
            }
            pilots.add(new Pilot(
                identity.serialNumber(),
                name,
                identity.rank(),
                identity.squadronId(),
                squadronName,
                identity.status(),
                resolvedPilot.referencePilot(),
                statistics.forPilot(identity.serialNumber()),
                annotation,
                ageAt(annotation, lastMission)
            ));
        }

        List<Squadron> squadrons = resolved.squadrons().stream()
            .map(squadron -> squadron.withTotals(statistics.forSquadron(squadron.id())))
            .toList();

        return new UnifiedCampaignModel(
            resolved.campaign(),
            pilots,
            squadrons,
            statistics.aces(),
            resolved.missions(),
            resolved.campaignLog(),
            statistics.achievements()
        );
    }

    /**
     * Whole years between the annotated birth date and {@code date}; absent when either is unknown
     * or the birth date lies after it.
     */
    static Optional<Integer> ageAt(Optional<AnnotationRecord> annotation, Optional<LocalDate> date) {
        Optional<LocalDate> birth = annotation.flatMap(AnnotationRecord::parsedBirthDate);
        if (birth.isEmpty() || date.isEmpty() || birth.get().isAfter(date.get())) {
            return Optional.empty();
        }
        return Optional.of(Period.between(birth.get(), date.get()).getYears());
    }

    private static Optional<LocalDate> lastReportDate(List<CombatReport> reports) {
        return reports.stream()
            .map(CombatReport::date)
            .flatMap(Optional::stream)
            .map(CampaignDate::date)
            .flatMap(Optional::stream)
            .max(LocalDate::compareTo);
    }

    private static Optional<LocalDate> lastMissionDate(List<MissionEntry> missions) {
        return missions.stream()
            .map(MissionEntry::date)
            .flatMap(Optional::stream)
            .map(CampaignDate::date)
            .flatMap(Optional::stream)
            .max(LocalDate::compareTo);
    }
}
