package com.wingman.core.stats;

import com.wingman.core.error.DiagnosticCollector;
import com.wingman.core.error.DiagnosticKind;
import com.wingman.core.json.AceEntry;
import com.wingman.core.json.PersonnelEntry;
import com.wingman.core.json.VictoryCategories;
import com.wingman.core.model.Achievement;
import com.wingman.core.model.CareerBreakdown;
import com.wingman.core.model.CombatReport;
import com.wingman.core.model.MissionEntry;
import com.wingman.core.model.MissionRecord;
import com.wingman.core.model.PilotStatistics;
import com.wingman.core.model.Squadron;
import com.wingman.core.model.SquadronTotals;
import com.wingman.core.model.VictoryEvent;
import com.wingman.core.resolve.ResolvedCampaign;
import com.wingman.core.resolve.ResolvedPilot;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Derives per-pilot statistics from resolved records.
 * <p>
 * Combat reports are the primary source: a sortie is a distinct mission among the pilot's reports,
 * and victories and losses are the events those reports list. Pilots whose reports say nothing
 * about victories take the count from the aces file, then from the personnel roster.
 * Squadron totals count each mission once per squadron that flew it and sum the roster's victories.
 */
public final class CampaignAggregator {
    private static final Pattern ALTITUDE_METERS =
        Pattern.compile("^\\s*(\\d+(?:[.,]\\d+)?)\\s*(?:m|meters|metres)\\.?\\s*$", Pattern.CASE_INSENSITIVE);

    private final AceRanking ranking;
    private final AchievementEvaluator achievements;

    public CampaignAggregator() {
        this(new AceRanking(), new AchievementEvaluator());
    }

    CampaignAggregator(AceRanking ranking, AchievementEvaluator achievements) {
        this.ranking = ranking;
        this.achievements = achievements;
    }

    public CampaignStatistics aggregate(ResolvedCampaign campaign, DiagnosticCollector diagnostics) {
        Map<String, PilotStatistics> bySerial = new LinkedHashMap<>();
        List<AceRanking.Candidate> candidates = new ArrayList<>();
        for (ResolvedPilot pilot : campaign.pilots()) {
            PilotStatistics statistics = statisticsFor(pilot, diagnostics);
            bySerial.put(pilot.serialNumber(), statistics);
            candidates.add(new AceRanking.Candidate(
                pilot.serialNumber(),
                pilot.identity().name().orElse(pilot.serialNumber()),
                statistics.victories()
            ));
        }
        List<Achievement> unlocked = campaign.referencePilot()
            .map(reference -> achievements.evaluate(bySerial.get(reference.serialNumber())))
            .orElse(List.of());
        return new CampaignStatistics(bySerial, squadronTotals(campaign, bySerial), ranking.rank(candidates), unlocked);
    }

    static Map<String, SquadronTotals> squadronTotals(ResolvedCampaign campaign, Map<String, PilotStatistics> bySerial) {
        Map<String, String> squadronBySerial = new HashMap<>();
        for (ResolvedPilot pilot : campaign.pilots()) {
            pilot.identity().squadronId().ifPresent(id -> squadronBySerial.put(pilot.serialNumber(), id));
        }
        Map<String, Integer> missions = new HashMap<>();
        for (MissionEntry mission : campaign.missions()) {
            Set<String> flownBy = new TreeSet<>();
            Optional<String> recorded = mission.record().flatMap(MissionRecord::squadronId);
            if (recorded.isPresent()) {
                flownBy.add(recorded.get());
            } else {
                for (CombatReport report : mission.reports()) {
                    String squadron = squadronBySerial.get(report.folderSerial());
                    if (squadron != null) {
                        flownBy.add(squadron);
                    }
                }
            }
            flownBy.forEach(id -> missions.merge(id, 1, Integer::sum));
        }

        Map<String, SquadronTotals> totals = new TreeMap<>();
        for (Squadron squadron : campaign.squadrons()) {
            int victories = squadron.rosterSerials().stream()
                .map(serial -> bySerial.getOrDefault(serial, PilotStatistics.empty()))
                .mapToInt(PilotStatistics::victories)
                .sum();
            totals.put(squadron.id(), new SquadronTotals(missions.getOrDefault(squadron.id(), 0), victories));
        }
        return totals;
    }

    /**
     * Aircraft, duties and localities named by the reports, plus the mean stated altitude. Duties are
     * counted once per sortie, taken from the first report of that mission that names one.
     */
    static CareerBreakdown careerOf(List<CombatReport> reports) {
        Set<String> aircraft = new TreeSet<>();
        Set<String> localities = new TreeSet<>();
        Map<String, String> dutyByMission = new LinkedHashMap<>();
        BigDecimal altitudeSum = BigDecimal.ZERO;
        int altitudeCount = 0;
        for (CombatReport report : reports) {
            report.aircraft().filter(a -> !a.isBlank()).ifPresent(a -> aircraft.add(a.trim()));
            report.locality().filter(l -> !l.isBlank()).ifPresent(l -> localities.add(l.trim()));
            report.duty().filter(d -> !d.isBlank())
                .ifPresent(d -> dutyByMission.putIfAbsent(report.missionKey(), d.trim()));
            Optional<BigDecimal> altitude = report.altitude().flatMap(CampaignAggregator::metersOf);
            if (altitude.isPresent()) {
                altitudeSum = altitudeSum.add(altitude.get());
                altitudeCount++;
            }
        }
        Map<String, Integer> sortiesByDuty = new TreeMap<>();
        dutyByMission.values().forEach(duty -> sortiesByDuty.merge(duty, 1, Integer::sum));
        Optional<Double> average = altitudeCount == 0
            ? Optional.empty()
            : Optional.of(altitudeSum.divide(BigDecimal.valueOf(altitudeCount), 2, RoundingMode.HALF_UP).doubleValue());
        return new CareerBreakdown(List.copyOf(aircraft), sortiesByDuty, List.copyOf(localities), average);
    }

    /**
     * Parses altitudes written as "2000 meters" or "1500 m". Other units are not converted.
     */
    static Optional<BigDecimal> metersOf(String text) {
        Matcher matcher = ALTITUDE_METERS.matcher(text);
        if (!matcher.matches()) {
            return Optional.empty();
        }
        return Optional.of(new BigDecimal(matcher.group(1).replace(',', '.')));
    }

    PilotStatistics statisticsFor(ResolvedPilot pilot, DiagnosticCollector diagnostics) {
        Set<String> missions = new LinkedHashSet<>();
        List<VictoryEvent> reportVictories = new ArrayList<>();
        boolean reportsCarryVictories = false;
        int losses = 0;
        for (CombatReport report : pilot.reports()) {
            missions.add(report.missionKey());
            reportVictories.addAll(report.victories());
            reportsCarryVictories |= report.victoriesReported();
            losses += report.losses().size();
        }
        int sorties = missions.size();

        Optional<AceEntry> ace = pilot.aceEntry();
        Optional<PersonnelEntry> roster = pilot.personnelEntry();
        int victories;
        Map<String, Integer> byCategory;
        if (reportsCarryVictories) {
            victories = reportVictories.size();
            byCategory = VictoryCategories.group(reportVictories);
            Optional<Integer> stated = ace.flatMap(AceEntry::victories);
            if (stated.isPresent() && stated.get() != victories) {
                diagnostics.report(DiagnosticKind.STATISTIC_DISCREPANCY,
                    "pilot %s: %d victories in combat reports, %d in the aces file"
                        .formatted(pilot.serialNumber(), victories, stated.get()));
            }
        } else if (ace.flatMap(AceEntry::victories).isPresent()) {
            victories = ace.get().victories().get();
            byCategory = ace.get().victoriesByCategory();
        } else {
            victories = roster.flatMap(PersonnelEntry::victories).orElse(0);
            byCategory = Map.of();
        }

        Optional<Integer> missionsFlown = ace.flatMap(AceEntry::missionsFlown)
            .or(() -> roster.flatMap(PersonnelEntry::missionsFlown));
        double ratio = (double) victories / Math.max(sorties, 1);
        return new PilotStatistics(sorties, victories, byCategory, losses, ratio, missionsFlown, pilot.partial(),
            careerOf(pilot.reports()));
    }
}
