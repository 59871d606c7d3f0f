package com.wingman.core.resolve;

import com.wingman.core.error.DiagnosticCollector;
import com.wingman.core.error.DiagnosticKind;
import com.wingman.core.error.IdentityConflictException;
import com.wingman.core.json.AceEntry;
import com.wingman.core.json.CampaignSummary;
import com.wingman.core.json.LoadedRecord;
import com.wingman.core.json.PersonnelEntry;
import com.wingman.core.mission.MissionMatchQuery;
import com.wingman.core.mission.WeatherSource;
import com.wingman.core.model.Campaign;
import com.wingman.core.model.CampaignDate;
import com.wingman.core.model.CombatReport;
import com.wingman.core.model.LogEntry;
import com.wingman.core.model.MissionEntry;
import com.wingman.core.model.MissionParticipant;
import com.wingman.core.model.MissionRecord;
import com.wingman.core.model.SerialNumbers;
import com.wingman.core.model.Squadron;
import com.wingman.logging.AppLogger;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.logging.Logger;

/**
 * Joins loaded campaign records into pilots, squadrons and missions.
 * <p>
 * Pilots are identified by serial number only. Combat reports belong to the pilot named by their
 * folder, log entries to the squadron they name, and mission records pick up their reports and
 * weather. The result depends on nothing but the input records and the weather source.
 */
public final class CrossReferenceResolver {
    private static final Logger LOGGER = AppLogger.get();

    private static final Comparator<CombatReport> REPORT_ORDER = Comparator
        .comparing(CombatReport::folderSerial, SerialNumbers.ORDER)
        .thenComparing(r -> r.source().toString());

    public ResolvedCampaign resolve(LoadedCampaign loaded,
                                    WeatherSource weather,
                                    DiagnosticCollector diagnostics) throws IdentityConflictException {
        CampaignSummary summary = loaded.summary().map(LoadedRecord::record).orElse(CampaignSummary.absent());
        Campaign campaign = new Campaign(
            summary.name().orElse(loaded.folderName()),
            summary.date(),
            summary.referencePilotSerial(),
            summary.product()
        );

        PilotRegistry registry = new PilotRegistry();
        Map<String, AceEntry> aces = new HashMap<>();
        Map<String, PersonnelEntry> personnel = new HashMap<>();
        Map<String, List<CombatReport>> reportsBySerial = new HashMap<>();
        Set<String> partialSerials = new HashSet<>();

        registerAces(loaded, registry, aces, partialSerials);
        registerPersonnel(loaded, registry, personnel, partialSerials);
        registerReports(loaded, registry, reportsBySerial, partialSerials, diagnostics);
        registerParticipants(loaded, registry);

        Optional<String> referenceSerial = campaign.referencePilotSerial();
        if (referenceSerial.isPresent() && !registry.contains(referenceSerial.get())) {
            Path source = loaded.summary().map(LoadedRecord::source).orElse(loaded.campaignRoot());
            registry.register(PilotClaim.named(referenceSerial.get(), Optional.empty(), source));
        }

        List<MissionRecord> missionRecords = loaded.missions().stream().map(LoadedRecord::record).toList();
        Optional<String> referenceSquadron = referenceSquadron(summary, missionRecords, registry);

        List<ResolvedPilot> pilots = new ArrayList<>();
        for (PilotIdentity identity : registry.identities()) {
            boolean reference = referenceSerial.map(identity.serialNumber()::equals).orElse(false);
            if (reference && referenceSquadron.isPresent()) {
                identity = new PilotIdentity(identity.serialNumber(), identity.name(), identity.rank(),
                    referenceSquadron, identity.squadronName(), identity.status(), identity.sources());
            }
            List<CombatReport> reports = new ArrayList<>(reportsBySerial.getOrDefault(identity.serialNumber(), List.of()));
            reports.sort(REPORT_ORDER);
            pilots.add(new ResolvedPilot(
                identity,
                reference,
                reports,
                Optional.ofNullable(aces.get(identity.serialNumber())),
                Optional.ofNullable(personnel.get(identity.serialNumber())),
                partialSerials.contains(identity.serialNumber())
            ));
        }

        String fallbackPilotName = pilots.stream()
            .filter(ResolvedPilot::referencePilot)
            .findFirst()
            .flatMap(p -> p.identity().name())
            .orElse(campaign.name());
        List<MissionEntry> missions = buildMissions(loaded, missionRecords, weather, fallbackPilotName, referenceSerial);

        List<LogEntry> log = new ArrayList<>(loaded.eventLog().map(LoadedRecord::record).orElse(List.of()));
        log.sort(LogEntry.CHRONOLOGICAL);
        List<LogEntry> campaignLog = new ArrayList<>();
        Map<String, List<LogEntry>> activityBySquadron = new HashMap<>();
        for (LogEntry entry : log) {
            if (entry.squadronId().isPresent()) {
                activityBySquadron.computeIfAbsent(entry.squadronId().get(), id -> new ArrayList<>()).add(entry);
            } else {
                campaignLog.add(entry);
            }
        }

        List<Squadron> squadrons = buildSquadrons(pilots, personnel.values(), missionRecords, activityBySquadron);
        LOGGER.fine(() -> "Resolved %d pilots, %d squadrons, %d missions".formatted(
            pilots.size(), squadrons.size(), missions.size()));
        return new ResolvedCampaign(campaign, pilots, squadrons, missions, campaignLog);
    }

    private static void registerAces(LoadedCampaign loaded,
                                     PilotRegistry registry,
                                     Map<String, AceEntry> aces,
                                     Set<String> partialSerials) throws IdentityConflictException {
        if (loaded.aces().isEmpty()) {
            return;
        }
        LoadedRecord<List<AceEntry>> record = loaded.aces().get();
        for (AceEntry entry : record.record()) {
            registry.register(new PilotClaim(entry.serialNumber(), entry.name(), entry.rank(), entry.squadronId(),
                entry.squadronName(), Optional.empty(), record.source()));
            aces.putIfAbsent(entry.serialNumber(), entry);
            if (record.partial()) {
                partialSerials.add(entry.serialNumber());
            }
        }
    }

    private static void registerPersonnel(LoadedCampaign loaded,
                                          PilotRegistry registry,
                                          Map<String, PersonnelEntry> personnel,
                                          Set<String> partialSerials) throws IdentityConflictException {
        for (LoadedRecord<List<PersonnelEntry>> record : loaded.personnel()) {
            for (PersonnelEntry entry : record.record()) {
                registry.register(new PilotClaim(entry.serialNumber(), entry.name(), entry.rank(),
                    Optional.of(entry.squadronId()), Optional.empty(), entry.status(), record.source()));
                personnel.putIfAbsent(entry.serialNumber(), entry);
                if (record.partial()) {
                    partialSerials.add(entry.serialNumber());
                }
            }
        }
    }

    private static void registerReports(LoadedCampaign loaded,
                                        PilotRegistry registry,
                                        Map<String, List<CombatReport>> reportsBySerial,
                                        Set<String> partialSerials,
                                        DiagnosticCollector diagnostics) throws IdentityConflictException {
        for (LoadedRecord<CombatReport> record : loaded.combatReports()) {
            CombatReport report = record.record();
            String folderSerial = report.folderSerial();
            boolean consistent = report.pilotSerialNumber().map(folderSerial::equals).orElse(true);
            if (consistent) {
                registry.register(new PilotClaim(folderSerial, report.pilotName(), Optional.empty(), Optional.empty(),
                    report.squadron(), Optional.empty(), record.source()));
            } else {
                diagnostics.report(DiagnosticKind.SCHEMA_MISMATCH, record.source(),
                    "report names pilot %s but sits in folder %s".formatted(report.pilotSerialNumber().get(), folderSerial));
                registry.register(PilotClaim.named(folderSerial, Optional.empty(), record.source()));
            }
            reportsBySerial.computeIfAbsent(folderSerial, serial -> new ArrayList<>()).add(report);
            if (record.partial()) {
                partialSerials.add(folderSerial);
            }
        }
    }

    private static void registerParticipants(LoadedCampaign loaded, PilotRegistry registry) throws IdentityConflictException {
        for (LoadedRecord<MissionRecord> record : loaded.missions()) {
            for (MissionParticipant participant : record.record().participants()) {
                if (participant.serialNumber().isPresent()) {
                    registry.register(new PilotClaim(participant.serialNumber().get(), Optional.of(participant.name()),
                        participant.rank(), participant.squadronId(), Optional.empty(), Optional.empty(), record.source()));
                }
            }
        }
    }

    /**
     * Campaign.json first, then the latest mission header, then the reference pilot's own
     * mission participant entry.
     */
    private static Optional<String> referenceSquadron(CampaignSummary summary,
                                                      List<MissionRecord> missions,
                                                      PilotRegistry registry) {
        if (summary.squadronId().isPresent()) {
            return summary.squadronId();
        }
        Optional<MissionRecord> latest = missions.stream()
            .filter(m -> m.squadronId().isPresent())
            .max(Comparator
                .comparing((MissionRecord m) -> m.date().orElse(null), Comparator.nullsFirst(Comparator.naturalOrder()))
                .thenComparing(m -> m.time().orElse(""))
                .thenComparing(MissionRecord::missionId));
        if (latest.isPresent()) {
            return latest.get().squadronId();
        }
        Optional<String> serial = summary.referencePilotSerial();
        if (serial.isEmpty()) {
            return Optional.empty();
        }
        for (MissionRecord mission : missions) {
            for (MissionParticipant participant : mission.participants()) {
                if (participant.serialNumber().equals(serial) && participant.squadronId().isPresent()) {
                    return participant.squadronId();
                }
            }
        }
        return registry.find(serial.get()).flatMap(PilotIdentity::squadronId);
    }

    private static List<MissionEntry> buildMissions(LoadedCampaign loaded,
                                                    List<MissionRecord> missionRecords,
                                                    WeatherSource weather,
                                                    String fallbackPilotName,
                                                    Optional<String> referenceSerial) {
        MissionReportJoiner joiner = new MissionReportJoiner(missionRecords);
        Map<String, MissionRecord> recordsByKey = new TreeMap<>();
        Map<String, List<CombatReport>> reportsByKey = new TreeMap<>();
        for (MissionRecord record : missionRecords) {
            recordsByKey.putIfAbsent(record.missionId(), record);
            reportsByKey.computeIfAbsent(record.missionId(), key -> new ArrayList<>());
        }
        for (LoadedRecord<CombatReport> loadedReport : loaded.combatReports()) {
            CombatReport report = loadedReport.record();
            String key = joiner.missionFor(report).map(MissionRecord::missionId).orElse(report.missionKey());
            reportsByKey.computeIfAbsent(key, k -> new ArrayList<>()).add(report);
        }

        List<MissionEntry> missions = new ArrayList<>();
        for (Map.Entry<String, List<CombatReport>> entry : reportsByKey.entrySet()) {
            Optional<MissionRecord> record = Optional.ofNullable(recordsByKey.get(entry.getKey()));
            List<CombatReport> reports = new ArrayList<>(entry.getValue());
            reports.sort(REPORT_ORDER);
            Optional<CombatReport> firstReport = reports.stream().findFirst();

            Optional<CampaignDate> date = record.flatMap(MissionRecord::date).or(() -> firstReport.flatMap(CombatReport::date));
            Optional<String> time = record.flatMap(MissionRecord::time).or(() -> firstReport.flatMap(CombatReport::time));
            List<String> squadmates = squadmates(record, reports, referenceSerial);

            String pilotName = firstReport.flatMap(CombatReport::pilotName).orElse(fallbackPilotName);
            MissionMatchQuery query = new MissionMatchQuery(
                record.map(MissionRecord::missionId),
                date,
                Optional.of(pilotName),
                record.flatMap(MissionRecord::missionFileName)
            );
            missions.add(new MissionEntry(entry.getKey(), date, time, record, reports, squadmates, weather.find(query)));
        }
        missions.sort(MissionEntry.CHRONOLOGICAL);
        return missions;
    }

    /**
     * Flight members other than the reference pilot, sorted. Falls back to the names listed in the
     * after-action report, then to the report's flight roster, when the mission data has none.
     */
    static List<String> squadmates(Optional<MissionRecord> record,
                                   List<CombatReport> reports,
                                   Optional<String> referenceSerial) {
        Set<String> planes = new TreeSet<>();
        record.ifPresent(r -> r.participants().stream()
            .filter(p -> p.serialNumber().isEmpty() || !p.serialNumber().equals(referenceSerial))
            .map(MissionParticipant::name)
            .filter(name -> !name.isBlank())
            .forEach(planes::add));
        if (!planes.isEmpty()) {
            return List.copyOf(planes);
        }
        Set<String> names = new LinkedHashSet<>();
        for (CombatReport report : reports) {
            names.addAll(SquadmateExtractor.fromReport(report.haReport()));
            if (!names.isEmpty()) {
                break;
            }
        }
        if (names.isEmpty()) {
            reports.forEach(report -> names.addAll(report.flightPilots()));
        }
        return List.copyOf(names);
    }

    private static List<Squadron> buildSquadrons(List<ResolvedPilot> pilots,
                                                 Iterable<PersonnelEntry> personnel,
                                                 List<MissionRecord> missions,
                                                 Map<String, List<LogEntry>> activityBySquadron) {
        Map<String, Optional<String>> names = new TreeMap<>(SerialNumbers.ORDER);
        for (ResolvedPilot pilot : pilots) {
            pilot.identity().squadronId().ifPresent(id -> names.putIfAbsent(id, Optional.empty()));
        }
        personnel.forEach(entry -> names.putIfAbsent(entry.squadronId(), Optional.empty()));
        missions.forEach(m -> m.squadronId().ifPresent(id -> names.putIfAbsent(id, Optional.empty())));
        activityBySquadron.keySet().forEach(id -> names.putIfAbsent(id, Optional.empty()));

        for (ResolvedPilot pilot : pilots) {
            PilotIdentity identity = pilot.identity();
            if (identity.squadronId().isPresent() && identity.squadronName().isPresent()) {
                names.computeIfPresent(identity.squadronId().get(),
                    (id, name) -> name.isPresent() ? name : identity.squadronName());
            }
        }
        missions.stream()
            .sorted(Comparator.comparing(MissionRecord::missionId))
            .filter(m -> m.squadronId().isPresent() && m.squadronName().isPresent())
            .forEach(m -> names.computeIfPresent(m.squadronId().get(),
                (id, name) -> name.isPresent() ? name : m.squadronName()));

        List<Squadron> squadrons = new ArrayList<>();
        names.forEach((id, name) -> {
            List<String> roster = pilots.stream()
                .filter(p -> p.identity().squadronId().map(id::equals).orElse(false))
                .map(ResolvedPilot::serialNumber)
                .toList();
            squadrons.add(new Squadron(id, name, roster, activityBySquadron.getOrDefault(id, List.of())));
        });
        return squadrons;
    }
}
