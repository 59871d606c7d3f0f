package com.wingman.report;

import com.wingman.core.model.CampaignDate;
import com.wingman.core.model.CombatReport;
import com.wingman.core.model.MissionEntry;
import com.wingman.core.model.MissionRecord;
import com.wingman.core.model.Pilot;
import com.wingman.core.model.UnifiedCampaignModel;
import com.wingman.core.model.WeatherKey;
import com.wingman.core.model.WeatherSnapshot;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Writes the reference pilot's campaign as a plain-text diary, one entry per mission.
 */
public class CampaignDiaryExporter {
    private static final String RULE = "=".repeat(80);
    private static final String SEPARATOR = "-".repeat(80);

    public void export(UnifiedCampaignModel model, Path target) throws IOException {
        Objects.requireNonNull(model, "model");
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(target, render(model), StandardCharsets.UTF_8);
    }

    public String render(UnifiedCampaignModel model) {
        Optional<Pilot> pilot = model.referencePilot();
        StringBuilder diary = new StringBuilder();
        diary.append(RULE).append('\n');
        diary.append("CAMPAIGN DIARY: ").append(model.campaign().name()).append('\n');
        diary.append(RULE).append("\n\n");
        diary.append("Pilot: ").append(pilot.map(CampaignDiaryExporter::pilotLine).orElse("unknown")).append('\n');
        pilot.flatMap(p -> p.squadronName().or(p::squadronId))
            .ifPresent(squadron -> diary.append("Squadron: ").append(squadron).append('\n'));
        period(model.missions()).ifPresent(period -> diary.append("Period: ").append(period).append('\n'));
        diary.append('\n').append(RULE).append("\n\n");

        for (MissionEntry mission : model.missions()) {
            diary.append(entry(mission, pilot.map(Pilot::name)));
            diary.append(SEPARATOR).append("\n\n");
        }
        return diary.toString();
    }

    static String entry(MissionEntry mission, Optional<String> pilotName) {
        StringBuilder text = new StringBuilder();
        text.append(mission.date().map(CampaignDate::display).orElse(mission.missionKey()));
        mission.time().ifPresent(time -> text.append(", ").append(time));
        text.append('\n');

        Optional<MissionRecord> record = mission.record();
        List<String> sentences = new ArrayList<>();
        mission.weather().flatMap(CampaignDiaryExporter::weatherSentence).ifPresent(sentences::add);
        record.flatMap(MissionRecord::airfield).ifPresent(airfield -> sentences.add("We took off from " + airfield + "."));

        Optional<String> duty = record.flatMap(MissionRecord::duty)
            .or(() -> mission.reports().stream().map(CombatReport::duty).flatMap(Optional::stream).findFirst());
        Optional<String> aircraft = record.flatMap(MissionRecord::aircraft)
            .or(() -> mission.reports().stream().map(CombatReport::aircraft).flatMap(Optional::stream).findFirst());
        if (duty.isPresent() || aircraft.isPresent()) {
            sentences.add("Our task was " + duty.map(d -> "a " + d + " mission").orElse("a mission")
                + aircraft.map(a -> " in the " + a).orElse("") + ".");
        }

        List<String> companions = mission.squadmates().stream()
            .filter(name -> pilotName.map(p -> !name.contains(p)).orElse(true))
            .limit(3)
            .toList();
        if (!companions.isEmpty()) {
            sentences.add("Flying with me: " + String.join(", ", companions) + ".");
        }

        int victories = mission.reports().stream().mapToInt(r -> r.victories().size()).sum();
        int losses = mission.reports().stream().mapToInt(r -> r.losses().size()).sum();
        if (victories > 0) {
            sentences.add("Confirmed " + victories + (victories == 1 ? " victory." : " victories."));
        }
        if (losses > 0) {
            sentences.add("Losses: " + losses + ".");
        }
        if (victories == 0 && losses == 0) {
            sentences.add("The sortie passed without loss.");
        }
        text.append(String.join(" ", sentences)).append('\n');

        mission.reports().stream()
            .map(CombatReport::narrative)
            .flatMap(Optional::stream)
            .filter(narrative -> !narrative.isBlank())
            .findFirst()
            .ifPresent(narrative -> text.append('\n').append(narrative.strip()).append('\n'));
        return text.toString();
    }

    private static Optional<String> weatherSentence(WeatherSnapshot weather) {
        List<String> parts = new ArrayList<>();
        weather.get(WeatherKey.TEMPERATURE).ifPresent(t -> parts.add(t + " degrees"));
        weather.get(WeatherKey.CLOUD_LEVEL).ifPresent(c -> parts.add("cloud base at " + c + " m"));
        weather.get(WeatherKey.HAZE).ifPresent(h -> parts.add("haze " + h));
        if (parts.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of("Weather: " + String.join(", ", parts) + ".");
    }

    private static String pilotLine(Pilot pilot) {
        return pilot.rank().map(rank -> rank + " ").orElse("") + pilot.name() + " (" + pilot.serialNumber() + ")";
    }

    private static Optional<String> period(List<MissionEntry> missions) {
        List<CampaignDate> dates = missions.stream().map(MissionEntry::date).flatMap(Optional::stream).toList();
        if (dates.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(dates.get(0).display() + " to " + dates.get(dates.size() - 1).display());
    }
}
