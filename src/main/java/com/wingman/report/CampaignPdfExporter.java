package com.wingman.report;

import com.wingman.core.model.Ace;
import com.wingman.core.model.Achievement;
import com.wingman.core.model.CampaignDate;
import com.wingman.core.model.CareerBreakdown;
import com.wingman.core.model.CombatReport;
import com.wingman.core.model.MissionEntry;
import com.wingman.core.model.MissionRecord;
import com.wingman.core.model.Pilot;
import com.wingman.core.model.PilotStatistics;
import com.wingman.core.model.UnifiedCampaignModel;
import com.wingman.core.model.WeatherKey;
import com.wingman.core.model.WindLayer;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDFont;
import org.apache.pdfbox.pdmodel.font.PDType1Font;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Renders a campaign summary page followed by one page per mission.
 */
public class CampaignPdfExporter {
    private static final float MARGIN = 40f;
    private static final float LINE_HEIGHT = 14f;
    private static final float BODY_SIZE = 11f;
    private static final float TEXT_WIDTH = PDRectangle.A4.getWidth() - 2 * MARGIN;
    private static final int TOP_ACES = 10;

    public void export(UnifiedCampaignModel model, Path target) throws IOException {
        Objects.requireNonNull(model, "model");
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (PDDocument document = new PDDocument()) {
            appendSummaryPage(document, model);
            for (MissionEntry mission : model.missions()) {
                appendMissionPage(document, mission);
            }
            document.save(target.toFile());
        }
    }

    private void appendSummaryPage(PDDocument document, UnifiedCampaignModel model) throws IOException {
        try (PageWriter page = new PageWriter(document)) {
            page.heading("Campaign: " + model.campaign().name(), 18);
            if (model.campaign().currentDate().isPresent()) {
                page.line("Campaign date: " + model.campaign().currentDate().get().display());
            }
            page.gap();

            Optional<Pilot> reference = model.referencePilot();
            if (reference.isPresent()) {
                Pilot pilot = reference.get();
                page.heading("Pilot", 13);
                page.line(pilot.rank().map(r -> r + " ").orElse("") + pilot.name() + " (" + pilot.serialNumber() + ")");
                Optional<String> squadron = pilot.squadronName().or(pilot::squadronId);
                if (squadron.isPresent()) {
                    page.line("Squadron: " + squadron.get());
                }
                if (pilot.ageAtLastMission().isPresent()) {
                    page.line("Age at last mission: " + pilot.ageAtLastMission().get());
                }
                PilotStatistics stats = pilot.statistics();
                page.line("Sorties: %d   Victories: %d   Losses: %d   Ratio: %s".formatted(
                    stats.sorties(), stats.victories(), stats.losses(), String.format(Locale.ROOT, "%.2f", stats.victoryRatio())));
                for (Map.Entry<String, Integer> category : stats.victoriesByCategory().entrySet()) {
                    page.line("  " + category.getKey() + ": " + category.getValue());
                }
                CareerBreakdown career = stats.career();
                if (!career.aircraftTypes().isEmpty()) {
                    page.line("Aircraft flown: " + String.join(", ", career.aircraftTypes()));
                }
                for (Map.Entry<String, Integer> duty : career.sortiesByDuty().entrySet()) {
                    page.line("  " + duty.getKey() + ": " + duty.getValue() + " sorties");
                }
                if (career.averageAltitudeMeters().isPresent()) {
                    page.line(String.format(Locale.ROOT, "Average altitude: %.0f m", career.averageAltitudeMeters().get()));
                }
                page.gap();
            }

            if (!model.achievements().isEmpty()) {
                page.heading("Achievements", 13);
                for (Achievement achievement : model.achievements()) {
                    page.line("- " + achievement.title() + ": " + achievement.description());
                }
                page.gap();
            }

            page.heading("Aces", 13);
            if (model.aces().isEmpty()) {
                page.line("No victories recorded.");
            }
            for (Ace ace : model.aces().subList(0, Math.min(TOP_ACES, model.aces().size()))) {
                page.line("%d. %s (%s): %d".formatted(ace.position(), ace.name(), ace.serialNumber(), ace.victories()));
            }
        }
    }

    private void appendMissionPage(PDDocument document, MissionEntry mission) throws IOException {
        try (PageWriter page = new PageWriter(document)) {
            String title = mission.date().map(CampaignDate::display).orElse(mission.missionKey())
                + mission.time().map(t -> " " + t).orElse("");
            page.heading("Mission " + title, 16);

            Optional<MissionRecord> record = mission.record();
            if (record.isPresent()) {
                MissionRecord data = record.get();
                field(page, "Squadron", data.squadronName().or(data::squadronId));
                field(page, "Aircraft", data.aircraft());
                field(page, "Duty", data.duty());
                field(page, "Airfield", data.airfield());
                field(page, "Altitude", data.altitudeMeters().map(a -> a + " m"));
                if (data.description().isPresent()) {
                    page.gap();
                    page.paragraph(data.description().get());
                }
            }
            if (!mission.squadmates().isEmpty()) {
                page.gap();
                page.paragraph("Flight: " + String.join(", ", mission.squadmates()));
            }
            if (mission.weather().isPresent()) {
                page.gap();
                page.heading("Weather", 13);
                for (Map.Entry<WeatherKey, String> value : mission.weather().get().values().entrySet()) {
                    page.line(value.getKey().fileKey() + ": " + value.getValue());
                }
                for (WindLayer layer : mission.weather().get().windLayers()) {
                    page.line(String.format(Locale.ROOT, "Wind at %.0f m: %.0f deg, %.1f m/s",
                        layer.altitude(), layer.direction(), layer.speed()));
                }
            }
            for (CombatReport report : mission.reports()) {
                page.gap();
                page.heading("Combat report: " + report.pilotName().orElse(report.folderSerial()), 13);
                field(page, "Locality", report.locality());
                page.line("Victories: " + report.victories().size() + "   Losses: " + report.losses().size());
                if (report.narrative().isPresent()) {
                    page.paragraph(report.narrative().get());
                }
            }
        }
    }

    private static void field(PageWriter page, String label, Optional<String> value) throws IOException {
        if (value.isPresent()) {
            page.line(label + ": " + value.get());
        }
    }

    /**
     * Writes lines top-down, continuing on a fresh page when the current one is full.
     */
    private static final class PageWriter implements AutoCloseable {
        private final PDDocument document;
        private PDPageContentStream stream;
        private float y;

        private PageWriter(PDDocument document) throws IOException {
            this.document = document;
            newPage();
        }

        void heading(String text, float size) throws IOException {
            write(text, PDType1Font.HELVETICA_BOLD, size);
        }

        void line(String text) throws IOException {
            for (String wrapped : wrap(sanitize(text, PDType1Font.HELVETICA), PDType1Font.HELVETICA, BODY_SIZE)) {
                write(wrapped, PDType1Font.HELVETICA, BODY_SIZE);
            }
        }

        void paragraph(String text) throws IOException {
            for (String part : text.split("\\R")) {
                if (part.isBlank()) {
                    gap();
                } else {
                    line(part.strip());
                }
            }
        }

        void gap() {
            y -= LINE_HEIGHT / 2;
        }

        private void write(String text, PDFont font, float size) throws IOException {
            if (y < MARGIN + LINE_HEIGHT) {
                stream.close();
                newPage();
            }
            stream.beginText();
            stream.setFont(font, size);
            stream.newLineAtOffset(MARGIN, y);
            stream.showText(sanitize(text, font));
            stream.endText();
            y -= Math.max(LINE_HEIGHT, size + 4);
        }

        private void newPage() throws IOException {
            PDPage page = new PDPage(PDRectangle.A4);
            document.addPage(page);
            stream = new PDPageContentStream(document, page);
            y = page.getMediaBox().getHeight() - MARGIN;
        }

        @Override
        public void close() throws IOException {
            stream.close();
        }
    }

    static List<String> wrap(String text, PDFont font, float size) throws IOException {
        List<String> lines = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        for (String word : text.split("\\s+")) {
            if (word.isEmpty()) {
                continue;
            }
            String candidate = current.length() == 0 ? word : current + " " + word;
            float width = font.getStringWidth(candidate) / 1000 * size;
            if (width > TEXT_WIDTH && current.length() > 0) {
                lines.add(current.toString());
                current = new StringBuilder(word);
            } else {
                current = new StringBuilder(candidate);
            }
        }
        if (current.length() > 0) {
            lines.add(current.toString());
        }
        return lines;
    }

    /**
     * Standard Type 1 fonts only cover WinAnsi; anything else is shown as '?'.
     */
    static String sanitize(String text, PDFont font) {
        StringBuilder clean = new StringBuilder(text.length());
        text.codePoints().forEach(cp -> {
            if (Character.isISOControl(cp)) {
                clean.append(' ');
                return;
            }
            String glyph = new String(Character.toChars(cp));
            try {
                font.encode(glyph);
                clean.append(glyph);
            } catch (IOException | IllegalArgumentException ex) {
                clean.append('?');
            }
        });
        return clean.toString();
    }
}
