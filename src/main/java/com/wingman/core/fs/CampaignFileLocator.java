package com.wingman.core.fs;

import com.wingman.core.error.PathInvalidException;
import com.wingman.logging.AppLogger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Enumerates the expected campaign files below a campaign root without opening any of them.
 * Installations differ in completeness between versions, so every missing entry is reported as
 * absent rather than raised; only an unusable root fails.
 */
public final class CampaignFileLocator {
    private static final Logger LOGGER = AppLogger.get();
    private static final Comparator<Path> PATH_ORDER = Comparator.comparing(Path::toString);
    private static final String JSON_EXTENSION = ".json";

    public CampaignFileSet locate(Path campaignRoot) throws PathInvalidException {
        if (campaignRoot == null) {
            throw new PathInvalidException(null, "no campaign root given");
        }
        if (!Files.exists(campaignRoot)) {
            throw new PathInvalidException(campaignRoot, "does not exist");
        }
        if (!Files.isDirectory(campaignRoot)) {
            throw new PathInvalidException(campaignRoot, "not a directory");
        }
        if (!Files.isReadable(campaignRoot)) {
            throw new PathInvalidException(campaignRoot, "not readable");
        }

        List<Path> entries = listEntries(campaignRoot);
        Optional<Path> summary = findEntry(entries, FileCategory.CAMPAIGN_SUMMARY, Files::isRegularFile);
        Optional<Path> aces = findEntry(entries, FileCategory.ACES, Files::isRegularFile);
        Optional<Path> log = findEntry(entries, FileCategory.EVENT_LOG, Files::isRegularFile);
        Optional<Path> reportsFolder = findEntry(entries, FileCategory.COMBAT_REPORTS, Files::isDirectory);
        Optional<Path> missionFolder = findEntry(entries, FileCategory.MISSION_DATA, Files::isDirectory);
        Optional<Path> personnelFolder = findEntry(entries, FileCategory.PERSONNEL, Files::isDirectory);

        List<CombatReportFolder> reportFolders = reportsFolder.map(this::collectReportFolders).orElse(List.of());
        List<Path> missionFiles = missionFolder.map(this::listJsonFiles).orElse(List.of());
        List<Path> personnelFiles = personnelFolder.map(this::listJsonFiles).orElse(List.of());

        CampaignFileSet fileSet = new CampaignFileSet(
            campaignRoot, summary, aces, log, reportsFolder, reportFolders, missionFolder, missionFiles, personnelFiles);
        LOGGER.fine(() -> "Located %d campaign files under %s (absent: %s)"
            .formatted(fileSet.fileCount(), campaignRoot, fileSet.absentCategories()));
        return fileSet;
    }

    private List<CombatReportFolder> collectReportFolders(Path reportsRoot) {
        List<CombatReportFolder> folders = new ArrayList<>();
        for (Path child : listEntries(reportsRoot)) {
            if (!Files.isDirectory(child)) {
                continue;
            }
            String name = child.getFileName().toString();
            if (name.startsWith(".")) {
                continue;
            }
            folders.add(new CombatReportFolder(name.trim(), child, listJsonFiles(child)));
        }
        return folders;
    }

    private List<Path> listJsonFiles(Path folder) {
        return listEntries(folder).stream()
            .filter(Files::isRegularFile)
            .filter(CampaignFileLocator::isJson)
            .collect(Collectors.toList());
    }

    private static boolean isJson(Path path) {
        Path fileName = path.getFileName();
        if (fileName == null) {
            return false;
        }
        String lower = fileName.toString().toLowerCase(Locale.ROOT);
        return lower.endsWith(JSON_EXTENSION) && !lower.startsWith(".");
    }

    /**
     * Exact-case match wins; otherwise the first case-insensitive match in path order.
     */
    private static Optional<Path> findEntry(List<Path> entries, FileCategory category, Predicate<Path> kind) {
        String wanted = category.entryName();
        Optional<Path> exact = entries.stream()
            .filter(p -> p.getFileName().toString().equals(wanted))
            .filter(kind)
            .findFirst();
        if (exact.isPresent()) {
            return exact;
        }
        return entries.stream()
            .filter(p -> p.getFileName().toString().equalsIgnoreCase(wanted))
            .filter(kind)
            .findFirst();
    }

    private static List<Path> listEntries(Path folder) {
        try (Stream<Path> stream = Files.list(folder)) {
            return stream.sorted(PATH_ORDER).collect(Collectors.toList());
        } catch (IOException ex) {
            LOGGER.warning("Could not list " + folder + ": " + ex.getMessage());
            return List.of();
        }
    }
}
