package com.wingman.core.fs;

import com.wingman.logging.AppLogger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Layout helpers for a PWCG installation root ({@code <root>/User/Campaigns/<name>}).
 */
public final class CampaignDirectory {

    private CampaignDirectory() {
    }

    public static Path campaignsFolder(Path pwcgRoot) {
        return pwcgRoot.resolve("User").resolve("Campaigns");
    }

    public static Path campaignRoot(Path pwcgRoot, String campaignName) {
        return campaignsFolder(pwcgRoot).resolve(campaignName);
    }

    /**
     * The simulator keeps generated missions next to the PWCG folder: {@code <root>/../data/Missions/PWCG}.
     */
    public static Path defaultMissionFolder(Path pwcgRoot) {
        return pwcgRoot.resolve("..").resolve("data").resolve("Missions").resolve("PWCG").normalize();
    }

    /**
     * @return campaign folder names sorted alphabetically; empty when the campaigns folder is missing
     */
    public static List<String> listCampaigns(Path pwcgRoot) {
        if (pwcgRoot == null) {
            return List.of();
        }
        Path campaigns = campaignsFolder(pwcgRoot);
        if (!Files.isDirectory(campaigns)) {
            return List.of();
        }
        try (Stream<Path> stream = Files.list(campaigns)) {
            return stream.filter(Files::isDirectory)
                .map(p -> p.getFileName().toString())
                .filter(name -> !name.startsWith("."))
                .sorted()
                .collect(Collectors.toList());
        } catch (IOException ex) {
            AppLogger.get().warning("Could not list campaigns under " + campaigns + ": " + ex.getMessage());
            return List.of();
        }
    }
}
