package com.wingman.config;

import com.wingman.core.fs.CampaignDirectory;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;

/**
 * Resolves analyzer settings: system property override first, then persisted preference, then default.
 */
public final class ConfigService {
    static final String PWCG_ROOT_PROPERTY = "wingman.pwcgRoot";
    static final String MISSION_FOLDER_PROPERTY = "wingman.missionFolder";
    static final String ANNOTATION_FILE_PROPERTY = "wingman.annotationFile";
    static final String LOADER_THREADS_PROPERTY = "wingman.loaderThreads";

    private static final String PREF_KEY_PWCG_ROOT = "pwcg.root";
    private static final String PREF_KEY_MISSION_FOLDER = "mission.folder";
    private static final String PREF_KEY_ANNOTATION_FILE = "annotation.file";
    private static final String PREF_KEY_LAST_CAMPAIGN = "campaign.last";

    private static final String ANNOTATION_FILE_NAME = "pilot-annotations.json";
    private static final int MAX_DEFAULT_LOADER_THREADS = 4;

    private static final ConfigService INSTANCE = new ConfigService(PreferencesStore.global());

    private final PreferencesStore preferences;

    ConfigService(PreferencesStore preferences) {
        this.preferences = preferences;
    }

    public static ConfigService getInstance() {
        return INSTANCE;
    }

    public Optional<Path> getPwcgRoot() {
        return override(PWCG_ROOT_PROPERTY).or(() -> preferences.getPath(PREF_KEY_PWCG_ROOT));
    }

    public void setPwcgRoot(Path root) {
        preferences.putPath(PREF_KEY_PWCG_ROOT, root);
    }

    /**
     * Simulator mission folder; when nothing is configured it is derived from the PWCG root.
     */
    public Optional<Path> getMissionFolder() {
        Optional<Path> configured = override(MISSION_FOLDER_PROPERTY)
            .or(() -> preferences.getPath(PREF_KEY_MISSION_FOLDER));
        if (configured.isPresent()) {
            return configured;
        }
        return getPwcgRoot().map(CampaignDirectory::defaultMissionFolder);
    }

    public void setMissionFolder(Path folder) {
        preferences.putPath(PREF_KEY_MISSION_FOLDER, folder);
    }

    public Path getAnnotationFile() {
        return override(ANNOTATION_FILE_PROPERTY)
            .or(() -> preferences.getPath(PREF_KEY_ANNOTATION_FILE))
            .orElseGet(() -> Paths.get(System.getProperty("user.home"), ".wingman", ANNOTATION_FILE_NAME));
    }

    public void setAnnotationFile(Path file) {
        preferences.putPath(PREF_KEY_ANNOTATION_FILE, file);
    }

    public Optional<String> getLastCampaign() {
        return preferences.getString(PREF_KEY_LAST_CAMPAIGN);
    }

    public void setLastCampaign(String campaignName) {
        preferences.putString(PREF_KEY_LAST_CAMPAIGN, campaignName);
    }

    public int getLoaderThreads() {
        String raw = System.getProperty(LOADER_THREADS_PROPERTY);
        if (raw != null && !raw.isBlank()) {
            try {
                return Math.max(1, Integer.parseInt(raw.trim()));
            } catch (NumberFormatException ignored) {
                // fall through to the default
            }
        }
        return Math.max(1, Math.min(MAX_DEFAULT_LOADER_THREADS, Runtime.getRuntime().availableProcessors()));
    }

    private static Optional<Path> override(String property) {
        String value = System.getProperty(property);
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(Paths.get(value.trim()));
    }
}
