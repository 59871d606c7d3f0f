package com.wingman.cli;

import com.wingman.config.ConfigService;
import com.wingman.core.annotation.JsonFileAnnotationStore;
import com.wingman.core.error.CampaignSyncException;
import com.wingman.core.error.SyncDiagnostic;
import com.wingman.core.fs.CampaignDirectory;
import com.wingman.core.model.Ace;
import com.wingman.core.model.Achievement;
import com.wingman.core.model.CampaignModelJsonWriter;
import com.wingman.core.model.Pilot;
import com.wingman.core.model.UnifiedCampaignModel;
import com.wingman.core.sync.CampaignSyncService;
import com.wingman.core.sync.SyncRequest;
import com.wingman.core.sync.SyncResult;
import com.wingman.logging.AppLogger;
import com.wingman.report.CampaignDiaryExporter;
import com.wingman.report.CampaignPdfExporter;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Command-line entry point: runs one sync and prints a summary.
 *
 * <pre>
 * --campaign &lt;dir|name&gt; [--pwcg &lt;root&gt;] [--missions &lt;dir&gt;] [--annotations &lt;file&gt;]
 * [--diary &lt;file&gt;] [--pdf &lt;file&gt;] [--json &lt;file&gt;]
 * --list [--pwcg &lt;root&gt;]
 * </pre>
 */
public final class CampaignAnalyzerCli {
    private static final Logger LOGGER = AppLogger.get();

    static final int EXIT_OK = 0;
    static final int EXIT_SYNC_FAILED = 1;
    static final int EXIT_USAGE = 2;
    static final int EXIT_EXPORT_FAILED = 3;

    private static final Set<String> VALUE_OPTIONS =
        Set.of("--campaign", "--pwcg", "--missions", "--annotations", "--diary", "--pdf", "--json");
    private static final int TOP_ACES = 5;

    private final ConfigService config;
    private final PrintStream out;
    private final PrintStream err;

    CampaignAnalyzerCli(ConfigService config, PrintStream out, PrintStream err) {
        this.config = config;
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        int code = new CampaignAnalyzerCli(ConfigService.getInstance(), System.out, System.err).run(args);
        System.exit(code);
    }

    int run(String[] args) {
        Map<String, String> options = new HashMap<>();
        boolean list = false;
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if ("--list".equals(arg)) {
                list = true;
            } else if (VALUE_OPTIONS.contains(arg) && i + 1 < args.length) {
                options.put(arg, args[++i]);
            } else {
                err.println("Unknown or incomplete option: " + arg);
                printUsage();
                return EXIT_USAGE;
            }
        }

        Optional<Path> pwcgRoot = Optional.ofNullable(options.get("--pwcg")).map(Paths::get).or(config::getPwcgRoot);
        if (list) {
            if (pwcgRoot.isEmpty()) {
                err.println("No PWCG root configured; pass --pwcg <root>.");
                return EXIT_USAGE;
            }
            CampaignDirectory.listCampaigns(pwcgRoot.get()).forEach(out::println);
            return EXIT_OK;
        }

        Optional<Path> campaignRoot = resolveCampaign(options.get("--campaign"), pwcgRoot);
        if (campaignRoot.isEmpty()) {
            err.println("No campaign given.");
            printUsage();
            return EXIT_USAGE;
        }

        Optional<Path> missionFolder = Optional.ofNullable(options.get("--missions")).map(Paths::get)
            .or(() -> pwcgRoot.map(CampaignDirectory::defaultMissionFolder))
            .or(config::getMissionFolder);
        Path annotationFile = Optional.ofNullable(options.get("--annotations")).map(Paths::get)
            .orElseGet(config::getAnnotationFile);

        SyncResult result;
        try (CampaignSyncService service = new CampaignSyncService(config.getLoaderThreads())) {
            JsonFileAnnotationStore store = new JsonFileAnnotationStore(annotationFile);
            result = service.runSync(new SyncRequest(campaignRoot.get(), missionFolder, store));
        } catch (CampaignSyncException ex) {
            LOGGER.log(Level.SEVERE, "Sync failed for " + campaignRoot.get(), ex);
            err.println("Sync failed: " + ex.getMessage());
            return EXIT_SYNC_FAILED;
        }

        printSummary(result);
        try {
            export(result.model(), options);
        } catch (IOException ex) {
            LOGGER.log(Level.SEVERE, "Export failed", ex);
            err.println("Export failed: " + ex.getMessage());
            return EXIT_EXPORT_FAILED;
        }
        return EXIT_OK;
    }

    private Optional<Path> resolveCampaign(String argument, Optional<Path> pwcgRoot) {
        if (argument == null) {
            return config.getLastCampaign().flatMap(name -> pwcgRoot.map(root -> CampaignDirectory.campaignRoot(root, name)));
        }
        Path direct = Paths.get(argument);
        if (Files.isDirectory(direct) || pwcgRoot.isEmpty()) {
            return Optional.of(direct);
        }
        config.setLastCampaign(argument);
        return Optional.of(CampaignDirectory.campaignRoot(pwcgRoot.get(), argument));
    }

    private void printSummary(SyncResult result) {
        UnifiedCampaignModel model = result.model();
        out.println("Campaign: " + model.campaign().name());
        model.campaign().currentDate().ifPresent(date -> out.println("Date: " + date.display()));
        Optional<Pilot> reference = model.referencePilot();
        reference.ifPresent(pilot -> out.println("Pilot: %s (%s), %d sorties, %d victories, %d losses".formatted(
            pilot.name(), pilot.serialNumber(), pilot.statistics().sorties(), pilot.statistics().victories(),
            pilot.statistics().losses())));
        out.println("Pilots: " + model.pilots().size() + ", squadrons: " + model.squadrons().size()
            + ", missions: " + model.missions().size());
        List<Ace> aces = model.aces();
        for (Ace ace : aces.subList(0, Math.min(TOP_ACES, aces.size()))) {
            out.println("  %d. %s (%s) %d".formatted(ace.position(), ace.name(), ace.serialNumber(), ace.victories()));
        }
        if (!model.achievements().isEmpty()) {
            out.println("Achievements: " + String.join(", ",
                model.achievements().stream().map(Achievement::title).toList()));
        }
        if (!result.diagnostics().isEmpty()) {
            out.println("Diagnostics (" + result.diagnostics().size() + "):");
            for (SyncDiagnostic diagnostic : result.diagnostics()) {
                out.println("  " + diagnostic);
            }
        }
    }

    private void export(UnifiedCampaignModel model, Map<String, String> options) throws IOException {
        String diary = options.get("--diary");
        if (diary != null) {
            new CampaignDiaryExporter().export(model, Paths.get(diary));
            out.println("Diary written to " + diary);
        }
        String pdf = options.get("--pdf");
        if (pdf != null) {
            new CampaignPdfExporter().export(model, Paths.get(pdf));
            out.println("PDF written to " + pdf);
        }
        String json = options.get("--json");
        if (json != null) {
            new CampaignModelJsonWriter().write(model, Paths.get(json));
            out.println("Model written to " + json);
        }
    }

    private void printUsage() {
        err.println("Usage: --campaign <dir|name> [--pwcg <root>] [--missions <dir>] [--annotations <file>]"
            + " [--diary <file>] [--pdf <file>] [--json <file>]");
        err.println("       --list [--pwcg <root>]");
    }
}
