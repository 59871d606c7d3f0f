package com.wingman.core.sync;

import com.wingman.config.ConfigService;
import com.wingman.core.annotation.AnnotationStore;
import com.wingman.core.error.CampaignSyncException;
import com.wingman.core.error.DiagnosticCollector;
import com.wingman.core.error.DiagnosticKind;
import com.wingman.core.error.MalformedRecordException;
import com.wingman.core.error.SyncCancelledException;
import com.wingman.core.fs.CampaignFileLocator;
import com.wingman.core.fs.CampaignFileSet;
import com.wingman.core.fs.CombatReportFolder;
import com.wingman.core.fs.FileCategory;
import com.wingman.core.json.AceEntry;
import com.wingman.core.json.CampaignAcesLoader;
import com.wingman.core.json.CampaignLogLoader;
import com.wingman.core.json.CampaignSummary;
import com.wingman.core.json.CampaignSummaryLoader;
import com.wingman.core.json.CombatReportLoader;
import com.wingman.core.json.LoadedRecord;
import com.wingman.core.json.MissionDataLoader;
import com.wingman.core.json.PersonnelEntry;
import com.wingman.core.json.PersonnelLoader;
import com.wingman.core.mission.MissionFileIndex;
import com.wingman.core.mission.MissionWeatherLookup;
import com.wingman.core.mission.WeatherSource;
import com.wingman.core.model.AnnotationRecord;
import com.wingman.core.model.CombatReport;
import com.wingman.core.model.LogEntry;
import com.wingman.core.model.MissionRecord;
import com.wingman.core.model.UnifiedCampaignModel;
import com.wingman.core.model.UnifiedCampaignModelAssembler;
import com.wingman.core.resolve.CrossReferenceResolver;
import com.wingman.core.resolve.LoadedCampaign;
import com.wingman.core.resolve.ResolvedCampaign;
import com.wingman.core.stats.CampaignAggregator;
import com.wingman.core.stats.CampaignStatistics;
import com.wingman.logging.AppLogger;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Logger;

/**
 * Runs the campaign pipeline: locate files, load them in parallel, wait for every loader, then
 * cross-reference, aggregate and assemble the model.
 * <p>
 * {@link #startSync} runs in the background and cancels whatever sync is still in flight, so the
 * newest request always wins. {@link #runSync} is the same pipeline on the calling thread.
 */
public final class CampaignSyncService implements AutoCloseable {
    private static final Logger LOGGER = AppLogger.get();

    private final CampaignFileLocator locator = new CampaignFileLocator();
    private final CampaignSummaryLoader summaryLoader = new CampaignSummaryLoader();
    private final CampaignAcesLoader acesLoader = new CampaignAcesLoader();
    private final CampaignLogLoader logLoader = new CampaignLogLoader();
    private final CombatReportLoader reportLoader = new CombatReportLoader();
    private final MissionDataLoader missionLoader = new MissionDataLoader();
    private final PersonnelLoader personnelLoader = new PersonnelLoader();
    private final CrossReferenceResolver resolver = new CrossReferenceResolver();
    private final CampaignAggregator aggregator = new CampaignAggregator();
    private final UnifiedCampaignModelAssembler assembler = new UnifiedCampaignModelAssembler();

    private final ExecutorService syncExecutor;
    private final ExecutorService loaderPool;
    private SyncHandle current;

    public CampaignSyncService() {
        this(ConfigService.getInstance().getLoaderThreads());
    }

    public CampaignSyncService(int loaderThreads) {
        this.syncExecutor = Executors.newSingleThreadExecutor(daemonThreads("campaign-sync"));
        this.loaderPool = Executors.newFixedThreadPool(Math.max(1, loaderThreads), daemonThreads("campaign-loader"));
    }

    /**
     * Starts a sync in the background, cancelling the one in flight if any.
     */
    public synchronized SyncHandle startSync(SyncRequest request, SyncProgressListener listener) {
        if (current != null && !current.result().isDone()) {
            LOGGER.info("Cancelling the running sync in favour of " + request.campaignRoot());
            current.cancel();
        }
        CancellationToken token = new CancellationToken();
        CompletableFuture<SyncResult> result = CompletableFuture.supplyAsync(() -> {
            try {
                return runSync(request, listener, token);
            } catch (CampaignSyncException ex) {
                throw new CompletionException(ex);
            }
        }, syncExecutor);
        current = new SyncHandle(token, result);
        return current;
    }

    public SyncResult runSync(SyncRequest request) throws CampaignSyncException {
        return runSync(request, SyncProgressListener.NONE, new CancellationToken());
    }

    public SyncResult runSync(SyncRequest request,
                              SyncProgressListener listener,
                              CancellationToken token) throws CampaignSyncException {
        DiagnosticCollector diagnostics = new DiagnosticCollector();
        listener.onProgress(SyncStage.LOCATE, 0, "Locating files under " + request.campaignRoot());
        token.throwIfCancelled();
        CampaignFileSet files = locator.locate(request.campaignRoot());
        for (FileCategory category : files.absentCategories()) {
            diagnostics.report(DiagnosticKind.MISSING_CATEGORY, files.campaignRoot(), category.entryName() + " not found");
        }
        LOGGER.fine(() -> "Found %d campaign files under %s".formatted(files.fileCount(), files.campaignRoot()));

        token.throwIfCancelled();
        LoadedCampaign loaded = loadAll(files, listener, token, diagnostics);
        token.throwIfCancelled();

        WeatherSource weather = weatherSource(request, diagnostics);
        listener.onProgress(SyncStage.RESOLVE, 75, SyncStage.RESOLVE.label());
        ResolvedCampaign resolved = resolver.resolve(loaded, query -> {
            token.throwIfCancelled();
            return weather.find(query);
        }, diagnostics);

        token.throwIfCancelled();
        listener.onProgress(SyncStage.AGGREGATE, 85, SyncStage.AGGREGATE.label());
        CampaignStatistics statistics = aggregator.aggregate(resolved, diagnostics);

        token.throwIfCancelled();
        listener.onProgress(SyncStage.ASSEMBLE, 95, SyncStage.ASSEMBLE.label());
        AnnotationStore store = request.annotationStore();
        if (store.wasRecoveredFromCorruption()) {
            diagnostics.report(DiagnosticKind.ANNOTATION_STORE_CORRUPT,
                "annotation file was unreadable and has been reset to empty");
        }
        Map<String, AnnotationRecord> annotations = store.snapshot();
        UnifiedCampaignModel model = assembler.assemble(resolved, statistics, annotations);

        token.throwIfCancelled();
        SyncResult result = new SyncResult(model, diagnostics.snapshot(), Instant.now());
        listener.onProgress(SyncStage.COMPLETE, 100, SyncStage.COMPLETE.label());
        LOGGER.info("Synced campaign '%s': %d pilots, %d missions, %d diagnostics".formatted(
            model.campaign().name(), model.pilots().size(), model.missions().size(), result.diagnostics().size()));
        return result;
    }

    @Override
    public void close() {
        synchronized (this) {
            if (current != null) {
                current.cancel();
            }
        }
        syncExecutor.shutdownNow();
        loaderPool.shutdownNow();
    }

    private LoadedCampaign loadAll(CampaignFileSet files,
                                   SyncProgressListener listener,
                                   CancellationToken token,
                                   DiagnosticCollector diagnostics) {
        Map<SyncStage, Integer> counts = new EnumMap<>(SyncStage.class);
        counts.put(SyncStage.CAMPAIGN_SUMMARY, files.campaignSummary().isPresent() ? 1 : 0);
        counts.put(SyncStage.ACES, files.aces().isPresent() ? 1 : 0);
        counts.put(SyncStage.EVENT_LOG, files.eventLog().isPresent() ? 1 : 0);
        counts.put(SyncStage.COMBAT_REPORTS, files.combatReportFolders().stream().mapToInt(f -> f.reports().size()).sum());
        counts.put(SyncStage.MISSION_DATA, files.missionDataFiles().size());
        counts.put(SyncStage.PERSONNEL, files.personnelFiles().size());
        LoadProgress progress = new LoadProgress(listener, counts);
        progress.reportEmptyStages();
        Loads loads = new Loads(token, diagnostics, progress);

        CompletableFuture<Optional<LoadedRecord<CampaignSummary>>> summary =
            loads.optional(files.campaignSummary(), SyncStage.CAMPAIGN_SUMMARY, summaryLoader::load);
        CompletableFuture<Optional<LoadedRecord<List<AceEntry>>>> aces =
            loads.optional(files.aces(), SyncStage.ACES, acesLoader::load);
        CompletableFuture<Optional<LoadedRecord<List<LogEntry>>>> eventLog =
            loads.optional(files.eventLog(), SyncStage.EVENT_LOG, logLoader::load);

        List<CompletableFuture<Optional<LoadedRecord<CombatReport>>>> reports = new ArrayList<>();
        for (CombatReportFolder folder : files.combatReportFolders()) {
            for (Path report : folder.reports()) {
                reports.add(loads.submit(report, SyncStage.COMBAT_REPORTS,
                    file -> reportLoader.load(file, folder.serialNumber())));
            }
        }
        List<CompletableFuture<Optional<LoadedRecord<MissionRecord>>>> missions = new ArrayList<>();
        for (Path mission : files.missionDataFiles()) {
            missions.add(loads.submit(mission, SyncStage.MISSION_DATA, missionLoader::load));
        }
        List<CompletableFuture<Optional<LoadedRecord<List<PersonnelEntry>>>>> personnel = new ArrayList<>();
        for (Path roster : files.personnelFiles()) {
            personnel.add(loads.submit(roster, SyncStage.PERSONNEL, personnelLoader::load));
        }

        loads.awaitAll();
        return new LoadedCampaign(
            files.campaignRoot(),
            summary.join(),
            aces.join(),
            eventLog.join(),
            collect(reports),
            collect(missions),
            collect(personnel)
        );
    }

    private WeatherSource weatherSource(SyncRequest request, DiagnosticCollector diagnostics) {
        if (request.missionFolder().isEmpty()) {
            diagnostics.report(DiagnosticKind.MISSION_FILE_NOT_FOUND, "no simulator mission folder configured");
            return WeatherSource.NONE;
        }
        return new MissionWeatherLookup(new MissionFileIndex(request.missionFolder().get()), diagnostics);
    }

    private static <T> List<LoadedRecord<T>> collect(List<CompletableFuture<Optional<LoadedRecord<T>>>> futures) {
        List<LoadedRecord<T>> records = new ArrayList<>();
        for (CompletableFuture<Optional<LoadedRecord<T>>> future : futures) {
            future.join().ifPresent(records::add);
        }
        return records;
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    @FunctionalInterface
    private interface FileLoader<T> {
        LoadedRecord<T> load(Path file) throws MalformedRecordException;
    }

    /**
     * Loader tasks of one sync. A file that fails to parse becomes a diagnostic and an empty result;
     * only cancellation fails a task.
     */
    private final class Loads {
        private final CancellationToken token;
        private final DiagnosticCollector diagnostics;
        private final LoadProgress progress;
        private final List<CompletableFuture<?>> pending = new ArrayList<>();

        private Loads(CancellationToken token, DiagnosticCollector diagnostics, LoadProgress progress) {
            this.token = token;
            this.diagnostics = diagnostics;
            this.progress = progress;
        }

        <T> CompletableFuture<Optional<LoadedRecord<T>>> optional(Optional<Path> file, SyncStage stage, FileLoader<T> loader) {
            if (file.isEmpty()) {
                return CompletableFuture.completedFuture(Optional.empty());
            }
            return submit(file.get(), stage, loader);
        }

        <T> CompletableFuture<Optional<LoadedRecord<T>>> submit(Path file, SyncStage stage, FileLoader<T> loader) {
            CompletableFuture<Optional<LoadedRecord<T>>> future = CompletableFuture.supplyAsync(() -> {
                token.throwIfCancelled();
                try {
                    LoadedRecord<T> record = loader.load(file);
                    if (record.partial()) {
                        diagnostics.report(DiagnosticKind.SCHEMA_MISMATCH, file, String.join("; ", record.notes()));
                    }
                    return Optional.of(record);
                } catch (MalformedRecordException ex) {
                    LOGGER.warning("Skipping " + file + ": " + ex.getMessage());
                    diagnostics.report(DiagnosticKind.MALFORMED_RECORD, file, ex.getMessage());
                    return Optional.<LoadedRecord<T>>empty();
                } finally {
                    progress.fileDone(stage);
                }
            }, loaderPool);
            pending.add(future);
            return future;
        }

        /**
         * Blocks until every submitted loader has finished, then rethrows a cancellation or an
         * unexpected loader failure.
         */
        void awaitAll() {
            try {
                CompletableFuture.allOf(pending.toArray(new CompletableFuture<?>[0])).join();
            } catch (CompletionException ex) {
                Throwable cause = ex.getCause();
                if (cause instanceof SyncCancelledException cancelled) {
                    throw cancelled;
                }
                if (cause instanceof RuntimeException runtime) {
                    throw runtime;
                }
                throw ex;
            }
        }
    }
}
