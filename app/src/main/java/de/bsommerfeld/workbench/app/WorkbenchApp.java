package de.bsommerfeld.workbench.app;

import ch.qos.logback.classic.Level;
import com.google.inject.Guice;
import com.google.inject.Injector;
import de.bsommerfeld.workbench.core.config.GlobalConfig;
import de.bsommerfeld.workbench.core.domain.Project;
import de.bsommerfeld.workbench.core.util.StorageUtils;
import de.bsommerfeld.workbench.prefetch.FetchFailure;
import de.bsommerfeld.workbench.prefetch.PrefetchReport;
import de.bsommerfeld.workbench.prefetch.RunState;
import de.bsommerfeld.workbench.prefetch.StartupPrefetchOrchestrator;
import de.bsommerfeld.workbench.workspace.WorkspaceExecutor;
import de.bsommerfeld.workbench.workspace.WorkspaceRepository;
import de.bsommerfeld.workbench.workspace.git.GitStatusCache;
import de.bsommerfeld.workbench.workspace.session.SessionCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.ExecutionException;

/**
 * Entry point. Loads the workspace, lets the startup prefetch warm the caches
 * and reports what it did.
 */
public final class WorkbenchApp {

    static {
        // Initialize Logging Directory via StorageUtils
        Path logDir = StorageUtils.getLogsDir(StorageUtils.APP_NAME);
        try {
            Files.createDirectories(logDir);
            System.setProperty("LOG_DIR", logDir.toAbsolutePath().toString());
        } catch (IOException e) {
            System.err.println("Failed to create log directory " + logDir + ": " + e.getMessage());
        }
    }

    private static final Logger LOG = LoggerFactory.getLogger(WorkbenchApp.class);

    private WorkbenchApp() {
    }

    public static void main(String[] args) {
        LOG.info("Initializing...");
        Injector injector = Guice.createInjector(new AppModule());
        int exitCode = run(injector);
        if (exitCode != 0)
            System.exit(exitCode);
    }

    /**
     * Runs one startup cycle against the given injector and shuts its I/O pool
     * down afterwards.
     *
     * @return process exit code
     */
    static int run(Injector injector) {
        applyDebugMode(injector.getInstance(GlobalConfig.class));

        WorkspaceRepository repository = injector.getInstance(WorkspaceRepository.class);
        StartupPrefetchOrchestrator orchestrator = injector.getInstance(StartupPrefetchOrchestrator.class);
        WorkspaceExecutor executor = injector.getInstance(WorkspaceExecutor.class);

        try {
            List<Project> projects = repository.reload().get();
            if (orchestrator.getState() == RunState.NOT_STARTED) {
                LOG.info("Startup prefetch did not run ({} workspace entries)", projects.size());
                return 0;
            }
            PrefetchReport report = orchestrator.completion().get();
            logSummary(report, injector);
            return 0;
        } catch (ExecutionException e) {
            LOG.error("Failed to load the workspace", e.getCause());
            return 1;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while waiting for the startup prefetch");
            return 1;
        } finally {
            executor.shutdown();
        }
    }

    private static void logSummary(PrefetchReport report, Injector injector) {
        LOG.info("Warmed git status for {} projects and sessions for {} worktrees",
                injector.getInstance(GitStatusCache.class).size(),
                injector.getInstance(SessionCache.class).size());
        for (FetchFailure failure : report.failures()) {
            LOG.info("  {} {} ({}): {}", failure.entityKind().name().toLowerCase(), failure.entityId(),
                    failure.operation().description(), failure.cause().getMessage());
        }
    }

    private static void applyDebugMode(GlobalConfig config) {
        if (!config.isDebugMode())
            return;
        Logger root = LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
        if (root instanceof ch.qos.logback.classic.Logger logbackRoot) {
            logbackRoot.setLevel(Level.DEBUG);
            LOG.debug("Debug mode enabled");
        }
    }
}
