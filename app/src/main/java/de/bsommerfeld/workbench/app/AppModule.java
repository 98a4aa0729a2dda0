package de.bsommerfeld.workbench.app;

import com.google.inject.AbstractModule;
import de.bsommerfeld.workbench.core.config.ApplicationMode;
import de.bsommerfeld.workbench.core.config.ConfigLoader;
import de.bsommerfeld.workbench.core.config.GlobalConfig;
import de.bsommerfeld.workbench.core.util.StorageUtils;
import de.bsommerfeld.workbench.prefetch.ProjectListWatcher;
import de.bsommerfeld.workbench.workspace.ExpansionState;
import de.bsommerfeld.workbench.workspace.JsonWorkspaceService;
import de.bsommerfeld.workbench.workspace.ProjectIndex;
import de.bsommerfeld.workbench.workspace.TestExpansionState;
import de.bsommerfeld.workbench.workspace.TestWorkspaceService;
import de.bsommerfeld.workbench.workspace.UiStateExpansionState;
import de.bsommerfeld.workbench.workspace.WorkspacePaths;
import de.bsommerfeld.workbench.workspace.WorkspaceRepository;
import de.bsommerfeld.workbench.workspace.WorkspaceService;
import de.bsommerfeld.workbench.workspace.WorktreeLister;
import de.bsommerfeld.workbench.workspace.git.GitStatusFetcher;
import de.bsommerfeld.workbench.workspace.git.GitStatusService;
import de.bsommerfeld.workbench.workspace.git.TestGitStatusFetcher;
import de.bsommerfeld.workbench.workspace.session.SessionIndexService;
import de.bsommerfeld.workbench.workspace.session.SessionPrefetcher;
import de.bsommerfeld.workbench.workspace.session.TestSessionPrefetcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Guice Module for application wiring.
 */
public class AppModule extends AbstractModule {

    private static final Logger LOG = LoggerFactory.getLogger(AppModule.class);

    private final Path dataDir;
    private final ApplicationMode mode;

    public AppModule() {
        this(StorageUtils.getAppDataDir(StorageUtils.APP_NAME), ApplicationMode.get());
    }

    public AppModule(Path dataDir, ApplicationMode mode) {
        this.dataDir = dataDir;
        this.mode = mode;
    }

    @Override
    protected void configure() {
        GlobalConfig config;
        try {
            Files.createDirectories(dataDir);
            Path configPath = dataDir.resolve("config.toml");
            LOG.info("Loading Configuration from: {}", configPath.toAbsolutePath());
            config = ConfigLoader.from(configPath).load(GlobalConfig.class, GlobalConfig::new);
        } catch (IOException | UncheckedIOException e) {
            // Config is vital, fail fast
            throw new IllegalStateException("Failed to load Application Configuration", e);
        }

        bind(GlobalConfig.class).toInstance(config);
        bind(WorkspacePaths.class).toInstance(new WorkspacePaths(dataDir));

        // --- MODE SWITCHING (PROD vs TEST) ---
        LOG.info("Application Mode initialized: {}", mode);
        if (mode.isTest()) {
            // TEST MODE: generated workspace, no disk reads, no git processes
            bind(WorkspaceService.class).to(TestWorkspaceService.class);
            bind(GitStatusFetcher.class).to(TestGitStatusFetcher.class);
            bind(SessionPrefetcher.class).to(TestSessionPrefetcher.class);
            bind(ExpansionState.class).to(TestExpansionState.class);
        } else {
            bind(WorkspaceService.class).to(JsonWorkspaceService.class);
            bind(GitStatusFetcher.class).to(GitStatusService.class);
            bind(SessionPrefetcher.class).to(SessionIndexService.class);
            bind(ExpansionState.class).to(UiStateExpansionState.class);
        }

        bind(ProjectIndex.class).to(WorkspaceRepository.class);
        bind(WorktreeLister.class).to(WorkspaceRepository.class);

        // Must exist before the first project list is announced
        bind(ProjectListWatcher.class).asEagerSingleton();
    }
}
