package de.bsommerfeld.workbench.prefetch;

import com.google.common.eventbus.Subscribe;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.workbench.core.config.GlobalConfig;
import de.bsommerfeld.workbench.core.event.ApplicationEventBus;
import de.bsommerfeld.workbench.core.event.ControlEvents.ProjectsChangedEvent;
import de.bsommerfeld.workbench.workspace.ExpansionState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Starts the prefetch the first time a non-empty project list shows up.
 * Subsequent project list changes are left to the regular refresh paths.
 */
@Singleton
public class ProjectListWatcher {

    private static final Logger LOG = LoggerFactory.getLogger(ProjectListWatcher.class);

    private final StartupPrefetchOrchestrator orchestrator;
    private final ExpansionState expansionState;
    private final boolean enabled;

    @Inject
    public ProjectListWatcher(StartupPrefetchOrchestrator orchestrator, ExpansionState expansionState,
            ApplicationEventBus eventBus, GlobalConfig config) {
        this.orchestrator = orchestrator;
        this.expansionState = expansionState;
        this.enabled = config.getPrefetch().isEnabled();
        eventBus.register(this);
        if (!enabled)
            LOG.info("Startup prefetch disabled by configuration");
    }

    @Subscribe
    public void onProjectsChanged(ProjectsChangedEvent event) {
        if (!enabled || event.projects().isEmpty())
            return;
        if (orchestrator.getState() != RunState.NOT_STARTED)
            return;
        orchestrator.run(event.projects(), expansionState.getExpandedIds());
    }
}
