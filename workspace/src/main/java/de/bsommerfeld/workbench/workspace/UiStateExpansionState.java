package de.bsommerfeld.workbench.workspace;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * {@link ExpansionState} seeded from the {@code expanded_project_ids} array of
 * the persisted {@code ui-state.json} and updated in-process as the user
 * expands or collapses projects.
 *
 * <p>
 * A missing or unreadable file is not an error: the sidebar simply starts
 * collapsed. Writing the state back is owned by the shell, not by this class.
 */
@Singleton
public class UiStateExpansionState implements ExpansionState {

    private static final Logger LOG = LoggerFactory.getLogger(UiStateExpansionState.class);

    private final Path uiStateFile;
    private final ObjectMapper mapper = new ObjectMapper();

    private Set<String> expanded;

    @Inject
    public UiStateExpansionState(WorkspacePaths paths) {
        this.uiStateFile = paths.uiStateFile();
    }

    @Override
    public synchronized Set<String> getExpandedIds() {
        return Set.copyOf(state());
    }

    public synchronized void expand(String projectId) {
        state().add(projectId);
    }

    public synchronized void collapse(String projectId) {
        state().remove(projectId);
    }

    public synchronized void toggle(String projectId) {
        Set<String> ids = state();
        if (!ids.remove(projectId))
            ids.add(projectId);
    }

    private Set<String> state() {
        if (expanded == null)
            expanded = load();
        return expanded;
    }

    private Set<String> load() {
        Set<String> ids = new LinkedHashSet<>();
        if (!Files.exists(uiStateFile)) {
            LOG.debug("No UI state at {}, starting with all projects collapsed", uiStateFile);
            return ids;
        }
        try {
            JsonNode node = mapper.readTree(uiStateFile.toFile()).path("expanded_project_ids");
            if (node.isArray()) {
                for (JsonNode id : node) {
                    if (id.isTextual())
                        ids.add(id.asText());
                }
            }
            LOG.debug("Restored {} expanded projects from UI state", ids.size());
        } catch (IOException e) {
            LOG.warn("Failed to read UI state from {}, starting collapsed", uiStateFile, e);
        }
        return ids;
    }
}
