package de.bsommerfeld.workbench.workspace;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.workbench.core.domain.Project;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Expansion state for TEST mode: every second repository of the generated
 * workspace counts as expanded, so both prefetch tiers are populated.
 */
@Singleton
public class TestExpansionState implements ExpansionState {

    private final WorkspaceService workspaceService;

    @Inject
    public TestExpansionState(WorkspaceService workspaceService) {
        this.workspaceService = workspaceService;
    }

    @Override
    public Set<String> getExpandedIds() {
        List<Project> repositories = workspaceService.getProjects().stream()
                .filter(p -> !p.isFolder())
                .toList();
        Set<String> expanded = new LinkedHashSet<>();
        for (int i = 0; i < repositories.size(); i += 2) {
            expanded.add(repositories.get(i).id());
        }
        return Set.copyOf(expanded);
    }
}
