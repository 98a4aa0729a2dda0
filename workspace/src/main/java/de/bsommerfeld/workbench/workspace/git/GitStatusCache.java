package de.bsommerfeld.workbench.workspace.git;

import com.google.inject.Singleton;
import de.bsommerfeld.workbench.core.domain.GitStatus;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Latest git status per project, keyed by project id, then worktree id.
 * Each write replaces a whole project entry atomically; readers never see a
 * half-updated project.
 */
@Singleton
public class GitStatusCache {

    private final Map<String, Map<String, GitStatus>> byProject = new ConcurrentHashMap<>();

    public void put(String projectId, Map<String, GitStatus> statuses) {
        byProject.put(projectId, Map.copyOf(statuses));
    }

    public Optional<Map<String, GitStatus>> get(String projectId) {
        return Optional.ofNullable(byProject.get(projectId));
    }

    public boolean contains(String projectId) {
        return byProject.containsKey(projectId);
    }

    public int size() {
        return byProject.size();
    }
}
