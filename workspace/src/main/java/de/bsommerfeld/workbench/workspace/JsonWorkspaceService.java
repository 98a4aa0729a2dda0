package de.bsommerfeld.workbench.workspace;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.workbench.core.domain.Project;
import de.bsommerfeld.workbench.core.domain.Worktree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * {@link WorkspaceService} backed by {@code projects.json}.
 *
 * <p>
 * The file is re-read on every call so that edits made by other processes are
 * picked up without a restart. Worktrees whose checkout directory no longer
 * exists, and project entries without an id, are dropped with a warning; the file itself is never rewritten here.
 */
@Singleton
public class JsonWorkspaceService implements WorkspaceService {

    private static final Logger LOG = LoggerFactory.getLogger(JsonWorkspaceService.class);

    private final Path projectsFile;
    private final ObjectMapper mapper = new ObjectMapper();

    @Inject
    public JsonWorkspaceService(WorkspacePaths paths) {
        this.projectsFile = paths.projectsFile();
    }

    @Override
    public List<Project> getProjects() {
        return load().projects();
    }

    @Override
    public List<Worktree> getWorktrees(String projectId) {
        ProjectsData data = load();
        Project project = data.projects().stream()
                .filter(p -> p.id().equals(projectId))
                .findFirst()
                .orElseThrow(() -> WorkspaceException.notFound("Unknown project: " + projectId));
        if (project.isFolder())
            throw WorkspaceException.notFound("Project " + projectId + " is a folder");

        return data.worktrees().stream()
                .filter(w -> projectId.equals(w.projectId()))
                .toList();
    }

    private ProjectsData load() {
        if (!Files.exists(projectsFile)) {
            LOG.trace("Projects file not found at {}, treating workspace as empty", projectsFile);
            return new ProjectsData(List.of(), List.of());
        }

        ProjectsData raw;
        try {
            raw = mapper.readValue(projectsFile.toFile(), ProjectsData.class);
        } catch (IOException e) {
            throw new WorkspaceException(WorkspaceException.Kind.IO,
                    "Failed to read projects file " + projectsFile, e);
        }

        List<Project> projects = new ArrayList<>();
        for (Project p : raw.projects()) {
            if (p != null && p.id() != null) {
                projects.add(p);
            } else {
                LOG.warn("Ignoring project entry without id in {}: {}", projectsFile, p);
            }
        }

        List<Worktree> valid = new ArrayList<>();
        for (Worktree w : raw.worktrees()) {
            if (w.path() != null && Files.exists(Paths.get(w.path()))) {
                valid.add(w);
            } else {
                LOG.warn("Ignoring orphaned worktree '{}' - path does not exist: {}", w.name(), w.path());
            }
        }
        return new ProjectsData(projects, valid);
    }

    /**
     * On-disk shape of {@code projects.json}.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    record ProjectsData(
            @JsonProperty("projects") List<Project> projects,
            @JsonProperty("worktrees") List<Worktree> worktrees) {

        ProjectsData {
            projects = projects != null ? projects : List.of();
            worktrees = worktrees != null ? worktrees : List.of();
        }
    }
}
