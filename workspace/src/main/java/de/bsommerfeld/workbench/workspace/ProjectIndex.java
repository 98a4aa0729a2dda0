package de.bsommerfeld.workbench.workspace;

import de.bsommerfeld.workbench.core.domain.Project;

import java.util.List;

/**
 * Ordered view of the workspace's projects and folders.
 */
public interface ProjectIndex {

    List<Project> listProjects();
}
