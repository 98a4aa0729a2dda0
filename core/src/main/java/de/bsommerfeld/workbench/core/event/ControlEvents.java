package de.bsommerfeld.workbench.core.event;

import de.bsommerfeld.workbench.core.domain.Project;

import java.util.List;

/**
 * Cross-module events bridging the workspace layer, the prefetch layer and
 * the shell. Only events that more than one module produces or consumes
 * belong here.
 */
public class ControlEvents {

    /**
     * Fired whenever the project list is (re)loaded. The list may be empty and
     * may arrive several times with identical content.
     */
    public record ProjectsChangedEvent(List<Project> projects) {
        public ProjectsChangedEvent {
            projects = projects == null ? List.of() : List.copyOf(projects);
        }
    }
}
