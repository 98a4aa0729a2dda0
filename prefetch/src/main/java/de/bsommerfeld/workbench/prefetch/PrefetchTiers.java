package de.bsommerfeld.workbench.prefetch;

import de.bsommerfeld.workbench.core.domain.Project;

import java.util.List;

/**
 * Non-folder projects of one run, split by fetch priority. Both lists keep the
 * project index order.
 *
 * @param priority   projects the user has expanded
 * @param background every other project
 */
public record PrefetchTiers(List<Project> priority, List<Project> background) {

    public PrefetchTiers {
        priority = List.copyOf(priority);
        background = List.copyOf(background);
    }

    public boolean isEmpty() {
        return priority.isEmpty() && background.isEmpty();
    }
}
