package de.bsommerfeld.workbench.prefetch;

import de.bsommerfeld.workbench.core.domain.Project;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Splits the project index into the tiers the startup prefetch works through.
 * Folders and entries without an id are dropped; every other project lands in
 * exactly one tier, in its original relative order.
 */
public final class PriorityPartitioner {

    private PriorityPartitioner() {
    }

    public static PrefetchTiers partition(List<Project> projects, Set<String> expandedIds) {
        List<Project> priority = new ArrayList<>();
        List<Project> background = new ArrayList<>();
        if (projects == null)
            return new PrefetchTiers(priority, background);

        Set<String> expanded = expandedIds != null ? expandedIds : Set.of();
        for (Project p : projects) {
            if (p == null || p.isFolder() || p.id() == null)
                continue;
            if (expanded.contains(p.id())) {
                priority.add(p);
            } else {
                background.add(p);
            }
        }
        return new PrefetchTiers(priority, background);
    }
}
