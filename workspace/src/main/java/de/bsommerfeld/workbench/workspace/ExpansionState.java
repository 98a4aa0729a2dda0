package de.bsommerfeld.workbench.workspace;

import java.util.Set;

/**
 * The set of project ids the user has expanded in the sidebar tree.
 */
public interface ExpansionState {

    /**
     * Returns an immutable snapshot. Later expansion changes are not reflected
     * in a previously returned set.
     */
    Set<String> getExpandedIds();
}
