package de.bsommerfeld.workbench.core.domain;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class GitStatusTest {

    @Test
    void isClean_shouldBeTrueWithoutChanges() {
        var status = new GitStatus("wt1", "main", 2, 0, 0, 0, 0, 1000L);
        assertTrue(status.isClean());
    }

    @Test
    void isClean_shouldBeFalseWithUntrackedFiles() {
        var status = new GitStatus("wt1", "main", 0, 0, 0, 0, 1, 1000L);
        assertFalse(status.isClean());
    }

    @Test
    void projectFactories_shouldDistinguishFolders() {
        assertFalse(Project.of("p1", "alpha", "/tmp/alpha").isFolder());
        assertTrue(Project.folder("f1", "group").isFolder());
        assertNull(Project.folder("f1", "group").path());
    }
}
