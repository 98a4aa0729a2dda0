package de.bsommerfeld.workbench.workspace;

import de.bsommerfeld.workbench.core.domain.Project;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class TestWorkspaceServiceTest {

    @Test
    void constructor_shouldSeedProjectsWithOneFolder() {
        var service = new TestWorkspaceService(new TestDataGenerator(new Random(7)), 5);

        assertEquals(6, service.getProjects().size());
        assertEquals(1, service.getProjects().stream().filter(Project::isFolder).count());
    }

    @Test
    void getWorktrees_shouldReturnOneToThreeForEveryProject() {
        var service = new TestWorkspaceService(new TestDataGenerator(new Random(7)), 5);

        for (Project p : service.getProjects()) {
            if (p.isFolder())
                continue;
            int count = service.getWorktrees(p.id()).size();
            assertTrue(count >= 1 && count <= 3, "unexpected worktree count " + count);
        }
    }

    @Test
    void getWorktrees_shouldRejectFolders() {
        var service = new TestWorkspaceService(new TestDataGenerator(new Random(7)), 2);

        var ex = assertThrows(WorkspaceException.class, () -> service.getWorktrees("folder-1"));
        assertEquals(WorkspaceException.Kind.NOT_FOUND, ex.getKind());
    }
}
