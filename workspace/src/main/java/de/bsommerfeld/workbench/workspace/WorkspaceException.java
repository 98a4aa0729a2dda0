package de.bsommerfeld.workbench.workspace;

/**
 * Failure of a workspace read. {@link Kind#NOT_FOUND} means the requested
 * entity does not exist (or is a folder where a project was expected);
 * {@link Kind#IO} means the backing store could not be read.
 */
public class WorkspaceException extends RuntimeException {

    public enum Kind {
        NOT_FOUND,
        IO
    }

    private final Kind kind;

    public WorkspaceException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public WorkspaceException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public static WorkspaceException notFound(String message) {
        return new WorkspaceException(Kind.NOT_FOUND, message);
    }

    public Kind getKind() {
        return kind;
    }
}
