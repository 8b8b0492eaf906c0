package com.horstmann.tmgrader;

/**
 * Thrown when the sandbox runtime itself cannot be used (daemon unreachable, image
 * missing, container cannot be created). Unlike per-group failures, this aborts the
 * whole grading run.
 */
public class SandboxUnavailableException extends GraderException {
    public SandboxUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    public SandboxUnavailableException(String message) {
        super(message);
    }
}
