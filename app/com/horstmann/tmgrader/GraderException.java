package com.horstmann.tmgrader;

public class GraderException extends RuntimeException {
    public GraderException() {        
    }

    public GraderException(String message, Throwable cause) {
        super(message, cause);
    }

    public GraderException(String message) {
        super(message);
    }

    public GraderException(Throwable cause) {
        super(cause);
    }    
}
