package com.lapair.tool.frontend;

public class FrontEndException extends RuntimeException {
    public FrontEndException(String message) { super(message); }
    public FrontEndException(String message, Throwable cause) { super(message, cause); }
}
