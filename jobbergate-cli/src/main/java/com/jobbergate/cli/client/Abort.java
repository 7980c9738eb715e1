package com.jobbergate.cli.client;

/**
 * Ends the current command with a message for the user and exit code 1.
 *
 * {@code subject} heads the error panel; {@code support} appends the support
 * contact to it.
 */
public class Abort extends RuntimeException {

    private final String  subject;
    private final boolean support;

    public Abort(String message, String subject, boolean support) {
        super(message);
        this.subject = subject;
        this.support = support;
    }

    public Abort(String message, String subject, boolean support, Throwable cause) {
        super(message, cause);
        this.subject = subject;
        this.support = support;
    }

    public String  getSubject() { return subject; }
    public boolean isSupport()  { return support; }
}
