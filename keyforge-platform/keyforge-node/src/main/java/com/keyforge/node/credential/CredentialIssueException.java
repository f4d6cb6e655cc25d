package com.keyforge.node.credential;

/**
 * Root credentials for a node could not be issued or cached.
 */
public class CredentialIssueException extends RuntimeException {

    public CredentialIssueException(String message) {
        super(message);
    }

    public CredentialIssueException(String message, Throwable cause) {
        super(message, cause);
    }
}
