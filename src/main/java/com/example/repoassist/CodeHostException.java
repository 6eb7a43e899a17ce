package com.example.repoassist;

/** The code host could not be reached or returned something unusable. */
public class CodeHostException extends Exception {

    public CodeHostException(String message) {
        super(message);
    }

    public CodeHostException(String message, Throwable cause) {
        super(message, cause);
    }
}
