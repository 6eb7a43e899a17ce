package com.example.repoassist;

public class SessionNotFoundException extends RuntimeException {

    public SessionNotFoundException(String sessionId) {
        super("No session " + sessionId);
    }
}
