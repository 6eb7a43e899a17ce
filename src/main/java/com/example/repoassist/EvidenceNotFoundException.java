package com.example.repoassist;

public class EvidenceNotFoundException extends RuntimeException {

    public EvidenceNotFoundException(String message) {
        super(message);
    }
}
