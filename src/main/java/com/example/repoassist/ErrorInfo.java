package com.example.repoassist;

import lombok.Value;

/** Structured error of a failed request: what failed, in which state, and why. */
@Value
public class ErrorInfo {
    ErrorKind kind;
    RequestState state;
    String message;
}
