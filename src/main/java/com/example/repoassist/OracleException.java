package com.example.repoassist;

/**
 * Failure of a call to the external reasoning engine. The base type means the engine could not
 * be reached or failed outright.
 */
public class OracleException extends Exception {

    public OracleException(String message) {
        super(message);
    }

    public OracleException(String message, Throwable cause) {
        super(message, cause);
    }

    public ErrorKind kind() {
        return ErrorKind.ORACLE_UNREACHABLE;
    }
}
