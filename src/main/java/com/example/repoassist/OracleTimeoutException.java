package com.example.repoassist;

public class OracleTimeoutException extends OracleException {

    public OracleTimeoutException(String message) {
        super(message);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.ORACLE_TIMEOUT;
    }
}
