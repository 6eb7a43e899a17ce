package com.example.repoassist;

/** The engine answered, but not in the shape the call contract requires. */
public class OracleUnparseableException extends OracleException {

    private final String rawResponse;

    public OracleUnparseableException(String message, String rawResponse) {
        super(message);
        this.rawResponse = rawResponse;
    }

    public String getRawResponse() {
        return rawResponse;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.ORACLE_UNPARSEABLE;
    }
}
