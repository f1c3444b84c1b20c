package org.hdlscore.compiler.api;

/**
 * A query failure caused by a construct whose resolution is not implemented yet.
 * Lets callers distinguish "has no definitions" from "cannot be resolved yet".
 */
public class UnsupportedConstructException extends ScoreException {

    private final String construct;

    /**
     * @param construct A short description of the unsupported construct.
     */
    public UnsupportedConstructException(String construct) {
        this.construct = construct;
    }

    public String getConstruct() {
        return construct;
    }
}
