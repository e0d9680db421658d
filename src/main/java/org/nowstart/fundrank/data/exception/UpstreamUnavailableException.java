package org.nowstart.fundrank.data.exception;

public class UpstreamUnavailableException extends FundrankException {

    public static final String CODE = "upstream_unavailable";

    public UpstreamUnavailableException(String message, Throwable cause) {
        super(CODE, message, cause);
    }
}
