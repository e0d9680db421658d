package org.nowstart.fundrank.data.exception;

import lombok.Getter;

@Getter
public class FundrankException extends RuntimeException {

    private final String code;

    public FundrankException(String code, String message) {
        super(message);
        this.code = code;
    }

    public FundrankException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }
}
