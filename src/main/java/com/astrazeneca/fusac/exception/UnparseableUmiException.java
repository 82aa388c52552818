package com.astrazeneca.fusac.exception;


import java.util.Locale;

public class UnparseableUmiException extends RuntimeException {
    public final static String UnparseableUmiExceptionMessage = "UMI can't be parsed from read \"%s\": %s.";

    public UnparseableUmiException(String readName, String reason) {
            super(String.format(Locale.US, UnparseableUmiExceptionMessage, readName, reason));
    }
}
