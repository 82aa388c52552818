package com.astrazeneca.fusac.exception;


import java.util.Locale;

public class MissingAlleleException extends RuntimeException {
    public final static String MissingAlleleExceptionMessage = "No match for allele \"%s\" found in base counts, " +
            "comparison not possible.";

    public MissingAlleleException(char allele) {
            super(String.format(Locale.US, MissingAlleleExceptionMessage, allele));
    }
}
