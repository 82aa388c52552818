package com.astrazeneca.fusac;

import com.astrazeneca.fusac.data.VariantSite;

import static com.astrazeneca.fusac.data.scopedata.GlobalReadOnlyScope.instance;

public final class Utils {

    private Utils() {
    }

    /**
     * Method creates string from arguments by appending them with specified delimiter
     * @param delim specified delimiter
     * @param args array of arguments
     * @return generated string
     */
    public static String join(String delim, Object... args) {
        if (args.length == 0) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < args.length; i++) {
            sb.append(args[i]);
            if (i + 1 != args.length) {
                sb.append(delim);
            }
        }
        return sb.toString();
    }

    /**
     * Method prints the exception and counts it. Exceptions of single reads, alleles or records are not critical:
     * the unit is skipped and processing continues from the next one.
     * @param exception exception to report
     * @param place unit that was skipped (read, allele, record)
     * @param placeDef name of the unit
     * @param site variant site where exception occurs, may be null
     */
    public static void printExceptionAndContinue(Exception exception, String place, String placeDef, VariantSite site) {
        String firstPart = "There was Exception while processing " + place + " " + placeDef;
        String secondPart = ". The processing will be continued from the next " + place + ".";
        if (site != null) {
            System.err.println(firstPart + " on site " + site.printSite() + secondPart);
        } else {
            System.err.println(firstPart + " but site is undefined" + secondPart);
        }
        System.err.println(exception.getMessage());
        if (instance().conf.debug) {
            exception.printStackTrace();
        }
        instance().conf.exceptionCounter.incrementAndGet();
    }
}
