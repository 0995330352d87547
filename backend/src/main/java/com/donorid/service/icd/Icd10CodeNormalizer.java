package com.donorid.service.icd;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Canonical ICD-10 code form: upper case, punctuation and whitespace removed ("i21.4 " becomes "I214").
 */
public final class Icd10CodeNormalizer {

    private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^A-Z0-9]");

    private Icd10CodeNormalizer() {
    }

    public static String normalize(String code) {
        if (code == null) {
            return "";
        }
        return NON_ALPHANUMERIC.matcher(code.toUpperCase(Locale.ROOT)).replaceAll("");
    }
}
