package com.example.scanner.validation;

import java.util.List;
import java.util.Set;

/**
 * Known retail product barcodes (EAN prefixes 690-695 and a couple of
 * literal values) that show up on phone boxes and look like identifiers.
 */
public final class ProductBarcodeDenylist {

    private static final List<String> DENIED_PREFIXES =
            List.of("693", "690", "691", "692", "694", "695");

    private static final Set<String> DENIED_VALUES =
            Set.of("6932204509475", "693220450947");

    private ProductBarcodeDenylist() {}

    public static boolean isDenylisted(String value) {
        if (value == null) {
            return false;
        }
        if (DENIED_VALUES.contains(value)) {
            return true;
        }
        for (String prefix : DENIED_PREFIXES) {
            if (value.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }

    /**
     * True for EAN-13 or UPC-A length values the denylist covers. Shorter or
     * longer runs with a denied prefix can still be phone numbers.
     */
    public static boolean isProductCode(String value) {
        if (value == null || value.length() < 12 || value.length() > 13) {
            return false;
        }
        return isDenylisted(value);
    }
}
