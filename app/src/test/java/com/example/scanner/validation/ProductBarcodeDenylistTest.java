package com.example.scanner.validation;

import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

public class ProductBarcodeDenylistTest {

    @Test
    public void isDenylisted_knownLiterals() {
        assertTrue(ProductBarcodeDenylist.isDenylisted("6932204509475"));
        assertTrue(ProductBarcodeDenylist.isDenylisted("693220450947"));
    }

    @Test
    public void isDenylisted_eanPrefixes690To695() {
        for (String prefix : new String[]{"690", "691", "692", "693", "694", "695"}) {
            assertTrue(prefix, ProductBarcodeDenylist.isDenylisted(prefix + "1234567890"));
        }
    }

    @Test
    public void isDenylisted_otherValues_false() {
        assertFalse(ProductBarcodeDenylist.isDenylisted("696123456789"));
        assertFalse(ProductBarcodeDenylist.isDenylisted("354626223546262"));
        assertFalse(ProductBarcodeDenylist.isDenylisted(null));
    }

    @Test
    public void isProductCode_onlyEanLengths() {
        assertTrue(ProductBarcodeDenylist.isProductCode("6932204509475"));
        assertTrue(ProductBarcodeDenylist.isProductCode("690123456789"));
        assertFalse(ProductBarcodeDenylist.isProductCode("6912345678"));
        assertFalse(ProductBarcodeDenylist.isProductCode("691234567890123"));
        assertFalse(ProductBarcodeDenylist.isProductCode("354626223546"));
        assertFalse(ProductBarcodeDenylist.isProductCode(null));
    }
}
