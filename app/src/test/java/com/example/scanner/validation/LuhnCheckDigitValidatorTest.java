package com.example.scanner.validation;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

import java.util.Random;

public class LuhnCheckDigitValidatorTest {

    private final LuhnCheckDigitValidator luhn = new LuhnCheckDigitValidator();

    @Test
    public void calculate_knownImeis_returnCheckDigit() {
        assertEquals(2, luhn.calculate("35462622354626"));
        assertEquals(8, luhn.calculate("49015420323751"));
        assertEquals(7, luhn.calculate("12345678901234"));
    }

    @Test
    public void calculate_nonDigit_returnsMinusOne() {
        assertEquals(-1, luhn.calculate("3546262235462A"));
    }

    @Test
    public void isValid_validImei_true() {
        assertTrue(luhn.isValid("354626223546262"));
        assertTrue(luhn.isValid("490154203237518"));
    }

    @Test
    public void isValid_wrongCheckDigit_false() {
        assertFalse(luhn.isValid("123456789012345"));
        assertFalse(luhn.isValid("354626223546263"));
    }

    @Test
    public void isValid_tooShortOrNull_false() {
        assertFalse(luhn.isValid(null));
        assertFalse(luhn.isValid("5"));
    }

    @Test
    public void verify_nonDigitCheckCharacter_false() {
        assertFalse(luhn.verify("35462622354626", 'X'));
    }

    @Test
    public void isValid_randomFifteenDigitNumbers_matchesRightToLeftLuhn() {
        Random random = new Random(20240611L);
        for (int n = 0; n < 2000; n++) {
            StringBuilder sb = new StringBuilder();
            for (int i = 0; i < 15; i++) {
                sb.append((char) ('0' + random.nextInt(10)));
            }
            String number = sb.toString();
            assertEquals(number, referenceLuhn(number), luhn.isValid(number));
        }
    }

    @Test
    public void calculate_appendedDigitAlwaysValidates() {
        Random random = new Random(7L);
        for (int n = 0; n < 500; n++) {
            StringBuilder sb = new StringBuilder();
            for (int i = 0; i < 14; i++) {
                sb.append((char) ('0' + random.nextInt(10)));
            }
            String body = sb.toString();
            assertTrue(body, luhn.isValid(body + luhn.calculate(body)));
        }
    }

    private static boolean referenceLuhn(String number) {
        int sum = 0;
        boolean doubleIt = false;
        for (int i = number.length() - 1; i >= 0; i--) {
            int d = number.charAt(i) - '0';
            if (doubleIt) {
                d *= 2;
                if (d > 9) {
                    d -= 9;
                }
            }
            sum += d;
            doubleIt = !doubleIt;
        }
        return sum % 10 == 0;
    }
}
