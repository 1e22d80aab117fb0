package com.example.scanner.validation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Validates IMEI check digits with the Luhn (mod 10) algorithm.
 */
public class LuhnCheckDigitValidator {

    private static final Logger log = LoggerFactory.getLogger(LuhnCheckDigitValidator.class);

    /**
     * Verify a check digit against the given data
     *
     * @param data The digits covered by the check digit (14 for an IMEI)
     * @param checkDigit The expected check digit character ('0'-'9')
     * @return true if valid, false otherwise
     */
    public boolean verify(String data, char checkDigit) {
        if (data == null || data.isEmpty()) {
            return false;
        }

        int expected = calculate(data);
        if (expected < 0) {
            return false;
        }
        int actual = parseCheckDigit(checkDigit);

        if (actual < 0) {
            log.warn("Invalid check digit character: {}", checkDigit);
            return false;
        }

        boolean valid = (expected == actual);
        if (!valid) {
            log.debug("Check digit mismatch: expected {} actual {} data {}", expected, actual, data);
        }

        return valid;
    }

    /**
     * Verify a full number whose last digit is the check digit.
     */
    public boolean isValid(String number) {
        if (number == null || number.length() < 2) {
            return false;
        }
        int last = number.length() - 1;
        return verify(number.substring(0, last), number.charAt(last));
    }

    /**
     * Calculate the check digit for given data. Every second digit counted
     * from the left (positions 2, 4, ...) is doubled, and 9 is subtracted
     * from doubled values above 9.
     *
     * @return the check digit, or -1 if the data contains a non-digit
     */
    public int calculate(String data) {
        int sum = 0;

        for (int i = 0; i < data.length(); i++) {
            char c = data.charAt(i);
            if (c < '0' || c > '9') {
                return -1;
            }
            int value = c - '0';
            if (i % 2 == 1) {
                value *= 2;
                if (value > 9) {
                    value -= 9;
                }
            }
            sum += value;
        }

        return (10 - (sum % 10)) % 10;
    }

    private int parseCheckDigit(char c) {
        if (c >= '0' && c <= '9') {
            return c - '0';
        }
        return -1;  // Invalid
    }
}
