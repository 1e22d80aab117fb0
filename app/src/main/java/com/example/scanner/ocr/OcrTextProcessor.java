package com.example.scanner.ocr;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;

/**
 * Cleans raw OCR output before candidate extraction. Sticker labels are
 * mostly digits, so letters the recognizer confuses with digits are fixed
 * when they sit inside a digit run.
 */
public class OcrTextProcessor {
    private static final Logger log = LoggerFactory.getLogger(OcrTextProcessor.class);

    // OCR common misrecognition corrections
    private static final Map<Character, Character> DIGIT_CORRECTIONS = new HashMap<>();
    static {
        DIGIT_CORRECTIONS.put('O', '0');
        DIGIT_CORRECTIONS.put('o', '0');
        DIGIT_CORRECTIONS.put('D', '0');
        DIGIT_CORRECTIONS.put('Q', '0');
        DIGIT_CORRECTIONS.put('I', '1');
        DIGIT_CORRECTIONS.put('l', '1');
        DIGIT_CORRECTIONS.put('|', '1');
        DIGIT_CORRECTIONS.put('S', '5');
        DIGIT_CORRECTIONS.put('B', '8');
        DIGIT_CORRECTIONS.put('Z', '2');
    }

    private final boolean digitCorrection;

    public OcrTextProcessor(boolean digitCorrection) {
        this.digitCorrection = digitCorrection;
    }

    public String clean(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }

        String normalized = text.replace('\r', '\n').replace('\t', ' ');
        if (!digitCorrection) {
            return normalized;
        }

        char[] chars = normalized.toCharArray();
        int corrections = 0;

        for (int i = 1; i < chars.length - 1; i++) {
            Character corrected = DIGIT_CORRECTIONS.get(chars[i]);
            if (corrected == null) {
                continue;
            }
            // Only inside a digit run, e.g. "35462O223" but not "IMEI"
            if (Character.isDigit(chars[i - 1]) && isDigitOrCorrectable(chars[i + 1])) {
                chars[i] = corrected;
                corrections++;
            }
        }

        if (corrections > 0) {
            log.debug("✏️ Applied {} OCR digit corrections", corrections);
        }
        return new String(chars);
    }

    private static boolean isDigitOrCorrectable(char c) {
        return Character.isDigit(c) || DIGIT_CORRECTIONS.containsKey(c);
    }
}
