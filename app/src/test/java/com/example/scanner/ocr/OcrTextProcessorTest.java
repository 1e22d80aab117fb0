package com.example.scanner.ocr;

import static org.junit.Assert.assertEquals;

import org.junit.Test;

public class OcrTextProcessorTest {

    private final OcrTextProcessor processor = new OcrTextProcessor(true);

    @Test
    public void clean_letterInsideDigitRun_corrected() {
        assertEquals("IMEI: 354620223546262", processor.clean("IMEI: 35462O223546262"));
    }

    @Test
    public void clean_consecutiveLetters_corrected() {
        assertEquals("120034", processor.clean("12OO34"));
    }

    @Test
    public void clean_wordsLeftAlone() {
        assertEquals("IMEI SERIAL Model", processor.clean("IMEI SERIAL Model"));
    }

    @Test
    public void clean_mixedConfusions() {
        assertEquals("1538", processor.clean("1S38"));
        assertEquals("71117", processor.clean("7Il|7"));
    }

    @Test
    public void clean_normalizesWhitespace() {
        assertEquals("a\n\nb c", processor.clean("a\r\nb\tc"));
    }

    @Test
    public void clean_correctionDisabled_onlyNormalizes() {
        OcrTextProcessor plain = new OcrTextProcessor(false);

        assertEquals("35462O22", plain.clean("35462O22"));
    }

    @Test
    public void clean_null_empty() {
        assertEquals("", processor.clean(null));
    }
}
