package com.example.scanner.models;

/**
 * How a candidate was found inside the decoded text.
 */
public enum CandidateOrigin {
    /** Preceded by an IMEI label such as "IMEI1:". */
    LABELED,
    /** Bare digit run accepted by the leading-digit heuristic. */
    UNLABELED,
    /** Found inside a string leaf of a JSON payload. */
    JSON_WALK
}
