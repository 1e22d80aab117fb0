package com.example.scanner.models;

public enum RejectReason {
    NONE,
    BAD_LENGTH,
    BAD_CHECKSUM,
    DENYLISTED
}
