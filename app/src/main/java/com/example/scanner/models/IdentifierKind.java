package com.example.scanner.models;

public enum IdentifierKind {
    IMEI,
    MOBILE
}
