package com.example.scanner.camera;

public enum PermissionState {
    GRANTED,
    DENIED,
    PROMPT,
    UNKNOWN
}
