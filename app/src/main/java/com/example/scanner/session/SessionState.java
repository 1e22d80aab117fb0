package com.example.scanner.session;

public enum SessionState {
    IDLE,
    REQUESTING_PERMISSION,
    INITIALIZING,
    ACTIVE,
    SWITCHING_CAMERA,
    EMERGENCY_STOPPED,
    ERROR
}
