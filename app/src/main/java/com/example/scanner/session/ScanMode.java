package com.example.scanner.session;

public enum ScanMode {
    CAMERA,
    UPLOAD
}
