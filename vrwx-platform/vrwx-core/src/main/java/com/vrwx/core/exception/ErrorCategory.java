package com.vrwx.core.exception;

public enum ErrorCategory {
    AUTHORIZATION,
    STATE,
    VALIDATION,
    RESOURCE
}
