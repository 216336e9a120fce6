package com.omkar.case_sync.shared;

public enum ErrorKind {
    TRANSPORT,        // network unreachable, timeout
    UPSTREAM_STATUS,  // Intempus answered with a 4xx/5xx
    LOCAL_STORE,      // local write or commit failed
    VALIDATION,       // request rejected before reaching Intempus
    INTERNAL
}
