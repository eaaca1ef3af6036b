package com.platform.chaoslab.chaos;

/**
 * Category tag carried by every injected fault.
 * 
 * Categories form a small tree so that a caller matching a broad category
 * (e.g. any timeout) also matches the narrower ones beneath it.
 */
public enum FailureCategory {
    RUNTIME(null),
    TIMEOUT(null),
    INVALID_VALUE(null),
    APPLICATION_ERROR(RUNTIME),
    PARTIAL_FAILURE(RUNTIME),
    RESOURCE_EXHAUSTION(RUNTIME),
    CHAOS_TIMEOUT(TIMEOUT),
    DATA_CORRUPTION(INVALID_VALUE);
    
    private final FailureCategory parent;
    
    FailureCategory(FailureCategory parent) {
        this.parent = parent;
    }
    
    public FailureCategory getParent() {
        return parent;
    }
    
    /**
     * True if this category equals {@code other} or is nested beneath it.
     */
    public boolean isA(FailureCategory other) {
        for (FailureCategory c = this; c != null; c = c.parent) {
            if (c == other) {
                return true;
            }
        }
        return false;
    }
}
