package com.sitecraft.build;

public enum FailureCategory {
    DISCOVERY(false),
    PARSE(false),
    RENDER(false),
    WRITE(false),
    TIMEOUT(false),
    CONFIG(true),
    CACHE_COMMIT(true),
    IO(true),
    CANCELLED(true);

    private final boolean cycleFatal;

    FailureCategory(boolean cycleFatal) {
        this.cycleFatal = cycleFatal;
    }

    public boolean isCycleFatal() {
        return cycleFatal;
    }
}
