package com.sitecraft.build;

public enum BuildMode {
    /** Discards the loaded cache before discovery. */
    FULL,
    INCREMENTAL
}
