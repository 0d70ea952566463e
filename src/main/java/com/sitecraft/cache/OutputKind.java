package com.sitecraft.cache;

public enum OutputKind {
    PAGE,
    AGGREGATE,
    ASSET
}
