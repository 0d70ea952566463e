package com.sitecraft.source;

public enum ArtifactKind {
    CONTENT,
    TEMPLATE,
    PARTIAL,
    DATA,
    CONFIG,
    ASSET
}
