package com.sitecraft.source;

public record DiscoveryError(String sourceId, String message) {
}
