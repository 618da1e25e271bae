package com.lendingpool.util;

/**
 * Normalizer for asset identifiers (token symbols or 0x addresses).
 */
public final class AssetIds {
    private AssetIds(){}

    public static String normalize(String asset) {
        if (asset == null) throw new IllegalArgumentException("asset is null");
        String trimmed = asset.trim();
        if (trimmed.isEmpty()) throw new IllegalArgumentException("asset is blank");
        if (trimmed.startsWith("0x") || trimmed.startsWith("0X")) {
            String hex = trimmed.substring(2);
            if (hex.length() != 40) throw new IllegalArgumentException("invalid address length (need 40 hex chars): " + asset);
            return "0x" + hex.toLowerCase();
        }
        return trimmed.toUpperCase();
    }
}
