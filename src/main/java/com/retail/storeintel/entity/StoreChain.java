package com.retail.storeintel.entity;

/**
 * Retail chains tracked by the service. {@link #V_MART} is the own brand,
 * every other value is a competitor chain.
 */
public enum StoreChain {

    V_MART("V-Mart"),
    V2_RETAIL("V2 Retail"),
    ZUDIO("Zudio"),
    STYLE_BAZAR("Style Bazar"),
    MAX_FASHION("Max Fashion"),
    RELIANCE_TRENDS("Reliance Trends"),
    PANTALOONS("Pantaloons"),
    SHOPPERS_STOP("Shoppers Stop"),
    LIFESTYLE("Lifestyle"),
    WESTSIDE("Westside"),
    OTHER("Other");

    private final String displayName;

    StoreChain(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    public boolean isOwnBrand() {
        return this == V_MART;
    }

    /**
     * Resolve a chain from its enum name or display name, case-insensitive.
     *
     * @throws IllegalArgumentException if nothing matches
     */
    public static StoreChain fromLabel(String label) {
        if (label == null || label.isBlank()) {
            throw new IllegalArgumentException("Store chain label is blank");
        }
        String normalized = label.trim();
        for (StoreChain chain : values()) {
            if (chain.name().equalsIgnoreCase(normalized)
                    || chain.displayName.equalsIgnoreCase(normalized)) {
                return chain;
            }
        }
        throw new IllegalArgumentException("Unknown store chain: " + label);
    }
}
