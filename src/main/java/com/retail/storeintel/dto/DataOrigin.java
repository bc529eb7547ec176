package com.retail.storeintel.dto;

public enum DataOrigin {
    PROVIDER,
    FALLBACK
}
