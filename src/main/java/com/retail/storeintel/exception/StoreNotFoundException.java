package com.retail.storeintel.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.NOT_FOUND)
public class StoreNotFoundException extends RuntimeException {

    private final String storeId;

    public StoreNotFoundException(String storeId) {
        super("Store not found: " + storeId);
        this.storeId = storeId;
    }

    public String getStoreId() {
        return storeId;
    }
}
