package com.example.feedsync.exception;

/**
 * The item is gone or private at the metadata source.
 */
public class ItemNotFoundException extends RuntimeException {

    private final String itemId;

    public ItemNotFoundException(String itemId) {
        super("Item not found: " + itemId);
        this.itemId = itemId;
    }

    public ItemNotFoundException(String itemId, Throwable cause) {
        super("Item not found: " + itemId, cause);
        this.itemId = itemId;
    }

    public String getItemId() {
        return itemId;
    }
}
