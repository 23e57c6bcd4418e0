package com.example.itemstore.error.exception;

import com.example.itemstore.error.ItemErrorCode;

public class ItemNotFoundException extends BaseException {
    public ItemNotFoundException() {
        super(ItemErrorCode.ITEM_NOT_FOUND);
    }
}
