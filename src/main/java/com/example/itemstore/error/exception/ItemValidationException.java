package com.example.itemstore.error.exception;

import com.example.itemstore.error.ItemErrorCode;

public class ItemValidationException extends BaseException {
    public ItemValidationException(String reason) {
        super(ItemErrorCode.INVALID_INPUT_VALUE, reason);
    }
}
