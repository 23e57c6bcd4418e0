package com.example.itemstore.models;

import java.util.List;

public record ItemListResponse(List<Item> items, int count) {

    public static ItemListResponse of(List<Item> items) {
        return new ItemListResponse(items, items.size());
    }
}
