package com.example.itemstore.models;

public record ItemResponse(String message, Item item) {
}
