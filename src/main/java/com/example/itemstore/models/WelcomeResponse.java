package com.example.itemstore.models;

import java.util.Map;

public record WelcomeResponse(String message, Map<String, String> endpoints) {
}
