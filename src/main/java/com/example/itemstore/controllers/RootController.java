package com.example.itemstore.controllers;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import com.example.itemstore.config.ItemStoreProperties;
import com.example.itemstore.models.WelcomeResponse;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import lombok.RequiredArgsConstructor;

@RestController
@RequiredArgsConstructor
public class RootController {

    private static final Map<String, String> ENDPOINTS;

    static {
        Map<String, String> endpoints = new LinkedHashMap<>();
        endpoints.put("GET /items", "Get all items");
        endpoints.put("GET /items/{id}", "Get item by ID");
        endpoints.put("POST /items", "Create new item");
        endpoints.put("PUT /items/{id}", "Update item");
        endpoints.put("DELETE /items/{id}", "Delete item");
        ENDPOINTS = Collections.unmodifiableMap(endpoints);
    }

    private final ItemStoreProperties properties;

    @GetMapping("/")
    public WelcomeResponse welcome() {
        return new WelcomeResponse(properties.welcomeMessage(), ENDPOINTS);
    }
}
