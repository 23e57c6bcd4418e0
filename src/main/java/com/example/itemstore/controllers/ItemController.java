package com.example.itemstore.controllers;

import com.example.itemstore.models.Item;
import com.example.itemstore.models.ItemCreateRequest;
import com.example.itemstore.models.ItemListResponse;
import com.example.itemstore.models.ItemResponse;
import com.example.itemstore.models.ItemUpdateRequest;
import com.example.itemstore.services.ItemStore;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

@RestController
@RequestMapping("/items")
@RequiredArgsConstructor
public class ItemController {

    private final ItemStore itemStore;

    @GetMapping
    public ItemListResponse getItems() {
        return ItemListResponse.of(itemStore.list());
    }

    @GetMapping("/{id}")
    public Item getItem(@PathVariable("id") long id) {
        return itemStore.get(id);
    }

    @PostMapping
    public ResponseEntity<ItemResponse> createItem(@Valid @RequestBody ItemCreateRequest request) {
        Item created = itemStore.create(request);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(new ItemResponse("Item created successfully", created));
    }

    @PutMapping("/{id}")
    public ItemResponse updateItem(@PathVariable("id") long id, @Valid @RequestBody ItemUpdateRequest request) {
        return new ItemResponse("Item updated successfully", itemStore.update(id, request));
    }

    @DeleteMapping("/{id}")
    public ItemResponse deleteItem(@PathVariable("id") long id) {
        return new ItemResponse("Item deleted successfully", itemStore.delete(id));
    }
}
