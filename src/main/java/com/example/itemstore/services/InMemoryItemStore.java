package com.example.itemstore.services;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.springframework.stereotype.Service;

import com.example.itemstore.error.exception.ItemNotFoundException;
import com.example.itemstore.error.exception.ItemValidationException;
import com.example.itemstore.models.Item;
import com.example.itemstore.models.ItemCreateRequest;
import com.example.itemstore.models.ItemUpdateRequest;

import lombok.extern.slf4j.Slf4j;

/**
 * {@link ItemStore} backed by an insertion-ordered map. The map and the id counter are guarded
 * by this instance's monitor.
 */
@Slf4j
@Service
public class InMemoryItemStore implements ItemStore {

    private final Map<Long, Item> items = new LinkedHashMap<>();
    private long nextId = 1;

    @Override
    public synchronized List<Item> list() {
        return new ArrayList<>(items.values());
    }

    @Override
    public synchronized Item get(long id) {
        log.debug("Looking up item {}", id);
        return find(id);
    }

    @Override
    public synchronized Item create(ItemCreateRequest request) {
        if (request.getName() == null || request.getName().isEmpty()) {
            throw new ItemValidationException("name must not be empty");
        }
        if (request.getPrice() == null) {
            throw new ItemValidationException("price must not be null");
        }
        Item item = Item.builder()
                .id(nextId++)
                .name(request.getName())
                .description(request.getDescription())
                .price(request.getPrice())
                .quantity(request.getQuantity() == null ? 0 : request.getQuantity())
                .build();
        items.put(item.getId(), item);
        log.info("Created item {} ({})", item.getId(), item.getName());
        return item;
    }

    @Override
    public synchronized Item update(long id, ItemUpdateRequest request) {
        Item current = find(id);
        if (!request.hasChanges()) {
            log.debug("Update of item {} carried no fields", id);
            return current;
        }

        Item.ItemBuilder builder = current.toBuilder();
        if (request.getName() != null) {
            String name = required(request.getName(), "name");
            if (name.isEmpty()) {
                throw new ItemValidationException("name must not be empty");
            }
            builder.name(name);
        }
        if (request.getDescription() != null) {
            builder.description(request.getDescription().orElse(null));
        }
        if (request.getPrice() != null) {
            builder.price(required(request.getPrice(), "price"));
        }
        if (request.getQuantity() != null) {
            builder.quantity(required(request.getQuantity(), "quantity"));
        }

        Item updated = builder.build();
        items.put(id, updated);
        log.info("Updated item {}", id);
        return updated;
    }

    @Override
    public synchronized Item delete(long id) {
        Item removed = items.remove(id);
        if (removed == null) {
            log.debug("Item {} not found", id);
            throw new ItemNotFoundException();
        }
        log.info("Deleted item {}", id);
        return removed;
    }

    private Item find(long id) {
        Item item = items.get(id);
        if (item == null) {
            log.debug("Item {} not found", id);
            throw new ItemNotFoundException();
        }
        return item;
    }

    private static <T> T required(Optional<T> value, String field) {
        return value.orElseThrow(() -> new ItemValidationException(field + " must not be null"));
    }
}
