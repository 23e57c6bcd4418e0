package com.example.itemstore.models;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * A stored item. Instances are immutable; updates replace the stored snapshot.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class Item {
    long id;
    String name;
    String description;
    double price;
    int quantity;
}
