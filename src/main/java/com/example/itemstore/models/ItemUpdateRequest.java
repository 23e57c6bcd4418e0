package com.example.itemstore.models;

import java.util.Optional;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;

import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Partial update payload.
 *
 * <p>A {@code null} field means the key was absent from the request and the stored value is kept.
 * A non-null {@link Optional} means the key was present; {@link Optional#empty()} stands for an
 * explicit JSON {@code null}, which only {@code description} accepts.
 */
@Data
@NoArgsConstructor
public class ItemUpdateRequest {

    private Optional<@NotEmpty String> name;

    private Optional<String> description;

    private Optional<@NotNull Double> price;

    private Optional<@NotNull Integer> quantity;

    public boolean hasChanges() {
        return name != null || description != null || price != null || quantity != null;
    }
}
