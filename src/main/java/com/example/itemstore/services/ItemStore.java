package com.example.itemstore.services;

import java.util.List;

import com.example.itemstore.error.exception.ItemNotFoundException;
import com.example.itemstore.error.exception.ItemValidationException;
import com.example.itemstore.models.Item;
import com.example.itemstore.models.ItemCreateRequest;
import com.example.itemstore.models.ItemUpdateRequest;

/**
 * Holds every item for the lifetime of the application.
 *
 * <p>Ids are assigned from a counter that only moves forward, so an id is never handed out twice,
 * even after the item that held it was deleted.
 */
public interface ItemStore {

    /**
     * @return all items in insertion order
     */
    List<Item> list();

    /**
     * @throws ItemNotFoundException if no item has this id
     */
    Item get(long id);

    /**
     * Assigns the next id and stores a new item. A missing quantity defaults to 0.
     *
     * @throws ItemValidationException if name is empty or price is missing
     */
    Item create(ItemCreateRequest request);

    /**
     * Overwrites the fields present in {@code request} and keeps the rest.
     *
     * @throws ItemNotFoundException if no item has this id
     * @throws ItemValidationException if a present field is null or a present name is empty;
     *         description is the only field that may be cleared
     */
    Item update(long id, ItemUpdateRequest request);

    /**
     * @return the removed item
     * @throws ItemNotFoundException if no item has this id
     */
    Item delete(long id);
}
