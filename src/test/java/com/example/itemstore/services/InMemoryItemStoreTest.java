package com.example.itemstore.services;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import java.util.stream.LongStream;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.example.itemstore.error.exception.ItemNotFoundException;
import com.example.itemstore.error.exception.ItemValidationException;
import com.example.itemstore.models.Item;
import com.example.itemstore.models.ItemCreateRequest;
import com.example.itemstore.models.ItemUpdateRequest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryItemStoreTest {

    private InMemoryItemStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryItemStore();
    }

    @Test
    @DisplayName("Widget/Gadget scenario: ids 1 and 2, deleting 1 leaves 2 reachable")
    void widgetGadgetScenario() {
        Item widget = store.create(create("Widget", 9.99, null));
        assertThat(widget).isEqualTo(Item.builder()
                .id(1).name("Widget").description(null).price(9.99).quantity(0).build());

        Item gadget = store.create(ItemCreateRequest.builder().name("Gadget").price(5.0).quantity(3).build());
        assertThat(gadget.getId()).isEqualTo(2);
        assertThat(gadget.getQuantity()).isEqualTo(3);

        store.delete(1);

        assertThatThrownBy(() -> store.get(1)).isInstanceOf(ItemNotFoundException.class);
        assertThat(store.get(2)).isEqualTo(gadget);
    }

    @Test
    void idsKeepIncreasingAcrossDeletes() {
        long previous = 0;
        for (int i = 0; i < 10; i++) {
            Item item = store.create(create("item-" + i, i, null));
            assertThat(item.getId()).isGreaterThan(previous);
            previous = item.getId();
            if (i % 2 == 0) {
                store.delete(item.getId());
            }
        }

        Item last = store.create(create("last", 1.0, null));
        assertThat(last.getId()).isEqualTo(11);
    }

    @Test
    void getReturnsWhatCreateReturned() {
        Item created = store.create(ItemCreateRequest.builder()
                .name("Lamp").description("desk lamp").price(12.5).quantity(4).build());

        assertThat(store.get(created.getId())).isEqualTo(created);
    }

    @Test
    void listCountTracksCreatesMinusDeletes() {
        store.create(create("a", 1, null));
        Item b = store.create(create("b", 2, null));
        store.create(create("c", 3, null));
        store.delete(b.getId());

        assertThat(store.list()).extracting(Item::getName).containsExactly("a", "c");
    }

    @Test
    void listIsASnapshot() {
        store.create(create("a", 1, null));
        List<Item> snapshot = store.list();
        store.create(create("b", 2, null));

        assertThat(snapshot).hasSize(1);
        assertThat(store.list()).hasSize(2);
    }

    @Test
    void createRejectsEmptyNameAndMissingPrice() {
        assertThatThrownBy(() -> store.create(create("", 1.0, null)))
                .isInstanceOf(ItemValidationException.class)
                .hasMessageContaining("name");
        assertThatThrownBy(() -> store.create(ItemCreateRequest.builder().name("x").build()))
                .isInstanceOf(ItemValidationException.class)
                .hasMessageContaining("price");

        assertThat(store.list()).isEmpty();
        assertThat(store.create(create("ok", 1.0, null)).getId()).isEqualTo(1);
    }

    @Test
    void whitespaceNameIsAccepted() {
        Item created = store.create(create("   ", 1.0, null));

        assertThat(created.getName()).isEqualTo("   ");
    }

    @Test
    @DisplayName("Concurrent creates get distinct ids 1..N")
    void concurrentCreatesNeverShareAnId() throws Exception {
        int threads = 8;
        int perThread = 250;
        int total = threads * perThread;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<List<Long>>> futures = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    List<Long> ids = new ArrayList<>();
                    for (int i = 0; i < perThread; i++) {
                        ids.add(store.create(create("item", 1.0, null)).getId());
                    }
                    return ids;
                }));
            }
            start.countDown();

            Set<Long> ids = new HashSet<>();
            for (Future<List<Long>> future : futures) {
                ids.addAll(future.get(30, TimeUnit.SECONDS));
            }

            assertThat(ids).hasSize(total);
            assertThat(ids).containsAll(LongStream.rangeClosed(1, total).boxed().collect(Collectors.toList()));
            assertThat(store.list()).hasSize(total);
        } finally {
            executor.shutdownNow();
            assertThat(executor.awaitTermination(10, TimeUnit.SECONDS)).isTrue();
        }
    }

    @Test
    void emptyUpdateLeavesItemUnchanged() {
        Item created = store.create(create("Widget", 9.99, "blue"));

        Item updated = store.update(created.getId(), new ItemUpdateRequest());

        assertThat(updated).isEqualTo(created);
        assertThat(store.get(created.getId())).isEqualTo(created);
    }

    @Test
    void priceOnlyUpdateTouchesOnlyPrice() {
        Item created = store.create(ItemCreateRequest.builder()
                .name("Widget").description("blue").price(9.99).quantity(7).build());
        ItemUpdateRequest request = new ItemUpdateRequest();
        request.setPrice(Optional.of(4.5));

        Item updated = store.update(created.getId(), request);

        assertThat(updated.getPrice()).isEqualTo(4.5);
        assertThat(updated.getId()).isEqualTo(created.getId());
        assertThat(updated.getName()).isEqualTo("Widget");
        assertThat(updated.getDescription()).isEqualTo("blue");
        assertThat(updated.getQuantity()).isEqualTo(7);
        assertThat(store.get(created.getId())).isEqualTo(updated);
    }

    @Test
    void explicitNullClearsDescription() {
        Item created = store.create(create("Widget", 9.99, "blue"));
        ItemUpdateRequest request = new ItemUpdateRequest();
        request.setDescription(Optional.empty());

        assertThat(store.update(created.getId(), request).getDescription()).isNull();
    }

    @Test
    void explicitNullOnRequiredFieldIsRejected() {
        Item created = store.create(create("Widget", 9.99, null));
        ItemUpdateRequest request = new ItemUpdateRequest();
        request.setName(Optional.of("Renamed"));
        request.setQuantity(Optional.empty());

        assertThatThrownBy(() -> store.update(created.getId(), request))
                .isInstanceOf(ItemValidationException.class)
                .hasMessageContaining("quantity");
        assertThat(store.get(created.getId())).isEqualTo(created);
    }

    @Test
    void updateAndDeleteOfMissingItemFail() {
        assertThatThrownBy(() -> store.update(99, new ItemUpdateRequest()))
                .isInstanceOf(ItemNotFoundException.class);
        assertThatThrownBy(() -> store.delete(99))
                .isInstanceOf(ItemNotFoundException.class);
    }

    @Test
    void deleteReturnsRemovedItem() {
        Item created = store.create(create("Widget", 9.99, null));

        assertThat(store.delete(created.getId())).isEqualTo(created);
        assertThatThrownBy(() -> store.delete(created.getId())).isInstanceOf(ItemNotFoundException.class);
    }

    private static ItemCreateRequest create(String name, double price, String description) {
        return ItemCreateRequest.builder().name(name).price(price).description(description).build();
    }
}
