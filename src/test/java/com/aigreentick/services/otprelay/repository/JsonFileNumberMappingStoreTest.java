package com.aigreentick.services.otprelay.repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonFileNumberMappingStoreTest {

    @TempDir
    Path tempDir;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private Path mappingsFile;
    private JsonFileNumberMappingStore store;

    @BeforeEach
    void setUp() {
        mappingsFile = tempDir.resolve("mappings.json");
        store = newStore();
        store.init();
    }

    private JsonFileNumberMappingStore newStore() {
        return new JsonFileNumberMappingStore(objectMapper, mappingsFile, Duration.ofSeconds(5));
    }

    @Test
    void load_MissingFile_ReturnsEmpty() {
        assertThat(store.load()).isEmpty();
        assertThat(store.snapshot()).isEmpty();
    }

    @Test
    void load_CorruptFile_ReturnsEmpty() throws Exception {
        // Given
        Files.writeString(mappingsFile, "{not json");

        // When/Then
        assertThat(store.load()).isEmpty();
    }

    @Test
    void put_PersistsAndReloadsFromDisk() {
        // Given
        store.put("8801799999", 42L);

        // When
        JsonFileNumberMappingStore reopened = newStore();
        reopened.init();

        // Then
        assertThat(reopened.snapshot()).containsEntry("8801799999", 42L);
        assertThat(mappingsFile).exists();
    }

    @Test
    void put_SameNumberTwice_LastOwnerWins() {
        // Given
        store.put("8801799999", 1L);

        // When
        store.put("8801799999", 2L);

        // Then
        assertThat(store.snapshot()).containsExactly(Map.entry("8801799999", 2L));
        assertThat(store.load()).containsEntry("8801799999", 2L);
    }

    @Test
    void put_EmptyNumber_Rejected() {
        assertThatThrownBy(() -> store.put("", 1L)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void put_KeepsEntriesWrittenByAnotherInstance() {
        // Given
        JsonFileNumberMappingStore other = newStore();
        other.init();
        other.put("111111111", 1L);

        // When
        store.put("222222222", 2L);

        // Then
        assertThat(store.load()).containsKeys("111111111", "222222222");
    }

    @Test
    void put_ConcurrentWriters_NoLostUpdates() throws Exception {
        // Given
        int writers = 16;
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();

        // When
        for (int i = 0; i < writers; i++) {
            long subscriber = i;
            String number = "88017" + String.format("%05d", i);
            futures.add(pool.submit(() -> {
                start.await();
                store.put(number, subscriber);
                return null;
            }));
        }
        start.countDown();
        for (Future<?> future : futures) {
            future.get();
        }
        pool.shutdown();

        // Then
        assertThat(store.snapshot()).hasSize(writers);
        assertThat(store.load()).hasSize(writers);
    }

    @Test
    void save_ReplacesContentsAndSnapshot() {
        // Given
        store.put("111111111", 1L);

        // When
        store.save(Map.of("999999999", 9L));

        // Then
        assertThat(store.snapshot()).containsOnlyKeys("999999999");
        assertThat(store.load()).containsOnlyKeys("999999999");
    }

    @Test
    void numbersOwnedBy_FiltersBySubscriber() {
        // Given
        store.put("111111111", 1L);
        store.put("222222222", 2L);
        store.put("333333333", 1L);

        // When/Then
        assertThat(store.numbersOwnedBy(1L)).containsExactly("111111111", "333333333");
        assertThat(store.numbersOwnedBy(7L)).isEmpty();
    }
}
