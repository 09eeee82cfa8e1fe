package com.aigreentick.services.otprelay.repository;

import com.aigreentick.services.otprelay.exception.MappingLockTimeoutException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MappingFileLockTest {

    @TempDir
    Path tempDir;

    @Test
    void acquire_HeldElsewhere_TimesOut() {
        // Given
        Path lockFile = tempDir.resolve("mappings.json.lock");
        MappingFileLock holder = new MappingFileLock(lockFile, Duration.ofSeconds(1));
        MappingFileLock contender = new MappingFileLock(lockFile, Duration.ofMillis(200));

        // When/Then
        try (MappingFileLock.Handle ignored = holder.acquire()) {
            assertThatThrownBy(contender::acquire).isInstanceOf(MappingLockTimeoutException.class);
        }
    }

    @Test
    void acquire_AfterRelease_Succeeds() {
        // Given
        Path lockFile = tempDir.resolve("mappings.json.lock");
        MappingFileLock first = new MappingFileLock(lockFile, Duration.ofSeconds(1));
        MappingFileLock second = new MappingFileLock(lockFile, Duration.ofSeconds(1));

        // When
        first.acquire().close();

        // Then
        try (MappingFileLock.Handle handle = second.acquire()) {
            assertThat(handle).isNotNull();
        }
    }

    @Test
    void put_LockHeld_StillUpdatesMemory() {
        // Given
        Path mappingsFile = tempDir.resolve("mappings.json");
        JsonFileNumberMappingStore store =
                new JsonFileNumberMappingStore(new ObjectMapper(), mappingsFile, Duration.ofMillis(200));
        store.init();
        MappingFileLock holder = new MappingFileLock(
                tempDir.resolve("mappings.json.lock").toAbsolutePath(), Duration.ofSeconds(1));

        // When
        try (MappingFileLock.Handle ignored = holder.acquire()) {
            store.put("8801799999", 5L);
        }

        // Then
        assertThat(store.snapshot()).containsEntry("8801799999", 5L);
        assertThat(mappingsFile).doesNotExist();
    }

    @Test
    void put_ReAllocationKeptInMemory_SurvivesNextWriteAndIsPersisted() {
        // Given
        Path mappingsFile = tempDir.resolve("mappings.json");
        JsonFileNumberMappingStore store =
                new JsonFileNumberMappingStore(new ObjectMapper(), mappingsFile, Duration.ofMillis(200));
        store.init();
        store.put("8801799999", 1L);
        MappingFileLock holder = new MappingFileLock(
                tempDir.resolve("mappings.json.lock").toAbsolutePath(), Duration.ofSeconds(1));
        try (MappingFileLock.Handle ignored = holder.acquire()) {
            store.put("8801799999", 2L);
        }

        // When
        store.put("8801711111", 3L);

        // Then
        assertThat(store.snapshot())
                .containsEntry("8801799999", 2L)
                .containsEntry("8801711111", 3L);
        assertThat(store.load())
                .containsEntry("8801799999", 2L)
                .containsEntry("8801711111", 3L);
    }
}
