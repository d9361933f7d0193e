package com.example.khaznati_backend.service;

import com.example.khaznati_backend.exception.ConflictException;
import com.example.khaznati_backend.exception.IncompleteException;
import com.example.khaznati_backend.exception.NotFoundException;
import com.example.khaznati_backend.model.Account;
import com.example.khaznati_backend.model.StoredFile;
import com.example.khaznati_backend.repository.AccountRepository;
import com.example.khaznati_backend.repository.StoredFileRepository;
import com.example.khaznati_backend.service.Interfaces.ChunkIndex;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataJpaTest
@Import(JpaChunkIndex.class)
class JpaChunkIndexTest {

    @Autowired
    private ChunkIndex chunkIndex;

    @Autowired
    private AccountRepository accountRepository;

    @Autowired
    private StoredFileRepository fileRepository;

    private StoredFile file;

    @BeforeEach
    void setUp() {
        Account owner = accountRepository.saveAndFlush(new Account("ext-" + UUID.randomUUID(), "Owner", -1));
        StoredFile stored = new StoredFile(owner, "clip.mp4", 25);
        stored.setBackend("local");
        stored.setChunkCount(3);
        file = fileRepository.saveAndFlush(stored);
    }

    @Test
    void listsChunksInSequenceOrder() {
        chunkIndex.append(file.getId(), 2, "loc-2", 5);
        chunkIndex.append(file.getId(), 0, "loc-0", 10);
        chunkIndex.append(file.getId(), 1, "loc-1", 10);

        assertThat(chunkIndex.listOrdered(file.getId()))
                .extracting(ChunkIndex.ChunkRecord::locator)
                .containsExactly("loc-0", "loc-1", "loc-2");
    }

    @Test
    void sameSequenceIndexTwiceIsConflict() {
        chunkIndex.append(file.getId(), 0, "loc-0", 10);

        assertThatThrownBy(() -> chunkIndex.append(file.getId(), 0, "loc-other", 10))
                .isInstanceOf(ConflictException.class);
    }

    @Test
    void gapIsReportedAsIncompleteButStillListedForCleanup() {
        chunkIndex.append(file.getId(), 0, "loc-0", 10);
        chunkIndex.append(file.getId(), 2, "loc-2", 5);

        assertThatThrownBy(() -> chunkIndex.listOrdered(file.getId()))
                .isInstanceOf(IncompleteException.class);
        assertThat(chunkIndex.listAll(file.getId()))
                .extracting(ChunkIndex.ChunkRecord::sequenceIndex)
                .containsExactly(0, 2);
    }

    @Test
    void deleteAllRemovesEveryChunk() {
        chunkIndex.append(file.getId(), 0, "loc-0", 10);
        chunkIndex.append(file.getId(), 1, "loc-1", 10);

        chunkIndex.deleteAll(file.getId());

        assertThat(chunkIndex.listAll(file.getId())).isEmpty();
    }

    @Test
    void rejectsUnknownFileAndBadInput() {
        assertThatThrownBy(() -> chunkIndex.append(UUID.randomUUID(), 0, "loc", 1))
                .isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> chunkIndex.append(file.getId(), -1, "loc", 1))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> chunkIndex.append(file.getId(), 0, " ", 1))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
