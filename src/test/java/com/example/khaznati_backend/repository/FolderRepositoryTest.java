package com.example.khaznati_backend.repository;

import com.example.khaznati_backend.model.Account;
import com.example.khaznati_backend.model.Folder;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.dao.DataIntegrityViolationException;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

@DataJpaTest
class FolderRepositoryTest {

    @Autowired
    private AccountRepository accountRepository;

    @Autowired
    private FolderRepository folderRepository;

    @Test
    void siblingNamesAreUniqueUnderOneParent() {
        Account owner = accountRepository.saveAndFlush(new Account("ext-" + UUID.randomUUID(), "Owner", -1));
        Folder parent = folderRepository.saveAndFlush(new Folder(owner, null, "Projects"));
        folderRepository.saveAndFlush(new Folder(owner, parent, "2026"));

        assertThrows(DataIntegrityViolationException.class,
                () -> folderRepository.saveAndFlush(new Folder(owner, parent, "2026")));
    }

    @Test
    void sameNameUnderDifferentParentsIsAllowed() {
        Account owner = accountRepository.saveAndFlush(new Account("ext-" + UUID.randomUUID(), "Owner", -1));
        Folder a = folderRepository.saveAndFlush(new Folder(owner, null, "a"));
        Folder b = folderRepository.saveAndFlush(new Folder(owner, null, "b"));

        folderRepository.saveAndFlush(new Folder(owner, a, "shared"));
        folderRepository.saveAndFlush(new Folder(owner, b, "shared"));

        assertThat(folderRepository.findByOwnerIdAndParentIdOrderByNameAsc(owner.getId(), a.getId())).hasSize(1);
        assertThat(folderRepository.findByOwnerIdAndParentIdOrderByNameAsc(owner.getId(), b.getId())).hasSize(1);
    }
}
