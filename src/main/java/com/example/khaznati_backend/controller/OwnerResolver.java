package com.example.khaznati_backend.controller;

import com.example.khaznati_backend.exception.NotFoundException;
import com.example.khaznati_backend.model.Account;
import com.example.khaznati_backend.service.AccountService;
import com.example.khaznati_backend.service.UploadCoordinator;
import com.example.khaznati_backend.service.UploadHandle;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Maps the {@code owner} request parameter (external subject) to an account id.
 */
@Component
class OwnerResolver {
    private final AccountService accountService;

    OwnerResolver(AccountService accountService) {
        this.accountService = accountService;
    }

    /** Existing owner; unknown subjects are a 404. */
    UUID existing(String ownerExternalSubject) {
        return accountService.getByExternalSubjectOrThrow(ownerExternalSubject).getId();
    }

    /** Creates the account on first use. */
    UUID ensure(String ownerExternalSubject) {
        Account account = accountService.ensureByExternalSubject(ownerExternalSubject, null);
        return account.getId();
    }

    UploadHandle ownedUpload(UploadCoordinator uploads, UUID uploadId, String ownerExternalSubject) {
        UploadHandle handle = new UploadHandle(uploadId);
        if (!uploads.ownerOf(handle).equals(existing(ownerExternalSubject))) {
            throw new NotFoundException("Upload not found: " + uploadId);
        }
        return handle;
    }
}
