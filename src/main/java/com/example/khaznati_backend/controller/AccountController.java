package com.example.khaznati_backend.controller;

import com.example.khaznati_backend.dto.web.UsageResponse;
import com.example.khaznati_backend.service.AccountService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Exposes storage usage for UI consumption.
 */
@RestController
@RequestMapping("/v1/account")
public class AccountController {
    private static final Logger LOGGER = LoggerFactory.getLogger(AccountController.class);
    private final AccountService accountService;
    private final OwnerResolver owners;

    public AccountController(AccountService accountService, OwnerResolver owners) {
        this.accountService = accountService;
        this.owners = owners;
    }

    /**
     * Returns used and allowed bytes for the requested account.
     *
     * @param owner account identifier (external subject)
     * @return usage DTO; {@code quotaBytes=-1} means unlimited
     */
    @GetMapping("/usage")
    public UsageResponse usage(@RequestParam("owner") String owner) {
        AccountService.OwnerUsage usage = accountService.getOwner(owners.existing(owner));
        LOGGER.info("AccountController usage owner={} used={} quota={}", usage.ownerId(), usage.usedBytes(), usage.quotaBytes());
        return new UsageResponse(usage.usedBytes(), usage.quotaBytes(), usage.isUnlimited());
    }
}
