package com.vaultstake.controller;

import com.vaultstake.dto.StakingRequests;
import com.vaultstake.dto.StakingResponses;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Receipt callback for assets delivered into custody. Every receipt is accepted.
 */
@RestController
@RequestMapping("/api/custody")
public class CustodyController {

    private static final Logger log = LoggerFactory.getLogger(CustodyController.class);

    @PostMapping("/receipts")
    public ResponseEntity<StakingResponses.AssetReceiptAck> acknowledgeReceipt(
            @Valid @RequestBody StakingRequests.AssetReceiptRequest request
    ) {
        log.debug("Acknowledged receipt of asset {} from {} (operator={})",
                request.assetId(), request.from(), request.operator());
        return ResponseEntity.ok(new StakingResponses.AssetReceiptAck(request.assetId(), true));
    }
}
