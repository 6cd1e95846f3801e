package com.vaultstake.controller;

import com.vaultstake.dto.StakingResponses;
import com.vaultstake.service.StakingAdminService;
import com.vaultstake.web.StakingException;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.OffsetDateTime;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(StakingAdminController.class)
class StakingAdminControllerTest {

    private static final String ADMIN = "0x9999999999999999999999999999999999999999";

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private StakingAdminService stakingAdminService;

    @Test
    void initialize_returnsCreatedSummary() throws Exception {
        when(stakingAdminService.initialize(anyString(), any())).thenReturn(summary(false));

        String requestBody = """
                {
                  "collectionAddress": "0x2222222222222222222222222222222222222222",
                  "rewardTokenAddress": "0x3333333333333333333333333333333333333333",
                  "rewardPerBlock": 100,
                  "earlyExitTax": 1000,
                  "stakeLimit": 10,
                  "carryAmount": 500,
                  "stakingDurationHours": 2160,
                  "unbondingPeriodHours": 168
                }
                """;

        mockMvc.perform(post("/api/admin/staking/initialize")
                        .header("X-Wallet-Address", ADMIN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(requestBody))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.initialized").value(true))
                .andExpect(jsonPath("$.stakeLimit").value(10));
    }

    @Test
    void initialize_rejectsMissingFields() throws Exception {
        mockMvc.perform(post("/api/admin/staking/initialize")
                        .header("X-Wallet-Address", ADMIN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"collectionAddress\": \"0x2222222222222222222222222222222222222222\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_REQUEST"))
                .andExpect(jsonPath("$.fieldErrors.rewardTokenAddress").value("rewardTokenAddress is required"));

        verify(stakingAdminService, never()).initialize(anyString(), any());
    }

    @Test
    void setStakeLimit_mapsUnauthorizedToForbidden() throws Exception {
        when(stakingAdminService.setStakeLimit(ADMIN, 5L)).thenThrow(StakingException.unauthorized("SET_STAKE_LIMIT"));

        mockMvc.perform(put("/api/admin/staking/stake-limit")
                        .header("X-Wallet-Address", ADMIN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"value\": 5}"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("UNAUTHORIZED"));
    }

    @Test
    void setUnbondingPeriod_rejectsNegativeHours() throws Exception {
        mockMvc.perform(put("/api/admin/staking/unbonding-period")
                        .header("X-Wallet-Address", ADMIN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"hours\": -1}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.fieldErrors.hours").value("hours must be non-negative"));
    }

    @Test
    void setStakingEndTime_rejectsHoursBeyondHundredYears() throws Exception {
        mockMvc.perform(put("/api/admin/staking/staking-end-time")
                        .header("X-Wallet-Address", ADMIN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"hours\": 9223372036854775807}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_REQUEST"))
                .andExpect(jsonPath("$.fieldErrors.hours").value("hours must be at most 876000"));

        verify(stakingAdminService, never()).setStakingEndTime(anyString(), anyLong());
    }

    @Test
    void initialize_rejectsOversizedDurations() throws Exception {
        String requestBody = """
                {
                  "collectionAddress": "0x2222222222222222222222222222222222222222",
                  "rewardTokenAddress": "0x3333333333333333333333333333333333333333",
                  "rewardPerBlock": 100,
                  "earlyExitTax": 1000,
                  "stakeLimit": 10,
                  "carryAmount": 500,
                  "stakingDurationHours": 876001,
                  "unbondingPeriodHours": 99999999999
                }
                """;

        mockMvc.perform(post("/api/admin/staking/initialize")
                        .header("X-Wallet-Address", ADMIN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(requestBody))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.fieldErrors.stakingDurationHours").value("stakingDurationHours must be at most 876000"))
                .andExpect(jsonPath("$.fieldErrors.unbondingPeriodHours").value("unbondingPeriodHours must be at most 876000"));

        verify(stakingAdminService, never()).initialize(anyString(), any());
    }

    @Test
    void pause_returnsPausedSummary() throws Exception {
        when(stakingAdminService.pause(ADMIN)).thenReturn(summary(true));

        mockMvc.perform(post("/api/admin/staking/pause").header("X-Wallet-Address", ADMIN))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.paused").value(true));
    }

    @Test
    void withdrawAsset_returnsRecipient() throws Exception {
        when(stakingAdminService.forceWithdrawAsset(ADMIN, "asset-1")).thenReturn(
                new StakingResponses.AssetWithdrawal("asset-1", "0x1111111111111111111111111111111111111111", true, 500L));

        mockMvc.perform(post("/api/admin/staking/assets/asset-1/withdraw").header("X-Wallet-Address", ADMIN))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.entryRemoved").value(true))
                .andExpect(jsonPath("$.carryReturned").value(500));
    }

    private static StakingResponses.PoolSummary summary(boolean paused) {
        return new StakingResponses.PoolSummary(
                true, paused, "0x2222222222222222222222222222222222222222", "0x3333333333333333333333333333333333333333",
                OffsetDateTime.parse("2025-09-01T00:00:00Z"), 604_800L, 100L, 10L, 500L, 1_000L, 0L, 0L, 0L
        );
    }
}
