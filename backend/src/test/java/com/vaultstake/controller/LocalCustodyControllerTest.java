package com.vaultstake.controller;

import com.vaultstake.config.StakingProperties;
import com.vaultstake.custody.CustodyTransferException;
import com.vaultstake.custody.LedgerAssetCustodian;
import com.vaultstake.custody.LedgerRewardTokenLedger;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = LocalCustodyController.class, properties = "staking.custody.local-faucet-enabled=true")
class LocalCustodyControllerTest {

    private static final String HOLDER = "0x1111111111111111111111111111111111111111";

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private LedgerAssetCustodian assetCustodian;

    @MockitoBean
    private LedgerRewardTokenLedger rewardTokenLedger;

    @MockitoBean
    private StakingProperties stakingProperties;

    @Test
    void mintAsset_assignsAssetToNormalizedHolder() throws Exception {
        mockMvc.perform(post("/api/custody/local/assets")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"assetId\": \"asset-1\", \"holder\": \"" + HOLDER + "\"}"))
                .andExpect(status().isCreated());

        verify(assetCustodian).mint("asset-1", HOLDER);
    }

    @Test
    void mintAsset_mapsCustodyConflictToBadGateway() throws Exception {
        doThrow(new CustodyTransferException("Asset is held in custody: asset-1"))
                .when(assetCustodian).mint("asset-1", HOLDER);

        mockMvc.perform(post("/api/custody/local/assets")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"assetId\": \"asset-1\", \"holder\": \"" + HOLDER + "\"}"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.code").value("CUSTODY_TRANSFER_FAILED"));
    }

    @Test
    void creditTokens_returnsNewBalance() throws Exception {
        when(rewardTokenLedger.balanceOf(HOLDER)).thenReturn(2_500L);

        mockMvc.perform(post("/api/custody/local/tokens")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"holder\": \"" + HOLDER + "\", \"amount\": 2500}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.balance").value(2500));

        verify(rewardTokenLedger).credit(HOLDER, 2_500L);
    }

    @Test
    void balance_rejectsInvalidWallet() throws Exception {
        mockMvc.perform(get("/api/custody/local/tokens/not-a-wallet"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_WALLET_ADDRESS"));
    }
}
