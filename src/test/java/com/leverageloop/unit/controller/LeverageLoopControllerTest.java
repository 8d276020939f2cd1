package com.leverageloop.unit.controller;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.leverageloop.api.controller.LeverageLoopController;
import com.leverageloop.config.ApiResponseAdvice;
import com.leverageloop.domain.enums.CollateralToken;
import com.leverageloop.domain.enums.LedgerAction;
import com.leverageloop.domain.enums.LoopStatus;
import com.leverageloop.domain.enums.MarketSentiment;
import com.leverageloop.domain.model.LeverageLoop;
import com.leverageloop.domain.model.LeveragePosition;
import com.leverageloop.domain.model.LoopTransaction;
import com.leverageloop.domain.model.LoopsSummary;
import com.leverageloop.domain.model.ReservedBalance;
import com.leverageloop.engine.LeverageLoopEngine;
import com.leverageloop.exception.GlobalExceptionHandler;
import com.leverageloop.ledger.TransactionLog;
import com.leverageloop.store.PositionStore;
import com.leverageloop.support.TestFixtures;
import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

/**
 * Standalone MockMvc tests for the LeverageLoopController.
 */
@ExtendWith(MockitoExtension.class)
class LeverageLoopControllerTest {

    private MockMvc mockMvc;

    @Mock
    private LeverageLoopEngine leverageLoopEngine;

    @Mock
    private PositionStore positionStore;

    @Mock
    private TransactionLog transactionLog;

    @BeforeEach
    void setUp() {
        LeverageLoopController controller = new LeverageLoopController(leverageLoopEngine, positionStore, transactionLog);
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalExceptionHandler(true), new ApiResponseAdvice(true))
                .build();
    }

    @Test
    @DisplayName("POST /api/loops deploys a loop and returns it")
    void openLoop() throws Exception {
        LeverageLoop loop = TestFixtures.loopWithBorrows("loop_1", "1000", "750");
        when(leverageLoopEngine.executeLeverageLoop(
                        any(BigDecimal.class),
                        eq(CollateralToken.SOL),
                        eq(MarketSentiment.BULLISH),
                        eq(2),
                        isNull(),
                        isNull()))
                .thenReturn(loop);

        mockMvc.perform(post("/api/loops")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(
                                """
                                {"initialCapitalUsd": 1000, "collateralToken": "SOL",
                                 "sentiment": "BULLISH", "targetIterations": 2}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.paperTrading").value(true))
                .andExpect(jsonPath("$.data.loopId").value("loop_1"))
                .andExpect(jsonPath("$.data.iterations").value(1))
                .andExpect(jsonPath("$.data.totalExposureUsd").value(750));
    }

    @Test
    @DisplayName("POST /api/loops returns 422 when the engine refuses")
    void openLoopRejected() throws Exception {
        when(leverageLoopEngine.executeLeverageLoop(any(), any(), any(), anyInt(), any(), any()))
                .thenReturn(null);

        mockMvc.perform(post("/api/loops")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(
                                """
                                {"initialCapitalUsd": 1000, "collateralToken": "SOL", "targetIterations": 3}
                                """))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.paperTrading").value(true))
                .andExpect(jsonPath("$.error.code").value("LOOP_REJECTED"))
                .andExpect(jsonPath("$.error.loopId").doesNotExist())
                .andExpect(jsonPath("$.error.details.collateralToken").value("SOL"))
                .andExpect(jsonPath("$.error.details.targetIterations").value(3))
                .andExpect(jsonPath("$.error.details.initialCapitalUsd").value(1000));
    }

    @Test
    @DisplayName("POST /api/loops validates the body")
    void openLoopValidation() throws Exception {
        mockMvc.perform(post("/api/loops")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(
                                """
                                {"initialCapitalUsd": -5, "targetIterations": 0}
                                """))
                .andExpect(status().isBadRequest());

        verify(leverageLoopEngine, never()).executeLeverageLoop(any(), any(), any(), anyInt(), any(), any());
    }

    @Test
    @DisplayName("GET /api/loops/summary returns the active loops summary")
    void summary() throws Exception {
        when(leverageLoopEngine.getActiveLoopsSummary())
                .thenReturn(LoopsSummary.builder()
                        .activeLoops(2)
                        .totalExposureUsd(new BigDecimal("2062.5"))
                        .totalPositions(3)
                        .averageLeverage(new BigDecimal("1.03125"))
                        .loops(List.of())
                        .build());

        mockMvc.perform(get("/api/loops/summary"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.activeLoops").value(2))
                .andExpect(jsonPath("$.data.totalPositions").value(3))
                .andExpect(jsonPath("$.data.averageLeverage").value(1.03125));
    }

    @Test
    @DisplayName("GET /api/loops/{loopId} returns 404 for an unknown loop")
    void unknownLoop() throws Exception {
        when(leverageLoopEngine.findLoop("missing")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/loops/missing"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error.code").value("NOT_FOUND"))
                .andExpect(jsonPath("$.error.loopId").value("missing"))
                .andExpect(jsonPath("$.error.details.identifier").value("missing"))
                .andExpect(jsonPath("$.error.path").value("/api/loops/missing"));
    }

    @Test
    @DisplayName("Unexpected failure under a loop path names that loop in the error")
    void unexpectedFailureCarriesLoopId() throws Exception {
        when(leverageLoopEngine.findLoop("loop_7"))
                .thenReturn(Optional.of(TestFixtures.loopWithBorrows("loop_7", "1000", "750")));
        when(transactionLog.getTransactionsForLoop("loop_7")).thenThrow(new IllegalStateException("ledger offline"));

        mockMvc.perform(get("/api/loops/loop_7/transactions"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error.code").value("INTERNAL_ERROR"))
                .andExpect(jsonPath("$.error.loopId").value("loop_7"))
                .andExpect(jsonPath("$.error.message").value("An unexpected error occurred"));
    }

    @Test
    @DisplayName("Non-boolean emergency flag is a 400 naming the parameter and loop")
    void badEmergencyFlag() throws Exception {
        mockMvc.perform(post("/api/loops/loop_7/unwind").param("emergency", "maybe"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("BAD_REQUEST"))
                .andExpect(jsonPath("$.error.loopId").value("loop_7"))
                .andExpect(jsonPath("$.error.details.parameter").value("emergency"))
                .andExpect(jsonPath("$.error.details.value").value("maybe"));

        verify(leverageLoopEngine, never()).unwindLoop(any(), anyBoolean());
    }

    @Test
    @DisplayName("GET /api/loops/{loopId} falls back to the store for a loop retired before restart")
    void storedLoop() throws Exception {
        LeverageLoop retired = TestFixtures.loopWithBorrows("loop_old", "1000", "750");
        List<LeveragePosition> positions = retired.getPositions();
        retired.setStatus(LoopStatus.UNWINDING);
        when(leverageLoopEngine.findLoop("loop_old")).thenReturn(Optional.empty());
        when(positionStore.findLoop("loop_old")).thenReturn(Optional.of(retired));
        when(positionStore.getPositionsForLoop("loop_old")).thenReturn(positions);

        mockMvc.perform(get("/api/loops/loop_old"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.status").value("UNWINDING"))
                .andExpect(jsonPath("$.data.positions[0].positionId").value("loop_old_iter_1"));
    }

    @Test
    @DisplayName("GET /api/loops/{loopId}/transactions returns the ledger rows")
    void transactions() throws Exception {
        LeverageLoop loop = TestFixtures.loopWithBorrows("loop_1", "1000", "750");
        when(leverageLoopEngine.findLoop("loop_1")).thenReturn(Optional.of(loop));
        when(transactionLog.getTransactionsForLoop("loop_1"))
                .thenReturn(List.of(LoopTransaction.builder()
                        .id(1L)
                        .action(LedgerAction.BORROW)
                        .assetId(CollateralToken.USDC.getAssetId())
                        .amount(new BigDecimal("750"))
                        .amountUsd(new BigDecimal("750"))
                        .protocol("solend")
                        .agentTag(TransactionLog.AGENT_TAG)
                        .loopId("loop_1")
                        .build()));

        mockMvc.perform(get("/api/loops/loop_1/transactions"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data[0].action").value("BORROW"))
                .andExpect(jsonPath("$.data[0].amountUsd").value(750));
    }

    @Test
    @DisplayName("GET /api/loops/{loopId}/positions lists stored positions")
    void positions() throws Exception {
        LeverageLoop loop = TestFixtures.loopWithBorrows("loop_1", "1000", "750", "562.5");
        when(leverageLoopEngine.findLoop("loop_1")).thenReturn(Optional.of(loop));
        when(positionStore.getPositionsForLoop("loop_1")).thenReturn(loop.getPositions());

        mockMvc.perform(get("/api/loops/loop_1/positions"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.length()").value(2))
                .andExpect(jsonPath("$.data[1].iteration").value(2));
    }

    @Test
    @DisplayName("GET /api/loops/{loopId}/health recomputes health")
    void health() throws Exception {
        LeverageLoop loop = TestFixtures.loopWithBorrows("loop_1", "1000", "750");
        when(leverageLoopEngine.findLoop("loop_1")).thenReturn(Optional.of(loop));
        when(leverageLoopEngine.monitorLoopHealth(loop)).thenReturn(new BigDecimal("0.5"));

        mockMvc.perform(get("/api/loops/loop_1/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.loopId").value("loop_1"))
                .andExpect(jsonPath("$.data.healthScore").value(0.5));
    }

    @Test
    @DisplayName("POST /api/loops/{loopId}/unwind passes the emergency flag")
    void unwind() throws Exception {
        LeverageLoop loop = TestFixtures.loopWithBorrows("loop_1", "1000", "750");
        when(leverageLoopEngine.findLoop("loop_1")).thenReturn(Optional.of(loop));
        when(leverageLoopEngine.unwindLoop(loop, true)).thenReturn(true);

        mockMvc.perform(post("/api/loops/loop_1/unwind").param("emergency", "true"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.loopId").value("loop_1"))
                .andExpect(jsonPath("$.data.success").value(true));
    }

    @Test
    @DisplayName("POST /api/loops/emergency-unwind requires CONFIRM")
    void emergencyUnwindRequiresConfirm() throws Exception {
        mockMvc.perform(post("/api/loops/emergency-unwind")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"confirm\": \"yes\"}"))
                .andExpect(status().isBadRequest());

        verify(leverageLoopEngine, never()).emergencyUnwindAllLoops();
        verify(leverageLoopEngine, never()).unwindLoop(any(), anyBoolean());
    }

    @Test
    @DisplayName("POST /api/loops/emergency-unwind unwinds all loops")
    void emergencyUnwind() throws Exception {
        when(leverageLoopEngine.emergencyUnwindAllLoops()).thenReturn(3);

        mockMvc.perform(post("/api/loops/emergency-unwind")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"confirm\": \"CONFIRM\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.unwound").value(3));
    }

    @Test
    @DisplayName("GET /api/loops/reserved-balances lists reservations")
    void reservedBalances() throws Exception {
        when(positionStore.getReservedBalances())
                .thenReturn(List.of(ReservedBalance.builder()
                        .assetId(CollateralToken.SOL.getAssetId())
                        .reservedAmountUsd(new BigDecimal("1750"))
                        .reason("defi_collateral")
                        .positionIds(List.of("loop_1_iter_1"))
                        .build()));

        mockMvc.perform(get("/api/loops/reserved-balances"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data[0].assetId").value(CollateralToken.SOL.getAssetId()))
                .andExpect(jsonPath("$.data[0].positionIds[0]").value("loop_1_iter_1"));
    }
}
