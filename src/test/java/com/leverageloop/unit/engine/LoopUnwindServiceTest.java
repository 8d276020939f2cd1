package com.leverageloop.unit.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.leverageloop.domain.enums.CollateralToken;
import com.leverageloop.domain.enums.LoopStatus;
import com.leverageloop.domain.enums.PositionStatus;
import com.leverageloop.domain.model.LeverageLoop;
import com.leverageloop.domain.model.ReservedBalance;
import com.leverageloop.engine.ActiveLoopRegistry;
import com.leverageloop.engine.LoopUnwindService;
import com.leverageloop.engine.ReservationCalculator;
import com.leverageloop.event.LoopEvent;
import com.leverageloop.event.LoopEventType;
import com.leverageloop.exception.ProtocolException;
import com.leverageloop.ledger.TransactionLog;
import com.leverageloop.oracle.PriceOracle;
import com.leverageloop.protocol.ProtocolGateway;
import com.leverageloop.protocol.ProtocolResult;
import com.leverageloop.store.PositionStore;
import com.leverageloop.support.TestFixtures;
import java.math.BigDecimal;
import java.util.Collection;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEvent;
import org.springframework.context.ApplicationEventPublisher;

/**
 * Unit tests for LoopUnwindService covering withdrawal gating, LIFO repayment,
 * partial failures, retries and reservation cleanup.
 */
@ExtendWith(MockitoExtension.class)
class LoopUnwindServiceTest {

    @Mock
    private PositionStore positionStore;

    @Mock
    private ProtocolGateway protocolGateway;

    @Mock
    private TransactionLog transactionLog;

    @Mock
    private PriceOracle priceOracle;

    @Mock
    private ApplicationEventPublisher applicationEventPublisher;

    private ActiveLoopRegistry activeLoopRegistry;
    private LoopUnwindService loopUnwindService;

    @BeforeEach
    void setUp() {
        activeLoopRegistry = new ActiveLoopRegistry();
        loopUnwindService = new LoopUnwindService(
                activeLoopRegistry,
                positionStore,
                protocolGateway,
                transactionLog,
                new ReservationCalculator(activeLoopRegistry, priceOracle),
                TestFixtures.defaultLoopSettings(),
                applicationEventPublisher);
    }

    private LeverageLoop registeredTwoIterationLoop() {
        LeverageLoop loop = TestFixtures.loopWithBorrows("loop_1", "1000", "750", "562.5");
        activeLoopRegistry.register(loop);
        return loop;
    }

    private void withdrawSucceeds() {
        when(protocolGateway.withdraw(any(), anyString(), anyInt())).thenReturn(ProtocolResult.ok("withdraw-tx"));
    }

    private static ArgumentCaptor<ApplicationEvent> captureEvents(ApplicationEventPublisher publisher) {
        ArgumentCaptor<ApplicationEvent> captor = ArgumentCaptor.forClass(ApplicationEvent.class);
        verify(publisher).publishEvent(captor.capture());
        return captor;
    }

    @Nested
    @DisplayName("Repayment")
    class Repayment {

        @Test
        @DisplayName("Withdraws the total borrowed then repays in LIFO order")
        void lifoOrder() {
            LeverageLoop loop = registeredTwoIterationLoop();
            withdrawSucceeds();
            when(protocolGateway.repay(any(), any(), anyString(), anyInt())).thenReturn(ProtocolResult.ok("repay-tx"));

            boolean unwound = loopUnwindService.unwindLoop(loop, false);

            assertThat(unwound).isTrue();
            InOrder order = inOrder(protocolGateway);
            order.verify(protocolGateway)
                    .withdraw(argThat(amount -> amount.compareTo(new BigDecimal("1312.5")) == 0), eq("solend"), eq(200));
            order.verify(protocolGateway)
                    .repay(
                            argThat(amount -> amount.compareTo(new BigDecimal("562.5")) == 0),
                            eq(CollateralToken.SOL),
                            eq("solend"),
                            eq(200));
            order.verify(protocolGateway)
                    .repay(
                            argThat(amount -> amount.compareTo(new BigDecimal("750")) == 0),
                            eq(CollateralToken.SOL),
                            eq("solend"),
                            eq(200));

            assertThat(loop.getStatus()).isEqualTo(LoopStatus.UNWINDING);
            assertThat(loop.getClosedAt()).isNotNull();
            assertThat(loop.getPositions()).allMatch(position -> position.getStatus() == PositionStatus.CLOSED);
            assertThat(activeLoopRegistry.isActive("loop_1")).isFalse();
            assertThat(activeLoopRegistry.getHistory()).containsExactly(loop);
        }

        @Test
        @DisplayName("A failed repay leaves that position open and the unwind still succeeds")
        void partialRepayFailure() {
            LeverageLoop loop = registeredTwoIterationLoop();
            withdrawSucceeds();
            when(protocolGateway.repay(any(), any(), anyString(), anyInt()))
                    .thenReturn(ProtocolResult.ok("repay-2"), ProtocolResult.protocolError("repay rejected"));

            boolean unwound = loopUnwindService.unwindLoop(loop, false);

            assertThat(unwound).isTrue();
            assertThat(loop.getPositions().get(1).getStatus()).isEqualTo(PositionStatus.CLOSED);
            assertThat(loop.getPositions().get(0).getStatus()).isEqualTo(PositionStatus.ACTIVE);
            assertThat(loop.getStatus()).isEqualTo(LoopStatus.UNWINDING);
            verify(positionStore).updatePositionStatus("loop_1_iter_2", PositionStatus.CLOSED);
            verify(positionStore, never()).updatePositionStatus("loop_1_iter_1", PositionStatus.CLOSED);
        }

        @Test
        @DisplayName("Retry skips the withdrawal and never repays a closed position twice")
        void retryIsIdempotent() {
            LeverageLoop loop = registeredTwoIterationLoop();
            withdrawSucceeds();
            when(protocolGateway.repay(any(), any(), anyString(), anyInt()))
                    .thenReturn(
                            ProtocolResult.ok("repay-2"),
                            ProtocolResult.protocolError("repay rejected"),
                            ProtocolResult.ok("repay-1"));

            loopUnwindService.unwindLoop(loop, false);
            boolean retried = loopUnwindService.unwindLoop(loop, false);

            assertThat(retried).isTrue();
            verify(protocolGateway, times(1)).withdraw(any(), anyString(), anyInt());
            verify(protocolGateway, times(3)).repay(any(), any(), anyString(), anyInt());
            verify(protocolGateway, times(2))
                    .repay(argThat(amount -> amount.compareTo(new BigDecimal("750")) == 0), any(), anyString(), anyInt());
            assertThat(loop.getPositions()).allMatch(position -> position.getStatus() == PositionStatus.CLOSED);
            assertThat(activeLoopRegistry.getHistory()).hasSize(1);
        }

        @Test
        @DisplayName("Repay exception is contained to its position")
        void repayException() {
            LeverageLoop loop = registeredTwoIterationLoop();
            withdrawSucceeds();
            when(protocolGateway.repay(any(), any(), anyString(), anyInt()))
                    .thenThrow(new ProtocolException("solend", "repay", "rpc down"))
                    .thenReturn(ProtocolResult.ok("repay-1"));

            assertThat(loopUnwindService.unwindLoop(loop, false)).isTrue();
            assertThat(loop.getPositions().get(1).getStatus()).isEqualTo(PositionStatus.ACTIVE);
            assertThat(loop.getPositions().get(0).getStatus()).isEqualTo(PositionStatus.CLOSED);
        }
    }

    @Nested
    @DisplayName("Aborts and Edge Cases")
    class AbortsAndEdgeCases {

        @Test
        @DisplayName("Withdrawal failure aborts with the loop untouched")
        void withdrawalFailure() {
            LeverageLoop loop = registeredTwoIterationLoop();
            when(protocolGateway.withdraw(any(), anyString(), anyInt()))
                    .thenReturn(ProtocolResult.insufficientLiquidity("utilization 100%"));

            boolean unwound = loopUnwindService.unwindLoop(loop, false);

            assertThat(unwound).isFalse();
            assertThat(loop.getStatus()).isEqualTo(LoopStatus.COMPLETED);
            assertThat(loop.isFundsWithdrawn()).isFalse();
            assertThat(activeLoopRegistry.isActive("loop_1")).isTrue();
            verify(protocolGateway, never()).repay(any(), any(), anyString(), anyInt());
            verify(positionStore, never()).retireLoop(any(), any(), any());

            LoopEvent event = (LoopEvent) captureEvents(applicationEventPublisher).getValue();
            assertThat(event.getEventType()).isEqualTo(LoopEventType.UNWIND_FAILED);
        }

        @Test
        @DisplayName("Loop without positions is retired without protocol calls")
        void emptyLoop() {
            LeverageLoop loop = TestFixtures.loopWithBorrows("loop_empty", "1000");
            activeLoopRegistry.register(loop);

            assertThat(loopUnwindService.unwindLoop(loop, false)).isTrue();
            assertThat(loop.getStatus()).isEqualTo(LoopStatus.UNWINDING);
            assertThat(activeLoopRegistry.isActive("loop_empty")).isFalse();
            verify(protocolGateway, never()).withdraw(any(), anyString(), anyInt());
        }

        @Test
        @DisplayName("Emergency unwind marks the loop EMERGENCY")
        void emergencyStatus() {
            LeverageLoop loop = registeredTwoIterationLoop();
            withdrawSucceeds();
            when(protocolGateway.repay(any(), any(), anyString(), anyInt())).thenReturn(ProtocolResult.ok("repay-tx"));

            loopUnwindService.unwindLoop(loop, true);

            assertThat(loop.getStatus()).isEqualTo(LoopStatus.EMERGENCY);
        }
    }

    @Nested
    @DisplayName("Reservations")
    class Reservations {

        @Test
        @DisplayName("Clears the asset reservation when no other loop holds it")
        @SuppressWarnings("unchecked")
        void clearsWhenLastHolder() {
            LeverageLoop loop = registeredTwoIterationLoop();
            withdrawSucceeds();
            when(protocolGateway.repay(any(), any(), anyString(), anyInt())).thenReturn(ProtocolResult.ok("repay-tx"));

            loopUnwindService.unwindLoop(loop, false);

            ArgumentCaptor<List<ReservedBalance>> remaining = ArgumentCaptor.forClass(List.class);
            ArgumentCaptor<Collection<String>> cleared = ArgumentCaptor.forClass(Collection.class);
            verify(positionStore).retireLoop(eq(loop), remaining.capture(), cleared.capture());
            assertThat(remaining.getValue()).isEmpty();
            assertThat(cleared.getValue()).containsExactly(CollateralToken.SOL.getAssetId());
        }

        @Test
        @DisplayName("Keeps a reduced reservation while another loop holds the asset")
        @SuppressWarnings("unchecked")
        void keepsOtherHolders() {
            LeverageLoop loop = registeredTwoIterationLoop();
            LeverageLoop other = TestFixtures.loopWithBorrows("loop_2", "500", "375");
            activeLoopRegistry.register(other);
            withdrawSucceeds();
            when(protocolGateway.repay(any(), any(), anyString(), anyInt())).thenReturn(ProtocolResult.ok("repay-tx"));

            loopUnwindService.unwindLoop(loop, false);

            ArgumentCaptor<List<ReservedBalance>> remaining = ArgumentCaptor.forClass(List.class);
            ArgumentCaptor<Collection<String>> cleared = ArgumentCaptor.forClass(Collection.class);
            verify(positionStore).retireLoop(eq(loop), remaining.capture(), cleared.capture());
            assertThat(cleared.getValue()).isEmpty();
            assertThat(remaining.getValue()).hasSize(1);
            ReservedBalance reservation = remaining.getValue().get(0);
            assertThat(reservation.getReservedAmountUsd()).isEqualByComparingTo("875");
            assertThat(reservation.getPositionIds()).containsExactly("loop_2_iter_1");
        }

        @Test
        @DisplayName("A loop still deploying on the asset keeps its reservation")
        @SuppressWarnings("unchecked")
        void keepsDeployingHolder() {
            LeverageLoop loop = registeredTwoIterationLoop();
            LeverageLoop deploying = TestFixtures.loopWithBorrows("loop_3", "2000", "1500");
            activeLoopRegistry.beginDeployment(deploying);
            withdrawSucceeds();
            when(protocolGateway.repay(any(), any(), anyString(), anyInt())).thenReturn(ProtocolResult.ok("repay-tx"));

            loopUnwindService.unwindLoop(loop, false);

            ArgumentCaptor<List<ReservedBalance>> remaining = ArgumentCaptor.forClass(List.class);
            ArgumentCaptor<Collection<String>> cleared = ArgumentCaptor.forClass(Collection.class);
            verify(positionStore).retireLoop(eq(loop), remaining.capture(), cleared.capture());
            assertThat(cleared.getValue()).isEmpty();
            assertThat(remaining.getValue()).singleElement().satisfies(reservation -> {
                assertThat(reservation.getReservedAmountUsd()).isEqualByComparingTo("3500");
                assertThat(reservation.getPositionIds()).containsExactly("loop_3_iter_1");
            });
        }
    }

    @Test
    @DisplayName("Emergency unwind of all loops counts successes and continues past failures")
    void emergencyUnwindAll() {
        activeLoopRegistry.register(TestFixtures.loopWithBorrows("loop_a", "1000", "750"));
        activeLoopRegistry.register(TestFixtures.loopWithBorrows("loop_b", "1000", "750"));
        when(protocolGateway.withdraw(any(), anyString(), anyInt()))
                .thenReturn(ProtocolResult.ok("withdraw-tx"), ProtocolResult.protocolError("paused"));
        when(protocolGateway.repay(any(), any(), anyString(), anyInt())).thenReturn(ProtocolResult.ok("repay-tx"));

        int unwound = loopUnwindService.emergencyUnwindAllLoops();

        assertThat(unwound).isEqualTo(1);
        assertThat(activeLoopRegistry.getActiveLoopCount()).isEqualTo(1);
        verify(protocolGateway, times(2)).withdraw(any(), anyString(), anyInt());
    }
}
