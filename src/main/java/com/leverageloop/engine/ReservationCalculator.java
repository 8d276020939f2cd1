package com.leverageloop.engine;

import com.leverageloop.domain.enums.CollateralToken;
import com.leverageloop.domain.model.LeverageLoop;
import com.leverageloop.domain.model.LeveragePosition;
import com.leverageloop.domain.model.ReservedBalance;
import com.leverageloop.oracle.PriceOracle;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Builds reserved-balance rows for collateral assets.
 *
 * <p>A reservation covers every active or still-deploying loop holding the asset: its USD
 * value is the sum of each loop's cumulative collateral (the last position's collateral
 * amount), and its position id list names all of their positions. Token units use the oracle price, or
 * 1.0 when no price is known.
 *
 * <p>Callers hold {@link ActiveLoopRegistry#withAssetLock} for the asset from the
 * computation through the store write.
 */
@Component
public class ReservationCalculator {

    static final String RESERVATION_REASON = "defi_collateral";

    private final ActiveLoopRegistry activeLoopRegistry;
    private final PriceOracle priceOracle;

    public ReservationCalculator(ActiveLoopRegistry activeLoopRegistry, PriceOracle priceOracle) {
        this.activeLoopRegistry = activeLoopRegistry;
        this.priceOracle = priceOracle;
    }

    /**
     * Reservation for the loop's collateral asset, counting the loop itself whether or not
     * it is registered yet.
     */
    public ReservedBalance forIteration(LeverageLoop loop) {
        String assetId = loop.getCollateralToken().getAssetId();
        List<LeverageLoop> holders = holdersOf(assetId, loop.getLoopId());
        holders.add(loop);
        return build(assetId, holders);
    }

    /**
     * Reservations that must remain for {@code assetIds} once {@code loop} is retired.
     * Assets no other committed loop holds are absent from the result and should be cleared.
     */
    public List<ReservedBalance> remainingAfterRetirement(LeverageLoop loop, Collection<String> assetIds) {
        List<ReservedBalance> remaining = new ArrayList<>();
        for (String assetId : assetIds) {
            List<LeverageLoop> holders = holdersOf(assetId, loop.getLoopId());
            if (!holders.isEmpty()) {
                remaining.add(build(assetId, holders));
            }
        }
        return remaining;
    }

    private List<LeverageLoop> holdersOf(String assetId, String excludedLoopId) {
        List<LeverageLoop> holders = new ArrayList<>();
        for (LeverageLoop active : activeLoopRegistry.getCommittedLoops()) {
            CollateralToken token = active.getCollateralToken();
            if (!active.getLoopId().equals(excludedLoopId)
                    && token != null
                    && token.getAssetId().equals(assetId)
                    && active.getLastPosition() != null) {
                holders.add(active);
            }
        }
        return holders;
    }

    private ReservedBalance build(String assetId, List<LeverageLoop> holders) {
        BigDecimal collateralUsd = BigDecimal.ZERO;
        List<String> positionIds = new ArrayList<>();
        for (LeverageLoop holder : holders) {
            LeveragePosition last = holder.getLastPosition();
            if (last == null) {
                continue;
            }
            collateralUsd = collateralUsd.add(last.getCollateralAmountUsd());
            holder.getPositions().stream()
                    .filter(LeveragePosition::isActive)
                    .map(LeveragePosition::getPositionId)
                    .forEach(positionIds::add);
        }

        BigDecimal price = priceOracle
                .getPrice(assetId)
                .filter(p -> p.signum() > 0)
                .orElse(BigDecimal.ONE);

        return ReservedBalance.builder()
                .assetId(assetId)
                .reservedAmount(collateralUsd.divide(price, 9, RoundingMode.HALF_UP))
                .reservedAmountUsd(collateralUsd)
                .reason(RESERVATION_REASON)
                .positionIds(positionIds)
                .lastUpdated(LocalDateTime.now())
                .build();
    }
}
