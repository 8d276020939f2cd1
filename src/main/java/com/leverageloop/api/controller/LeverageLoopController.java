package com.leverageloop.api.controller;

import com.leverageloop.api.dto.request.OpenLoopRequest;
import com.leverageloop.domain.model.LeverageLoop;
import com.leverageloop.domain.model.LeveragePosition;
import com.leverageloop.domain.model.LoopTransaction;
import com.leverageloop.domain.model.LoopsSummary;
import com.leverageloop.domain.model.ReservedBalance;
import com.leverageloop.engine.LeverageLoopEngine;
import com.leverageloop.exception.BusinessException;
import com.leverageloop.exception.ResourceNotFoundException;
import com.leverageloop.ledger.TransactionLog;
import com.leverageloop.store.PositionStore;
import jakarta.validation.Valid;
import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST endpoints for leverage loops.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>POST /api/loops -- deploy a new loop</li>
 *   <li>GET /api/loops/summary -- aggregate view of active loops</li>
 *   <li>GET /api/loops/{loopId} -- one loop, active or retired</li>
 *   <li>GET /api/loops/{loopId}/positions -- stored positions, closed ones included</li>
 *   <li>GET /api/loops/{loopId}/transactions -- ledger rows of the loop</li>
 *   <li>GET /api/loops/{loopId}/health -- recomputed health score</li>
 *   <li>POST /api/loops/{loopId}/unwind -- unwind one loop</li>
 *   <li>POST /api/loops/emergency-unwind -- unwind everything (requires "CONFIRM" text)</li>
 *   <li>GET /api/loops/reserved-balances -- collateral reserved by active loops</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/loops")
public class LeverageLoopController {

    private static final Logger log = LoggerFactory.getLogger(LeverageLoopController.class);

    private final LeverageLoopEngine leverageLoopEngine;
    private final PositionStore positionStore;
    private final TransactionLog transactionLog;

    public LeverageLoopController(
            LeverageLoopEngine leverageLoopEngine, PositionStore positionStore, TransactionLog transactionLog) {
        this.leverageLoopEngine = leverageLoopEngine;
        this.positionStore = positionStore;
        this.transactionLog = transactionLog;
    }

    /**
     * Deploys a loop. A refusal (safety gate, invalid sizing) is reported as 422.
     */
    @PostMapping
    public ResponseEntity<LeverageLoop> openLoop(@Valid @RequestBody OpenLoopRequest request) {
        log.info(
                "Loop requested: {} USD {} collateral, {} iterations, sentiment {}",
                request.getInitialCapitalUsd(),
                request.getCollateralToken(),
                request.getTargetIterations(),
                request.getSentiment());

        LeverageLoop loop = leverageLoopEngine.executeLeverageLoop(
                request.getInitialCapitalUsd(),
                request.getCollateralToken(),
                request.getSentiment(),
                request.getTargetIterations(),
                request.getBorrowingProtocol(),
                request.getLendingProtocol());
        if (loop == null) {
            throw BusinessException.loopNotOpened(
                    request.getInitialCapitalUsd(), request.getCollateralToken(), request.getTargetIterations());
        }
        return ResponseEntity.ok(loop);
    }

    @GetMapping("/summary")
    public ResponseEntity<LoopsSummary> getSummary() {
        return ResponseEntity.ok(leverageLoopEngine.getActiveLoopsSummary());
    }

    @GetMapping("/reserved-balances")
    public ResponseEntity<List<ReservedBalance>> getReservedBalances() {
        return ResponseEntity.ok(positionStore.getReservedBalances());
    }

    @GetMapping("/{loopId}")
    public ResponseEntity<LeverageLoop> getLoop(@PathVariable String loopId) {
        return ResponseEntity.ok(requireLoop(loopId));
    }

    @GetMapping("/{loopId}/positions")
    public ResponseEntity<List<LeveragePosition>> getPositions(@PathVariable String loopId) {
        requireLoop(loopId);
        return ResponseEntity.ok(positionStore.getPositionsForLoop(loopId));
    }

    @GetMapping("/{loopId}/transactions")
    public ResponseEntity<List<LoopTransaction>> getTransactions(@PathVariable String loopId) {
        requireLoop(loopId);
        return ResponseEntity.ok(transactionLog.getTransactionsForLoop(loopId));
    }

    @GetMapping("/{loopId}/health")
    public ResponseEntity<Map<String, Object>> getLoopHealth(@PathVariable String loopId) {
        LeverageLoop loop = requireLoop(loopId);
        BigDecimal health = leverageLoopEngine.monitorLoopHealth(loop);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("loopId", loopId);
        body.put("healthScore", health);
        body.put("status", loop.getStatus());
        return ResponseEntity.ok(body);
    }

    @PostMapping("/{loopId}/unwind")
    public ResponseEntity<Map<String, Object>> unwindLoop(
            @PathVariable String loopId, @RequestParam(defaultValue = "false") boolean emergency) {
        LeverageLoop loop = requireLoop(loopId);
        log.warn("Unwind of loop {} requested via API (emergency={})", loopId, emergency);

        boolean success = leverageLoopEngine.unwindLoop(loop, emergency);
        return ResponseEntity.ok(Map.of("loopId", loopId, "success", success));
    }

    /**
     * Emergency-unwinds every active loop. Requires "confirm": "CONFIRM" in the body.
     */
    @PostMapping("/emergency-unwind")
    public ResponseEntity<Object> emergencyUnwind(@RequestBody Map<String, String> body) {
        if (!"CONFIRM".equals(body.get("confirm"))) {
            return ResponseEntity.badRequest()
                    .body(Map.of("error", "Emergency unwind requires 'confirm': 'CONFIRM' in request body"));
        }

        log.error("EMERGENCY UNWIND REQUESTED via API");
        int unwound = leverageLoopEngine.emergencyUnwindAllLoops();
        return ResponseEntity.ok(Map.of("unwound", unwound));
    }

    /**
     * In-memory loop first; a loop retired before the last restart is only in the store,
     * so it is loaded from there with its positions attached.
     */
    private LeverageLoop requireLoop(String loopId) {
        return leverageLoopEngine
                .findLoop(loopId)
                .or(() -> positionStore.findLoop(loopId).map(stored -> {
                    stored.setPositions(positionStore.getPositionsForLoop(loopId));
                    return stored;
                }))
                .orElseThrow(() -> ResourceNotFoundException.loop(loopId));
    }
}
