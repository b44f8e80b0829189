package dao.tron.bridge.controller;

import dao.tron.bridge.event.AuditRecord;
import dao.tron.bridge.model.BridgeStats;
import dao.tron.bridge.model.BridgeTransaction;
import dao.tron.bridge.model.LockRequest;
import dao.tron.bridge.model.ProofEntry;
import dao.tron.bridge.model.ReleaseRequest;
import dao.tron.bridge.model.TransferResolutionRequest;
import dao.tron.bridge.model.ValidationStatus;
import dao.tron.bridge.service.BridgeService;
import dao.tron.bridge.util.Amounts;
import dao.tron.bridge.util.ProofIds;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@RestController
@RequestMapping("/api/bridge")
public class BridgeController {

    public static final String CALLER_HEADER = "X-Bridge-Caller";

    private final BridgeService bridgeService;

    public BridgeController(BridgeService bridgeService) {
        this.bridgeService = bridgeService;
    }

    /**
     * POST /api/bridge/locks
     */
    @PostMapping("/locks")
    public ResponseEntity<BridgeTransaction> lock(@RequestHeader(CALLER_HEADER) String caller,
                                                  @Valid @RequestBody LockRequest req) {
        BridgeTransaction tx = bridgeService.lockAsset(caller, Amounts.parse(req.getAmount()), req.getDestination());
        return ResponseEntity.status(statusOf(tx)).body(tx);
    }

    /**
     * POST /api/bridge/attestations
     */
    @PostMapping("/attestations")
    public ResponseEntity<ValidationStatus> attest(@RequestHeader(CALLER_HEADER) String caller,
                                                   @Valid @RequestBody ReleaseRequest req) {
        ValidationStatus status = bridgeService.attest(caller, req.getRecipient(), Amounts.parse(req.getAmount()),
                ProofIds.resolve(req.getProof(), req.getSourceTxSignature()));
        return ResponseEntity.ok(status);
    }

    /**
     * POST /api/bridge/releases
     */
    @PostMapping("/releases")
    public ResponseEntity<BridgeTransaction> release(@RequestHeader(CALLER_HEADER) String caller,
                                                     @Valid @RequestBody ReleaseRequest req) {
        BridgeTransaction tx = bridgeService.release(caller, req.getRecipient(), Amounts.parse(req.getAmount()),
                ProofIds.resolve(req.getProof(), req.getSourceTxSignature()));
        return ResponseEntity.status(statusOf(tx)).body(tx);
    }

    /**
     * POST /api/bridge/transactions/{nonce}/resolution
     * Admin settles a transfer whose outcome the asset ledger never reported.
     */
    @PostMapping("/transactions/{nonce}/resolution")
    public ResponseEntity<BridgeTransaction> resolve(@RequestHeader(CALLER_HEADER) String caller,
                                                     @PathVariable long nonce,
                                                     @Valid @RequestBody TransferResolutionRequest req) {
        return ResponseEntity.ok(bridgeService.resolveTransfer(caller, nonce, req.getLanded()));
    }

    @GetMapping("/transfers/unconfirmed")
    public ResponseEntity<Map<String, Object>> unconfirmed() {
        List<BridgeTransaction> txs = bridgeService.unconfirmedTransfers();
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("count", txs.size());
        response.put("transactions", txs);
        return ResponseEntity.ok(response);
    }

    @GetMapping("/stats")
    public ResponseEntity<BridgeStats> stats() {
        return ResponseEntity.ok(bridgeService.getBridgeStats());
    }

    /**
     * GET /api/bridge/validation-status?recipient=..&amount=..&proof=..
     * (sourceTxSignature may stand in for proof)
     */
    @GetMapping("/validation-status")
    public ResponseEntity<ValidationStatus> validationStatus(@RequestParam String recipient,
                                                             @RequestParam String amount,
                                                             @RequestParam(required = false) String proof,
                                                             @RequestParam(required = false) String sourceTxSignature) {
        return ResponseEntity.ok(bridgeService.getValidationStatus(recipient, Amounts.parse(amount),
                ProofIds.resolve(proof, sourceTxSignature)));
    }

    @GetMapping("/transactions")
    public ResponseEntity<Map<String, Object>> transactions(@RequestParam(required = false) String counterparty) {
        List<BridgeTransaction> txs = bridgeService.listTransactions(counterparty);
        Map<String, Object> response = new LinkedHashMap<>();
        if (counterparty != null && !counterparty.isBlank()) {
            response.put("counterparty", counterparty.trim());
        }
        response.put("count", txs.size());
        response.put("transactions", txs);
        return ResponseEntity.ok(response);
    }

    @GetMapping("/transactions/{nonce}")
    public ResponseEntity<BridgeTransaction> transaction(@PathVariable long nonce) {
        return ResponseEntity.ok(bridgeService.getTransaction(nonce));
    }

    /**
     * GET /api/bridge/proofs/{proof}
     * Whether a destination-side proof has been consumed, and by which release.
     */
    @GetMapping("/proofs/{proof}")
    public ResponseEntity<Map<String, Object>> proof(@PathVariable String proof) {
        String proofId = ProofIds.normalize(proof);
        Optional<ProofEntry> entry = bridgeService.findProof(proofId);
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("proof", proofId);
        response.put("consumed", entry.isPresent());
        entry.ifPresent(e -> {
            response.put("validationKey", e.validationKey());
            response.put("releaseNonce", e.releaseNonce());
            response.put("consumedAt", e.consumedAt());
        });
        return ResponseEntity.ok(response);
    }

    @GetMapping("/events")
    public ResponseEntity<Map<String, Object>> events(@RequestParam(required = false) Long fromSequence) {
        List<AuditRecord> records = bridgeService.events(fromSequence);
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("count", records.size());
        response.put("events", records);
        return ResponseEntity.ok(response);
    }

    // 202 while the asset movement is not confirmed yet
    private static HttpStatus statusOf(BridgeTransaction tx) {
        return tx.completed() ? HttpStatus.CREATED : HttpStatus.ACCEPTED;
    }
}
