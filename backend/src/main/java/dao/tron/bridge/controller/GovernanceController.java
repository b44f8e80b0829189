package dao.tron.bridge.controller;

import dao.tron.bridge.model.BridgeProposal;
import dao.tron.bridge.model.ProposalRequest;
import dao.tron.bridge.service.GovernanceService;
import dao.tron.bridge.util.Amounts;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static dao.tron.bridge.controller.BridgeController.CALLER_HEADER;

@RestController
@RequestMapping("/api/governance/proposals")
public class GovernanceController {

    private final GovernanceService governanceService;

    public GovernanceController(GovernanceService governanceService) {
        this.governanceService = governanceService;
    }

    @PostMapping
    public ResponseEntity<BridgeProposal> propose(@RequestHeader(CALLER_HEADER) String caller,
                                                  @Valid @RequestBody ProposalRequest req) {
        BridgeProposal p = governanceService.propose(caller, req.getKind(), req.getTarget(),
                Amounts.parseOptional(req.getValue()), req.getRationale());
        return ResponseEntity.status(HttpStatus.CREATED).body(p);
    }

    @PostMapping("/{id}/approve")
    public ResponseEntity<BridgeProposal> approve(@RequestHeader(CALLER_HEADER) String caller, @PathVariable long id) {
        return ResponseEntity.ok(governanceService.approve(caller, id));
    }

    @PostMapping("/{id}/reject")
    public ResponseEntity<BridgeProposal> reject(@RequestHeader(CALLER_HEADER) String caller, @PathVariable long id) {
        return ResponseEntity.ok(governanceService.reject(caller, id));
    }

    @PostMapping("/{id}/execute")
    public ResponseEntity<BridgeProposal> execute(@RequestHeader(CALLER_HEADER) String caller, @PathVariable long id) {
        return ResponseEntity.ok(governanceService.execute(caller, id));
    }

    @GetMapping
    public ResponseEntity<Map<String, Object>> list() {
        List<BridgeProposal> proposals = governanceService.listProposals();
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("count", proposals.size());
        response.put("proposals", proposals);
        return ResponseEntity.ok(response);
    }

    @GetMapping("/{id}")
    public ResponseEntity<BridgeProposal> get(@PathVariable long id) {
        return ResponseEntity.ok(governanceService.getProposal(id));
    }
}
