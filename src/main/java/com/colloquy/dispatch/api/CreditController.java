package com.colloquy.dispatch.api;

import com.colloquy.core.credit.CostAccountant;
import com.colloquy.core.credit.CreditStatistics;
import com.colloquy.core.credit.CreditTransaction;
import com.colloquy.core.credit.TransactionResult;
import com.colloquy.core.credit.TransactionType;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * REST endpoints for credit balances.
 */
@RestController
@RequestMapping("/api/v1/credits")
public class CreditController {

    private final CostAccountant accountant;

    public CreditController(CostAccountant accountant) {
        this.accountant = accountant;
    }

    @GetMapping("/{userId}")
    public ResponseEntity<CreditStatistics> statistics(@PathVariable String userId) {
        return accountant.statistics(userId)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/{userId}/transactions")
    public ResponseEntity<List<CreditTransaction>> transactions(@PathVariable String userId,
                                                                @RequestParam(defaultValue = "50") int limit) {
        if (accountant.balance(userId).isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(accountant.history(userId, Math.max(1, Math.min(limit, 500))));
    }

    /**
     * GET /api/v1/credits/{userId}/check/{amount}: whether the balance covers {@code amount}.
     */
    @GetMapping("/{userId}/check/{amount}")
    public ResponseEntity<Map<String, Object>> check(@PathVariable String userId, @PathVariable long amount) {
        if (amount < 0) {
            return ResponseEntity.badRequest().body(Map.of("error", "Amount must not be negative"));
        }
        Optional<Long> balance = accountant.balance(userId);
        if (balance.isEmpty()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", "No credit account for " + userId));
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("hasSufficientCredits", accountant.hasCredits(userId, amount));
        body.put("requiredCredits", amount);
        body.put("currentBalance", balance.get());
        body.put("difference", balance.get() - amount);
        return ResponseEntity.ok(body);
    }

    /**
     * POST /api/v1/credits/{userId}: add credits, opening the account if needed.
     */
    @PostMapping("/{userId}")
    public ResponseEntity<Map<String, Object>> add(@PathVariable String userId, @RequestBody CreditRequest request) {
        TransactionType type;
        try {
            type = request.type() != null ? TransactionType.valueOf(request.type().toUpperCase()) : TransactionType.PURCHASE;
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", "Invalid type: " + request.type()));
        }
        if (type == TransactionType.USAGE || request.amount() <= 0) {
            return ResponseEntity.badRequest().body(Map.of("error", "Amount must be positive and type must not be USAGE"));
        }

        accountant.ensureAccount(userId);
        String reason = request.reason() != null ? request.reason() : "Credit " + type.name().toLowerCase();
        TransactionResult result = accountant.credit(userId, request.amount(), type, reason);
        if (!result.succeeded()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", result.message()));
        }
        return ResponseEntity.ok(Map.of("userId", userId, "balance", result.balance()));
    }
}
