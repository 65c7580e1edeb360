package com.demo.fit.controller;

import com.demo.fit.controller.dto.CreditDtos.*;
import com.demo.fit.model.CreditAccount;
import com.demo.fit.model.SubscriptionPlan;
import com.demo.fit.model.Tier;
import com.demo.fit.service.CreditLedger;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/credits")
public class CreditController {

    private final CreditLedger ledger;

    @PostMapping(value = "/check-credits", consumes = MediaType.APPLICATION_JSON_VALUE)
    public CheckResponse checkCredits(@Valid @RequestBody CheckRequest req) {
        String userId = RequestUsers.userId(req.userEmail);
        int needed = positive(req.creditsNeeded, "credits_needed");
        CreditAccount account = ledger.account(userId);

        var res = new CheckResponse();
        res.hasCredits = account.creditsRemaining() >= needed;
        res.creditsRemaining = account.creditsRemaining();
        res.tier = account.tier().code();
        return res;
    }

    /** 402 when the balance is too low; the balance is left untouched. */
    @PostMapping(value = "/deduct-credit", consumes = MediaType.APPLICATION_JSON_VALUE)
    public BalanceResponse deductCredit(@Valid @RequestBody DeductRequest req) {
        String userId = RequestUsers.userId(req.userEmail);
        int n = positive(req.creditCount, "credit_count");
        String reason = req.reason == null || req.reason.isBlank() ? "manual" : req.reason.trim();
        return BalanceResponse.of(ledger.deduct(userId, n, reason));
    }

    @PostMapping(value = "/add-credits", consumes = MediaType.APPLICATION_JSON_VALUE)
    public BalanceResponse addCredits(@Valid @RequestBody AddRequest req) {
        String userId = RequestUsers.userId(req.userEmail);
        int n = positive(req.creditCount, "credit_count");
        String source = req.source == null || req.source.isBlank() ? "purchase" : req.source.trim();
        return BalanceResponse.of(ledger.add(userId, n, source));
    }

    @PostMapping(value = "/upgrade-subscription", consumes = MediaType.APPLICATION_JSON_VALUE)
    public AccountResponse upgradeSubscription(@Valid @RequestBody UpgradeRequest req) {
        String userId = RequestUsers.userId(req.userEmail);
        Tier tier;
        SubscriptionPlan plan;
        try {
            tier = req.tier == null || req.tier.isBlank() ? Tier.PRO : Tier.parse(req.tier);
            plan = tier == Tier.PRO ? SubscriptionPlan.parse(req.plan) : null;
        } catch (IllegalArgumentException iae) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, iae.getMessage(), iae);
        }
        CreditAccount account = ledger.upgradeTier(userId, tier, plan, req.subscriptionExpires);
        return AccountResponse.from(account, ledger.history(userId, 20));
    }

    @GetMapping
    public AccountResponse getCredits(@RequestParam("user_email") String userEmail,
                                      @RequestParam(name = "history_limit", defaultValue = "20") int historyLimit) {
        String userId = RequestUsers.userId(userEmail);
        return AccountResponse.from(ledger.account(userId), ledger.history(userId, Math.min(historyLimit, 200)));
    }

    private static int positive(Integer value, String field) {
        if (value == null) return 1;
        if (value <= 0) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, field + " must be positive");
        }
        return value;
    }
}
