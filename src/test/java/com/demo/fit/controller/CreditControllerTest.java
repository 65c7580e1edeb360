package com.demo.fit.controller;

import com.demo.fit.support.IntegrationTestSupport;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;

import static org.hamcrest.Matchers.hasSize;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class CreditControllerTest extends IntegrationTestSupport {

    @Autowired
    private MockMvc mvc;

    private ResultActions postJson(String path, String json) throws Exception {
        return mvc.perform(post(path).contentType(MediaType.APPLICATION_JSON).content(json));
    }

    @Test
    void checkCreditsOnFreshAccount() throws Exception {
        String user = newUser();

        postJson("/api/credits/check-credits", """
                {"user_email": "%s", "credits_needed": 1}
                """.formatted(user))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.has_credits").value(false))
                .andExpect(jsonPath("$.credits_remaining").value(0))
                .andExpect(jsonPath("$.tier").value("free"));
    }

    @Test
    void addThenDeduct() throws Exception {
        String user = newUser();

        postJson("/api/credits/add-credits", """
                {"user_email": "%s", "credit_count": 5}
                """.formatted(user))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.credits_remaining").value(5));

        postJson("/api/credits/deduct-credit", """
                {"user_email": "%s", "credit_count": 2, "reason": "fit_analysis"}
                """.formatted(user))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.credits_remaining").value(3));

        mvc.perform(get("/api/credits").param("user_email", user).param("history_limit", "5"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.credits_remaining").value(3))
                .andExpect(jsonPath("$.credits_used").value(2))
                .andExpect(jsonPath("$.history", hasSize(2)))
                .andExpect(jsonPath("$.history[0].amount").value(-2))
                .andExpect(jsonPath("$.history[0].reason").value("fit_analysis"))
                .andExpect(jsonPath("$.history[0].balance_after").value(3))
                .andExpect(jsonPath("$.history[1].reason").value("purchase"));
    }

    @Test
    void overdraftIsRefusedWithoutChange() throws Exception {
        String user = newUser();
        ledger.add(user, 1, "test_grant");

        postJson("/api/credits/deduct-credit", """
                {"user_email": "%s", "credit_count": 2}
                """.formatted(user))
                .andExpect(status().isPaymentRequired())
                .andExpect(jsonPath("$.error").value("insufficient_credits"))
                .andExpect(jsonPath("$.credits_remaining").value(1))
                .andExpect(jsonPath("$.credits_needed").value(2));
        assertEquals(1, ledger.balance(user));
    }

    @Test
    void nonPositiveCountIs400() throws Exception {
        postJson("/api/credits/add-credits", """
                {"user_email": "%s", "credit_count": 0}
                """.formatted(newUser()))
                .andExpect(status().isBadRequest());
    }

    @Test
    void upgradeGrantsPlanCredits() throws Exception {
        String user = newUser();

        postJson("/api/credits/upgrade-subscription", """
                {"user_email": "%s", "tier": "pro", "plan": "season_pass"}
                """.formatted(user))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.tier").value("pro"))
                .andExpect(jsonPath("$.subscription_active").value(true))
                .andExpect(jsonPath("$.subscription_plan").value("season_pass"))
                .andExpect(jsonPath("$.subscription_expires").isNotEmpty())
                .andExpect(jsonPath("$.credits_remaining").value(150))
                .andExpect(jsonPath("$.history[0].reason").value("subscription_season_pass"));
    }

    @Test
    void unknownPlanIs400() throws Exception {
        postJson("/api/credits/upgrade-subscription", """
                {"user_email": "%s", "plan": "lifetime"}
                """.formatted(newUser()))
                .andExpect(status().isBadRequest());
    }

    @Test
    void downgradeKeepsBalance() throws Exception {
        String user = newUser();
        postJson("/api/credits/upgrade-subscription", """
                {"user_email": "%s"}
                """.formatted(user)).andExpect(status().isOk());

        postJson("/api/credits/upgrade-subscription", """
                {"user_email": "%s", "tier": "free"}
                """.formatted(user))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.tier").value("free"))
                .andExpect(jsonPath("$.subscription_active").value(false))
                .andExpect(jsonPath("$.credits_remaining").value(20));
    }

    @Test
    void blankEmailIs400() throws Exception {
        postJson("/api/credits/check-credits", """
                {"user_email": "  "}
                """)
                .andExpect(status().isBadRequest());
    }
}
