package com.demo.fit.controller;

import com.demo.fit.controller.dto.ProfileDtos.*;
import com.demo.fit.service.StalenessTracker;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;

/**
 * Profile upload hooks. A change only bumps the version; records go stale lazily and are
 * recomputed when the caller asks for it.
 */
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/profiles")
public class ProfileController {

    private final StalenessTracker staleness;

    @PostMapping(value = "/profile-changed", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ProfileChangedResponse profileChanged(@Valid @RequestBody ProfileChangedRequest req) {
        String userId = RequestUsers.userId(req.userEmail);
        long version = staleness.recordProfileChange(userId, req.profile);
        var status = staleness.needsRecomputation(userId);

        var res = new ProfileChangedResponse();
        res.success = true;
        res.profileVersion = version;
        res.needsRecomputation = status.needed();
        res.reason = status.reason();
        return res;
    }

    @PostMapping(value = "/reset-profile", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResetResponse resetProfile(@Valid @RequestBody ResetRequest req) {
        String userId = RequestUsers.userId(req.userEmail);
        staleness.resetProfile(userId);
        var res = new ResetResponse();
        res.success = true;
        res.message = "Profile and fit analyses removed";
        return res;
    }
}
