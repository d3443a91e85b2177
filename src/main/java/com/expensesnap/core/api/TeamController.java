package com.expensesnap.core.api;

import com.expensesnap.core.api.dto.InviteRequest;
import com.expensesnap.core.api.dto.InviteResponse;
import com.expensesnap.core.api.dto.ResetPasswordRequest;
import com.expensesnap.core.api.dto.UserResponse;
import com.expensesnap.core.application.TeamService;
import com.expensesnap.core.domain.access.CallerIdentity;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

@RestController
@Tag(name = "Team", description = "Invite codes and company membership")
@SecurityRequirement(name = "Bearer Authentication")
public class TeamController {

    private final TeamService team;

    public TeamController(TeamService team) {
        this.team = team;
    }

    @PostMapping("/invites")
    @Operation(summary = "Create a single-use invite code")
    public ResponseEntity<InviteResponse> createInvite(@AuthenticationPrincipal CallerIdentity caller,
                                                       @RequestBody(required = false) InviteRequest req) {
        InviteRequest r = req == null ? new InviteRequest() : req;
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(InviteResponse.from(team.createInvite(caller, r.companyId, r.role)));
    }

    @GetMapping("/team")
    @Operation(summary = "Users and unused invite codes in scope")
    public Map<String, Object> list(@AuthenticationPrincipal CallerIdentity caller,
                                    @RequestParam(value = "companyId", required = false) UUID companyId) {
        TeamService.TeamOverview overview = team.team(caller, companyId);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("users", overview.users().stream().map(UserResponse::from).toList());
        body.put("invites", overview.pendingInvites().stream().map(InviteResponse::from).toList());
        return body;
    }

    @DeleteMapping("/team/{userId}")
    @Operation(summary = "Remove a member")
    public Map<String, Object> remove(@AuthenticationPrincipal CallerIdentity caller,
                                      @PathVariable("userId") UUID userId) {
        team.removeMember(caller, userId);
        return Map.of("removed", userId);
    }

    @PostMapping("/team/{userId}/reset-password")
    @Operation(summary = "Set a new password for a member")
    public Map<String, Object> resetPassword(@AuthenticationPrincipal CallerIdentity caller,
                                             @PathVariable("userId") UUID userId,
                                             @RequestBody ResetPasswordRequest req) {
        team.resetPassword(caller, userId, req.password);
        return Map.of("reset", userId);
    }
}
