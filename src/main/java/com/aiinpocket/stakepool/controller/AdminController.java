package com.aiinpocket.stakepool.controller;

import com.aiinpocket.stakepool.model.entity.LockupTier;
import com.aiinpocket.stakepool.model.entity.PoolState;
import com.aiinpocket.stakepool.model.entity.UserActivity;
import com.aiinpocket.stakepool.service.AntiFraudService;
import com.aiinpocket.stakepool.service.EmergencyControlService;
import com.aiinpocket.stakepool.service.PoolAdminService;
import com.aiinpocket.stakepool.service.TierRegistryService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * 管理員 API：暫停、級距、封鎖、金庫與遷移。
 * 權限檢查在服務層進行（呼叫者地址必須是設定檔中的管理員）。
 */
@RestController
@RequestMapping("/api/admin")
@RequiredArgsConstructor
public class AdminController {

    private final EmergencyControlService emergencyControl;
    private final TierRegistryService tierRegistry;
    private final AntiFraudService antiFraud;
    private final PoolAdminService poolAdminService;

    @PostMapping("/pause")
    public ResponseEntity<Map<String, Boolean>> pause(@RequestHeader(StakingController.CALLER_HEADER) String caller) {
        emergencyControl.pause(caller);
        return ResponseEntity.ok(Map.of("paused", true));
    }

    @PostMapping("/unpause")
    public ResponseEntity<Map<String, Boolean>> unpause(@RequestHeader(StakingController.CALLER_HEADER) String caller) {
        emergencyControl.unpause(caller);
        return ResponseEntity.ok(Map.of("paused", false));
    }

    @PutMapping("/tiers/{lockupDays}/apy")
    public ResponseEntity<TierResponse> setTierApy(
            @RequestHeader(StakingController.CALLER_HEADER) String caller,
            @PathVariable int lockupDays,
            @Valid @RequestBody ApyRequest request) {
        return ResponseEntity.ok(toDto(tierRegistry.setTierApy(caller, lockupDays, request.apyBps())));
    }

    @PostMapping("/tiers/{lockupDays}/toggle")
    public ResponseEntity<TierResponse> toggleTier(
            @RequestHeader(StakingController.CALLER_HEADER) String caller,
            @PathVariable int lockupDays) {
        return ResponseEntity.ok(toDto(tierRegistry.toggleTierStatus(caller, lockupDays)));
    }

    @PostMapping("/users/{address}/ban")
    public ResponseEntity<ActivityDto> ban(
            @RequestHeader(StakingController.CALLER_HEADER) String caller,
            @PathVariable String address,
            @Valid @RequestBody BanRequest request) {
        return ResponseEntity.ok(toDto(antiFraud.banUser(caller, address, request.reason())));
    }

    @PostMapping("/users/{address}/unban")
    public ResponseEntity<ActivityDto> unban(
            @RequestHeader(StakingController.CALLER_HEADER) String caller,
            @PathVariable String address) {
        return ResponseEntity.ok(toDto(antiFraud.unbanUser(caller, address)));
    }

    /** 可疑但尚未封鎖的用戶 */
    @GetMapping("/flagged")
    public ResponseEntity<List<ActivityDto>> flagged() {
        return ResponseEntity.ok(antiFraud.findFlaggedUsers().stream().map(this::toDto).toList());
    }

    @PutMapping("/treasury")
    public ResponseEntity<Map<String, String>> changeTreasury(
            @RequestHeader(StakingController.CALLER_HEADER) String caller,
            @Valid @RequestBody TreasuryRequest request) {
        PoolState pool = poolAdminService.changeTreasury(caller, request.address());
        return ResponseEntity.ok(Map.of("treasury", pool.getTreasury()));
    }

    @PostMapping("/migrate")
    public ResponseEntity<Map<String, Boolean>> migrate(@RequestHeader(StakingController.CALLER_HEADER) String caller) {
        PoolState pool = poolAdminService.markMigrated(caller);
        return ResponseEntity.ok(Map.of("migrated", pool.isMigrated()));
    }

    // ===== DTO =====

    private TierResponse toDto(LockupTier tier) {
        return new TierResponse(tier.getLockupDays(), tier.getBaseApyBps(), tier.isActive());
    }

    private ActivityDto toDto(UserActivity a) {
        return new ActivityDto(a.getAddress(), a.getActionsToday(), a.getSuspiciousScore(),
                a.isFlagged(), a.isBanned(), a.getBanReason(), a.getBannedAt());
    }

    record ApyRequest(@NotNull Integer apyBps) {}

    record BanRequest(@NotBlank String reason) {}

    record TreasuryRequest(@NotBlank String address) {}

    record TierResponse(int lockupDays, int baseApyBps, boolean active) {}

    record ActivityDto(String address, int actionsToday, int suspiciousScore,
                       boolean flagged, boolean banned, String banReason, Instant bannedAt) {}
}
