package com.aiinpocket.stakepool.service;

import com.aiinpocket.stakepool.config.StakingProperties;
import com.aiinpocket.stakepool.exception.StakingError;
import com.aiinpocket.stakepool.exception.StakingException;
import com.aiinpocket.stakepool.model.entity.UserActivity;
import com.aiinpocket.stakepool.model.enums.StakingEventType;
import com.aiinpocket.stakepool.repository.UserActivityRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * 防詐操作頻率控管。
 *
 * <p>每位用戶的操作窗口為滾動 24 小時，窗口內操作數超過上限即拒絕。
 * 連續兩個以上窗口撞到上限時可疑分數 +1，乾淨的窗口結束時分數 -1；
 * 分數達門檻只會標記為可疑，封鎖一律由管理員手動執行。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AntiFraudService {

    private final UserActivityRepository activityRepo;
    private final StakingProperties properties;
    private final AccessPolicy accessPolicy;
    private final ReentrancyGuard guard;
    private final TransactionTemplate transactionTemplate;
    private final StakingEventRecorder eventRecorder;
    private final Clock clock;

    /**
     * 記錄一次用戶操作。
     * 在獨立交易執行：即使因超過上限被拒絕，計數與分數仍會寫入。
     */
    @Transactional(noRollbackFor = StakingException.class)
    public UserActivity recordAction(String address) {
        Instant now = clock.instant();
        UserActivity activity = activityRepo.findById(address)
                .orElseGet(() -> UserActivity.builder().address(address).windowStart(now).build());

        rollWindowIfExpired(activity, now);
        activity.setActionsToday(activity.getActionsToday() + 1);

        int limit = properties.antiFraud().maxActionsPerDay();
        if (activity.getActionsToday() > limit) {
            if (!activity.isCapHitInWindow()) {
                registerCapHit(activity);
            }
            activityRepo.save(activity);
            log.warn("[防詐] {} 超過每日操作上限 {}（目前 {} 次）", address, limit, activity.getActionsToday());
            throw new StakingException(StakingError.TOO_MANY_ACTIONS_TODAY,
                    String.format("今日操作已達上限 %d 次", limit));
        }
        return activityRepo.save(activity);
    }

    @Transactional(readOnly = true)
    public void requireNotBanned(String address) {
        boolean banned = activityRepo.findById(address).map(UserActivity::isBanned).orElse(false);
        if (banned) {
            throw new StakingException(StakingError.USER_IS_BANNED);
        }
    }

    public UserActivity banUser(String caller, String address, String reason) {
        accessPolicy.requireOwner(caller);
        String target = accessPolicy.requireAddress(address);
        return guard.execute("banUser", () -> transactionTemplate.execute(status -> {
            UserActivity activity = findOrCreate(target);
            activity.setBanned(true);
            activity.setBanReason(reason);
            activity.setBannedAt(clock.instant());
            eventRecorder.record(target, StakingEventType.USER_BANNED, reason);
            log.warn("[防詐] 管理員封鎖用戶 {}，原因: {}", target, reason);
            return activityRepo.save(activity);
        }));
    }

    public UserActivity unbanUser(String caller, String address) {
        accessPolicy.requireOwner(caller);
        String target = accessPolicy.requireAddress(address);
        return guard.execute("unbanUser", () -> transactionTemplate.execute(status -> {
            UserActivity activity = findOrCreate(target);
            activity.setBanned(false);
            activity.setBanReason(null);
            activity.setBannedAt(null);
            activity.setFlagged(false);
            eventRecorder.record(target, StakingEventType.USER_UNBANNED, null);
            log.info("[防詐] 管理員解除封鎖 {}", target);
            return activityRepo.save(activity);
        }));
    }

    @Transactional(readOnly = true)
    public Optional<UserActivity> getActivity(String address) {
        return activityRepo.findById(address);
    }

    @Transactional(readOnly = true)
    public List<UserActivity> findFlaggedUsers() {
        return activityRepo.findByFlaggedTrueAndBannedFalse();
    }

    // 窗口到期：乾淨的窗口讓可疑分數衰減 1，再開新窗口
    private void rollWindowIfExpired(UserActivity activity, Instant now) {
        Instant start = activity.getWindowStart();
        if (start != null && now.isBefore(start.plus(window()))) {
            return;
        }
        if (start != null && !activity.isCapHitInWindow() && activity.getSuspiciousScore() > 0) {
            activity.setSuspiciousScore(activity.getSuspiciousScore() - 1);
            log.debug("[防詐] {} 可疑分數衰減至 {}", activity.getAddress(), activity.getSuspiciousScore());
        }
        activity.setWindowStart(now);
        activity.setActionsToday(0);
        activity.setCapHitInWindow(false);
    }

    private void registerCapHit(UserActivity activity) {
        Instant current = activity.getWindowStart();
        Instant previous = activity.getLastCapWindowStart();
        // 上一個撞上限的窗口緊鄰本窗口才算連續
        boolean consecutive = previous != null && current.isBefore(previous.plus(window().multipliedBy(2)));
        activity.setConsecutiveCapWindows(consecutive ? activity.getConsecutiveCapWindows() + 1 : 1);
        activity.setCapHitInWindow(true);
        activity.setLastCapWindowStart(current);

        if (activity.getConsecutiveCapWindows() >= 2) {
            activity.setSuspiciousScore(activity.getSuspiciousScore() + 1);
            log.warn("[防詐] {} 連續 {} 個窗口撞到上限，可疑分數 {}",
                    activity.getAddress(), activity.getConsecutiveCapWindows(), activity.getSuspiciousScore());
        }
        int threshold = properties.antiFraud().suspiciousThreshold();
        if (!activity.isFlagged() && activity.getSuspiciousScore() >= threshold) {
            activity.setFlagged(true);
            eventRecorder.record(activity.getAddress(), StakingEventType.USER_FLAGGED,
                    "suspiciousScore=" + activity.getSuspiciousScore());
            log.warn("[防詐] {} 可疑分數達門檻 {}，已標記待審查", activity.getAddress(), threshold);
        }
    }

    private UserActivity findOrCreate(String address) {
        return activityRepo.findById(address)
                .orElseGet(() -> UserActivity.builder().address(address).windowStart(clock.instant()).build());
    }

    private Duration window() {
        return properties.antiFraud().window();
    }
}
