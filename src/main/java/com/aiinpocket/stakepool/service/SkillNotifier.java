package com.aiinpocket.stakepool.service;

/**
 * 受信任的技能通知方（市集）。
 * 只有此地址能啟用/停用用戶技能、發放任務與成就獎勵；授權以地址比對，不依賴繼承。
 */
@FunctionalInterface
public interface SkillNotifier {

    String address();

    default boolean isCaller(String caller) {
        String trusted = address();
        return caller != null && trusted != null && trusted.equalsIgnoreCase(caller.trim());
    }
}
