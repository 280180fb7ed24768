package com.aiinpocket.parkfinder.model.enums;

/**
 * 公園提交的審核狀態。
 *
 * <ul>
 *   <li>PENDING — 等待社群投票（初始狀態，僅提交者與管理員可見）</li>
 *   <li>APPROVED — 已通過（終態，所有人可見）</li>
 *   <li>REJECTED — 已駁回（終態，僅管理員可見）</li>
 * </ul>
 */
public enum ParkStatus {
    PENDING,
    APPROVED,
    REJECTED;

    public boolean isTerminal() {
        return this != PENDING;
    }
}
