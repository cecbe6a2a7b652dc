package com.paircraft.engine.model;

/**
 * Registration status. Withdrawal is a flag, players are never removed.
 */
public enum PlayerStatus {
    ACTIVE,
    WITHDRAWN
}
