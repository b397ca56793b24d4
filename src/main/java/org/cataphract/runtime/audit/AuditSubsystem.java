package org.cataphract.runtime.audit;

public enum AuditSubsystem {
    SCHEDULER,
    MOVEMENT,
    LOGISTICS,
    SUPPLY,
    SIEGE,
    COMBAT,
    MORALE,
    HARRYING,
    MESSAGING,
    NAVAL,
    OPERATIONS,
    RECRUITMENT,
    MERCENARY
}
