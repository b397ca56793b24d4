package org.cataphract.runtime.rules;

import org.cataphract.config.RulesConfig;

/**
 * The resolvers of one rules configuration, wired together once and shared by
 * the scheduler and the upkeep steps. Resolvers hold no campaign state.
 */
public final class RuleSet {

    private final RulesConfig config;
    private final ArmyMath math;
    private final MoraleCheckResolver morale;
    private final LogisticsResolver logistics;
    private final CombatResolver combat;
    private final HarryingResolver harrying;
    private final MessagingResolver messaging;
    private final NavalResolver naval;
    private final OperationsResolver operations;
    private final RecruitmentEngine recruitment;
    private final MercenaryUpkeep mercenaries;

    public RuleSet(RulesConfig config) {
        this.config = config;
        this.math = new ArmyMath(config);
        this.morale = new MoraleCheckResolver(config, math);
        this.logistics = new LogisticsResolver(config, math, morale);
        this.combat = new CombatResolver(config, math, morale);
        this.harrying = new HarryingResolver(config, math);
        this.messaging = new MessagingResolver(config);
        this.naval = new NavalResolver(config);
        this.operations = new OperationsResolver(config);
        this.recruitment = new RecruitmentEngine(config, math);
        this.mercenaries = new MercenaryUpkeep(config, math);
    }

    public RulesConfig config() {
        return config;
    }

    public ArmyMath math() {
        return math;
    }

    public MoraleCheckResolver morale() {
        return morale;
    }

    public LogisticsResolver logistics() {
        return logistics;
    }

    public CombatResolver combat() {
        return combat;
    }

    public HarryingResolver harrying() {
        return harrying;
    }

    public MessagingResolver messaging() {
        return messaging;
    }

    public NavalResolver naval() {
        return naval;
    }

    public OperationsResolver operations() {
        return operations;
    }

    public RecruitmentEngine recruitment() {
        return recruitment;
    }

    public MercenaryUpkeep mercenaries() {
        return mercenaries;
    }
}
