package org.cataphract.runtime;

import org.cataphract.config.RulesConfig;
import org.cataphract.runtime.internal.services.RollService;
import org.cataphract.runtime.internal.services.SeededRollSource;
import org.cataphract.runtime.map.Hex;
import org.cataphract.runtime.model.Army;
import org.cataphract.runtime.model.Campaign;
import org.cataphract.runtime.model.DayPart;
import org.cataphract.runtime.model.Stronghold;
import org.cataphract.runtime.model.Tick;
import org.cataphract.runtime.orders.OrderScheduler;
import org.cataphract.runtime.rules.RuleSet;
import org.cataphract.runtime.spi.IRollSource;
import org.cataphract.runtime.spi.IUpkeepStep;
import org.cataphract.runtime.upkeep.UpkeepStepFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.function.LongFunction;

/**
 * Drives a campaign through its day-parts. Each part runs dawn housekeeping
 * (mornings only: seasons, movement points, rest, returning detachments and
 * thresholds), dispatches the orders due, runs the upkeep steps in their
 * configured order, checks the campaign invariants and moves the clock on.
 * <p>
 * The engine works on whatever campaign it is given; transactions and locking
 * are the business of {@link CampaignEngine}.
 */
public class TickEngine {

    private static final Logger LOG = LoggerFactory.getLogger(TickEngine.class);

    private final RuleSet rules;
    private final OrderScheduler scheduler;
    private final List<IUpkeepStep> steps;
    private final LongFunction<IRollSource> rollSources;
    private final CampaignInvariants invariants = new CampaignInvariants();

    public TickEngine(RuleSet rules, OrderScheduler scheduler) {
        this(rules, scheduler, UpkeepStepFactory.createAll(rules.config().upkeepSteps()), SeededRollSource::new);
    }

    /**
     * @param rules       Resolvers to apply.
     * @param scheduler   Dispatches the orders due each part.
     * @param steps       Upkeep steps, in execution order.
     * @param rollSources Creates the root roll source of a campaign from its seed.
     */
    public TickEngine(RuleSet rules, OrderScheduler scheduler, List<IUpkeepStep> steps,
                      LongFunction<IRollSource> rollSources) {
        this.rules = rules;
        this.scheduler = scheduler;
        this.steps = List.copyOf(steps);
        this.rollSources = rollSources;
    }

    /**
     * @return a roll service for the campaign's current tick.
     */
    public RollService rollsFor(Campaign campaign) {
        return new RollService(rollSources.apply(campaign.getSeed()), campaign.getAuditLog(),
                campaign.getCurrentTick());
    }

    /**
     * Resolves the campaign's current day-part and advances its clock by one part.
     *
     * @param campaign The working campaign, mutated in place.
     * @param before   The campaign as it stood before the part, for the invariant checks.
     * @throws org.cataphract.runtime.api.InvariantViolationException if the part left an impossible state.
     */
    public void runPart(Campaign campaign, Campaign before) {
        Tick tick = campaign.getCurrentTick();
        RollService rolls = rollsFor(campaign);
        if (tick.part() == DayPart.MORNING) {
            dawn(campaign, tick);
        }
        int dispatched = scheduler.dispatchDue(campaign, rolls);
        for (IUpkeepStep step : steps) {
            step.apply(campaign, rules, rolls);
        }
        invariants.check(before, campaign);
        campaign.setCurrentTick(tick.next());
        LOG.info("Campaign {} resolved {}: {} orders dispatched, {} audit entries", campaign.getId(), tick,
                dispatched, campaign.getAuditLog().size());
    }

    private void dawn(Campaign campaign, Tick tick) {
        RulesConfig config = rules.config();
        int day = tick.day();
        if (day > 0 && day % config.daysPerSeason() == 0) {
            campaign.setSeason(campaign.getSeason().next());
            for (Hex hex : campaign.getMap().getHexes()) {
                hex.setForagingUsesRemaining(config.supply().forageUsesPerSeason());
            }
            LOG.info("Campaign {} enters {} on day {}", campaign.getId(), campaign.getSeason(), day);
        }

        for (Army army : campaign.getArmies().values()) {
            rules.morale().returnDeparted(campaign, army, day);
            army.setMovementPointsRemaining(config.movement().pointsPerDay());
            switch (army.getStatus()) {
                case RESTING:
                    if (army.getMoraleCurrent() < army.getMoraleResting()) {
                        army.setMoraleCurrent(Math.min(army.getMoraleResting(),
                                army.getMoraleCurrent() + config.morale().restRecoveryPerDay()));
                    }
                    if (army.getRestUntilDay() != null && day >= army.getRestUntilDay()) {
                        army.setStatus(Army.Status.IDLE);
                        army.setRestUntilDay(null);
                    }
                    break;
                case MARCHING:
                case FORAGING:
                case TORCHING:
                case HARRYING:
                    army.setStatus(Army.Status.IDLE);
                    break;
                default:
                    break;
            }
        }

        for (Stronghold stronghold : campaign.getStrongholds().values()) {
            if (stronghold.getCurrentThreshold() == 0 && campaign.findActiveSiege(stronghold.getId()).isEmpty()) {
                stronghold.setCurrentThreshold(stronghold.getBaseThreshold());
            }
        }
    }
}
