package org.cataphract.runtime;

import org.cataphract.config.RulesConfig;
import org.cataphract.runtime.api.AuthorizationException;
import org.cataphract.runtime.api.CampaignSnapshot;
import org.cataphract.runtime.api.CommitException;
import org.cataphract.runtime.api.ConflictException;
import org.cataphract.runtime.api.InvalidStateException;
import org.cataphract.runtime.api.NotFoundException;
import org.cataphract.runtime.api.OrderRequest;
import org.cataphract.runtime.api.TickAbortedException;
import org.cataphract.runtime.api.ValidationException;
import org.cataphract.runtime.audit.AuditEntry;
import org.cataphract.runtime.internal.services.SnapshotWriter;
import org.cataphract.runtime.model.Campaign;
import org.cataphract.runtime.model.CampaignStatus;
import org.cataphract.runtime.model.Tick;
import org.cataphract.runtime.orders.Order;
import org.cataphract.runtime.orders.OrderScheduler;
import org.cataphract.runtime.rules.RuleSet;
import org.cataphract.runtime.spi.ICampaignCommitter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Entry point for hosts. Every call that touches a campaign holds that
 * campaign's lock, so one campaign is mutated by one thread at a time while
 * different campaigns proceed in parallel.
 * <p>
 * {@link #advance} resolves day-parts one at a time. Each part works on the
 * live campaign; if it breaks an invariant or the host fails to commit it, the
 * campaign is restored to the state before the part and the call aborts.
 * Parts committed earlier in the same call stay committed.
 */
public class CampaignEngine {

    private static final Logger LOG = LoggerFactory.getLogger(CampaignEngine.class);

    private final OrderScheduler scheduler;
    private final TickEngine tickEngine;
    private final ICampaignCommitter committer;
    private final SnapshotWriter snapshotWriter = new SnapshotWriter();
    private final ConcurrentMap<Long, ReentrantLock> locks = new ConcurrentHashMap<>();

    public CampaignEngine(RulesConfig config, ICampaignCommitter committer) {
        RuleSet rules = new RuleSet(config);
        this.scheduler = new OrderScheduler(rules);
        this.tickEngine = new TickEngine(rules, scheduler);
        this.committer = committer;
    }

    public CampaignEngine(OrderScheduler scheduler, TickEngine tickEngine, ICampaignCommitter committer) {
        this.scheduler = scheduler;
        this.tickEngine = tickEngine;
        this.committer = committer;
    }

    public Order submitOrder(Campaign campaign, OrderRequest request) throws ValidationException,
            AuthorizationException, NotFoundException, ConflictException, InvalidStateException {
        ReentrantLock lock = lockFor(campaign);
        lock.lock();
        try {
            requireActive(campaign);
            return scheduler.submit(campaign, request);
        } finally {
            lock.unlock();
        }
    }

    public Order cancelOrder(Campaign campaign, long orderId) throws InvalidStateException, NotFoundException {
        ReentrantLock lock = lockFor(campaign);
        lock.lock();
        try {
            requireActive(campaign);
            return scheduler.cancel(campaign, orderId, tickEngine.rollsFor(campaign));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Resolves {@code days} whole days, committing after every part.
     *
     * @return the snapshot of the last part resolved.
     * @throws InvalidStateException if the campaign is not active.
     * @throws TickAbortedException  if a part was rolled back.
     */
    public CampaignSnapshot advance(Campaign campaign, int days) throws InvalidStateException, TickAbortedException {
        if (days < 1) {
            throw new IllegalArgumentException("days must be at least 1, got " + days);
        }
        ReentrantLock lock = lockFor(campaign);
        lock.lock();
        try {
            requireActive(campaign);
            CampaignSnapshot last = null;
            for (int part = 0; part < days * Tick.PARTS_PER_DAY; part++) {
                last = advancePart(campaign);
            }
            LOG.info("Campaign {} advanced {} days to {}", campaign.getId(), days, campaign.getCurrentTick());
            return last;
        } finally {
            lock.unlock();
        }
    }

    private CampaignSnapshot advancePart(Campaign campaign) throws TickAbortedException {
        Tick tick = campaign.getCurrentTick();
        Campaign before = campaign.deepCopy();
        int mark = campaign.getAuditLog().size();
        try {
            tickEngine.runPart(campaign, before);
            List<AuditEntry> entries = campaign.getAuditLog().entries();
            CampaignSnapshot snapshot = snapshotWriter.snapshot(campaign, tick, entries.subList(mark, entries.size()));
            committer.commit(snapshot);
            return snapshot;
        } catch (CommitException | RuntimeException e) {
            campaign.restoreFrom(before);
            LOG.error("Campaign {} rolled back {}", campaign.getId(), tick, e);
            throw new TickAbortedException(tick, e);
        }
    }

    /**
     * @return the audit entries produced at or after the given tick.
     */
    public List<AuditEntry> getAuditLog(Campaign campaign, Tick sinceTick) {
        ReentrantLock lock = lockFor(campaign);
        lock.lock();
        try {
            return List.copyOf(campaign.getAuditLog().entriesSince(sinceTick));
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return canonical JSON of the campaign as it stands.
     */
    public String stateJson(Campaign campaign) {
        ReentrantLock lock = lockFor(campaign);
        lock.lock();
        try {
            return snapshotWriter.stateJson(campaign);
        } finally {
            lock.unlock();
        }
    }

    private ReentrantLock lockFor(Campaign campaign) {
        return locks.computeIfAbsent(campaign.getId(), id -> new ReentrantLock());
    }

    private static void requireActive(Campaign campaign) throws InvalidStateException {
        if (campaign.getStatus() != CampaignStatus.ACTIVE) {
            throw new InvalidStateException("Campaign " + campaign.getId() + " is " + campaign.getStatus());
        }
    }
}
