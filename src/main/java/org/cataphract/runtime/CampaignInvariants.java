package org.cataphract.runtime;

import org.cataphract.runtime.api.InvariantViolationException;
import org.cataphract.runtime.audit.AuditEntry;
import org.cataphract.runtime.model.Army;
import org.cataphract.runtime.model.Campaign;
import org.cataphract.runtime.model.Detachment;
import org.cataphract.runtime.model.Stronghold;
import org.cataphract.runtime.orders.Order;
import org.cataphract.runtime.orders.OrderStatus;

import java.util.List;

/**
 * Consistency checks run at the end of every day-part. Any failure means the
 * rules produced an impossible state, and the part is rolled back.
 */
public final class CampaignInvariants {

    /**
     * @param before The campaign as it stood when the part began.
     * @param after  The campaign at the end of the part.
     * @throws InvariantViolationException on the first broken invariant found.
     */
    public void check(Campaign before, Campaign after) {
        for (Army army : after.getArmies().values()) {
            if (!after.getMap().hasHex(army.getLocationHexId())) {
                fail("Army " + army.getId() + " stands on missing hex " + army.getLocationHexId());
            }
            if (army.getSuppliesCurrent() < 0 || army.getSuppliesCurrent() > army.getSuppliesCapacity()) {
                fail("Army " + army.getId() + " holds " + army.getSuppliesCurrent() + " supplies with capacity "
                        + army.getSuppliesCapacity());
            }
            if (army.getMoraleCurrent() < 0 || army.getMoraleCurrent() > army.getMoraleMax()) {
                fail("Army " + army.getId() + " morale " + army.getMoraleCurrent() + " outside [0, "
                        + army.getMoraleMax() + "]");
            }
            if (army.getLootCarried() < 0) {
                fail("Army " + army.getId() + " carries negative loot");
            }
            for (Detachment detachment : army.getDetachments()) {
                if (detachment.getSoldiers() < 0 || detachment.getWagons() < 0) {
                    fail("Detachment " + detachment.getId() + " of army " + army.getId() + " has negative strength");
                }
            }
        }
        for (Stronghold stronghold : after.getStrongholds().values()) {
            if (stronghold.getCurrentThreshold() < 0) {
                fail("Stronghold " + stronghold.getId() + " threshold is negative");
            }
            Stronghold earlier = before.getStrongholds().get(stronghold.getId());
            if (earlier != null && stronghold.getCurrentThreshold() > earlier.getCurrentThreshold()
                    && before.findActiveSiege(stronghold.getId()).isPresent()
                    && after.findActiveSiege(stronghold.getId()).isPresent()) {
                fail("Stronghold " + stronghold.getId() + " threshold rose from " + earlier.getCurrentThreshold()
                        + " to " + stronghold.getCurrentThreshold() + " under siege");
            }
        }
        for (Order earlier : before.getOrders().values()) {
            Order now = after.getOrders().get(earlier.getId());
            if (now == null) {
                fail("Order " + earlier.getId() + " disappeared");
            } else if (now.getStatus() != earlier.getStatus() && !reachable(earlier, now)) {
                fail("Order " + earlier.getId() + " went from " + earlier.getStatus() + " back to " + now.getStatus());
            }
        }
        List<AuditEntry> old = before.getAuditLog().entries();
        List<AuditEntry> current = after.getAuditLog().entries();
        if (current.size() < old.size() || !current.subList(0, old.size()).equals(old)) {
            fail("Audit log of campaign " + after.getId() + " was rewritten");
        }
    }

    private static boolean reachable(Order from, Order to) {
        if (from.getStatus().canTransitionTo(to.getStatus())) {
            return true;
        }
        // PENDING may pass through EXECUTING within one part.
        return from.getStatus().canTransitionTo(OrderStatus.EXECUTING)
                && OrderStatus.EXECUTING.canTransitionTo(to.getStatus());
    }

    private static void fail(String message) {
        throw new InvariantViolationException(message);
    }
}
