package org.cataphract.runtime.spi;

import org.cataphract.runtime.api.CampaignSnapshot;
import org.cataphract.runtime.api.CommitException;

/**
 * Host callback that persists the state reached after each day-part.
 */
@FunctionalInterface
public interface ICampaignCommitter {

    /**
     * Persists a resolved part. Throwing rolls the part back in memory as well.
     *
     * @param snapshot State and audit entries of the part just resolved.
     * @throws CommitException if the snapshot could not be persisted.
     */
    void commit(CampaignSnapshot snapshot) throws CommitException;
}
