package org.cataphract.runtime.upkeep;

import org.cataphract.runtime.spi.IUpkeepStep;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * A factory for upkeep steps, keyed by the names used in
 * {@code cataphract.tick.upkeep-steps}.
 */
public final class UpkeepStepFactory {

    private static final Map<String, Supplier<IUpkeepStep>> registry = new HashMap<>();

    static {
        register(SupplyDrainStep.NAME, SupplyDrainStep::new);
        register(SiegeAdvanceStep.NAME, SiegeAdvanceStep::new);
        register(RecruitmentStep.NAME, RecruitmentStep::new);
        register(MercenaryUpkeepStep.NAME, MercenaryUpkeepStep::new);
        register(MessageDeliveryStep.NAME, MessageDeliveryStep::new);
        register(FleetArrivalStep.NAME, FleetArrivalStep::new);
    }

    private UpkeepStepFactory() {
    }

    /**
     * Registers a step under a name, replacing any step registered under it before.
     * @param name The configuration name.
     * @param creator Creates a fresh step.
     */
    public static synchronized void register(String name, Supplier<IUpkeepStep> creator) {
        registry.put(name.toLowerCase(Locale.ROOT), creator);
    }

    /**
     * Creates the step registered under a name.
     * @param name The configuration name.
     * @return A new step.
     * @throws IllegalArgumentException if no step is registered under the name.
     */
    public static synchronized IUpkeepStep create(String name) {
        Objects.requireNonNull(name, "Upkeep step name cannot be null.");
        Supplier<IUpkeepStep> creator = registry.get(name.toLowerCase(Locale.ROOT));
        if (creator == null) {
            throw new IllegalArgumentException("Unknown upkeep step: " + name);
        }
        return creator.get();
    }

    /**
     * Creates the steps for a list of names, in list order.
     */
    public static List<IUpkeepStep> createAll(List<String> names) {
        List<IUpkeepStep> steps = new ArrayList<>(names.size());
        for (String name : names) {
            steps.add(create(name));
        }
        return steps;
    }
}
