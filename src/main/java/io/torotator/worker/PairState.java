package io.torotator.worker;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Lifecycle of a {@link WorkerPair}.
 *
 * <pre>
 * ALLOCATING -&gt; STARTING       ports leased
 * STARTING   -&gt; ALLOCATING     launch failed; ports released, retry after backoff
 * STARTING   -&gt; REGISTERED     both processes running, forwarder port registered
 * REGISTERED -&gt; RETIRING       shutdown, a process exited, or lifetime expired
 * RETIRING   -&gt; DONE           deregistered, processes terminated, ports released
 * ALLOCATING, STARTING -&gt; DONE shutdown before the pair became reachable
 * </pre>
 */
public enum PairState {
    ALLOCATING,
    STARTING,
    REGISTERED,
    RETIRING,
    DONE;

    private static final Map<PairState, Set<PairState>> TRANSITIONS = new EnumMap<>(PairState.class);

    static {
        TRANSITIONS.put(ALLOCATING, EnumSet.of(STARTING, DONE));
        TRANSITIONS.put(STARTING, EnumSet.of(ALLOCATING, REGISTERED, DONE));
        TRANSITIONS.put(REGISTERED, EnumSet.of(RETIRING));
        TRANSITIONS.put(RETIRING, EnumSet.of(DONE));
        TRANSITIONS.put(DONE, EnumSet.noneOf(PairState.class));
    }

    public boolean canMoveTo(PairState next) {
        return TRANSITIONS.get(this).contains(next);
    }
}
