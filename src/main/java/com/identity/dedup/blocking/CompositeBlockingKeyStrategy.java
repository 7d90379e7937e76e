package com.identity.dedup.blocking;

import com.identity.dedup.core.model.NormalizedIdentity;

import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Union of the keys of several strategies.
 */
public class CompositeBlockingKeyStrategy implements BlockingKeyStrategy {

    private final List<BlockingKeyStrategy> delegates;

    public CompositeBlockingKeyStrategy(List<BlockingKeyStrategy> delegates) {
        this.delegates = List.copyOf(delegates);
    }

    @Override
    public Set<String> generateKeys(NormalizedIdentity identity) {
        Set<String> keys = new TreeSet<>();
        for (BlockingKeyStrategy delegate : delegates) {
            keys.addAll(delegate.generateKeys(identity));
        }
        return keys;
    }
}
