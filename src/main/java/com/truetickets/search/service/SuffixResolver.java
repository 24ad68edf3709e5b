package com.truetickets.search.service;

import com.truetickets.search.config.SearchProperties;
import com.truetickets.search.model.SearchStrategy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalLong;

/**
 * Expands the last three digits of a ticket number into the absolute numbers worth probing.
 *
 * <p>Ticket numbers are assumed to grow by one per ticket without gaps, so the newest ticket
 * {@code latest} bounds what a suffix can mean: the suffix is placed in the thousand-block of
 * {@code latest}, moved one block back if that lands above {@code latest}, and then older blocks
 * are added as further candidates. Gaps, reused numbers or a stale {@code latest} make the
 * guess miss; nothing here tries to correct for that.
 */
@Slf4j
@Component
public class SuffixResolver {

    private static final long BLOCK = 1000;

    private final int lookbackBlocks;

    @Autowired
    public SuffixResolver(SearchProperties properties) {
        this(properties.suffixLookbackBlocks());
    }

    SuffixResolver(int lookbackBlocks) {
        if (lookbackBlocks < 1) {
            throw new IllegalArgumentException("lookbackBlocks must be at least 1");
        }
        this.lookbackBlocks = lookbackBlocks;
    }

    /**
     * Candidates newest first. Candidates below 1 are dropped, so the list may be shorter than
     * the lookback depth or even empty.
     */
    public List<Long> candidates(int suffix, long latest) {
        if (suffix < 0 || suffix >= BLOCK) {
            throw new IllegalArgumentException("Suffix must have three digits: " + suffix);
        }

        long base = Math.floorDiv(latest, BLOCK) * BLOCK + suffix;
        if (base > latest) {
            base -= BLOCK;
        }

        List<Long> candidates = new ArrayList<>(lookbackBlocks);
        for (int block = 0; block < lookbackBlocks; block++) {
            long candidate = base - block * BLOCK;
            if (candidate >= 1) {
                candidates.add(candidate);
            }
        }
        return candidates;
    }

    /**
     * Fills in the candidates of a suffix lookup. Without a known latest ticket number the suffix
     * is looked up as a plain ticket number instead.
     */
    public SearchStrategy resolve(SearchStrategy.SuffixTicketLookup lookup, OptionalLong latest) {
        if (latest.isEmpty()) {
            log.debug("Latest ticket number unknown, looking up '{}' as an exact number", lookup.suffix());
            return new SearchStrategy.ExactTicketLookup(lookup.suffix());
        }
        List<Long> candidates = candidates(Integer.parseInt(lookup.suffix()), latest.getAsLong());
        log.debug("Suffix '{}' with latest ticket {} resolves to {}", lookup.suffix(), latest.getAsLong(), candidates);
        return lookup.withCandidates(candidates);
    }
}
