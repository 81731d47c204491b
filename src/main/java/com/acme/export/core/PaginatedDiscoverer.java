package com.acme.export.core;

import com.acme.export.config.ExportConfig;
import com.acme.export.spi.Discoverer;
import com.acme.export.spi.ListingPageSource;
import com.acme.export.spi.ListingPageSource.ListingPage;
import io.micronaut.context.annotation.Requires;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Walks the remote paginated listing: page 1 tells how many pages there are, then every
 * page is fetched under the listing budget. A page that cannot be fetched after retries
 * fails the whole discovery, since a partial universe would look like deleted records.
 * A page reported as not found ends the walk early.
 */
@Singleton
@Requires(beans = ListingPageSource.class)
public class PaginatedDiscoverer implements Discoverer {
    private static final Logger LOG = LoggerFactory.getLogger(PaginatedDiscoverer.class);

    private final ListingPageSource source;
    private final RateLimiter limiter;
    private final RetryPolicy retryPolicy;
    private final int maxPages;

    @Inject
    public PaginatedDiscoverer(ListingPageSource source, RetryPolicy retryPolicy, ExportConfig config) {
        this(source, new TokenBucketRateLimiter(config.getDiscovery().getRateCapacity(),
                config.getDiscovery().getRateRefillPerSecond()), retryPolicy, config.getDiscovery().getMaxPages());
    }

    PaginatedDiscoverer(ListingPageSource source, RateLimiter limiter, RetryPolicy retryPolicy, int maxPages) {
        this.source = source;
        this.limiter = limiter;
        this.retryPolicy = retryPolicy;
        this.maxPages = maxPages;
    }

    @Override
    public List<WorkItem> listAllIdentifiers(OwnerContext owner, CancellationToken token) {
        ListingPage first = fetchPage(owner, 1, token);
        int lastPage = Math.max(first.lastPage(), 1);
        if (lastPage > maxPages) {
            LOG.warn("Owner {} lists {} pages, only the first {} are read", owner.ownerId(), lastPage, maxPages);
            lastPage = maxPages;
        }
        LOG.info("Listing for owner {} has {} page(s)", owner.ownerId(), lastPage);
        Set<WorkItem> items = new HashSet<>(first.items());
        for (int page = 2; page <= lastPage; page++) {
            try {
                items.addAll(fetchPage(owner, page, token).items());
            } catch (ListingEndException e) {
                // pagination over-reported, e.g. a workout deleted during the walk
                LOG.info("Listing for owner {} ended at page {} of {} advertised: {}",
                        owner.ownerId(), page - 1, lastPage, e.getMessage());
                break;
            }
        }
        return items.stream().sorted(Comparator.reverseOrder()).toList();
    }

    private ListingPage fetchPage(OwnerContext owner, int page, CancellationToken token) {
        int attempts = 0;
        while (true) {
            token.throwIfCancelled();
            limiter.admit(token);
            attempts++;
            try {
                ListingPage listing = source.fetchPage(owner, page);
                if (listing == null) {
                    throw new PermanentException("Empty listing page " + page);
                }
                return listing;
            } catch (ListingEndException e) {
                if (page == 1) {
                    throw new DiscoveryException("No listing for owner " + owner.ownerId() + ": " + e.getMessage(), e);
                }
                throw e;
            } catch (RuntimeException e) {
                FailureKind kind = Failures.classify(e);
                if (kind == FailureKind.RATE_LIMITED) {
                    limiter.penalize();
                }
                RetryDecision decision = retryPolicy.decide(kind, attempts, Failures.retryAfter(e));
                if (!decision.retry()) {
                    throw new DiscoveryException("Failed to fetch listing page " + page + " for owner "
                            + owner.ownerId() + " after " + attempts + " attempt(s): " + Failures.describe(e), e);
                }
                LOG.debug("Listing page {} attempt {} failed ({}), retrying in {} ms",
                        page, attempts, kind, decision.delay().toMillis());
                if (!token.sleep(decision.delay())) {
                    throw new CancelledException("Cancelled while listing owner " + owner.ownerId());
                }
            }
        }
    }
}
