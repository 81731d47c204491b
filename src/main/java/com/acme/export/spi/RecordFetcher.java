package com.acme.export.spi;

import com.acme.export.core.Artifact;
import com.acme.export.core.OwnerContext;
import com.acme.export.core.WorkItem;

public interface RecordFetcher {

    /**
     * Fetches one remote record and converts it into its output artifact.
     *
     * @throws com.acme.export.core.TransientException    network error, timeout, 5xx
     * @throws com.acme.export.core.RateLimitedException  remote signalled over-budget
     * @throws com.acme.export.core.PermanentException    parse failure, 4xx, malformed data
     */
    Artifact fetchAndConvert(OwnerContext owner, WorkItem item);
}
