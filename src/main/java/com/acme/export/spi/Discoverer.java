package com.acme.export.spi;

import com.acme.export.core.CancellationToken;
import com.acme.export.core.OwnerContext;
import com.acme.export.core.WorkItem;
import java.util.List;

public interface Discoverer {

    /**
     * Enumerates every remote identifier of the owner.
     *
     * @param token the run's cancellation token, checked between remote requests
     * @throws com.acme.export.core.DiscoveryException if the source cannot be enumerated
     * @throws com.acme.export.core.CancelledException if the run is cancelled while listing
     */
    List<WorkItem> listAllIdentifiers(OwnerContext owner, CancellationToken token);
}
