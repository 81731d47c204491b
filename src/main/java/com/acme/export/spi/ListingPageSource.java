package com.acme.export.spi;

import com.acme.export.core.OwnerContext;
import com.acme.export.core.WorkItem;
import java.util.List;

/**
 * One page of the remote paginated listing. Failures use the same taxonomy as {@link RecordFetcher}.
 */
public interface ListingPageSource {

    /**
     * @throws com.acme.export.core.ListingEndException if the page does not exist (HTTP 404),
     *                                                  i.e. the listing ended before the advertised last page
     */
    ListingPage fetchPage(OwnerContext owner, int page);

    /**
     * @param lastPage highest page number advertised by the listing's pagination controls
     */
    record ListingPage(List<WorkItem> items, int lastPage) {
        public ListingPage {
            items = List.copyOf(items);
        }
    }
}
