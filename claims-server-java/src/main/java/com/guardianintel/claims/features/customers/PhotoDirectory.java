package com.guardianintel.claims.features.customers;

import java.util.Collection;
import java.util.List;

public interface PhotoDirectory {

    /**
     * Looks up photos by id. Ids that do not exist are simply absent from the
     * result; callers compare sizes to detect them.
     */
    List<Photo> findByIds(Collection<Long> photoIds);
}
