package org.Aayush.geomatch.core;

import org.Aayush.geomatch.model.PointSet;
import org.Aayush.geomatch.model.ResultSet;

/**
 * Public nearest-point matching contract.
 */
public interface MatchService {
    /**
     * Matches every query point to its nearest reference point.
     *
     * @param queries query set; output order follows this set.
     * @param references reference set searched for each query.
     * @return one record per query point, or an empty result when either set is empty.
     */
    ResultSet match(PointSet queries, PointSet references);
}
