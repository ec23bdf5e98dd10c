/*
 * Copyright 2020 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License").
 * You may not use this file except in compliance with the License.
 * A copy of the License is located at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * or in the "license" file accompanying this file. This file is distributed
 * on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either
 * express or implied. See the License for the specific language governing
 * permissions and limitations under the License.
 */

package com.amazon.datacleaner.statistics;

import static com.amazon.datacleaner.CommonUtils.checkArgument;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.apache.commons.math3.ml.clustering.Cluster;
import org.apache.commons.math3.ml.clustering.Clusterable;
import org.apache.commons.math3.ml.clustering.DBSCANClusterer;

/**
 * DBSCAN noise labelling. A point is a core point when at least
 * {@code minSamples} points, itself included, lie within {@code eps}
 * (euclidean distance, bound included). Points that are neither core points
 * nor within {@code eps} of a core point are noise.
 */
public class DensityClustering {

    private final double eps;

    private final int minSamples;

    public DensityClustering(double eps, int minSamples) {
        checkArgument(!Double.isNaN(eps) && !Double.isInfinite(eps) && eps > 0, "eps must be a positive number");
        checkArgument(minSamples >= 1, "min_samples must be at least 1");
        this.eps = eps;
        this.minSamples = minSamples;
    }

    /**
     * @param points one row per point, all rows of the same dimension
     * @return for each point, true if it belongs to no cluster
     */
    public boolean[] noise(double[][] points) {
        checkArgument(points.length > 0, "no point to cluster");
        List<IndexedPoint> wrapped = new ArrayList<>(points.length);
        for (int i = 0; i < points.length; i++) {
            wrapped.add(new IndexedPoint(i, points[i]));
        }
        // the clusterer does not count a point among its own neighbours
        DBSCANClusterer<IndexedPoint> clusterer = new DBSCANClusterer<>(eps, minSamples - 1);
        boolean[] noise = new boolean[points.length];
        Arrays.fill(noise, true);
        for (Cluster<IndexedPoint> cluster : clusterer.cluster(wrapped)) {
            for (IndexedPoint point : cluster.getPoints()) {
                noise[point.position] = false;
            }
        }
        return noise;
    }

    private static class IndexedPoint implements Clusterable {

        private final int position;

        private final double[] point;

        IndexedPoint(int position, double[] point) {
            this.position = position;
            this.point = point;
        }

        @Override
        public double[] getPoint() {
            return point;
        }
    }
}
