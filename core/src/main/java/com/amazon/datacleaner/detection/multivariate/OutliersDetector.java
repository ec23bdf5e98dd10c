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

package com.amazon.datacleaner.detection.multivariate;

import static com.amazon.datacleaner.CommonUtils.checkArgument;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;

import lombok.extern.slf4j.Slf4j;

import com.amazon.datacleaner.config.DetectorKind;
import com.amazon.datacleaner.detection.AbstractNumericTableDetector;
import com.amazon.datacleaner.detection.DetectorFailureException;
import com.amazon.datacleaner.frame.Column;
import com.amazon.datacleaner.frame.Table;
import com.amazon.datacleaner.statistics.Descriptive;
import com.amazon.datacleaner.statistics.DensityClustering;

/**
 * Multivariate outliers of a numeric table. Columns are standardized, rows
 * holding a missing value are left out, and the rows that DBSCAN labels as
 * noise are flagged. Clustering runs the first time the flagged rows are
 * asked for; any failure surfaces as a {@link DetectorFailureException}.
 */
@Slf4j
public class OutliersDetector extends AbstractNumericTableDetector {

    public static final String FAILURE_MESSAGE = "DBScan error: clustering failed for the given data and parameters";

    private final double eps;

    private final int minSamples;

    /**
     * standardized values, one array per column; NaN where the value is missing
     */
    private final double[][] standardized;

    private OutliersDetector(Table data, Double eps, int minSamples) {
        super(data);
        checkArgument(minSamples >= 1, "min_samples must be a positive integer");
        this.minSamples = minSamples;
        this.standardized = standardize(data);
        this.eps = eps == null ? defaultEps(standardized) : eps;
        log.debug("eps {} min samples {}", this.eps, minSamples);
    }

    public static OutliersDetector fromData(OutliersConfig config, Table data) {
        return new OutliersDetector(data, config.getEps(), config.getMinSamples());
    }

    private static double[][] standardize(Table data) {
        List<Column> columns = data.getColumns();
        double[][] result = new double[columns.size()][];
        for (int j = 0; j < columns.size(); j++) {
            Column column = columns.get(j);
            double[] values = column.toDoubleArray();
            double mean = Descriptive.mean(values);
            double std = Descriptive.std(values);
            result[j] = new double[column.size()];
            for (int i = 0; i < column.size(); i++) {
                result[j][i] = (column.getDouble(i) - mean) / std;
            }
        }
        return result;
    }

    /**
     * The largest sample standard deviation of the standardized columns. This
     * is 1 unless a column is constant or too short, in which case it is NaN
     * and the column is ignored.
     */
    private static double defaultEps(double[][] standardized) {
        double eps = Double.NaN;
        for (double[] column : standardized) {
            double std = Descriptive.std(nonNaN(column));
            if (!Double.isNaN(std) && (Double.isNaN(eps) || std > eps)) {
                eps = std;
            }
        }
        return eps;
    }

    private static double[] nonNaN(double[] values) {
        return Arrays.stream(values).filter(v -> !Double.isNaN(v)).toArray();
    }

    @Override
    protected Collection<Object> computeIndex() {
        List<Integer> positions = new ArrayList<>();
        for (int i = 0; i < data.size(); i++) {
            boolean complete = true;
            for (double[] column : standardized) {
                complete &= !Double.isNaN(column[i]);
            }
            if (complete) {
                positions.add(i);
            }
        }
        double[][] points = new double[positions.size()][standardized.length];
        for (int p = 0; p < positions.size(); p++) {
            for (int j = 0; j < standardized.length; j++) {
                points[p][j] = standardized[j][positions.get(p)];
            }
        }
        boolean[] noise;
        try {
            noise = new DensityClustering(eps, minSamples).noise(points);
        } catch (RuntimeException e) {
            throw new DetectorFailureException(FAILURE_MESSAGE, e);
        }
        List<Object> keys = new ArrayList<>();
        for (int p = 0; p < noise.length; p++) {
            if (noise[p]) {
                keys.add(data.getIndex().get(positions.get(p)));
            }
        }
        return keys;
    }

    public double getEps() {
        return eps;
    }

    public int getMinSamples() {
        return minSamples;
    }

    @Override
    public DetectorKind getKind() {
        return DetectorKind.OUTLIERS;
    }
}
