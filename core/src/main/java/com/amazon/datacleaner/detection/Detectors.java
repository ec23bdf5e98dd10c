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

package com.amazon.datacleaner.detection;

import static com.amazon.datacleaner.CommonUtils.checkArgument;
import static com.amazon.datacleaner.CommonUtils.checkNotNull;

import java.util.function.Supplier;

import com.amazon.datacleaner.config.DetectorKind;
import com.amazon.datacleaner.detection.bound.BoundedConfig;
import com.amazon.datacleaner.detection.bound.BoundedDetector;
import com.amazon.datacleaner.detection.bound.DateRangeConfig;
import com.amazon.datacleaner.detection.bound.DateRangeDetector;
import com.amazon.datacleaner.detection.bound.LengthConfig;
import com.amazon.datacleaner.detection.bound.LengthDetector;
import com.amazon.datacleaner.detection.bound.QuantilesConfig;
import com.amazon.datacleaner.detection.bound.QuantilesDetector;
import com.amazon.datacleaner.detection.frequency.AssociationsConfig;
import com.amazon.datacleaner.detection.frequency.AssociationsDetector;
import com.amazon.datacleaner.detection.frequency.CountsConfig;
import com.amazon.datacleaner.detection.frequency.CountsDetector;
import com.amazon.datacleaner.detection.frequency.EnumConfig;
import com.amazon.datacleaner.detection.frequency.EnumDetector;
import com.amazon.datacleaner.detection.frequency.FreqConfig;
import com.amazon.datacleaner.detection.frequency.FreqDetector;
import com.amazon.datacleaner.detection.frequency.ValueConfig;
import com.amazon.datacleaner.detection.frequency.ValueDetector;
import com.amazon.datacleaner.detection.gaussian.GaussianConfig;
import com.amazon.datacleaner.detection.gaussian.IqrDetector;
import com.amazon.datacleaner.detection.gaussian.ModZScoreDetector;
import com.amazon.datacleaner.detection.gaussian.ZScoreDetector;
import com.amazon.datacleaner.detection.generic.CustomConfig;
import com.amazon.datacleaner.detection.generic.CustomDetector;
import com.amazon.datacleaner.detection.generic.CustomRowsDetector;
import com.amazon.datacleaner.detection.generic.DuplicatedConfig;
import com.amazon.datacleaner.detection.generic.DuplicatedDetector;
import com.amazon.datacleaner.detection.generic.DuplicatedRowsDetector;
import com.amazon.datacleaner.detection.multivariate.ByCategoryConfig;
import com.amazon.datacleaner.detection.multivariate.ByCategoryDetector;
import com.amazon.datacleaner.detection.multivariate.OutliersConfig;
import com.amazon.datacleaner.detection.multivariate.OutliersDetector;
import com.amazon.datacleaner.detection.text.EmailDetector;
import com.amazon.datacleaner.detection.text.KeyCollisionConfig;
import com.amazon.datacleaner.detection.text.KeyCollisionDetector;
import com.amazon.datacleaner.detection.text.PatternConfig;
import com.amazon.datacleaner.detection.text.PatternDetector;
import com.amazon.datacleaner.detection.text.PingConfig;
import com.amazon.datacleaner.detection.text.PingDetector;
import com.amazon.datacleaner.detection.text.SpacesConfig;
import com.amazon.datacleaner.detection.text.SpacesDetector;
import com.amazon.datacleaner.detection.text.UrlConfig;
import com.amazon.datacleaner.detection.text.UrlDetector;
import com.amazon.datacleaner.detection.types.CastableConfig;
import com.amazon.datacleaner.detection.types.CastableDetector;
import com.amazon.datacleaner.detection.types.TypesConfig;
import com.amazon.datacleaner.detection.types.TypesDetector;
import com.amazon.datacleaner.frame.Column;
import com.amazon.datacleaner.frame.Table;

/**
 * Entry point building a detector from its kind. A null configuration stands
 * for the defaults of the kind; otherwise its class must match the kind.
 */
public final class Detectors {

    public static final String NO_CLONE_MESSAGE = "This detection method can not be used with an existing detector"
            + " as an input.";

    private Detectors() {
    }

    /**
     * Fits a detector of the given kind on a column.
     *
     * @param kind   the detection method
     * @param config its parameters, null for the defaults
     * @param data   the column to inspect
     * @return the fitted detector
     */
    public static IDetector<Column> fromData(DetectorKind kind, DetectorConfig config, Column data) {
        checkNotNull(kind, "A detection method must be provided");
        checkNotNull(data, "data must not be null");
        switch (kind) {
        case BOUNDED:
            return BoundedDetector.fromData(config(kind, config, BoundedConfig.class, BoundedConfig.builder()::build),
                    data);
        case QUANTILES:
            return QuantilesDetector
                    .fromData(config(kind, config, QuantilesConfig.class, QuantilesConfig.builder()::build), data);
        case IQR:
            return IqrDetector.fromData(config(kind, config, GaussianConfig.class, GaussianConfig::defaults), data);
        case ZSCORE:
            return ZScoreDetector.fromData(config(kind, config, GaussianConfig.class, GaussianConfig::defaults), data);
        case MODZSCORE:
            return ModZScoreDetector.fromData(config(kind, config, GaussianConfig.class, GaussianConfig::defaults),
                    data);
        case LENGTH:
            return LengthDetector.fromData(config(kind, config, LengthConfig.class, LengthConfig.builder()::build),
                    data);
        case DATE_RANGE:
            return DateRangeDetector
                    .fromData(config(kind, config, DateRangeConfig.class, DateRangeConfig.builder()::build), data);
        case ENUM:
            return EnumDetector.fromData(config(kind, config, EnumConfig.class, EnumConfig.builder()::build), data);
        case VALUE:
            return ValueDetector.fromData(config(kind, config, ValueConfig.class, ValueConfig.builder()::build), data);
        case COUNTS:
            return CountsDetector.fromData(config(kind, config, CountsConfig.class, CountsConfig.builder()::build),
                    data);
        case FREQ:
            return FreqDetector.fromData(config(kind, config, FreqConfig.class, FreqConfig.builder()::build), data);
        case PATTERN:
            return PatternDetector.fromData(config(kind, config, PatternConfig.class, PatternConfig.builder()::build),
                    data);
        case EMAIL:
            checkArgument(config == null, "email takes no parameter");
            return EmailDetector.fromData(data);
        case URL:
            return UrlDetector.fromData(config(kind, config, UrlConfig.class, UrlConfig.builder()::build), data);
        case PING:
            return PingDetector.fromData(config(kind, config, PingConfig.class, PingConfig.builder()::build), data);
        case SPACES:
            return SpacesDetector.fromData(config(kind, config, SpacesConfig.class, SpacesConfig.builder()::build),
                    data);
        case KEY_COLLISION:
            return KeyCollisionDetector.fromData(
                    config(kind, config, KeyCollisionConfig.class, KeyCollisionConfig.builder()::build), data);
        case TYPES:
            return TypesDetector.fromData(config(kind, config, TypesConfig.class, TypesConfig.builder()::build), data);
        case CASTABLE:
            return CastableDetector
                    .fromData(config(kind, config, CastableConfig.class, CastableConfig.builder()::build), data);
        case DUPLICATED:
            return DuplicatedDetector
                    .fromData(config(kind, config, DuplicatedConfig.class, DuplicatedConfig.builder()::build), data);
        case CUSTOM:
            return CustomDetector.fromData(config(kind, config, CustomConfig.class, CustomConfig.builder()::build),
                    data);
        default:
            throw new IncompatibleDataException(kind + " applies to tables, not to a single column");
        }
    }

    /**
     * Fits a detector of the given kind on a table. A numerical column method
     * given a table with one numerical and one categorical column runs within
     * each category.
     *
     * @param kind   the detection method
     * @param config its parameters, null for the defaults
     * @param data   the table to inspect
     * @return the fitted detector
     */
    public static IDetector<Table> fromData(DetectorKind kind, DetectorConfig config, Table data) {
        checkNotNull(kind, "A detection method must be provided");
        checkNotNull(data, "data must not be null");
        if (kind.isNumericColumnKind()) {
            if (!AbstractNumericCategoricalTableDetector.isNumericCategorical(data)) {
                throw new IncompatibleDataException(AbstractNumericCategoricalTableDetector.INCOMPATIBLE_MESSAGE);
            }
            return ByCategoryDetector
                    .fromData(ByCategoryConfig.builder().method(kind).methodConfig(config).build(), data);
        }
        switch (kind) {
        case ASSOCIATIONS:
            return AssociationsDetector.fromData(
                    config(kind, config, AssociationsConfig.class, AssociationsConfig.builder()::build), data);
        case OUTLIERS:
            return OutliersDetector
                    .fromData(config(kind, config, OutliersConfig.class, OutliersConfig.builder()::build), data);
        case BY_CATEGORY:
            return ByCategoryDetector
                    .fromData(config(kind, config, ByCategoryConfig.class, ByCategoryConfig.builder()::build), data);
        case DUPLICATED:
            return DuplicatedRowsDetector
                    .fromData(config(kind, config, DuplicatedConfig.class, DuplicatedConfig.builder()::build), data);
        case CUSTOM:
            return CustomRowsDetector
                    .fromData(config(kind, config, CustomConfig.class, CustomConfig.builder()::build), data);
        default:
            throw new IncompatibleDataException(kind + " applies to a single column, not to a table");
        }
    }

    /**
     * Applies the fitted parameters of an existing detector to another column.
     *
     * @param source a detector fitted on a column
     * @param data   the column to inspect
     * @return a detector of the same kind and parameters bound to {@code data}
     */
    public static IDetector<Column> fromDetector(IDetector<?> source, Column data) {
        checkNotNull(source, "source detector must not be null");
        checkNotNull(data, "data must not be null");
        switch (source.getKind()) {
        case BOUNDED:
            return BoundedDetector.fromDetector(source(source, BoundedDetector.class), data);
        case QUANTILES:
            return QuantilesDetector.fromDetector(source(source, QuantilesDetector.class), data);
        case IQR:
            return IqrDetector.fromDetector(source(source, IqrDetector.class), data);
        case ZSCORE:
            return ZScoreDetector.fromDetector(source(source, ZScoreDetector.class), data);
        case MODZSCORE:
            return ModZScoreDetector.fromDetector(source(source, ModZScoreDetector.class), data);
        case LENGTH:
            return LengthDetector.fromDetector(source(source, LengthDetector.class), data);
        case DATE_RANGE:
            return DateRangeDetector.fromDetector(source(source, DateRangeDetector.class), data);
        case ENUM:
            return EnumDetector.fromDetector(source(source, EnumDetector.class), data);
        case VALUE:
            return ValueDetector.fromDetector(source(source, ValueDetector.class), data);
        case COUNTS:
            return CountsDetector.fromDetector(source(source, CountsDetector.class), data);
        case FREQ:
            return FreqDetector.fromDetector(source(source, FreqDetector.class), data);
        case PATTERN:
            return PatternDetector.fromDetector(source(source, PatternDetector.class), data);
        case EMAIL:
            return EmailDetector.fromDetector(source(source, EmailDetector.class), data);
        case URL:
            return UrlDetector.fromDetector(source(source, UrlDetector.class), data);
        case PING:
            return PingDetector.fromDetector(source(source, PingDetector.class), data);
        case SPACES:
            return SpacesDetector.fromDetector(source(source, SpacesDetector.class), data);
        case KEY_COLLISION:
            return KeyCollisionDetector.fromDetector(source(source, KeyCollisionDetector.class), data);
        case TYPES:
            return TypesDetector.fromDetector(source(source, TypesDetector.class), data);
        case CASTABLE:
            return CastableDetector.fromDetector(source(source, CastableDetector.class), data);
        case DUPLICATED:
            return DuplicatedDetector.fromDetector(source(source, DuplicatedDetector.class), data);
        case CUSTOM:
            return CustomDetector.fromDetector(source(source, CustomDetector.class), data);
        default:
            throw new IllegalArgumentException(NO_CLONE_MESSAGE);
        }
    }

    /**
     * Applies the fitted parameters of an existing table detector to another
     * table.
     *
     * @param source a detector fitted on a table
     * @param data   the table to inspect
     * @return a detector of the same kind and parameters bound to {@code data}
     */
    public static IDetector<Table> fromDetector(IDetector<?> source, Table data) {
        checkNotNull(source, "source detector must not be null");
        checkNotNull(data, "data must not be null");
        switch (source.getKind()) {
        case ASSOCIATIONS:
            return AssociationsDetector.fromDetector(source(source, AssociationsDetector.class), data);
        case DUPLICATED:
            return DuplicatedRowsDetector.fromDetector(source(source, DuplicatedRowsDetector.class), data);
        case CUSTOM:
            return CustomRowsDetector.fromDetector(source(source, CustomRowsDetector.class), data);
        default:
            throw new IllegalArgumentException(NO_CLONE_MESSAGE);
        }
    }

    private static <C extends DetectorConfig> C config(DetectorKind kind, DetectorConfig config, Class<C> type,
            Supplier<C> defaults) {
        if (config == null) {
            return defaults.get();
        }
        checkArgument(type.isInstance(config), String.format("%s expects a %s, found %s", kind, type.getSimpleName(),
                config.getClass().getSimpleName()));
        return type.cast(config);
    }

    private static <D> D source(IDetector<?> source, Class<D> type) {
        checkArgument(type.isInstance(source), String.format("a %s detector can not be applied to this data: %s",
                source.getKind(), source.getClass().getSimpleName()));
        return type.cast(source);
    }
}
