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

package com.amazon.capa;

import static com.amazon.capa.CommonUtils.checkArgument;
import static com.amazon.capa.CommonUtils.checkNotNull;
import static com.amazon.capa.CommonUtils.checkSequence;

import java.util.Collections;
import java.util.List;

import lombok.Getter;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.amazon.capa.anomalydetection.AffectedComponentFinder;
import com.amazon.capa.anomalydetection.AnomalyReconstructor;
import com.amazon.capa.anomalydetection.OptimalPartitioning;
import com.amazon.capa.anomalydetection.PartitioningResult;
import com.amazon.capa.config.PenaltyPolicy;
import com.amazon.capa.config.SavingType;
import com.amazon.capa.penalty.IPenaltyFunction;
import com.amazon.capa.penalty.Penalty;
import com.amazon.capa.returntypes.Anomaly;
import com.amazon.capa.returntypes.CapaDescriptor;
import com.amazon.capa.returntypes.Segment;
import com.amazon.capa.saving.ISaving;

/**
 * Subset multivariate collective and point anomaly detection (MVCAPA), see
 * Fisch, Eckley and Fearnhead, "Subset multivariate collective and point
 * anomaly detection", Journal of Computational and Graphical Statistics 31(2),
 * 2022.
 *
 * The detector finds the partition of a sequence into normal stretches,
 * collective anomalies and point anomalies that maximizes the total penalized
 * saving. The penalty of an anomaly grows with the number of components it
 * affects, so the same detector handles anomalies in one component as well as
 * anomalies in all of them. Instances are immutable and can be reused across
 * sequences.
 */
@Getter
public class Mvcapa {

    private static final Logger logger = LogManager.getLogger(Mvcapa.class);

    public static final int DEFAULT_MIN_SEGMENT_LENGTH = 2;

    public static final int DEFAULT_MAX_SEGMENT_LENGTH = 1000;

    public static final double DEFAULT_COLLECTIVE_PENALTY_SCALE = 2.0;

    public static final double DEFAULT_POINT_PENALTY_SCALE = 2.0;

    public static final PenaltyPolicy DEFAULT_COLLECTIVE_PENALTY = PenaltyPolicy.COMBINED;

    public static final PenaltyPolicy DEFAULT_POINT_PENALTY = PenaltyPolicy.SPARSE;

    public static final SavingType DEFAULT_SAVING = SavingType.MEAN;

    private final ISaving<?> saving;

    private final IPenaltyFunction collectivePenaltyFunction;

    private final double collectivePenaltyScale;

    private final IPenaltyFunction pointPenaltyFunction;

    private final double pointPenaltyScale;

    private final int minSegmentLength;

    private final int maxSegmentLength;

    private final boolean ignorePointAnomalies;

    protected Mvcapa(Builder<?> builder) {
        this.saving = builder.saving;
        this.collectivePenaltyFunction = builder.collectivePenalty;
        this.collectivePenaltyScale = builder.collectivePenaltyScale;
        this.pointPenaltyFunction = builder.pointPenalty;
        this.pointPenaltyScale = builder.pointPenaltyScale;
        this.minSegmentLength = builder.minSegmentLength;
        this.maxSegmentLength = builder.maxSegmentLength;
        this.ignorePointAnomalies = builder.ignorePointAnomalies;
    }

    /**
     * The penalty of collective anomalies for a sequence of the given shape.
     *
     * @param sampleSize number of rows
     * @param dimensions number of columns
     * @return the penalty
     */
    public Penalty getCollectivePenalty(int sampleSize, int dimensions) {
        return checkPenalty(collectivePenaltyFunction.getPenalty(sampleSize, dimensions, saving.getParameterCount(),
                collectivePenaltyScale), dimensions);
    }

    public Penalty getPointPenalty(int sampleSize, int dimensions) {
        return checkPenalty(
                pointPenaltyFunction.getPenalty(sampleSize, dimensions, saving.getParameterCount(), pointPenaltyScale),
                dimensions);
    }

    static Penalty checkPenalty(Penalty penalty, int dimensions) {
        checkNotNull(penalty, "penalty function returned null");
        checkArgument(penalty.getDimensions() == dimensions,
                "penalty has " + penalty.getDimensions() + " betas, expected " + dimensions);
        return penalty;
    }

    /**
     * Detects the collective and point anomalies of a sequence.
     *
     * @param data the sequence, one row per time index and one column per
     *             component; must be rectangular, finite and have at least
     *             minSegmentLength rows
     * @return the anomalies with their affected components, and the optimal
     *         savings of every prefix
     */
    public CapaDescriptor detect(double[][] data) {
        int dimensions = checkSequence(data);
        checkArgument(data.length >= minSegmentLength, "data must have at least min segment length samples (rows = "
                + data.length + ", min segment length = " + minSegmentLength + ")");
        return detect(saving, data, dimensions);
    }

    <P> CapaDescriptor detect(ISaving<P> typedSaving, double[][] data, int dimensions) {
        int sampleSize = data.length;
        Penalty collectivePenalty = getCollectivePenalty(sampleSize, dimensions);
        Penalty pointPenalty = getPointPenalty(sampleSize, dimensions);
        logger.debug("Running MVCAPA on {} rows and {} columns, collective {}, point {}", sampleSize, dimensions,
                collectivePenalty, pointPenalty);

        P parameters = typedSaving.initialize(data);
        OptimalPartitioning<P> partitioning = new OptimalPartitioning<>(typedSaving, collectivePenalty, pointPenalty,
                minSegmentLength, maxSegmentLength);
        PartitioningResult result = partitioning.partition(parameters, sampleSize);

        List<Segment> segments = AnomalyReconstructor.reconstruct(result);
        List<Anomaly> collective = AffectedComponentFinder.find(typedSaving, parameters,
                AnomalyReconstructor.collective(segments), partitioning.getCollectiveOptimizer());
        List<Anomaly> points = (ignorePointAnomalies) ? Collections.emptyList()
                : AffectedComponentFinder.find(typedSaving, parameters, AnomalyReconstructor.points(segments),
                        partitioning.getPointOptimizer());
        logger.debug("Found {} collective and {} point anomalies", collective.size(), points.size());
        return new CapaDescriptor(collective, points, result.getPrefixSavings(), collectivePenalty, pointPenalty);
    }

    /**
     * @return a new builder.
     */
    public static Builder<?> builder() {
        return new Builder<>();
    }

    public static class Builder<T extends Builder<T>> {

        protected ISaving<?> saving = DEFAULT_SAVING.create();
        protected IPenaltyFunction collectivePenalty = DEFAULT_COLLECTIVE_PENALTY;
        protected double collectivePenaltyScale = DEFAULT_COLLECTIVE_PENALTY_SCALE;
        protected IPenaltyFunction pointPenalty = DEFAULT_POINT_PENALTY;
        protected double pointPenaltyScale = DEFAULT_POINT_PENALTY_SCALE;
        protected int minSegmentLength = DEFAULT_MIN_SEGMENT_LENGTH;
        protected int maxSegmentLength = DEFAULT_MAX_SEGMENT_LENGTH;
        protected boolean ignorePointAnomalies = false;

        void validate() {
            checkNotNull(saving, "saving must not be null");
            checkNotNull(collectivePenalty, "collective penalty must not be null");
            checkNotNull(pointPenalty, "point penalty must not be null");
            checkArgument(collectivePenaltyScale > 0 && Double.isFinite(collectivePenaltyScale),
                    "collective penalty scale must be positive");
            checkArgument(pointPenaltyScale > 0 && Double.isFinite(pointPenaltyScale),
                    "point penalty scale must be positive");
            checkArgument(minSegmentLength >= 2, "min segment length must be at least 2");
            checkArgument(maxSegmentLength >= minSegmentLength,
                    "max segment length must be at least min segment length");
        }

        public Mvcapa build() {
            validate();
            return new Mvcapa(this);
        }

        public T saving(ISaving<?> saving) {
            this.saving = saving;
            return (T) this;
        }

        public T saving(SavingType savingType) {
            checkNotNull(savingType, "saving type must not be null");
            this.saving = savingType.create();
            return (T) this;
        }

        public T collectivePenalty(IPenaltyFunction collectivePenalty) {
            this.collectivePenalty = collectivePenalty;
            return (T) this;
        }

        public T collectivePenalty(String name) {
            this.collectivePenalty = PenaltyPolicy.fromName(name);
            return (T) this;
        }

        public T collectivePenaltyScale(double collectivePenaltyScale) {
            this.collectivePenaltyScale = collectivePenaltyScale;
            return (T) this;
        }

        public T pointPenalty(IPenaltyFunction pointPenalty) {
            this.pointPenalty = pointPenalty;
            return (T) this;
        }

        public T pointPenalty(String name) {
            this.pointPenalty = PenaltyPolicy.fromName(name);
            return (T) this;
        }

        public T pointPenaltyScale(double pointPenaltyScale) {
            this.pointPenaltyScale = pointPenaltyScale;
            return (T) this;
        }

        public T minSegmentLength(int minSegmentLength) {
            this.minSegmentLength = minSegmentLength;
            return (T) this;
        }

        public T maxSegmentLength(int maxSegmentLength) {
            this.maxSegmentLength = maxSegmentLength;
            return (T) this;
        }

        public T ignorePointAnomalies(boolean ignorePointAnomalies) {
            this.ignorePointAnomalies = ignorePointAnomalies;
            return (T) this;
        }
    }
}
