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

import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Warmup;
import org.openjdk.jmh.infra.Blackhole;

import com.amazon.capa.config.PenaltyPolicy;
import com.amazon.capa.returntypes.CapaDescriptor;
import com.amazon.capa.testutils.AnomalousDataGenerator;

@Warmup(iterations = 2)
@Measurement(iterations = 5)
@Fork(value = 1)
@State(Scope.Thread)
public class MvcapaBenchmark {

    public final static int DATA_SIZE = 2_000;

    @State(Scope.Benchmark)
    public static class BenchmarkState {
        @Param({ "1", "5", "20" })
        int dimensions;

        @Param({ "50", "200" })
        int maxSegmentLength;

        @Param({ "COMBINED", "SPARSE", "DENSE" })
        PenaltyPolicy penalty;

        double[][] data;
        Mvcapa detector;

        @Setup(Level.Trial)
        public void setUpData() {
            AnomalousDataGenerator generator = new AnomalousDataGenerator(42).addMeanShift(500, 519, 3.0)
                    .addMeanShift(1200, 1239, 2.0, 0).addVarianceShift(1700, 1749, 3.0);
            data = generator.generate(DATA_SIZE, dimensions);
            detector = Mvcapa.builder().collectivePenalty(penalty).maxSegmentLength(maxSegmentLength).build();
        }
    }

    @Benchmark
    public CapaDescriptor detect(BenchmarkState state, Blackhole blackhole) {
        CapaDescriptor result = state.detector.detect(state.data);
        blackhole.consume(result.getNumberOfAnomalies());
        return result;
    }
}
