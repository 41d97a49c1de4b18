package io.wipsim.core;

/*
 * Copyright (c) nosqlbench
 * 
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 * 
 *   http://www.apache.org/licenses/LICENSE-2.0
 * 
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.sampling.distribution.NormalizedGaussianSampler;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;

/// Random arrivals with normally distributed daily counts and efforts.
///
/// The number of tickets per day is drawn from `N(meanCount, stddevCount)`, rounded and floored
/// at zero; each effort is drawn from `N(meanEffort, stddevEffort)`, rounded and floored at the
/// minimum effort. All draws come from the generator passed in, so equal seeds give equal runs.
public class GaussianArrivalGenerator implements ArrivalSource {

    private static final Logger logger = LogManager.getLogger(GaussianArrivalGenerator.class);

    private final NormalizedGaussianSampler sampler;
    private final double meanCount;
    private final double stddevCount;
    private final double meanEffort;
    private final double stddevEffort;
    private final int minEffort;

    public GaussianArrivalGenerator(UniformRandomProvider rng, double meanCount, double stddevCount,
                                    double meanEffort, double stddevEffort, int minEffort) {
        if (stddevCount < 0.0 || stddevEffort < 0.0) {
            throw new IllegalArgumentException("Standard deviations must be non-negative");
        }
        if (minEffort < 1) {
            throw new IllegalArgumentException("Minimum effort must be at least 1, got " + minEffort);
        }
        this.sampler = RandomGenerators.gaussian(rng);
        this.meanCount = meanCount;
        this.stddevCount = stddevCount;
        this.meanEffort = meanEffort;
        this.stddevEffort = stddevEffort;
        this.minEffort = minEffort;
    }

    /// Create a generator from a run configuration, seeded with its seed.
    public static GaussianArrivalGenerator from(SimulationConfig config, RandomGenerators.Algorithm algorithm) {
        return new GaussianArrivalGenerator(
            RandomGenerators.create(algorithm, config.getSeed()),
            config.getMeanArrivalsPerDay(), config.getStddevArrivalsPerDay(),
            config.getMeanEffort(), config.getStddevEffort(), config.getMinEffort());
    }

    public static GaussianArrivalGenerator from(SimulationConfig config) {
        return from(config, RandomGenerators.Algorithm.XO_SHI_RO_256_PP);
    }

    @Override
    public List<Integer> effortsFor(int day) {
        int count = RandomGenerators.roundedGaussian(sampler, meanCount, stddevCount, 0);
        List<Integer> efforts = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            efforts.add(RandomGenerators.roundedGaussian(sampler, meanEffort, stddevEffort, minEffort));
        }
        logger.trace("day {}: {} arrivals {}", day, count, efforts);
        return efforts;
    }
}
