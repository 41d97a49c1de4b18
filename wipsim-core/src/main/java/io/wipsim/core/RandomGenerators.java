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
import org.apache.commons.rng.sampling.distribution.ZigguratSampler;
import org.apache.commons.rng.simple.RandomSource;

/// Seeded random number generators for arrival generation.
///
/// Based on Apache Commons RNG. Generators are always created from an explicit seed and handed
/// to their consumers, so a run can be reproduced from its seed alone.
public class RandomGenerators {

    /// Available PRNG algorithms.
    public enum Algorithm {
        /// XorShiro256++, 256-bit state, fast with excellent statistical properties
        XO_SHI_RO_256_PP(RandomSource.XO_SHI_RO_256_PP),
        /// SplitMix64, 64-bit state, when minimal state is desired
        SPLIT_MIX_64(RandomSource.SPLIT_MIX_64),
        /// Mersenne Twister, 19937-bit state
        MT(RandomSource.MT);

        private final RandomSource source;

        Algorithm(RandomSource source) {
            this.source = source;
        }

        RandomSource getSource() {
            return source;
        }
    }

    private RandomGenerators() {
    }

    /// Create a generator with the given algorithm and seed.
    ///
    /// @param algorithm the PRNG algorithm to use
    /// @param seed the seed for deterministic generation
    /// @return a uniform random provider
    public static UniformRandomProvider create(Algorithm algorithm, long seed) {
        return algorithm.getSource().create(seed);
    }

    /// Create a generator with {@link Algorithm#XO_SHI_RO_256_PP} and the given seed.
    public static UniformRandomProvider create(long seed) {
        return create(Algorithm.XO_SHI_RO_256_PP, seed);
    }

    /// @return a standard normal sampler drawing from the given generator
    public static NormalizedGaussianSampler gaussian(UniformRandomProvider rng) {
        return ZigguratSampler.NormalizedGaussian.of(rng);
    }

    /// Draw a normally distributed value, rounded half away from zero and floored at a minimum.
    ///
    /// @param sampler standard normal sampler
    /// @param mean the mean of the distribution
    /// @param stddev the standard deviation, 0 yields the rounded mean
    /// @param lowest the smallest value returned
    /// @return the rounded value, at least `lowest`
    public static int roundedGaussian(NormalizedGaussianSampler sampler, double mean, double stddev, int lowest) {
        double value = sampler.sample() * stddev + mean;
        long rounded = Math.round(Math.abs(value)) * (value < 0 ? -1 : 1);
        return (int) Math.max(lowest, Math.min(rounded, Integer.MAX_VALUE));
    }
}
