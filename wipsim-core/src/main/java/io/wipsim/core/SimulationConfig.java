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

import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/// Immutable parameters for one run of a {@link SimulationSet}.
///
/// Build with {@link #builder()}; every field has a default, and {@link Builder#build()} rejects
/// invalid values with an {@link IllegalArgumentException} naming the offending field.
///
/// ```java
/// SimulationConfig config = SimulationConfig.builder()
///     .days(100)
///     .meanEffort(7.0)
///     .seed(42L)
///     .build();
/// ```
public class SimulationConfig {

    public static final int DEFAULT_DAYS = 20;
    public static final int DEFAULT_DETAIL_LIMIT = 20;
    /// Upper bound for the mean and deviation of daily arrivals
    public static final int MAX_ARRIVALS_PER_DAY = 10_000;
    /// Upper bound for effort parameters, keeping every drawn effort well inside an int
    public static final int MAX_EFFORT_HOURS = 1_000_000;

    private final int days;
    private final double meanArrivalsPerDay;
    private final double stddevArrivalsPerDay;
    private final double meanEffort;
    private final double stddevEffort;
    private final int minEffort;
    private final int dailyCapacityHours;
    private final int wipCapHoursPerTicket;
    private final long seed;
    private final int detailLimit;
    private final List<BurndownPolicy> policies;

    private SimulationConfig(Builder builder) {
        this.days = builder.days;
        this.meanArrivalsPerDay = builder.meanArrivalsPerDay;
        this.stddevArrivalsPerDay = builder.stddevArrivalsPerDay;
        this.meanEffort = builder.meanEffort;
        this.stddevEffort = builder.stddevEffort;
        this.minEffort = builder.minEffort;
        this.dailyCapacityHours = builder.dailyCapacityHours;
        this.wipCapHoursPerTicket = builder.wipCapHoursPerTicket;
        this.seed = builder.seed != null ? builder.seed : System.nanoTime();
        this.detailLimit = builder.detailLimit;
        // enum order keeps the report in a fixed policy order
        this.policies = List.copyOf(EnumSet.copyOf(builder.policies));
    }

    public static Builder builder() {
        return new Builder();
    }

    public int getDays() {
        return days;
    }

    public double getMeanArrivalsPerDay() {
        return meanArrivalsPerDay;
    }

    public double getStddevArrivalsPerDay() {
        return stddevArrivalsPerDay;
    }

    public double getMeanEffort() {
        return meanEffort;
    }

    public double getStddevEffort() {
        return stddevEffort;
    }

    public int getMinEffort() {
        return minEffort;
    }

    public int getDailyCapacityHours() {
        return dailyCapacityHours;
    }

    public int getWipCapHoursPerTicket() {
        return wipCapHoursPerTicket;
    }

    public long getSeed() {
        return seed;
    }

    /// @return the largest day count or population size still printed in full
    public int getDetailLimit() {
        return detailLimit;
    }

    public List<BurndownPolicy> getPolicies() {
        return policies;
    }

    @Override
    public String toString() {
        return "SimulationConfig{" +
            "days=" + days +
            ", meanArrivalsPerDay=" + meanArrivalsPerDay +
            ", stddevArrivalsPerDay=" + stddevArrivalsPerDay +
            ", meanEffort=" + meanEffort +
            ", stddevEffort=" + stddevEffort +
            ", minEffort=" + minEffort +
            ", dailyCapacityHours=" + dailyCapacityHours +
            ", wipCapHoursPerTicket=" + wipCapHoursPerTicket +
            ", seed=" + seed +
            ", policies=" + policies +
            '}';
    }

    /// Builder for {@link SimulationConfig}.
    public static class Builder {
        private int days = DEFAULT_DAYS;
        private double meanArrivalsPerDay = 1.0;
        private double stddevArrivalsPerDay = 1.0;
        private double meanEffort = 6.0;
        private double stddevEffort = 4.0;
        private int minEffort = 1;
        private int dailyCapacityHours = 8;
        private int wipCapHoursPerTicket = 2;
        private Long seed;
        private int detailLimit = DEFAULT_DETAIL_LIMIT;
        private Set<BurndownPolicy> policies = EnumSet.allOf(BurndownPolicy.class);

        private Builder() {
        }

        public Builder days(int days) {
            this.days = days;
            return this;
        }

        public Builder meanArrivalsPerDay(double meanArrivalsPerDay) {
            this.meanArrivalsPerDay = meanArrivalsPerDay;
            return this;
        }

        public Builder stddevArrivalsPerDay(double stddevArrivalsPerDay) {
            this.stddevArrivalsPerDay = stddevArrivalsPerDay;
            return this;
        }

        public Builder meanEffort(double meanEffort) {
            this.meanEffort = meanEffort;
            return this;
        }

        public Builder stddevEffort(double stddevEffort) {
            this.stddevEffort = stddevEffort;
            return this;
        }

        public Builder minEffort(int minEffort) {
            this.minEffort = minEffort;
            return this;
        }

        public Builder dailyCapacityHours(int dailyCapacityHours) {
            this.dailyCapacityHours = dailyCapacityHours;
            return this;
        }

        public Builder wipCapHoursPerTicket(int wipCapHoursPerTicket) {
            this.wipCapHoursPerTicket = wipCapHoursPerTicket;
            return this;
        }

        public Builder seed(long seed) {
            this.seed = seed;
            return this;
        }

        public Builder detailLimit(int detailLimit) {
            this.detailLimit = detailLimit;
            return this;
        }

        /// Restrict the run to the given policies. They are always reported in declaration order.
        public Builder policies(Set<BurndownPolicy> policies) {
            this.policies = policies == null ? Collections.emptySet() : policies;
            return this;
        }

        /// @throws IllegalArgumentException if any field is out of range
        public SimulationConfig build() {
            if (days < 1) {
                throw new IllegalArgumentException("days must be at least 1, got " + days);
            }
            checkRange("meanArrivalsPerDay", meanArrivalsPerDay, 0.0, MAX_ARRIVALS_PER_DAY);
            checkRange("stddevArrivalsPerDay", stddevArrivalsPerDay, 0.0, MAX_ARRIVALS_PER_DAY);
            checkRange("meanEffort", meanEffort, -MAX_EFFORT_HOURS, MAX_EFFORT_HOURS);
            checkRange("stddevEffort", stddevEffort, 0.0, MAX_EFFORT_HOURS);
            if (minEffort < 1 || minEffort > MAX_EFFORT_HOURS) {
                throw new IllegalArgumentException(
                    "minEffort must be between 1 and " + MAX_EFFORT_HOURS + ", got " + minEffort);
            }
            if (dailyCapacityHours < 0) {
                throw new IllegalArgumentException(
                    "dailyCapacityHours must be non-negative, got " + dailyCapacityHours);
            }
            if (wipCapHoursPerTicket < 1) {
                throw new IllegalArgumentException(
                    "wipCapHoursPerTicket must be at least 1, got " + wipCapHoursPerTicket);
            }
            if (detailLimit < 0) {
                throw new IllegalArgumentException("detailLimit must be non-negative, got " + detailLimit);
            }
            if (policies.isEmpty()) {
                throw new IllegalArgumentException("at least one policy is required");
            }
            return new SimulationConfig(this);
        }

        private static void checkRange(String field, double value, double min, double max) {
            if (!Double.isFinite(value) || value < min || value > max) {
                throw new IllegalArgumentException(
                    String.format("%s must be a finite number between %s and %s, got %s", field, min, max, value));
            }
        }
    }
}
