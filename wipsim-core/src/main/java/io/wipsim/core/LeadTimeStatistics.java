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

import java.util.Collection;

/// Mean and population standard deviation of the lead times of a ticket population.
///
/// Every ticket counts, completed or not; an unfinished ticket contributes the lead time of its
/// last worked day.
///
/// @param count number of tickets summarized
/// @param completed number of those tickets with no remaining effort
/// @param mean mean lead time in days
/// @param stdev population standard deviation of the lead time
public record LeadTimeStatistics(int count, int completed, double mean, double stdev) {

    /// Summarize the given tickets.
    ///
    /// @param name used in the exception message when there is nothing to summarize
    /// @param tickets the final population of a simulation
    /// @return the summary
    /// @throws NoTicketsException if the population is empty
    public static LeadTimeStatistics of(String name, Collection<Ticket> tickets) {
        if (tickets.isEmpty()) {
            throw new NoTicketsException(name);
        }
        double sum = 0.0;
        double sumSq = 0.0;
        int completed = 0;
        for (Ticket ticket : tickets) {
            double leadTime = ticket.getLeadTime();
            sum += leadTime;
            sumSq += leadTime * leadTime;
            if (ticket.isCompleted()) {
                completed++;
            }
        }
        double n = tickets.size();
        double mean = sum / n;
        // rounding can push the variance a hair below zero for identical lead times
        double variance = Math.max(0.0, sumSq / n - mean * mean);
        return new LeadTimeStatistics(tickets.size(), completed, mean, Math.sqrt(variance));
    }

    /// @return mean plus one standard deviation, a rough upper bound for typical lead times
    public double meanPlusStdev() {
        return mean + stdev;
    }

    public int open() {
        return count - completed;
    }
}
