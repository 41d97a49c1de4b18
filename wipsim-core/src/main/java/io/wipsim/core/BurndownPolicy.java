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

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/// The scheduling policies that distribute a day's capacity over the open tickets.
///
/// Each policy is a stateless step run once per day against a simulation's whole population,
/// in arrival order. Policies differ only in the order they visit tickets and in how many hours
/// they offer each one; all of them burn down through {@link Ticket#burn(int, int, int)}, so
/// every ticket present on the day gets its next-day slot written.
///
/// Ties in the sorted policies fall back to arrival order (ticket id), since the sorts are stable
/// over a population that is kept in arrival order.
public enum BurndownPolicy {

    /// Work on every ticket for at most the WIP cap per day, then spend any leftover
    /// capacity uncapped in arrival order.
    EQUAL_WORKING("Equal working") {
        @Override
        public Allocation allocate(int day, List<Ticket> population, int capacity, int wipCapHours) {
            Allocation allocation = new Allocation(day, capacity);
            int hoursLeft = capacity;
            for (Ticket ticket : population) {
                int before = hoursLeft;
                hoursLeft = ticket.burn(day, hoursLeft, wipCapHours);
                allocation.recordFirstPass(ticket.getId(), before - hoursLeft);
            }
            if (hoursLeft > 0) {
                for (Ticket ticket : population) {
                    int before = hoursLeft;
                    hoursLeft = ticket.burnAgain(day, hoursLeft, hoursLeft);
                    allocation.recordSecondPass(ticket.getId(), before - hoursLeft);
                }
            }
            return allocation;
        }
    },

    /// Spend the whole capacity in arrival order.
    OLDEST_FIRST("Oldest first") {
        @Override
        public Allocation allocate(int day, List<Ticket> population, int capacity, int wipCapHours) {
            return burnGreedy(day, population, capacity);
        }
    },

    /// Shortest remaining effort first.
    SHORTEST_FIRST("Shortest first") {
        @Override
        public Allocation allocate(int day, List<Ticket> population, int capacity, int wipCapHours) {
            return burnGreedy(day, sorted(population, Comparator.comparingInt(t -> t.remainingOn(day))), capacity);
        }
    },

    /// Earliest start day first, shortest remaining effort among tickets of the same day.
    OLDEST_SHORTEST_FIRST("Oldest, shortest first") {
        @Override
        public Allocation allocate(int day, List<Ticket> population, int capacity, int wipCapHours) {
            Comparator<Ticket> order = Comparator.comparingInt(Ticket::getStartDay)
                .thenComparingInt(t -> t.remainingOn(day));
            return burnGreedy(day, sorted(population, order), capacity);
        }
    },

    /// Smallest remaining effort per day of age first, using integer division.
    AGE_WEIGHTED_SHORTEST_FIRST("Age weighted, shortest first") {
        @Override
        public Allocation allocate(int day, List<Ticket> population, int capacity, int wipCapHours) {
            return burnGreedy(day, sorted(population, Comparator.comparingInt(t -> weight(t, day))), capacity);
        }
    };

    private final String displayName;

    BurndownPolicy(String displayName) {
        this.displayName = displayName;
    }

    /// Burn down one day of the population.
    ///
    /// The caller must only invoke this for days that have a following day in the horizon.
    ///
    /// @param day the current day
    /// @param population all tickets added so far, in arrival order; not reordered
    /// @param capacity hours available for the day
    /// @param wipCapHours per-ticket limit for the first pass, used by {@link #EQUAL_WORKING} only
    /// @return the hours spent per ticket
    public abstract Allocation allocate(int day, List<Ticket> population, int capacity, int wipCapHours);

    public String getDisplayName() {
        return displayName;
    }

    /// Age-weighted priority of a ticket on a day. Age is at least 1 for any ticket already added.
    static int weight(Ticket ticket, int day) {
        return ticket.remainingOn(day) / ticket.ageOn(day);
    }

    private static List<Ticket> sorted(List<Ticket> population, Comparator<Ticket> order) {
        List<Ticket> copy = new ArrayList<>(population);
        copy.sort(order.thenComparingInt(Ticket::getId));
        return copy;
    }

    private static Allocation burnGreedy(int day, List<Ticket> ordered, int capacity) {
        Allocation allocation = new Allocation(day, capacity);
        int hoursLeft = capacity;
        for (Ticket ticket : ordered) {
            int before = hoursLeft;
            hoursLeft = ticket.burn(day, hoursLeft, hoursLeft);
            allocation.recordFirstPass(ticket.getId(), before - hoursLeft);
        }
        return allocation;
    }
}
