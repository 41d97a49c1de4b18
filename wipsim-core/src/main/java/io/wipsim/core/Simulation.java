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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/// One policy's ticket population and its day-by-day burn-down.
///
/// The population is an arena of tickets indexed by ticket id. Tickets are appended in arrival
/// order and never removed or reordered, which is what lets {@link BurndownPolicy#OLDEST_FIRST}
/// treat population order as age order. Every ticket is a private copy; nothing here is shared
/// with another simulation.
public class Simulation {

    private static final Logger logger = LogManager.getLogger(Simulation.class);

    private final BurndownPolicy policy;
    private final int days;
    private final int capacity;
    private final int wipCapHours;
    private final List<Ticket> tickets = new ArrayList<>();

    public Simulation(BurndownPolicy policy, int days, int capacity, int wipCapHours) {
        this.policy = policy;
        this.days = days;
        this.capacity = capacity;
        this.wipCapHours = wipCapHours;
    }

    /// Add a private copy of each ticket.
    ///
    /// @param arrivals tickets arriving today, with ids continuing the population's id sequence
    public void addTickets(List<Ticket> arrivals) {
        for (Ticket arrival : arrivals) {
            if (arrival.getId() != tickets.size()) {
                throw new IllegalArgumentException(
                    String.format("Ticket id %d does not continue population of %d tickets in '%s'",
                        arrival.getId(), tickets.size(), getName()));
            }
            tickets.add(arrival.copy());
        }
    }

    /// Run this simulation's policy for one day over the whole population.
    ///
    /// @param day the day to burn down; must have a following day in the horizon
    /// @return the hours spent per ticket
    public Allocation burnDown(int day) {
        if (day < 0 || day >= days - 1) {
            throw new IllegalArgumentException(
                String.format("Cannot burn down day %d of %d: no following day to carry into", day, days));
        }
        Allocation allocation = policy.allocate(day, Collections.unmodifiableList(tickets), capacity, wipCapHours);
        logger.debug("{} day {}: spent {} of {} hours, {} unused, over {} tickets",
            policy.getDisplayName(), allocation.getDay(), allocation.total(), allocation.getCapacity(),
            allocation.unused(), tickets.size());
        return allocation;
    }

    /// @return lead time statistics, or empty if no ticket ever arrived
    public Optional<LeadTimeStatistics> leadTimeStatistics() {
        if (tickets.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(LeadTimeStatistics.of(getName(), tickets));
    }

    public BurndownPolicy getPolicy() {
        return policy;
    }

    public String getName() {
        return policy.getDisplayName();
    }

    public Ticket getTicket(int id) {
        return tickets.get(id);
    }

    /// @return the population in arrival order
    public List<Ticket> getTickets() {
        return Collections.unmodifiableList(tickets);
    }

    /// @return tickets with effort left on the given day
    public int workInProgressOn(int day) {
        int wip = 0;
        for (Ticket ticket : tickets) {
            if (ticket.getStartDay() <= day && ticket.remainingOn(day) > 0) {
                wip++;
            }
        }
        return wip;
    }
}
