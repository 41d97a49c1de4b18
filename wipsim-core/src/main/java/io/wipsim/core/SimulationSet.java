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

/// Runs every configured policy over one shared arrival sequence.
///
/// Each day's arrivals are drawn once from the {@link ArrivalSource}, turned into tickets with
/// run-wide ids, and added by copy to every {@link Simulation} before any of them burns down that
/// day. The final day only receives arrivals; it has no following day to carry effort into.
public class SimulationSet {

    private static final Logger logger = LogManager.getLogger(SimulationSet.class);

    private final SimulationConfig config;
    private final List<Simulation> simulations;
    private final List<DayArrivals> arrivals = new ArrayList<>();
    private int nextTicketId;

    public SimulationSet(SimulationConfig config) {
        this.config = config;
        List<Simulation> sims = new ArrayList<>();
        for (BurndownPolicy policy : config.getPolicies()) {
            sims.add(new Simulation(policy, config.getDays(),
                config.getDailyCapacityHours(), config.getWipCapHoursPerTicket()));
        }
        this.simulations = Collections.unmodifiableList(sims);
    }

    /// Drive all remaining days of the horizon.
    ///
    /// @param source arrivals for each day, asked once per day in order
    /// @return this set, for chaining
    public SimulationSet run(ArrivalSource source) {
        logger.info("Simulating {} days with {} policies", config.getDays(), simulations.size());
        for (int day = arrivals.size(); day < config.getDays(); day++) {
            step(day, source.effortsFor(day));
        }
        logger.info("Simulated {} tickets over {} days", nextTicketId, config.getDays());
        return this;
    }

    /// Simulate a single day.
    ///
    /// @param day the next day of the run
    /// @param efforts efforts of the tickets arriving on that day
    /// @throws IllegalStateException if the day is not the next one in sequence
    public void step(int day, List<Integer> efforts) {
        if (day != arrivals.size()) {
            throw new IllegalStateException(
                String.format("Expected day %d next, got day %d", arrivals.size(), day));
        }
        if (day >= config.getDays()) {
            throw new IllegalStateException(
                String.format("Day %d is outside of the %d day horizon", day, config.getDays()));
        }
        DayArrivals today = new DayArrivals(day, efforts);
        arrivals.add(today);

        List<Ticket> tickets = new ArrayList<>(today.count());
        for (int effort : today.efforts()) {
            tickets.add(new Ticket(nextTicketId++, day, effort, config.getDays()));
        }
        logger.debug("day {}: {} arrivals, {} hours", day, today.count(), today.totalEffort());

        for (Simulation simulation : simulations) {
            simulation.addTickets(tickets);
            if (day < config.getDays() - 1) {
                simulation.burnDown(day);
            }
        }
    }

    public SimulationConfig getConfig() {
        return config;
    }

    public List<Simulation> getSimulations() {
        return simulations;
    }

    /// @return the arrivals of every day stepped so far
    public List<DayArrivals> getArrivals() {
        return Collections.unmodifiableList(arrivals);
    }

    public int getTicketCount() {
        return nextTicketId;
    }

    public double meanArrivalsPerDay() {
        if (arrivals.isEmpty()) {
            return 0.0;
        }
        int sum = 0;
        for (DayArrivals day : arrivals) {
            sum += day.count();
        }
        return (double) sum / arrivals.size();
    }

    public double meanEffortPerDay() {
        if (arrivals.isEmpty()) {
            return 0.0;
        }
        long sum = 0;
        for (DayArrivals day : arrivals) {
            sum += day.totalEffort();
        }
        return (double) sum / arrivals.size();
    }
}
