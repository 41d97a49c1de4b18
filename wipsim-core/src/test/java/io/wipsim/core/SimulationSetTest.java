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

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.EnumSet;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SimulationSetTest {

    private static SimulationConfig config(int days, long seed) {
        return SimulationConfig.builder().days(days).seed(seed).build();
    }

    private static Simulation simulationFor(SimulationSet set, BurndownPolicy policy) {
        return set.getSimulations().stream()
            .filter(s -> s.getPolicy() == policy)
            .findFirst()
            .orElseThrow();
    }

    @Test
    void shortestFirstScenario() {
        SimulationSet set = new SimulationSet(config(3, 1L))
            .run(FixedArrivals.builder().on(0, 5, 10).build());

        Simulation sjf = simulationFor(set, BurndownPolicy.SHORTEST_FIRST);
        assertThat(sjf.getTicket(0).getLeadTime()).isEqualTo(1);
        assertThat(sjf.getTicket(1).getLeadTime()).isEqualTo(2);
        assertThat(sjf.getTicket(1).getRemaining()).containsExactly(10, 7, 0);
    }

    @Test
    void everyPolicyGetsItsOwnCopyOfEachArrival() {
        SimulationSet set = new SimulationSet(config(4, 1L))
            .run(FixedArrivals.builder().on(0, 12, 2).build());

        Ticket equal = simulationFor(set, BurndownPolicy.EQUAL_WORKING).getTicket(1);
        Ticket oldest = simulationFor(set, BurndownPolicy.OLDEST_FIRST).getTicket(1);

        assertThat(equal).isNotSameAs(oldest);
        // equal working finishes the short ticket on day 0, oldest first waits for the long one
        assertThat(equal.getLeadTime()).isEqualTo(1);
        assertThat(oldest.getLeadTime()).isEqualTo(2);
        assertThat(equal.getRemaining()).containsExactly(2, 0, 0, 0);
        assertThat(oldest.getRemaining()).containsExactly(2, 2, 0, 0);
    }

    @Test
    void ticketsArrivingOnTheLastDayAreNotWorked() {
        SimulationSet set = new SimulationSet(config(3, 1L))
            .run(FixedArrivals.builder().on(2, 4).build());

        for (Simulation simulation : set.getSimulations()) {
            Ticket ticket = simulation.getTicket(0);
            assertThat(ticket.getRemaining()).containsExactly(0, 0, 4);
            assertThat(ticket.getLeadTime()).isZero();
            assertThat(ticket.isCompleted()).isFalse();
        }
    }

    @Test
    void singleDayRunOnlyCollectsArrivals() {
        SimulationSet set = new SimulationSet(config(1, 1L))
            .run(FixedArrivals.builder().on(0, 4, 2).build());

        assertThat(set.getTicketCount()).isEqualTo(2);
        for (Simulation simulation : set.getSimulations()) {
            assertThat(simulation.getTickets()).extracting(Ticket::getLeadTime).containsOnly(0);
        }
    }

    @Test
    void noArrivalsMeansNoStatistics() {
        SimulationSet set = new SimulationSet(config(10, 1L)).run(FixedArrivals.builder().build());

        assertThat(set.getTicketCount()).isZero();
        assertThat(set.getArrivals()).hasSize(10);
        for (Simulation simulation : set.getSimulations()) {
            assertThat(simulation.getTickets()).isEmpty();
            assertThat(simulation.leadTimeStatistics()).isEmpty();
            assertThatThrownBy(() -> LeadTimeStatistics.of(simulation.getName(), simulation.getTickets()))
                .isInstanceOf(NoTicketsException.class)
                .hasMessageContaining("no tickets");
        }
    }

    @Test
    void arrivalsAreRecordedPerDay() {
        SimulationSet set = new SimulationSet(config(4, 1L))
            .run(FixedArrivals.builder().on(0, 5, 10).on(2, 3).build());

        assertThat(set.getArrivals()).extracting(DayArrivals::count).containsExactly(2, 0, 1, 0);
        assertThat(set.meanArrivalsPerDay()).isEqualTo(0.75);
        assertThat(set.meanEffortPerDay()).isEqualTo(4.5);
        assertThat(set.getTicketCount()).isEqualTo(3);
    }

    @Test
    void effortTotalsDoNotOverflow() {
        SimulationSet set = new SimulationSet(config(2, 1L));
        set.step(0, List.of(Integer.MAX_VALUE, Integer.MAX_VALUE, Integer.MAX_VALUE));
        set.step(1, List.of());

        assertThat(set.getArrivals().get(0).totalEffort()).isEqualTo(3L * Integer.MAX_VALUE);
        assertThat(set.meanEffortPerDay()).isEqualTo(3.0 * Integer.MAX_VALUE / 2);
    }

    @Test
    void daysMustBeSteppedInOrder() {
        SimulationSet set = new SimulationSet(config(3, 1L));
        set.step(0, List.of(4));

        assertThatThrownBy(() -> set.step(2, List.of())).isInstanceOf(IllegalStateException.class);
        set.step(1, List.of());
        set.step(2, List.of());
        assertThatThrownBy(() -> set.step(3, List.of())).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void finalDayIsNeverBurnedDown() {
        Simulation simulation = new Simulation(BurndownPolicy.OLDEST_FIRST, 3, 8, 2);

        assertThatThrownBy(() -> simulation.burnDown(2))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("no following day");
    }

    @Test
    void onlySelectedPoliciesRun() {
        SimulationConfig config = SimulationConfig.builder()
            .days(5)
            .seed(3L)
            .policies(EnumSet.of(BurndownPolicy.AGE_WEIGHTED_SHORTEST_FIRST, BurndownPolicy.OLDEST_FIRST))
            .build();

        SimulationSet set = new SimulationSet(config);

        assertThat(set.getSimulations()).extracting(Simulation::getPolicy)
            .containsExactly(BurndownPolicy.OLDEST_FIRST, BurndownPolicy.AGE_WEIGHTED_SHORTEST_FIRST);
    }

    @Test
    void sameSeedReproducesTheRun() {
        SimulationConfig config = config(60, 1234L);
        SimulationSet first = new SimulationSet(config).run(GaussianArrivalGenerator.from(config));
        SimulationSet second = new SimulationSet(config).run(GaussianArrivalGenerator.from(config));

        assertThat(second.getArrivals()).isEqualTo(first.getArrivals());
        for (int i = 0; i < first.getSimulations().size(); i++) {
            List<Ticket> a = first.getSimulations().get(i).getTickets();
            List<Ticket> b = second.getSimulations().get(i).getTickets();
            assertThat(b).hasSameSizeAs(a);
            for (int t = 0; t < a.size(); t++) {
                assertThat(b.get(t).getRemaining()).containsExactly(a.get(t).getRemaining());
                assertThat(b.get(t).getLeadTime()).isEqualTo(a.get(t).getLeadTime());
            }
        }
    }

    @Test
    void replayedArrivalsGiveTheSameResult() {
        SimulationConfig config = config(40, 99L);
        SimulationSet original = new SimulationSet(config).run(GaussianArrivalGenerator.from(config));
        SimulationSet replay = new SimulationSet(config).run(FixedArrivals.of(original.getArrivals()));

        for (int i = 0; i < original.getSimulations().size(); i++) {
            assertThat(replay.getSimulations().get(i).leadTimeStatistics())
                .isEqualTo(original.getSimulations().get(i).leadTimeStatistics());
        }
    }

    @ParameterizedTest
    @EnumSource(BurndownPolicy.class)
    void trajectoriesAndCapacityHoldOverARandomRun(BurndownPolicy policy) {
        int days = 120;
        SimulationConfig config = SimulationConfig.builder()
            .days(days)
            .seed(7L)
            .meanArrivalsPerDay(1.5)
            .policies(EnumSet.of(policy))
            .build();
        Simulation simulation = new SimulationSet(config).run(GaussianArrivalGenerator.from(config))
            .getSimulations().get(0);
        List<Ticket> tickets = simulation.getTickets();
        assertThat(tickets).isNotEmpty();

        for (Ticket ticket : tickets) {
            int[] remaining = ticket.getRemaining();
            for (int d = ticket.getStartDay(); d < days - 1; d++) {
                assertThat(remaining[d + 1]).isLessThanOrEqualTo(remaining[d]);
            }
            if (ticket.isCompleted()) {
                for (int d = ticket.getEndDay() + 1; d < days; d++) {
                    assertThat(remaining[d]).isZero();
                }
                assertThat(ticket.getLeadTime()).isEqualTo(ticket.getEndDay() + 1 - ticket.getStartDay());
            }
        }

        for (int d = 0; d < days - 1; d++) {
            int spent = 0;
            int open = 0;
            for (Ticket ticket : tickets) {
                if (ticket.getStartDay() <= d) {
                    spent += ticket.remainingOn(d) - ticket.remainingOn(d + 1);
                    open += ticket.remainingOn(d);
                }
            }
            assertThat(spent).isLessThanOrEqualTo(config.getDailyCapacityHours());
            assertThat(spent).isEqualTo(Math.min(open, config.getDailyCapacityHours()));
        }
    }

    @Test
    void workInProgressCountsOpenTickets() {
        SimulationSet set = new SimulationSet(config(4, 1L))
            .run(FixedArrivals.builder().on(0, 12, 3).build());
        Simulation oldest = simulationFor(set, BurndownPolicy.OLDEST_FIRST);

        assertThat(oldest.workInProgressOn(0)).isEqualTo(2);
        assertThat(oldest.workInProgressOn(1)).isEqualTo(2);
        assertThat(oldest.workInProgressOn(2)).isZero();
    }
}
