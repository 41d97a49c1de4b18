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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TicketTest {

    @Test
    void newTicketStartsWithFullEffort() {
        Ticket ticket = new Ticket(0, 2, 7, 5);

        assertThat(ticket.remainingOn(2)).isEqualTo(7);
        assertThat(ticket.getRemaining()).containsExactly(0, 0, 7, 0, 0);
        assertThat(ticket.getLeadTime()).isZero();
        assertThat(ticket.isCompleted()).isFalse();
    }

    @Test
    void burnSpendsAtMostTheOfferedHours() {
        Ticket ticket = new Ticket(0, 0, 10, 3);

        int left = ticket.burn(0, 8, 2);

        assertThat(left).isEqualTo(6);
        assertThat(ticket.remainingOn(1)).isEqualTo(8);
        assertThat(ticket.getEndDay()).isZero();
        assertThat(ticket.getLeadTime()).isEqualTo(1);
    }

    @Test
    void burnSpendsAtMostTheRemainingEffort() {
        Ticket ticket = new Ticket(0, 0, 3, 3);

        int left = ticket.burn(0, 8, 8);

        assertThat(left).isEqualTo(5);
        assertThat(ticket.remainingOn(1)).isZero();
        assertThat(ticket.isCompleted()).isTrue();
    }

    @Test
    void burnWithoutCapacityOnlyCarriesForward() {
        Ticket ticket = new Ticket(0, 0, 4, 4);

        int left = ticket.burn(0, 0, 0);

        assertThat(left).isZero();
        assertThat(ticket.remainingOn(1)).isEqualTo(4);
        assertThat(ticket.getLeadTime()).isZero();
    }

    @Test
    void leadTimeFreezesOnceCompleted() {
        Ticket ticket = new Ticket(0, 1, 9, 6);
        ticket.burn(1, 0, 0);
        ticket.burn(2, 8, 8);
        ticket.burn(3, 8, 8);

        int left = ticket.burn(4, 8, 8);

        assertThat(left).isEqualTo(8);
        assertThat(ticket.getEndDay()).isEqualTo(3);
        assertThat(ticket.getLeadTime()).isEqualTo(3);
        assertThat(ticket.getRemaining()).containsExactly(0, 9, 9, 1, 0, 0);
    }

    @Test
    void burnAgainContinuesFromCarriedForwardEffort() {
        Ticket ticket = new Ticket(0, 0, 10, 2);
        int left = ticket.burn(0, 8, 2);

        left = ticket.burnAgain(0, left, left);

        assertThat(left).isZero();
        assertThat(ticket.remainingOn(1)).isEqualTo(2);
    }

    @Test
    void burnOnTheFinalDayIsRejected() {
        Ticket ticket = new Ticket(0, 0, 5, 2);

        assertThatThrownBy(() -> ticket.burn(1, 8, 8))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("No slot for day 2");
    }

    @Test
    void burnBeforeArrivalIsRejected() {
        Ticket ticket = new Ticket(0, 2, 5, 5);

        assertThatThrownBy(() -> ticket.burn(1, 8, 8)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void invalidTicketsAreRejected() {
        assertThatThrownBy(() -> new Ticket(0, 0, 0, 5)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new Ticket(0, 5, 3, 5)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new Ticket(-1, 0, 3, 5)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void copyDoesNotShareTheTrajectory() {
        Ticket original = new Ticket(3, 0, 6, 3);
        Ticket copy = original.copy();

        copy.burn(0, 8, 8);

        assertThat(copy.getId()).isEqualTo(3);
        assertThat(copy.remainingOn(1)).isZero();
        assertThat(original.getLeadTime()).isZero();
        original.burn(0, 2, 2);
        assertThat(original.remainingOn(1)).isEqualTo(4);
        assertThat(copy.remainingOn(1)).isZero();
    }
}
