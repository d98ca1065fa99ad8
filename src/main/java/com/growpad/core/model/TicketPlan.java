package com.growpad.core.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.LinkedHashSet;
import java.util.List;

/**
 * The epic and its tickets, as written to {@code tickets.json}.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record TicketPlan(
    String epicTitle,
    List<Ticket> tickets
) {

    /** Unique expected files across all tickets, in ticket order. */
    public List<String> expectedFiles() {
        LinkedHashSet<String> files = new LinkedHashSet<>();
        for (Ticket ticket : tickets) {
            files.addAll(ticket.filesExpected());
        }
        return List.copyOf(files);
    }

    public double totalEstimateHours() {
        return tickets.stream().mapToDouble(Ticket::estimateHours).sum();
    }
}
