package com.signalwatch.scan.model;

import java.util.List;

/**
 * A director with every company it is linked to. Identity is the registry id, never the name.
 */
public record Director(
    String directorId,
    String name,
    List<DirectorAppointment> appointments
) {
    public Director {
        appointments = appointments == null ? List.of() : List.copyOf(appointments);
    }
}
