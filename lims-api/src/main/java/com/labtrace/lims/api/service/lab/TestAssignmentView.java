package com.labtrace.lims.api.service.lab;

import com.labtrace.lims.api.domain.TestAssignment;
import com.labtrace.lims.api.domain.enumeration.TestAssignmentStatus;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

public record TestAssignmentView(
    UUID id,
    UUID sampleId,
    String testName,
    TestAssignmentStatus status,
    LocalDate dueDate,
    Instant testDate,
    String result,
    String resultUnit,
    boolean oos,
    String oosMessage,
    String analyst,
    String checkedBy,
    Instant checkedDate
) {
    public static TestAssignmentView from(TestAssignment assignment, String oosMessage) {
        return new TestAssignmentView(
            assignment.getId(),
            assignment.getSample() != null ? assignment.getSample().getId() : null,
            assignment.getDisplayName(),
            assignment.getStatus(),
            assignment.getDueDate(),
            assignment.getTestDate(),
            assignment.getResult(),
            assignment.getResultUnit(),
            assignment.isOos(),
            oosMessage,
            assignment.getAnalyst(),
            assignment.getCheckedBy(),
            assignment.getCheckedDate()
        );
    }
}
