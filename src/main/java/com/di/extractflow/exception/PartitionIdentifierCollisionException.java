package com.di.extractflow.exception;

import lombok.Getter;

import java.util.List;

/**
 * Objects already stored under a partition identifier do not match the partition set that identifier implies.
 */
@Getter
public class PartitionIdentifierCollisionException extends InvariantViolationException {

    private final String location;
    private final List<String> unexpectedKeys;

    public PartitionIdentifierCollisionException(String location, int expectedPartitions, List<String> existingKeys,
                                                 List<String> unexpectedKeys) {
        super(String.format("Location %s holds %d object(s) that do not match the expected %d partition archive(s): %s",
                location, existingKeys.size(), expectedPartitions, unexpectedKeys));
        this.location = location;
        this.unexpectedKeys = List.copyOf(unexpectedKeys);
    }
}
