package com.wingman.core.error;

import java.nio.file.Path;

/**
 * Two source records claim the same serial number with materially different pilot names.
 */
public final class IdentityConflictException extends CampaignSyncException {
    private final String serialNumber;
    private final String firstName;
    private final Path firstSource;
    private final String secondName;
    private final Path secondSource;

    public IdentityConflictException(String serialNumber,
                                     String firstName,
                                     Path firstSource,
                                     String secondName,
                                     Path secondSource) {
        super("Serial number %s is claimed by '%s' (%s) and '%s' (%s)"
            .formatted(serialNumber, firstName, firstSource, secondName, secondSource));
        this.serialNumber = serialNumber;
        this.firstName = firstName;
        this.firstSource = firstSource;
        this.secondName = secondName;
        this.secondSource = secondSource;
    }

    public String getSerialNumber() {
        return serialNumber;
    }

    public String getFirstName() {
        return firstName;
    }

    public Path getFirstSource() {
        return firstSource;
    }

    public String getSecondName() {
        return secondName;
    }

    public Path getSecondSource() {
        return secondSource;
    }
}
