package com.wingman.core.resolve;

import com.wingman.core.error.IdentityConflictException;
import com.wingman.core.model.PilotNames;
import com.wingman.core.model.PilotStatus;
import com.wingman.core.model.SerialNumbers;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Collects identity claims keyed by serial number. The first claim to supply a field wins it, except
 * the name, where the fullest spelling wins. A claim whose name cannot belong to the same person as
 * an earlier one fails with {@link IdentityConflictException}.
 */
public final class PilotRegistry {

    private final Map<String, Accumulator> pilots = new TreeMap<>(SerialNumbers.ORDER);

    public void register(PilotClaim claim) throws IdentityConflictException {
        Accumulator accumulator = pilots.computeIfAbsent(claim.serialNumber(), Accumulator::new);
        if (claim.name().isPresent()) {
            String name = claim.name().get();
            for (NamedSource earlier : accumulator.names) {
                if (!PilotNames.sameIdentity(earlier.name(), name)) {
                    throw new IdentityConflictException(claim.serialNumber(), earlier.name(), earlier.source(),
                        name, claim.source());
                }
            }
            accumulator.names.add(new NamedSource(name, claim.source()));
        }
        accumulator.rank = accumulator.rank.or(claim::rank);
        accumulator.squadronId = accumulator.squadronId.or(claim::squadronId);
        accumulator.squadronName = accumulator.squadronName.or(claim::squadronName);
        accumulator.status = accumulator.status.or(claim::status);
        if (!accumulator.sources.contains(claim.source())) {
            accumulator.sources.add(claim.source());
        }
    }

    public boolean contains(String serialNumber) {
        return pilots.containsKey(serialNumber);
    }

    public Optional<PilotIdentity> find(String serialNumber) {
        return Optional.ofNullable(pilots.get(serialNumber)).map(Accumulator::toIdentity);
    }

    /**
     * @return identities in serial order
     */
    public List<PilotIdentity> identities() {
        List<PilotIdentity> result = new ArrayList<>();
        pilots.values().forEach(accumulator -> result.add(accumulator.toIdentity()));
        return result;
    }

    private record NamedSource(String name, Path source) {
    }

    private static final class Accumulator {
        private final String serialNumber;
        private final List<NamedSource> names = new ArrayList<>();
        private final List<Path> sources = new ArrayList<>();
        private Optional<String> rank = Optional.empty();
        private Optional<String> squadronId = Optional.empty();
        private Optional<String> squadronName = Optional.empty();
        private Optional<PilotStatus> status = Optional.empty();

        private Accumulator(String serialNumber) {
            this.serialNumber = serialNumber;
        }

        private PilotIdentity toIdentity() {
            Optional<String> name = Optional.empty();
            for (NamedSource named : names) {
                if (name.isEmpty() || PilotNames.normalize(named.name()).length() > PilotNames.normalize(name.get()).length()) {
                    name = Optional.of(named.name().trim());
                }
            }
            return new PilotIdentity(serialNumber, name, rank, squadronId, squadronName, status, sources);
        }
    }
}
