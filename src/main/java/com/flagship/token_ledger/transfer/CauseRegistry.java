package com.flagship.token_ledger.transfer;

import java.util.List;
import java.util.Optional;

/**
 * Causes advertised to contributors. Informational only: contributions are
 * accepted for any cause id.
 */
public class CauseRegistry {

    private final List<Cause> causes;

    public CauseRegistry(List<Cause> causes) {
        this.causes = List.copyOf(causes);
    }

    public static CauseRegistry standard() {
        return new CauseRegistry(List.of(
            new Cause("vegan_outreach", "Vegan Outreach", "Promotes plant-based eating"),
            new Cause("animal_sanctuary", "Animal Sanctuary", "Shelter for rescued animals"),
            new Cause("environmental_fund", "Environmental Fund", "Protects the environment")
        ));
    }

    public List<Cause> all() {
        return causes;
    }

    public Optional<Cause> find(String causeId) {
        return causes.stream().filter(c -> c.getId().equals(causeId)).findFirst();
    }
}
