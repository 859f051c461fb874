package com.feedwarden.gate.identity;

import com.feedwarden.gate.model.IdentityProfile;

import java.util.Optional;

/**
 * Storage for identity profiles. Profiles are retired, never deleted.
 */
public interface IdentityProfileRepository {

    Optional<IdentityProfile> findById(String id);

    /** Inserts a new profile or overwrites the stored one with the same id. */
    void save(IdentityProfile profile);
}
