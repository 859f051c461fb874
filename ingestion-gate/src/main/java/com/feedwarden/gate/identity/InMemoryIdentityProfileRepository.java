package com.feedwarden.gate.identity;

import com.feedwarden.gate.model.IdentityProfile;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

@Component
@ConditionalOnProperty(prefix = "ingestion-gate.store", name = "mode", havingValue = "MEMORY")
public class InMemoryIdentityProfileRepository implements IdentityProfileRepository {

    private final ConcurrentMap<String, IdentityProfile> profiles = new ConcurrentHashMap<>();

    @Override
    public Optional<IdentityProfile> findById(String id) {
        return Optional.ofNullable(profiles.get(id)).map(p -> p.toBuilder().build());
    }

    @Override
    public void save(IdentityProfile profile) {
        profiles.put(profile.getId(), profile.toBuilder().build());
    }
}
