package com.feedwarden.gate.identity;

import com.feedwarden.gate.model.BrowserTemplate;
import com.feedwarden.gate.model.IdentityProfile;
import com.feedwarden.gate.model.IdentityStatus;
import com.feedwarden.gate.model.ProxyProfile;
import com.feedwarden.gate.model.ProxyTier;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Component;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Optional;

/**
 * Identity profiles in the identity_profiles table. Only the template name is stored;
 * headers are always rebuilt from the template so a profile can never drift into a mixed set.
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "ingestion-gate.store", name = "mode", havingValue = "JDBC", matchIfMissing = true)
public class JdbcIdentityProfileRepository implements IdentityProfileRepository {

    private final JdbcTemplate jdbcTemplate;

    @PostConstruct
    public void ensureSchema() {
        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS identity_profiles
            (
                id                 VARCHAR(64)  NOT NULL PRIMARY KEY,
                template           VARCHAR(32)  NOT NULL,
                status             VARCHAR(16)  NOT NULL,
                proxy_id           VARCHAR(64),
                proxy_url          VARCHAR(1024),
                proxy_tier         VARCHAR(16),
                proxy_created_at   TIMESTAMP WITH TIME ZONE,
                proxy_expires_at   TIMESTAMP WITH TIME ZONE,
                created_at         TIMESTAMP WITH TIME ZONE NOT NULL,
                retired_at         TIMESTAMP WITH TIME ZONE,
                retired_reason     VARCHAR(255)
            )
        """);
        log.info("identity_profiles schema ready.");
    }

    @Override
    public Optional<IdentityProfile> findById(String id) {
        return jdbcTemplate.query("SELECT * FROM identity_profiles WHERE id = ?", rowMapper(), id)
                .stream()
                .findFirst();
    }

    @Override
    public void save(IdentityProfile profile) {
        ProxyProfile proxy = profile.getProxySession();
        int updated = jdbcTemplate.update("""
                UPDATE identity_profiles SET status = ?, retired_at = ?, retired_reason = ?
                WHERE id = ?
                """,
                profile.getStatus().name(), ts(profile.getRetiredAt()), profile.getRetiredReason(), profile.getId());
        if (updated > 0) return;

        jdbcTemplate.update("""
                INSERT INTO identity_profiles
                (id, template, status, proxy_id, proxy_url, proxy_tier, proxy_created_at, proxy_expires_at,
                 created_at, retired_at, retired_reason)
                VALUES (?,?,?,?,?,?,?,?,?,?,?)
                """,
                profile.getId(),
                profile.getTemplate().name(),
                profile.getStatus().name(),
                proxy != null ? proxy.getId() : null,
                proxy != null ? proxy.getEgressUrl() : null,
                proxy != null ? proxy.getTier().name() : null,
                proxy != null ? ts(proxy.getCreatedAt()) : null,
                proxy != null ? ts(proxy.getExpiresAt()) : null,
                ts(profile.getCreatedAt()),
                ts(profile.getRetiredAt()),
                profile.getRetiredReason());
    }

    private RowMapper<IdentityProfile> rowMapper() {
        return (rs, rowNum) -> {
            ProxyProfile proxy = null;
            if (rs.getString("proxy_id") != null) {
                proxy = ProxyProfile.builder()
                        .id(rs.getString("proxy_id"))
                        .egressUrl(rs.getString("proxy_url"))
                        .tier(ProxyTier.valueOf(rs.getString("proxy_tier")))
                        .createdAt(instant(rs, "proxy_created_at"))
                        .expiresAt(instant(rs, "proxy_expires_at"))
                        .build();
            }
            return IdentityProfile.builder()
                    .id(rs.getString("id"))
                    .template(BrowserTemplate.valueOf(rs.getString("template")))
                    .status(IdentityStatus.valueOf(rs.getString("status")))
                    .proxySession(proxy)
                    .createdAt(instant(rs, "created_at"))
                    .retiredAt(instant(rs, "retired_at"))
                    .retiredReason(rs.getString("retired_reason"))
                    .build();
        };
    }

    private static Instant instant(ResultSet rs, String column) throws SQLException {
        OffsetDateTime value = rs.getObject(column, OffsetDateTime.class);
        return value == null ? null : value.toInstant();
    }

    private static OffsetDateTime ts(Instant instant) {
        return instant == null ? null : OffsetDateTime.ofInstant(instant, ZoneOffset.UTC);
    }
}
