package com.github.dimitryivaniuta.gatekeeper.directory;

import jakarta.persistence.QueryHint;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.QueryHints;

import java.util.Optional;
import java.util.UUID;

public interface AllowedIpAddressRepository extends JpaRepository<AllowedIpAddress, Long> {

    @QueryHints(@QueryHint(name = "jakarta.persistence.query.timeout", value = "1000"))
    Optional<AllowedIpAddress> findByIpAddress(String ipAddress);

    Optional<AllowedIpAddress> findByUuid(UUID uuid);
}
