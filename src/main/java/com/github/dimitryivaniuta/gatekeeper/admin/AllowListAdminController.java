package com.github.dimitryivaniuta.gatekeeper.admin;

import com.github.dimitryivaniuta.gatekeeper.directory.AllowListStatus;
import com.github.dimitryivaniuta.gatekeeper.directory.AllowedIpAddress;
import com.github.dimitryivaniuta.gatekeeper.directory.AllowedIpAddressRepository;
import com.github.dimitryivaniuta.gatekeeper.directory.ApiToken;
import com.github.dimitryivaniuta.gatekeeper.directory.ApiTokenRepository;
import com.github.dimitryivaniuta.gatekeeper.directory.JpaDirectoryLookup;
import com.github.dimitryivaniuta.gatekeeper.directory.TokenHashService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Allow-list administration. Served behind the full admission pipeline, so callers need an allowed
 * IP and an active token like any other client.
 */
@Slf4j
@Validated
@RestController
@RequiredArgsConstructor
@RequestMapping("/admin")
public class AllowListAdminController {

    private final ApiTokenRepository tokenRepo;
    private final AllowedIpAddressRepository ipRepo;
    private final TokenHashService hashService;
    private final JpaDirectoryLookup directoryLookup;

    // ---------- DTOs ----------
    public record CreateTokenRequest(
            @NotBlank @Size(max = 255) String label
    ) {}

    public record CreateTokenResponse(
            UUID uuid,
            String label,
            AllowListStatus status,
            String token,   // returned ONCE
            Instant createdAt
    ) {}

    public record TokenResponse(
            UUID uuid,
            String label,
            AllowListStatus status,
            Instant createdAt,
            Instant updatedAt
    ) {}

    public record CreateIpRequest(
            @NotBlank @Size(max = 64) String ipAddress
    ) {}

    public record IpResponse(
            UUID uuid,
            String ipAddress,
            AllowListStatus status,
            Instant createdAt,
            Instant updatedAt
    ) {}

    public record ChangeStatusRequest(
            @NotNull AllowListStatus status
    ) {}

    // ---------- tokens ----------

    @PostMapping("/api-tokens")
    @ResponseStatus(HttpStatus.CREATED)
    @Transactional
    public CreateTokenResponse createToken(@Valid @RequestBody CreateTokenRequest req) {
        String raw = hashService.generateRawToken();
        ApiToken saved = tokenRepo.save(ApiToken.builder()
                .label(req.label().trim())
                .tokenHash(hashService.hash(raw))
                .build());
        log.info("API token created uuid={} label={}", saved.getUuid(), saved.getLabel());
        return new CreateTokenResponse(saved.getUuid(), saved.getLabel(), saved.getStatus(), raw, saved.getCreatedAt());
    }

    @GetMapping("/api-tokens")
    public List<TokenResponse> listTokens() {
        return tokenRepo.findAll().stream().map(this::toTokenResponse).toList();
    }

    @PatchMapping("/api-tokens/{uuid}/status")
    @Transactional
    public TokenResponse changeTokenStatus(@PathVariable UUID uuid, @Valid @RequestBody ChangeStatusRequest req) {
        ApiToken token = tokenRepo.findByUuid(uuid)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Token not found"));
        token.setStatus(req.status());
        ApiToken saved = tokenRepo.saveAndFlush(token);
        directoryLookup.evictTokenHash(saved.getTokenHash());
        log.info("API token uuid={} status={}", uuid, req.status());
        return toTokenResponse(saved);
    }

    // ---------- IP addresses ----------

    @PostMapping("/allowed-ips")
    @ResponseStatus(HttpStatus.CREATED)
    @Transactional
    public IpResponse addIp(@Valid @RequestBody CreateIpRequest req) {
        String ip = req.ipAddress().trim();
        ipRepo.findByIpAddress(ip).ifPresent(x -> {
            throw new ResponseStatusException(HttpStatus.CONFLICT, "IP address already listed");
        });
        AllowedIpAddress saved = ipRepo.save(AllowedIpAddress.builder().ipAddress(ip).build());
        directoryLookup.evictIp(ip);
        log.info("Allowed IP added uuid={} ip={}", saved.getUuid(), ip);
        return toIpResponse(saved);
    }

    @GetMapping("/allowed-ips")
    public List<IpResponse> listIps() {
        return ipRepo.findAll().stream().map(this::toIpResponse).toList();
    }

    @PatchMapping("/allowed-ips/{uuid}/status")
    @Transactional
    public IpResponse changeIpStatus(@PathVariable UUID uuid, @Valid @RequestBody ChangeStatusRequest req) {
        AllowedIpAddress entry = ipRepo.findByUuid(uuid)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "IP address not found"));
        entry.setStatus(req.status());
        AllowedIpAddress saved = ipRepo.saveAndFlush(entry);
        directoryLookup.evictIp(saved.getIpAddress());
        log.info("Allowed IP uuid={} status={}", uuid, req.status());
        return toIpResponse(saved);
    }

    // ---------- mapping ----------
    private TokenResponse toTokenResponse(ApiToken t) {
        return new TokenResponse(t.getUuid(), t.getLabel(), t.getStatus(), t.getCreatedAt(), t.getUpdatedAt());
    }

    private IpResponse toIpResponse(AllowedIpAddress a) {
        return new IpResponse(a.getUuid(), a.getIpAddress(), a.getStatus(), a.getCreatedAt(), a.getUpdatedAt());
    }
}
