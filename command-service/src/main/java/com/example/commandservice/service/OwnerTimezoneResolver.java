package com.example.commandservice.service;

import com.example.commandservice.entity.OwnerProfile;
import com.example.commandservice.repository.OwnerProfileRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.DateTimeException;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.UUID;

/**
 * Resolves the zone used to derive local dates and times for an owner.
 * Falls back to UTC when the owner has no profile or an unusable timezone value.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OwnerTimezoneResolver {

    private final OwnerProfileRepository profileRepository;

    public ZoneId resolve(UUID ownerId) {
        String timezone = profileRepository.findById(ownerId)
                .map(OwnerProfile::getTimezone)
                .orElse(null);
        if (timezone == null || timezone.isBlank()) {
            return ZoneOffset.UTC;
        }
        try {
            return ZoneId.of(timezone.trim());
        } catch (DateTimeException e) {
            log.warn("Unusable timezone on profile, using UTC: ownerId={}, timezone={}", ownerId, timezone);
            return ZoneOffset.UTC;
        }
    }
}
