package com.pmmsentinel.core.model;

import java.time.Instant;

public record RequirementCheck(String requirement, String status, Instant lastVerified) {
}
