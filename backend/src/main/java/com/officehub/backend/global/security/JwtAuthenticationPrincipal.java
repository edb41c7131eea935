package com.officehub.backend.global.security;

import java.util.List;
import java.util.UUID;

public record JwtAuthenticationPrincipal(UUID employeeId, String loginId, List<String> roles) {
}
