package com.itms.backend.modules.auth.presentation.dto;

public record LoginResponse(AccessTokenResponse tokens, UserProfileResponse user) {
}
