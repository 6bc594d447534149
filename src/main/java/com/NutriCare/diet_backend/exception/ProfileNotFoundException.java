package com.NutriCare.diet_backend.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

import java.util.Map;

@Getter
public class ProfileNotFoundException extends ApiException {
    private final String profileName;

    public ProfileNotFoundException(String profileName) {
        super(String.format("RDA profile '%s' not found.", profileName),
                HttpStatus.NOT_FOUND,
                "PROFILE_NOT_FOUND");
        this.profileName = profileName;
    }

    @Override
    public Map<String, Object> getDetails() {
        return Map.of("profileName", String.valueOf(profileName));
    }
}
