package com.resonanceloop.engine.controller;

import com.resonanceloop.common.exception.ProfileNotFoundException;
import com.resonanceloop.common.model.ScoreDimension;
import com.resonanceloop.common.profile.ProfileStore;
import com.resonanceloop.common.profile.TargetProfile;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/profiles")
public class ProfileController {

    private final ProfileStore profileStore;

    public ProfileController(ProfileStore profileStore) {
        this.profileStore = profileStore;
    }

    @GetMapping
    public ResponseEntity<List<ProfileSummary>> list() {
        return ResponseEntity.ok(profileStore.listProfiles().stream().map(ProfileSummary::of).toList());
    }

    @GetMapping("/{profileId}")
    public ResponseEntity<ProfileSummary> get(@PathVariable String profileId) {
        return ResponseEntity.ok(ProfileSummary.of(profileStore.getProfile(profileId)));
    }

    @ExceptionHandler(ProfileNotFoundException.class)
    public ResponseEntity<Map<String, String>> notFound(ProfileNotFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", e.getMessage()));
    }

    public record ProfileSummary(
        String profileId,
        String displayName,
        String description,
        Map<ScoreDimension, Double> dimensionWeights,
        Map<String, String> categoricalCodes
    ) {
        static ProfileSummary of(TargetProfile p) {
            return new ProfileSummary(p.profileId(), p.displayName(), p.description(),
                                      p.dimensionWeights(), p.categoricalCodes());
        }
    }
}
