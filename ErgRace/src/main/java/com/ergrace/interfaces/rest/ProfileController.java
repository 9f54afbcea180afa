package com.ergrace.interfaces.rest;

import com.ergrace.application.RaceCoordinator;
import com.ergrace.domain.ProfileUpdate;
import com.ergrace.domain.UserProfile;
import com.ergrace.dto.ProfileRequest;
import jakarta.validation.Valid;
import java.util.NoSuchElementException;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Profiles live in the record store; with the store disabled every lookup is a 404. */
@RestController
@RequestMapping("/api/users/{id}/profile")
public class ProfileController {
  private final RaceCoordinator coordinator;

  public ProfileController(RaceCoordinator coordinator) {
    this.coordinator = coordinator;
  }

  @GetMapping
  public UserProfile profile(@PathVariable String id) {
    return coordinator.fetchProfile(id).orElseThrow(() -> notFound(id));
  }

  @PutMapping
  public UserProfile save(@PathVariable String id, @Valid @RequestBody ProfileRequest req) {
    return coordinator
        .saveProfile(id, new ProfileUpdate(req.displayName(), req.email(), req.walletAddress()))
        .orElseThrow(() -> notFound(id));
  }

  private static NoSuchElementException notFound(String id) {
    return new NoSuchElementException("Profile not found: " + id);
  }
}
