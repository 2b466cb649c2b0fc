package com.baskettecase.sqlgate.api;

import com.baskettecase.sqlgate.security.RequestUserContext;
import com.baskettecase.sqlgate.security.SessionService;
import com.baskettecase.sqlgate.store.AppUser;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Session Controller
 *
 * Opens and closes the caller's database session (the cached database password).
 */
@RestController
@RequestMapping("/api/v1/session")
@RequiredArgsConstructor
public class SessionController {

    private final SessionService sessionService;

    @PostMapping
    public ResponseEntity<SessionStatus> login(@Valid @RequestBody LoginRequest request) {
        AppUser user = RequestUserContext.getCurrentUser();
        sessionService.login(user, request.password());
        return ResponseEntity.ok(new SessionStatus(user.username(), true));
    }

    @DeleteMapping
    public ResponseEntity<SessionStatus> logout() {
        AppUser user = RequestUserContext.getCurrentUser();
        sessionService.logout(user);
        return ResponseEntity.ok(new SessionStatus(user.username(), false));
    }

    @GetMapping
    public ResponseEntity<SessionStatus> status() {
        AppUser user = RequestUserContext.getCurrentUser();
        return ResponseEntity.ok(new SessionStatus(user.username(), sessionService.isActive(user)));
    }

    public record LoginRequest(@NotBlank String password) {
        @Override
        public String toString() {
            return "LoginRequest[password=***]";
        }
    }

    public record SessionStatus(String username, boolean active) {}
}
