package com.example.poscore.auth;

import com.example.poscore.security.JwtService;
import com.example.poscore.user.User;
import com.example.poscore.user.UserRepository;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/auth")
@RequiredArgsConstructor
public class AuthController {

    private static final String KEY_ERROR = "error";
    private static final String KEY_USER = "user";
    private static final String KEY_TOKEN = "token";
    private static final String MSG_NOT_AUTHENTICATED = "Not authenticated";
    private static final String MSG_INVALID_CREDENTIALS = "Invalid credentials";

    private static final Logger log = LoggerFactory.getLogger(AuthController.class);

    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;
    private final JwtService jwtService;

    @PostMapping("/login")
    public ResponseEntity<Map<String, Object>> login(@RequestBody LoginRequest req) {
        if (req.getUsername() == null || req.getPassword() == null) {
            return ResponseEntity.badRequest()
                    .body(Map.<String, Object>of(KEY_ERROR, "Username and password are required"));
        }
        log.info("Login attempt for username={}", req.getUsername());
        var maybeUser = userRepository.findByUsername(req.getUsername());
        if (maybeUser.isEmpty() || !passwordEncoder.matches(req.getPassword(), maybeUser.get().getPassword())) {
            log.warn("Failed login for username={}", req.getUsername());
            return ResponseEntity.status(401).body(Map.<String, Object>of(KEY_ERROR, MSG_INVALID_CREDENTIALS));
        }
        User u = maybeUser.get();
        return ResponseEntity.ok(Map.<String, Object>of(KEY_TOKEN, jwtService.generateToken(u), KEY_USER, toBody(u)));
    }

    @GetMapping("/me")
    public ResponseEntity<Map<String, Object>> me(@RequestAttribute(name = "userId", required = false) Long userId) {
        if (userId == null)
            return ResponseEntity.status(401).body(Map.<String, Object>of(KEY_ERROR, MSG_NOT_AUTHENTICATED));
        return userRepository.findById(userId)
                .map(u -> ResponseEntity.ok(toBody(u)))
                // token of a deleted user
                .orElse(ResponseEntity.status(401).body(Map.<String, Object>of(KEY_ERROR, MSG_NOT_AUTHENTICATED)));
    }

    private static Map<String, Object> toBody(User u) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("id", u.getId());
        m.put("username", u.getUsername());
        m.put("role", u.getRole());
        m.put("can_manage_ledger", u.mayManageLedger());
        return m;
    }

    @Data
    public static class LoginRequest {
        @NotBlank
        private String username;
        @NotBlank
        private String password;
    }
}
