package com.example.poscore.security;

import com.example.poscore.config.props.JwtProperties;
import com.example.poscore.user.User;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.io.Decoders;
import io.jsonwebtoken.security.Keys;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.Key;
import java.util.Date;
import java.util.HashMap;
import java.util.Map;

@Service
public class JwtService {

    static final String CLAIM_ID = "id";
    static final String CLAIM_USERNAME = "username";
    static final String CLAIM_ROLE = "role";

    private final JwtProperties props;

    public JwtService(JwtProperties props) {
        this.props = props;
    }

    private Key getSigningKey() {
        String secret = props.getSecret();
        // base64 secrets are decoded, anything else is used as raw bytes
        byte[] keyBytes = secret.length() % 4 == 0 ? Decoders.BASE64.decode(secret)
                : secret.getBytes(StandardCharsets.UTF_8);
        return Keys.hmacShaKeyFor(keyBytes);
    }

    public String generateToken(User user) {
        Map<String, Object> claims = new HashMap<>();
        claims.put(CLAIM_ID, user.getId());
        claims.put(CLAIM_USERNAME, user.getUsername());
        claims.put(CLAIM_ROLE, user.getRole());
        return generateToken(claims);
    }

    public String generateToken(Map<String, Object> claims) {
        Date now = new Date();
        Date exp = new Date(now.getTime() + props.getExpiration());
        return Jwts.builder()
                .setClaims(claims)
                .setIssuer(props.getIssuer())
                .setIssuedAt(now)
                .setExpiration(exp)
                .signWith(getSigningKey(), SignatureAlgorithm.HS256)
                .compact();
    }

    public Claims parseToken(String token) {
        return Jwts.parserBuilder()
                .setSigningKey(getSigningKey())
                .requireIssuer(props.getIssuer())
                .build()
                .parseClaimsJws(token)
                .getBody();
    }
}
