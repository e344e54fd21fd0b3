package com.example.poscore.user;

import jakarta.persistence.*;
import lombok.*;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Entity
@Table(name = "app_user")
public class User {
    public static final String ROLE_ADMIN = "admin";
    public static final String ROLE_CASHIER = "cashier";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true)
    private String username;

    @Column(nullable = false)
    private String password;

    @Column(nullable = false)
    private String role; // 'admin' | 'cashier'

    @Column(name = "can_manage_ledger")
    @lombok.Builder.Default
    private Boolean canManageLedger = Boolean.FALSE;

    public boolean isAdmin() {
        return ROLE_ADMIN.equals(role);
    }

    /** Admins, and cashiers granted the flag, may record manual cash movements. */
    public boolean mayManageLedger() {
        return isAdmin() || Boolean.TRUE.equals(canManageLedger);
    }
}
