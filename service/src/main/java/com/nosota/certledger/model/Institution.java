package com.nosota.certledger.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;

/**
 * Institution registered on the ledger.
 *
 * <p>Keyed by the institution ID assigned at registration. The wallet address is the
 * sender of every certificate the institution issues unless the caller names another
 * issuer.
 */
@Entity
@Table(name = "institution")
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class Institution {
    @Id
    @Column(name = "institution_id", updatable = false, nullable = false, length = 36)
    private String institutionId;

    @Column(nullable = false)
    private String name;

    @Column(name = "contact_address", nullable = false)
    private String contactAddress;

    @Column(nullable = false)
    private String email;

    @Column(name = "wallet_address", nullable = false, length = 42)
    private String walletAddress;

    /**
     * Reserved flag.
     * <p>
     * Stored and exposed but never set to true by any ledger operation.
     * </p>
     */
    private boolean verified;

    @Column(name = "registered_at", nullable = false)
    private LocalDateTime registeredAt;

    /**
     * Hash of the RegisterInstitution transaction.
     */
    @Column(name = "transaction_hash", nullable = false, length = 66)
    private String transactionHash;

    /**
     * Null until the first insert, which makes Spring Data persist (INSERT) rather than merge.
     */
    @Version
    private Long version;
}
