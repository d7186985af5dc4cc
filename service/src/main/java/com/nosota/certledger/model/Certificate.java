package com.nosota.certledger.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Certificate entity - immutable once issued.
 *
 * <p>Keyed by the certificate hash, a content hash over recipient name, course name,
 * completion date and institution ID. Grade and the other fields are metadata and do
 * not take part in the hash.
 *
 * <p>The only field written after the first insert is {@code blockNumber}, back-filled
 * once the issuing transaction is sealed.
 */
@Entity
@Table(name = "certificate")
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class Certificate {
    @Id
    @Column(name = "certificate_hash", updatable = false, nullable = false, length = 66)
    private String certificateHash;

    @Column(name = "certificate_id", updatable = false, nullable = false, unique = true, length = 36)
    private String certificateId;

    @Column(name = "recipient_name", nullable = false)
    private String recipientName;

    @Column(name = "course_name", nullable = false)
    private String courseName;

    @Column(name = "completion_date", nullable = false)
    private LocalDate completionDate;

    private String grade;

    @Column(name = "institution_id", nullable = false, length = 36)
    private String institutionId;

    @Column(name = "institution_name", nullable = false)
    private String institutionName;

    /**
     * Sender address of the IssueCertificate transaction.
     */
    @Column(name = "issuer_address", nullable = false, length = 42)
    private String issuerAddress;

    @Column(name = "transaction_hash", nullable = false, length = 66)
    private String transactionHash;

    /**
     * Number of the block that sealed the issuing transaction; null until back-filled.
     */
    @Column(name = "block_number")
    private Long blockNumber;

    @Column(name = "issued_at", nullable = false)
    private LocalDateTime issuedAt;

    private boolean valid = true;

    @Version
    private Long version;
}
