package com.nosota.certledger.api;

import com.nosota.certledger.api.dto.BlockDTO;
import com.nosota.certledger.api.dto.CertificateDTO;
import com.nosota.certledger.api.dto.InstitutionDTO;
import com.nosota.certledger.api.dto.TransactionDTO;
import com.nosota.certledger.api.request.IssueCertificateRequest;
import com.nosota.certledger.api.request.RegisterInstitutionRequest;
import com.nosota.certledger.api.response.CertificateIssueResponse;
import com.nosota.certledger.api.response.CertificateVerificationResponse;
import com.nosota.certledger.api.response.InstitutionRegistrationResponse;
import com.nosota.certledger.api.response.LedgerStatsResponse;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Ledger API interface of the certificate ledger service.
 *
 * <p>Defines REST endpoints for:
 * <ul>
 *   <li>Institution registration and lookup</li>
 *   <li>Certificate issuance, verification and lookup</li>
 *   <li>Chain queries (blocks, transactions, statistics)</li>
 * </ul>
 *
 * <p>Every mutating call records a transaction and seals a new block before it returns.
 *
 * <p>This interface is implemented by:
 * <ul>
 *   <li>LedgerController - in service module (server-side implementation)</li>
 *   <li>LedgerClient - in api module (WebClient-based client for consumers)</li>
 * </ul>
 */
@RequestMapping("/api/v1/ledger")
public interface LedgerApi {

    // ==================== Institutions ====================

    /**
     * Registers an institution and assigns it a wallet address.
     *
     * @param request Institution name, contact address, email and optional gas limit
     * @return Registration result with the sealing transaction and block
     */
    @PostMapping("/institutions")
    ResponseEntity<InstitutionRegistrationResponse> registerInstitution(
            @RequestBody @Valid RegisterInstitutionRequest request) throws Exception;

    /**
     * Lists all registered institutions.
     */
    @GetMapping("/institutions")
    ResponseEntity<List<InstitutionDTO>> listInstitutions();

    /**
     * Retrieves an institution by ID.
     *
     * @param institutionId Institution ID returned at registration
     * @return Institution details
     */
    @GetMapping("/institutions/{institutionId}")
    ResponseEntity<InstitutionDTO> getInstitution(
            @PathVariable("institutionId") String institutionId) throws Exception;

    // ==================== Certificates ====================

    /**
     * Issues a certificate on behalf of a registered institution.
     *
     * @param request Certificate identity fields, grade and issuer
     * @return Issuance result with the certificate hash and sealing block
     */
    @PostMapping("/certificates")
    ResponseEntity<CertificateIssueResponse> issueCertificate(
            @RequestBody @Valid IssueCertificateRequest request) throws Exception;

    /**
     * Lists issued certificates, optionally restricted to one institution.
     *
     * @param institutionId Optional institution filter
     * @return Certificates ordered by issue time
     */
    @GetMapping("/certificates")
    ResponseEntity<List<CertificateDTO>> listCertificates(
            @RequestParam(value = "institutionId", required = false) String institutionId);

    /**
     * Retrieves a certificate by its hash without recording a verification.
     *
     * @param certificateHash Certificate hash
     * @return Certificate details
     */
    @GetMapping("/certificates/{certificateHash}")
    ResponseEntity<CertificateDTO> getCertificate(
            @PathVariable("certificateHash") String certificateHash) throws Exception;

    /**
     * Verifies a certificate and records the verification as an audit transaction.
     *
     * @param certificateHash Certificate hash
     * @param verifierAddress Optional address of the verifying party
     * @return Certificate record with the verification transaction
     */
    @PostMapping("/certificates/{certificateHash}/verify")
    ResponseEntity<CertificateVerificationResponse> verifyCertificate(
            @PathVariable("certificateHash") @NotBlank String certificateHash,
            @RequestParam(value = "verifierAddress", required = false) String verifierAddress) throws Exception;

    // ==================== Chain queries ====================

    /**
     * Lists all blocks starting from genesis.
     */
    @GetMapping("/blocks")
    ResponseEntity<List<BlockDTO>> listBlocks();

    /**
     * Retrieves the most recently sealed block (genesis if none sealed yet).
     */
    @GetMapping("/blocks/latest")
    ResponseEntity<BlockDTO> getLatestBlock();

    /**
     * Retrieves a block by number.
     *
     * @param blockNumber Block number (0 is genesis)
     * @return Block with its transactions
     */
    @GetMapping("/blocks/{blockNumber}")
    ResponseEntity<BlockDTO> getBlock(
            @PathVariable("blockNumber") @PositiveOrZero Long blockNumber) throws Exception;

    /**
     * Lists sealed transactions in block order followed by pending ones.
     */
    @GetMapping("/transactions")
    ResponseEntity<List<TransactionDTO>> listTransactions();

    /**
     * Retrieves a transaction by hash, sealed or pending.
     *
     * @param transactionHash Transaction hash
     * @return Transaction details
     */
    @GetMapping("/transactions/{transactionHash}")
    ResponseEntity<TransactionDTO> getTransaction(
            @PathVariable("transactionHash") String transactionHash) throws Exception;

    /**
     * Retrieves aggregated ledger statistics.
     */
    @GetMapping("/stats")
    ResponseEntity<LedgerStatsResponse> getStats();
}
