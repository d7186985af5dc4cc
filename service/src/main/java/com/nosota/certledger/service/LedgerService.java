package com.nosota.certledger.service;

import com.nosota.certledger.api.dto.BlockDTO;
import com.nosota.certledger.api.dto.CertificateDTO;
import com.nosota.certledger.api.dto.InstitutionDTO;
import com.nosota.certledger.api.dto.TransactionDTO;
import com.nosota.certledger.api.response.CertificateIssueResponse;
import com.nosota.certledger.api.response.CertificateVerificationResponse;
import com.nosota.certledger.api.response.InstitutionRegistrationResponse;
import com.nosota.certledger.api.response.LedgerStatsResponse;
import com.nosota.certledger.chain.Block;
import com.nosota.certledger.chain.Chain;
import com.nosota.certledger.chain.ChainTransaction;
import com.nosota.certledger.chain.payload.AuditPayload;
import com.nosota.certledger.chain.payload.CertificateIssuePayload;
import com.nosota.certledger.chain.payload.InstitutionRegistrationPayload;
import com.nosota.certledger.crypto.AddressGenerator;
import com.nosota.certledger.crypto.ContentHasher;
import com.nosota.certledger.error.BlockNotFoundException;
import com.nosota.certledger.error.CertificateAlreadyIssuedException;
import com.nosota.certledger.error.CertificateNotFoundException;
import com.nosota.certledger.error.InstitutionNotFoundException;
import com.nosota.certledger.error.TransactionNotFoundException;
import com.nosota.certledger.mapper.CertificateMapper;
import com.nosota.certledger.mapper.ChainMapper;
import com.nosota.certledger.mapper.InstitutionMapper;
import com.nosota.certledger.model.Certificate;
import com.nosota.certledger.model.Institution;
import com.nosota.certledger.repository.CertificateRepository;
import com.nosota.certledger.repository.InstitutionRepository;
import jakarta.transaction.Transactional;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.validation.annotation.Validated;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Certificate ledger operations.
 *
 * <p>This service provides:
 * <ul>
 *   <li>Institution registration (RegisterInstitution transaction)</li>
 *   <li>Certificate issuance (IssueCertificate transaction)</li>
 *   <li>Certificate verification (VerifyCertificate audit transaction)</li>
 *   <li>Read-only queries over institutions, certificates, blocks and transactions</li>
 * </ul>
 *
 * <p>Every mutating operation follows the same order: build the transaction, persist the
 * domain record, then submit the transaction and seal it into a new block before
 * returning. A failed persist therefore leaves the chain untouched. Mutating methods run
 * outside a surrounding database transaction so each write is committed before sealing.
 *
 * <p>Every transaction is addressed to the configured contract address.
 */
@Service
@Validated
@Slf4j
public class LedgerService {

    private final Chain chain;
    private final ContentHasher contentHasher;
    private final AddressGenerator addressGenerator;
    private final InstitutionRepository institutionRepository;
    private final CertificateRepository certificateRepository;
    private final Clock clock;
    private final String contractAddress;
    private final long defaultGasLimit;

    public LedgerService(Chain chain,
                         ContentHasher contentHasher,
                         AddressGenerator addressGenerator,
                         InstitutionRepository institutionRepository,
                         CertificateRepository certificateRepository,
                         Clock clock,
                         @Value("${ledger.contract-address:0x5fbdb2315678afecb367f032d93f642f64180aa3}") String contractAddress,
                         @Value("${ledger.gas.default-limit:200000}") long defaultGasLimit) {
        this.chain = chain;
        this.contentHasher = contentHasher;
        this.addressGenerator = addressGenerator;
        this.institutionRepository = institutionRepository;
        this.certificateRepository = certificateRepository;
        this.clock = clock;
        this.contractAddress = contractAddress;
        this.defaultGasLimit = defaultGasLimit;
    }

    // ==================== Institutions ====================

    /**
     * Registers an institution and seals its RegisterInstitution transaction.
     *
     * <p>A fresh wallet address is generated for the institution; the transaction is sent
     * from that wallet.
     *
     * @param name           Institution name
     * @param contactAddress Postal contact address
     * @param email          Contact email
     * @param gasLimit       Gas limit, default limit when null
     * @return Institution ID, wallet address, transaction hash, block number and gas used
     */
    @Transactional(Transactional.TxType.NOT_SUPPORTED)
    public InstitutionRegistrationResponse registerInstitution(@NotBlank String name,
                                                               @NotBlank String contactAddress,
                                                               @NotBlank String email,
                                                               Long gasLimit) {
        String institutionId = UUID.randomUUID().toString();
        String walletAddress = addressGenerator.nextAddress();

        InstitutionRegistrationPayload payload = new InstitutionRegistrationPayload(
                institutionId, name, contactAddress, email, walletAddress);
        ChainTransaction transaction = chain.newTransaction(
                walletAddress, contractAddress, payload, resolveGasLimit(gasLimit));

        Institution institution = new Institution();
        institution.setInstitutionId(institutionId);
        institution.setName(name);
        institution.setContactAddress(contactAddress);
        institution.setEmail(email);
        institution.setWalletAddress(walletAddress);
        institution.setVerified(false);
        institution.setRegisteredAt(LocalDateTime.now(clock));
        institution.setTransactionHash(transaction.getHash());
        institutionRepository.save(institution);

        Block block = chain.submitAndSeal(transaction);

        log.info("Registered institution: institutionId={}, name={}, wallet={}, txHash={}, block={}",
                institutionId, name, walletAddress, transaction.getHash(), block.getNumber());
        return new InstitutionRegistrationResponse(institutionId, walletAddress, transaction.getHash(),
                block.getNumber(), transaction.getGasUsed());
    }

    /**
     * @return all institutions in registration order, with their issued certificate counts
     */
    public List<InstitutionDTO> listInstitutions() {
        Map<String, Long> counts = certificateRepository.countGroupedByInstitution().stream()
                .collect(Collectors.toMap(
                        CertificateRepository.InstitutionCertificateCount::getInstitutionId,
                        CertificateRepository.InstitutionCertificateCount::getTotal));

        return institutionRepository.findAllByOrderByRegisteredAtAscInstitutionIdAsc().stream()
                .map(institution -> toDTO(institution, counts.getOrDefault(institution.getInstitutionId(), 0L)))
                .toList();
    }

    public InstitutionDTO getInstitution(@NotBlank String institutionId) throws InstitutionNotFoundException {
        Institution institution = institutionRepository.findById(institutionId)
                .orElseThrow(() -> new InstitutionNotFoundException(institutionId));
        return toDTO(institution, certificateRepository.countByInstitutionId(institutionId));
    }

    // ==================== Certificates ====================

    /**
     * Issues a certificate and seals its IssueCertificate transaction.
     *
     * <p>The certificate hash covers recipient name, course name, completion date and
     * institution ID only. Issuing the same identity twice is rejected before the chain is
     * touched; two concurrent duplicates that both pass the check collide on the primary
     * key, and the loser fails with a data integrity violation.
     *
     * <p>The certificate is stored first without a block number, which is back-filled
     * once the transaction is sealed.
     *
     * @param recipientName       Recipient full name
     * @param courseName          Course name
     * @param completionDate      Completion date
     * @param grade               Optional grade, metadata only
     * @param institutionId       Issuing institution
     * @param issuerWalletAddress Sender address, the institution's wallet when blank
     * @param gasLimit            Gas limit, default limit when null
     * @return Certificate ID and hash, transaction hash, block number and gas used
     * @throws InstitutionNotFoundException      If the institution is not registered
     * @throws CertificateAlreadyIssuedException If the same certificate was already issued
     */
    @Transactional(Transactional.TxType.NOT_SUPPORTED)
    public CertificateIssueResponse issueCertificate(@NotBlank String recipientName,
                                                     @NotBlank String courseName,
                                                     @NotNull LocalDate completionDate,
                                                     String grade,
                                                     @NotBlank String institutionId,
                                                     String issuerWalletAddress,
                                                     Long gasLimit)
            throws InstitutionNotFoundException, CertificateAlreadyIssuedException {

        Institution institution = institutionRepository.findById(institutionId)
                .orElseThrow(() -> new InstitutionNotFoundException(institutionId));

        String certificateHash = certificateHash(recipientName, courseName, completionDate, institutionId);
        if (certificateRepository.existsById(certificateHash)) {
            throw new CertificateAlreadyIssuedException(certificateHash);
        }

        String certificateId = UUID.randomUUID().toString();
        String issuer = issuerWalletAddress == null || issuerWalletAddress.isBlank()
                ? institution.getWalletAddress()
                : issuerWalletAddress;

        CertificateIssuePayload payload = new CertificateIssuePayload(certificateHash, certificateId,
                recipientName, courseName, completionDate.toString(), grade, institutionId);
        ChainTransaction transaction = chain.newTransaction(
                issuer, contractAddress, payload, resolveGasLimit(gasLimit));

        Certificate certificate = new Certificate();
        certificate.setCertificateHash(certificateHash);
        certificate.setCertificateId(certificateId);
        certificate.setRecipientName(recipientName);
        certificate.setCourseName(courseName);
        certificate.setCompletionDate(completionDate);
        certificate.setGrade(grade);
        certificate.setInstitutionId(institutionId);
        certificate.setInstitutionName(institution.getName());
        certificate.setIssuerAddress(issuer);
        certificate.setTransactionHash(transaction.getHash());
        certificate.setIssuedAt(LocalDateTime.now(clock));
        certificate.setValid(true);
        certificate = certificateRepository.save(certificate);

        Block block = chain.submitAndSeal(transaction);

        certificate.setBlockNumber(block.getNumber());
        certificateRepository.save(certificate);

        log.info("Issued certificate: certificateId={}, hash={}, institutionId={}, txHash={}, block={}",
                certificateId, certificateHash, institutionId, transaction.getHash(), block.getNumber());
        return new CertificateIssueResponse(certificateId, certificateHash, transaction.getHash(),
                block.getNumber(), transaction.getGasUsed());
    }

    /**
     * Verifies a certificate and records the verification on the chain.
     *
     * <p>Every call seals a new block with one VerifyCertificate audit transaction. The
     * certificate itself is never modified.
     *
     * @param certificateHash Hash of the certificate to verify
     * @param verifierAddress Sender of the audit transaction; a fresh address when blank
     * @return The certificate record with the audit transaction and its block
     * @throws CertificateNotFoundException If no certificate has this hash
     */
    @Transactional(Transactional.TxType.NOT_SUPPORTED)
    public CertificateVerificationResponse verifyCertificate(@NotBlank String certificateHash,
                                                             String verifierAddress)
            throws CertificateNotFoundException {

        Certificate certificate = certificateRepository.findById(certificateHash)
                .orElseThrow(() -> new CertificateNotFoundException(certificateHash));

        String verifier = verifierAddress == null || verifierAddress.isBlank()
                ? addressGenerator.nextAddress()
                : verifierAddress;

        AuditPayload payload = AuditPayload.certificateVerification(
                certificateHash, certificate.getInstitutionId(), verifier);
        ChainTransaction transaction = chain.newTransaction(verifier, contractAddress, payload, defaultGasLimit);
        Block block = chain.submitAndSeal(transaction);

        log.info("Verified certificate: hash={}, verifier={}, txHash={}, block={}",
                certificateHash, verifier, transaction.getHash(), block.getNumber());
        return new CertificateVerificationResponse(CertificateMapper.INSTANCE.toDTO(certificate), true,
                transaction.getHash(), block.getNumber());
    }

    /**
     * Lists certificates ordered by issue time, then hash.
     *
     * @param institutionId Optional institution filter; all certificates when null or blank
     */
    public List<CertificateDTO> listCertificates(String institutionId) {
        List<Certificate> certificates = institutionId == null || institutionId.isBlank()
                ? certificateRepository.findAllByOrderByIssuedAtAscCertificateHashAsc()
                : certificateRepository.findAllByInstitutionIdOrderByIssuedAtAscCertificateHashAsc(institutionId);
        return CertificateMapper.INSTANCE.toDTOList(certificates);
    }

    /**
     * Looks a certificate up without recording a verification.
     */
    public CertificateDTO getCertificate(@NotBlank String certificateHash) throws CertificateNotFoundException {
        Certificate certificate = certificateRepository.findById(certificateHash)
                .orElseThrow(() -> new CertificateNotFoundException(certificateHash));
        return CertificateMapper.INSTANCE.toDTO(certificate);
    }

    /**
     * Certificate fingerprint over its identity fields.
     *
     * <p>The completion date takes part in ISO-8601 form ({@code yyyy-MM-dd}).
     */
    public String certificateHash(String recipientName, String courseName, LocalDate completionDate,
                                  String institutionId) {
        return contentHasher.hash(Map.of(
                "recipient_name", recipientName,
                "course_name", courseName,
                "completion_date", completionDate.toString(),
                "institution_id", institutionId));
    }

    // ==================== Chain queries ====================

    public List<BlockDTO> listBlocks() {
        return ChainMapper.INSTANCE.toBlockDTOList(chain.blocks());
    }

    public BlockDTO getLatestBlock() {
        return ChainMapper.INSTANCE.toDTO(chain.latest());
    }

    public BlockDTO getBlock(long blockNumber) throws BlockNotFoundException {
        Block block = chain.blockByNumber(blockNumber)
                .orElseThrow(() -> new BlockNotFoundException(blockNumber));
        return ChainMapper.INSTANCE.toDTO(block);
    }

    public List<TransactionDTO> listTransactions() {
        return ChainMapper.INSTANCE.toTransactionDTOList(chain.allTransactions());
    }

    public TransactionDTO getTransaction(@NotBlank String transactionHash) throws TransactionNotFoundException {
        ChainTransaction transaction = chain.transactionByHash(transactionHash)
                .orElseThrow(() -> new TransactionNotFoundException(transactionHash));
        return ChainMapper.INSTANCE.toDTO(transaction);
    }

    /**
     * Aggregated figures over the database and the chain.
     *
     * <p>Chain figures are read one by one, so under concurrent sealing they may describe
     * slightly different heights.
     */
    public LedgerStatsResponse getStats() {
        long sealed = chain.sealedTransactionCount();
        long pending = chain.pendingCount();
        Block latest = chain.latest();

        return new LedgerStatsResponse(
                institutionRepository.count(),
                certificateRepository.count(),
                latest.getNumber(),
                latest.getNumber() + 1,
                sealed + pending,
                pending,
                chain.totalGasUsed(),
                latest.getHash(),
                chain.isValid(),
                contractAddress);
    }

    private long resolveGasLimit(Long gasLimit) {
        return gasLimit == null ? defaultGasLimit : gasLimit;
    }

    private InstitutionDTO toDTO(Institution institution, long certificatesIssued) {
        InstitutionDTO dto = InstitutionMapper.INSTANCE.toDTO(institution);
        dto.setCertificatesIssued(certificatesIssued);
        return dto;
    }
}
