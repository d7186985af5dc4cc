package com.nosota.certledger.service;

import com.nosota.certledger.api.dto.BlockDTO;
import com.nosota.certledger.api.dto.CertificateDTO;
import com.nosota.certledger.api.dto.InstitutionDTO;
import com.nosota.certledger.api.dto.TransactionDTO;
import com.nosota.certledger.api.model.OperationType;
import com.nosota.certledger.api.model.TransactionStatus;
import com.nosota.certledger.api.response.CertificateIssueResponse;
import com.nosota.certledger.api.response.CertificateVerificationResponse;
import com.nosota.certledger.api.response.InstitutionRegistrationResponse;
import com.nosota.certledger.api.response.LedgerStatsResponse;
import com.nosota.certledger.chain.Block;
import com.nosota.certledger.chain.Chain;
import com.nosota.certledger.chain.ChainTransaction;
import com.nosota.certledger.chain.TransactionPool;
import com.nosota.certledger.crypto.ContentHasher;
import com.nosota.certledger.error.BlockNotFoundException;
import com.nosota.certledger.error.CertificateAlreadyIssuedException;
import com.nosota.certledger.error.CertificateNotFoundException;
import com.nosota.certledger.error.InstitutionNotFoundException;
import com.nosota.certledger.error.TransactionNotFoundException;
import com.nosota.certledger.model.Certificate;
import com.nosota.certledger.model.Institution;
import com.nosota.certledger.repository.CertificateRepository;
import com.nosota.certledger.repository.InstitutionRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link LedgerService} over a real in-memory chain and map-backed repositories.
 */
@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class LedgerServiceTest {

    private static final String CONTRACT = "0x5fbdb2315678afecb367f032d93f642f64180aa3";
    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");
    private static final LocalDate COMPLETED = LocalDate.of(2024, 1, 1);

    @Mock
    private InstitutionRepository institutionRepository;

    @Mock
    private CertificateRepository certificateRepository;

    private final Map<String, Institution> institutions = new LinkedHashMap<>();
    private final Map<String, Certificate> certificates = new LinkedHashMap<>();
    private final AtomicInteger addressCounter = new AtomicInteger();

    private Chain chain;
    private LedgerService ledgerService;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        ContentHasher hasher = new ContentHasher();
        chain = new Chain(new TransactionPool(), hasher, new GasModel(), new TransactionStatusStateMachine(),
                clock, 20_000_000_000L, Block.DEFAULT_GAS_LIMIT);
        ledgerService = new LedgerService(chain, hasher,
                () -> String.format("0x%040x", addressCounter.incrementAndGet()),
                institutionRepository, certificateRepository, clock, CONTRACT, 200_000L);

        when(institutionRepository.save(any(Institution.class))).thenAnswer(invocation -> {
            Institution institution = invocation.getArgument(0);
            institutions.put(institution.getInstitutionId(), institution);
            return institution;
        });
        when(institutionRepository.findById(anyString()))
                .thenAnswer(invocation -> Optional.ofNullable(institutions.get(invocation.<String>getArgument(0))));
        when(institutionRepository.findAllByOrderByRegisteredAtAscInstitutionIdAsc())
                .thenAnswer(invocation -> List.copyOf(institutions.values()));
        when(institutionRepository.count()).thenAnswer(invocation -> (long) institutions.size());

        when(certificateRepository.save(any(Certificate.class))).thenAnswer(invocation -> {
            Certificate certificate = invocation.getArgument(0);
            certificates.put(certificate.getCertificateHash(), certificate);
            return certificate;
        });
        when(certificateRepository.findById(anyString()))
                .thenAnswer(invocation -> Optional.ofNullable(certificates.get(invocation.<String>getArgument(0))));
        when(certificateRepository.existsById(anyString()))
                .thenAnswer(invocation -> certificates.containsKey(invocation.<String>getArgument(0)));
        when(certificateRepository.findAllByOrderByIssuedAtAscCertificateHashAsc())
                .thenAnswer(invocation -> sortedCertificates(null));
        when(certificateRepository.findAllByInstitutionIdOrderByIssuedAtAscCertificateHashAsc(anyString()))
                .thenAnswer(invocation -> sortedCertificates(invocation.getArgument(0)));
        when(certificateRepository.countByInstitutionId(anyString()))
                .thenAnswer(invocation -> (long) sortedCertificates(invocation.getArgument(0)).size());
        when(certificateRepository.countGroupedByInstitution()).thenAnswer(invocation -> groupedCounts());
        when(certificateRepository.count()).thenAnswer(invocation -> (long) certificates.size());
    }

    @Test
    @DisplayName("SVC-001: Registering an institution seals one RegisterInstitution transaction")
    void registerInstitution() throws Exception {
        InstitutionRegistrationResponse response = ledgerService.registerInstitution(
                "Acme U", "1 Main St", "registrar@acme.edu", null);

        assertThat(response.gasUsed()).isEqualTo(150_000L);
        assertThat(response.blockNumber()).isEqualTo(1L);
        assertThat(response.walletAddress()).isEqualTo(String.format("0x%040x", 1));
        assertThat(response.transactionHash()).matches("0x[0-9a-f]{64}");

        BlockDTO block = ledgerService.getBlock(1);
        assertThat(block.getTransactions()).hasSize(1);
        TransactionDTO transaction = block.getTransactions().get(0);
        assertThat(transaction.getHash()).isEqualTo(response.transactionHash());
        assertThat(transaction.getOperation()).isEqualTo(OperationType.REGISTER_INSTITUTION);
        assertThat(transaction.getFrom()).isEqualTo(response.walletAddress());
        assertThat(transaction.getTo()).isEqualTo(CONTRACT);
        assertThat(transaction.getStatus()).isEqualTo(TransactionStatus.CONFIRMED);
        assertThat(transaction.getPayload())
                .containsEntry("name", "Acme U")
                .containsEntry("institution_id", response.institutionId());

        InstitutionDTO institution = ledgerService.getInstitution(response.institutionId());
        assertThat(institution.getName()).isEqualTo("Acme U");
        assertThat(institution.isVerified()).isFalse();
        assertThat(institution.getTransactionHash()).isEqualTo(response.transactionHash());
        assertThat(institution.getCertificatesIssued()).isZero();
    }

    @Test
    @DisplayName("SVC-002: Gas is charged up to the supplied limit")
    void registerWithLowGasLimit() {
        InstitutionRegistrationResponse response = ledgerService.registerInstitution(
                "Acme U", "1 Main St", "registrar@acme.edu", 100_000L);

        assertThat(response.gasUsed()).isEqualTo(100_000L);
    }

    @Test
    @DisplayName("SVC-003: Issuing a certificate stores it under its content hash and back-fills the block")
    void issueCertificate() throws Exception {
        InstitutionRegistrationResponse institution = registerAcme();

        CertificateIssueResponse response = ledgerService.issueCertificate(
                "Ada", "Systems 101", COMPLETED, "A", institution.institutionId(), null, null);

        assertThat(response.certificateHash())
                .isEqualTo(ledgerService.certificateHash("Ada", "Systems 101", COMPLETED, institution.institutionId()))
                .matches("0x[0-9a-f]{64}");
        assertThat(response.gasUsed()).isEqualTo(100_000L);
        assertThat(response.blockNumber()).isEqualTo(2L);

        CertificateDTO certificate = ledgerService.getCertificate(response.certificateHash());
        assertThat(certificate.getCertificateId()).isEqualTo(response.certificateId());
        assertThat(certificate.getBlockNumber()).isEqualTo(2L);
        assertThat(certificate.getIssuerAddress()).isEqualTo(institution.walletAddress());
        assertThat(certificate.getInstitutionName()).isEqualTo("Acme U");
        assertThat(certificate.getGrade()).isEqualTo("A");
        assertThat(certificate.isValid()).isTrue();

        TransactionDTO transaction = ledgerService.getTransaction(response.transactionHash());
        assertThat(transaction.getOperation()).isEqualTo(OperationType.ISSUE_CERTIFICATE);
        assertThat(transaction.getBlockNumber()).isEqualTo(2L);
        assertThat(transaction.getPayload()).containsEntry("completion_date", "2024-01-01");
        assertThat(ledgerService.getBlock(2).getTransactions()).hasSize(1);

        Map<String, Object> identity = new LinkedHashMap<>();
        identity.put("institution_id", institution.institutionId());
        identity.put("completion_date", "2024-01-01");
        identity.put("course_name", "Systems 101");
        identity.put("recipient_name", "Ada");
        assertThat(response.certificateHash()).isEqualTo(new ContentHasher().hash(identity));

        assertThat(ledgerService.getInstitution(institution.institutionId()).getCertificatesIssued()).isEqualTo(1L);
    }

    @Test
    @DisplayName("SVC-004: Explicit issuer address is used as the sender")
    void issueWithExplicitIssuer() throws Exception {
        InstitutionRegistrationResponse institution = registerAcme();
        String issuer = "0x" + "a".repeat(40);

        CertificateIssueResponse response = ledgerService.issueCertificate(
                "Ada", "Systems 101", COMPLETED, null, institution.institutionId(), issuer, 150_000L);

        assertThat(ledgerService.getTransaction(response.transactionHash()).getFrom()).isEqualTo(issuer);
        assertThat(ledgerService.getCertificate(response.certificateHash()).getIssuerAddress()).isEqualTo(issuer);
    }

    @Test
    @DisplayName("SVC-005: Issuing for an unknown institution leaves the chain untouched")
    void issueForUnknownInstitution() {
        assertThatThrownBy(() -> ledgerService.issueCertificate(
                "Ada", "Systems 101", COMPLETED, null, "missing", null, null))
                .isInstanceOf(InstitutionNotFoundException.class);

        assertThat(chain.height()).isZero();
        verify(certificateRepository, never()).save(any());
    }

    @Test
    @DisplayName("SVC-006: Re-issuing the same certificate identity is rejected")
    void issueDuplicate() throws Exception {
        InstitutionRegistrationResponse institution = registerAcme();
        ledgerService.issueCertificate("Ada", "Systems 101", COMPLETED, "A", institution.institutionId(), null, null);
        long height = chain.height();

        assertThatThrownBy(() -> ledgerService.issueCertificate(
                "Ada", "Systems 101", COMPLETED, "B", institution.institutionId(), null, null))
                .isInstanceOf(CertificateAlreadyIssuedException.class);

        assertThat(chain.height()).isEqualTo(height);
        assertThat(certificates).hasSize(1);
    }

    @Test
    @DisplayName("SVC-007: Verifying an unknown certificate fails without sealing")
    void verifyUnknown() {
        assertThatThrownBy(() -> ledgerService.verifyCertificate("0x" + "0".repeat(64), null))
                .isInstanceOf(CertificateNotFoundException.class);

        assertThat(chain.height()).isZero();
    }

    @Test
    @DisplayName("SVC-008: Each verification seals its own audit transaction and leaves the certificate unchanged")
    void verifyTwice() throws Exception {
        InstitutionRegistrationResponse institution = registerAcme();
        CertificateIssueResponse issued = ledgerService.issueCertificate(
                "Ada", "Systems 101", COMPLETED, "A", institution.institutionId(), null, null);
        CertificateDTO before = ledgerService.getCertificate(issued.certificateHash());

        CertificateVerificationResponse first = ledgerService.verifyCertificate(issued.certificateHash(), null);
        CertificateVerificationResponse second = ledgerService.verifyCertificate(issued.certificateHash(), "0x" + "b".repeat(40));

        assertThat(first.verified()).isTrue();
        assertThat(second.verified()).isTrue();
        assertThat(first.verificationTransactionHash()).isNotEqualTo(second.verificationTransactionHash());
        assertThat(first.blockNumber()).isEqualTo(3L);
        assertThat(second.blockNumber()).isEqualTo(4L);

        TransactionDTO firstTx = ledgerService.getTransaction(first.verificationTransactionHash());
        TransactionDTO secondTx = ledgerService.getTransaction(second.verificationTransactionHash());
        assertThat(firstTx.getOperation()).isEqualTo(OperationType.VERIFY_CERTIFICATE);
        assertThat(firstTx.getGasUsed()).isEqualTo(21_000L);
        assertThat(firstTx.getFrom()).matches("0x[0-9a-f]{40}");
        assertThat(secondTx.getFrom()).isEqualTo("0x" + "b".repeat(40));
        assertThat(secondTx.getPayload())
                .containsEntry("certificate_hash", issued.certificateHash())
                .containsEntry("verified", true);

        assertThat(ledgerService.getCertificate(issued.certificateHash())).isEqualTo(before);
        assertThat(first.certificate()).isEqualTo(before);
        verify(certificateRepository, times(2)).save(any(Certificate.class));
    }

    @Test
    @DisplayName("SVC-009: Listing certificates is repeatable and has no side effects")
    void listCertificatesIsIdempotent() throws Exception {
        InstitutionRegistrationResponse acme = registerAcme();
        InstitutionRegistrationResponse other = ledgerService.registerInstitution(
                "Other College", "2 Side St", "office@other.edu", null);
        ledgerService.issueCertificate("Ada", "Systems 101", COMPLETED, null, acme.institutionId(), null, null);
        ledgerService.issueCertificate("Grace", "Compilers", COMPLETED, null, acme.institutionId(), null, null);
        ledgerService.issueCertificate("Alan", "Computability", COMPLETED, null, other.institutionId(), null, null);
        long height = chain.height();

        List<CertificateDTO> first = ledgerService.listCertificates(null);
        List<CertificateDTO> second = ledgerService.listCertificates(null);

        assertThat(first).hasSize(3).isEqualTo(second);
        assertThat(ledgerService.listCertificates(acme.institutionId()))
                .extracting(CertificateDTO::getRecipientName)
                .containsExactlyInAnyOrder("Ada", "Grace");
        assertThat(chain.height()).isEqualTo(height);
    }

    @Test
    @DisplayName("SVC-010: Institution listing carries certificate counts")
    void listInstitutions() throws Exception {
        InstitutionRegistrationResponse acme = registerAcme();
        ledgerService.registerInstitution("Other College", "2 Side St", "office@other.edu", null);
        ledgerService.issueCertificate("Ada", "Systems 101", COMPLETED, null, acme.institutionId(), null, null);

        List<InstitutionDTO> listed = ledgerService.listInstitutions();

        assertThat(listed).extracting(InstitutionDTO::getName).containsExactly("Acme U", "Other College");
        assertThat(listed).extracting(InstitutionDTO::getCertificatesIssued).containsExactly(1L, 0L);
    }

    @Test
    @DisplayName("SVC-011: Statistics aggregate database and chain figures")
    void stats() throws Exception {
        InstitutionRegistrationResponse acme = registerAcme();
        ledgerService.issueCertificate("Ada", "Systems 101", COMPLETED, null, acme.institutionId(), null, null);

        LedgerStatsResponse stats = ledgerService.getStats();

        assertThat(stats.totalInstitutions()).isEqualTo(1);
        assertThat(stats.totalCertificates()).isEqualTo(1);
        assertThat(stats.blockHeight()).isEqualTo(2);
        assertThat(stats.totalBlocks()).isEqualTo(3);
        assertThat(stats.totalTransactions()).isEqualTo(2);
        assertThat(stats.pendingTransactions()).isZero();
        assertThat(stats.totalGasUsed()).isEqualTo(250_000L);
        assertThat(stats.latestBlockHash()).isEqualTo(ledgerService.getLatestBlock().getHash());
        assertThat(stats.chainValid()).isTrue();
        assertThat(stats.contractAddress()).isEqualTo(CONTRACT);
    }

    @Test
    @DisplayName("SVC-012: Unknown block, transaction and institution lookups fail")
    void unknownLookups() {
        assertThatThrownBy(() -> ledgerService.getBlock(5)).isInstanceOf(BlockNotFoundException.class);
        assertThatThrownBy(() -> ledgerService.getTransaction("0x" + "f".repeat(64)))
                .isInstanceOf(TransactionNotFoundException.class);
        assertThatThrownBy(() -> ledgerService.getInstitution("missing"))
                .isInstanceOf(InstitutionNotFoundException.class);
        assertThatThrownBy(() -> ledgerService.getCertificate("0x" + "f".repeat(64)))
                .isInstanceOf(CertificateNotFoundException.class);
    }

    @Test
    @DisplayName("SVC-013: Certificate hash ignores grade and depends on every identity field")
    void certificateHashIdentity() {
        String base = ledgerService.certificateHash("Ada", "Systems 101", COMPLETED, "inst-1");

        assertThat(ledgerService.certificateHash("Ada", "Systems 101", COMPLETED, "inst-1")).isEqualTo(base);
        assertThat(ledgerService.certificateHash("Ada", "Systems 102", COMPLETED, "inst-1")).isNotEqualTo(base);
        assertThat(ledgerService.certificateHash("Ada", "Systems 101", COMPLETED.plusDays(1), "inst-1")).isNotEqualTo(base);
        assertThat(ledgerService.certificateHash("Ada", "Systems 101", COMPLETED, "inst-2")).isNotEqualTo(base);
    }

    @Test
    @DisplayName("SVC-014: Transactions are listed in sealed order starting at the first block")
    void listTransactionsInOrder() throws Exception {
        InstitutionRegistrationResponse acme = registerAcme();
        CertificateIssueResponse issued = ledgerService.issueCertificate(
                "Ada", "Systems 101", COMPLETED, null, acme.institutionId(), null, null);

        assertThat(ledgerService.listTransactions())
                .extracting(TransactionDTO::getHash)
                .containsExactly(acme.transactionHash(), issued.transactionHash());
        assertThat(ledgerService.listBlocks()).extracting(BlockDTO::getNumber).containsExactly(0L, 1L, 2L);
    }

    @Test
    @DisplayName("SVC-015: A failed institution write leaves the chain where it was")
    void registerStoreFailureDoesNotSeal() {
        doThrow(new DataAccessResourceFailureException("database unavailable"))
                .when(institutionRepository).save(any(Institution.class));

        assertThatThrownBy(this::registerAcme)
                .isInstanceOf(DataAccessResourceFailureException.class);

        assertThat(chain.height()).isZero();
        assertThat(chain.pendingCount()).isZero();
        assertThat(chain.allTransactions()).isEmpty();
        assertThat(institutions).isEmpty();
    }

    @Test
    @DisplayName("SVC-016: A failed certificate write leaves the chain where it was")
    void issueStoreFailureDoesNotSeal() {
        InstitutionRegistrationResponse acme = registerAcme();
        long height = chain.height();
        List<String> sealedBefore = chain.allTransactions().stream()
                .map(ChainTransaction::getHash)
                .toList();
        doThrow(new DataAccessResourceFailureException("database unavailable"))
                .when(certificateRepository).save(any(Certificate.class));

        assertThatThrownBy(() -> ledgerService.issueCertificate(
                "Ada", "Systems 101", COMPLETED, "A", acme.institutionId(), null, null))
                .isInstanceOf(DataAccessResourceFailureException.class);

        assertThat(chain.height()).isEqualTo(height);
        assertThat(chain.pendingCount()).isZero();
        assertThat(chain.allTransactions()).extracting(ChainTransaction::getHash).containsExactlyElementsOf(sealedBefore);
        assertThat(certificates).isEmpty();
    }

    private InstitutionRegistrationResponse registerAcme() {
        return ledgerService.registerInstitution("Acme U", "1 Main St", "registrar@acme.edu", null);
    }

    private List<Certificate> sortedCertificates(String institutionId) {
        return certificates.values().stream()
                .filter(certificate -> institutionId == null || institutionId.equals(certificate.getInstitutionId()))
                .sorted(Comparator.comparing(Certificate::getIssuedAt).thenComparing(Certificate::getCertificateHash))
                .toList();
    }

    private List<CertificateRepository.InstitutionCertificateCount> groupedCounts() {
        Map<String, Long> counts = certificates.values().stream()
                .collect(Collectors.groupingBy(Certificate::getInstitutionId, Collectors.counting()));
        return counts.entrySet().stream()
                .map(entry -> (CertificateRepository.InstitutionCertificateCount) new CertificateRepository.InstitutionCertificateCount() {
                    @Override
                    public String getInstitutionId() {
                        return entry.getKey();
                    }

                    @Override
                    public Long getTotal() {
                        return entry.getValue();
                    }
                })
                .toList();
    }
}
