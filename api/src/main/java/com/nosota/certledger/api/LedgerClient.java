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
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.ResponseEntity;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.List;

/**
 * WebClient-based implementation of LedgerApi for consuming the certificate ledger service.
 *
 * <p><b>IMPORTANT:</b> This client is NOT a Spring @Component. Consuming services must
 * manually register it as a bean in their configuration.
 *
 * <p>Configuration example:
 * <pre>
 * {@code
 * @Configuration
 * public class CertLedgerClientConfig {
 *     @Bean
 *     public WebClient certLedgerWebClient(WebClient.Builder builder,
 *                                          @Value("${services.certledger.url}") String baseUrl) {
 *         return builder.baseUrl(baseUrl).build();
 *     }
 *
 *     @Bean
 *     public LedgerClient ledgerClient(WebClient certLedgerWebClient) {
 *         return new LedgerClient(certLedgerWebClient);
 *     }
 * }
 * }
 * </pre>
 */
@RequiredArgsConstructor
@Slf4j
public class LedgerClient implements LedgerApi {

    private static final String BASE_PATH = "/api/v1/ledger";

    private final WebClient webClient;

    @Override
    public ResponseEntity<InstitutionRegistrationResponse> registerInstitution(RegisterInstitutionRequest request) {
        log.debug("Calling registerInstitution: name={}", request.name());

        return webClient.post()
                .uri(BASE_PATH + "/institutions")
                .bodyValue(request)
                .retrieve()
                .toEntity(InstitutionRegistrationResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<List<InstitutionDTO>> listInstitutions() {
        log.debug("Calling listInstitutions");

        return webClient.get()
                .uri(BASE_PATH + "/institutions")
                .retrieve()
                .toEntity(new ParameterizedTypeReference<List<InstitutionDTO>>() {})
                .block();
    }

    @Override
    public ResponseEntity<InstitutionDTO> getInstitution(String institutionId) {
        log.debug("Calling getInstitution: institutionId={}", institutionId);

        return webClient.get()
                .uri(BASE_PATH + "/institutions/{institutionId}", institutionId)
                .retrieve()
                .toEntity(InstitutionDTO.class)
                .block();
    }

    @Override
    public ResponseEntity<CertificateIssueResponse> issueCertificate(IssueCertificateRequest request) {
        log.debug("Calling issueCertificate: institutionId={}, courseName={}",
                request.institutionId(), request.courseName());

        return webClient.post()
                .uri(BASE_PATH + "/certificates")
                .bodyValue(request)
                .retrieve()
                .toEntity(CertificateIssueResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<List<CertificateDTO>> listCertificates(String institutionId) {
        log.debug("Calling listCertificates: institutionId={}", institutionId);

        return webClient.get()
                .uri(uriBuilder -> {
                    uriBuilder.path(BASE_PATH + "/certificates");
                    if (institutionId != null) {
                        uriBuilder.queryParam("institutionId", institutionId);
                    }
                    return uriBuilder.build();
                })
                .retrieve()
                .toEntity(new ParameterizedTypeReference<List<CertificateDTO>>() {})
                .block();
    }

    @Override
    public ResponseEntity<CertificateDTO> getCertificate(String certificateHash) {
        log.debug("Calling getCertificate: certificateHash={}", certificateHash);

        return webClient.get()
                .uri(BASE_PATH + "/certificates/{certificateHash}", certificateHash)
                .retrieve()
                .toEntity(CertificateDTO.class)
                .block();
    }

    @Override
    public ResponseEntity<CertificateVerificationResponse> verifyCertificate(String certificateHash,
                                                                             String verifierAddress) {
        log.debug("Calling verifyCertificate: certificateHash={}, verifierAddress={}",
                certificateHash, verifierAddress);

        return webClient.post()
                .uri(uriBuilder -> {
                    uriBuilder.path(BASE_PATH + "/certificates/{certificateHash}/verify");
                    if (verifierAddress != null) {
                        uriBuilder.queryParam("verifierAddress", verifierAddress);
                    }
                    return uriBuilder.build(certificateHash);
                })
                .retrieve()
                .toEntity(CertificateVerificationResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<List<BlockDTO>> listBlocks() {
        log.debug("Calling listBlocks");

        return webClient.get()
                .uri(BASE_PATH + "/blocks")
                .retrieve()
                .toEntity(new ParameterizedTypeReference<List<BlockDTO>>() {})
                .block();
    }

    @Override
    public ResponseEntity<BlockDTO> getLatestBlock() {
        log.debug("Calling getLatestBlock");

        return webClient.get()
                .uri(BASE_PATH + "/blocks/latest")
                .retrieve()
                .toEntity(BlockDTO.class)
                .block();
    }

    @Override
    public ResponseEntity<BlockDTO> getBlock(Long blockNumber) {
        log.debug("Calling getBlock: blockNumber={}", blockNumber);

        return webClient.get()
                .uri(BASE_PATH + "/blocks/{blockNumber}", blockNumber)
                .retrieve()
                .toEntity(BlockDTO.class)
                .block();
    }

    @Override
    public ResponseEntity<List<TransactionDTO>> listTransactions() {
        log.debug("Calling listTransactions");

        return webClient.get()
                .uri(BASE_PATH + "/transactions")
                .retrieve()
                .toEntity(new ParameterizedTypeReference<List<TransactionDTO>>() {})
                .block();
    }

    @Override
    public ResponseEntity<TransactionDTO> getTransaction(String transactionHash) {
        log.debug("Calling getTransaction: transactionHash={}", transactionHash);

        return webClient.get()
                .uri(BASE_PATH + "/transactions/{transactionHash}", transactionHash)
                .retrieve()
                .toEntity(TransactionDTO.class)
                .block();
    }

    @Override
    public ResponseEntity<LedgerStatsResponse> getStats() {
        log.debug("Calling getStats");

        return webClient.get()
                .uri(BASE_PATH + "/stats")
                .retrieve()
                .toEntity(LedgerStatsResponse.class)
                .block();
    }
}
