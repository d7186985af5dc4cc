package com.nosota.certledger.controller;

import com.nosota.certledger.api.LedgerApi;
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
import com.nosota.certledger.service.LedgerService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@Validated
@RequiredArgsConstructor
@Slf4j
public class LedgerController implements LedgerApi {

    private final LedgerService ledgerService;

    @Override
    public ResponseEntity<InstitutionRegistrationResponse> registerInstitution(RegisterInstitutionRequest request) {
        InstitutionRegistrationResponse response = ledgerService.registerInstitution(
                request.name(), request.contactAddress(), request.email(), request.gasLimit());
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @Override
    public ResponseEntity<List<InstitutionDTO>> listInstitutions() {
        return ResponseEntity.ok(ledgerService.listInstitutions());
    }

    @Override
    public ResponseEntity<InstitutionDTO> getInstitution(String institutionId) throws Exception {
        return ResponseEntity.ok(ledgerService.getInstitution(institutionId));
    }

    @Override
    public ResponseEntity<CertificateIssueResponse> issueCertificate(IssueCertificateRequest request) throws Exception {
        CertificateIssueResponse response = ledgerService.issueCertificate(
                request.recipientName(),
                request.courseName(),
                request.completionDate(),
                request.grade(),
                request.institutionId(),
                request.issuerWalletAddress(),
                request.gasLimit());
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @Override
    public ResponseEntity<List<CertificateDTO>> listCertificates(String institutionId) {
        return ResponseEntity.ok(ledgerService.listCertificates(institutionId));
    }

    @Override
    public ResponseEntity<CertificateDTO> getCertificate(String certificateHash) throws Exception {
        return ResponseEntity.ok(ledgerService.getCertificate(certificateHash));
    }

    @Override
    public ResponseEntity<CertificateVerificationResponse> verifyCertificate(String certificateHash,
                                                                             String verifierAddress) throws Exception {
        return ResponseEntity.ok(ledgerService.verifyCertificate(certificateHash, verifierAddress));
    }

    @Override
    public ResponseEntity<List<BlockDTO>> listBlocks() {
        return ResponseEntity.ok(ledgerService.listBlocks());
    }

    @Override
    public ResponseEntity<BlockDTO> getLatestBlock() {
        return ResponseEntity.ok(ledgerService.getLatestBlock());
    }

    @Override
    public ResponseEntity<BlockDTO> getBlock(Long blockNumber) throws Exception {
        return ResponseEntity.ok(ledgerService.getBlock(blockNumber));
    }

    @Override
    public ResponseEntity<List<TransactionDTO>> listTransactions() {
        return ResponseEntity.ok(ledgerService.listTransactions());
    }

    @Override
    public ResponseEntity<TransactionDTO> getTransaction(String transactionHash) throws Exception {
        return ResponseEntity.ok(ledgerService.getTransaction(transactionHash));
    }

    @Override
    public ResponseEntity<LedgerStatsResponse> getStats() {
        return ResponseEntity.ok(ledgerService.getStats());
    }
}
