package com.nosota.certledger.repository;

import com.nosota.certledger.model.Certificate;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface CertificateRepository extends JpaRepository<Certificate, String> {

    List<Certificate> findAllByOrderByIssuedAtAscCertificateHashAsc();

    List<Certificate> findAllByInstitutionIdOrderByIssuedAtAscCertificateHashAsc(String institutionId);

    long countByInstitutionId(String institutionId);

    /**
     * Counts issued certificates per institution in one query.
     *
     * @return one row per institution that issued at least one certificate
     */
    @Query("SELECT c.institutionId AS institutionId, COUNT(c) AS total FROM Certificate c GROUP BY c.institutionId")
    List<InstitutionCertificateCount> countGroupedByInstitution();

    interface InstitutionCertificateCount {
        String getInstitutionId();

        Long getTotal();
    }
}
