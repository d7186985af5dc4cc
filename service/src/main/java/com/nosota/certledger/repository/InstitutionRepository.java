package com.nosota.certledger.repository;

import com.nosota.certledger.model.Institution;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface InstitutionRepository extends JpaRepository<Institution, String> {

    List<Institution> findAllByOrderByRegisteredAtAscInstitutionIdAsc();
}
