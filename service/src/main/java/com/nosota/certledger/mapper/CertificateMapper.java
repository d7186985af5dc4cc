package com.nosota.certledger.mapper;

import com.nosota.certledger.api.dto.CertificateDTO;
import com.nosota.certledger.model.Certificate;
import org.mapstruct.Mapper;
import org.mapstruct.factory.Mappers;

import java.util.List;

@Mapper
public interface CertificateMapper {

    CertificateMapper INSTANCE = Mappers.getMapper(CertificateMapper.class);

    CertificateDTO toDTO(Certificate certificate);

    List<CertificateDTO> toDTOList(List<Certificate> certificates);
}
