package com.nosota.certledger.mapper;

import com.nosota.certledger.api.dto.InstitutionDTO;
import com.nosota.certledger.model.Institution;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.factory.Mappers;

/**
 * MapStruct mapper for Institution entity to InstitutionDTO conversion.
 *
 * <p>certificatesIssued is derived from the certificate table, so callers set it after mapping.
 */
@Mapper
public interface InstitutionMapper {

    InstitutionMapper INSTANCE = Mappers.getMapper(InstitutionMapper.class);

    @Mapping(target = "certificatesIssued", ignore = true)
    InstitutionDTO toDTO(Institution institution);
}
