package com.nosota.certledger.mapper;

import com.nosota.certledger.api.dto.BlockDTO;
import com.nosota.certledger.api.dto.TransactionDTO;
import com.nosota.certledger.chain.Block;
import com.nosota.certledger.chain.ChainTransaction;
import com.nosota.certledger.chain.payload.TransactionPayload;
import org.mapstruct.Mapper;
import org.mapstruct.factory.Mappers;

import java.util.List;
import java.util.Map;

/**
 * MapStruct mapper for in-memory chain objects to their API representation.
 */
@Mapper
public interface ChainMapper {

    ChainMapper INSTANCE = Mappers.getMapper(ChainMapper.class);

    BlockDTO toDTO(Block block);

    List<BlockDTO> toBlockDTOList(List<Block> blocks);

    TransactionDTO toDTO(ChainTransaction transaction);

    List<TransactionDTO> toTransactionDTOList(List<ChainTransaction> transactions);

    /**
     * Payloads are exposed in the same snake_case form that is hashed.
     */
    default Map<String, Object> payloadToMap(TransactionPayload payload) {
        return payload == null ? null : payload.toCanonicalMap();
    }
}
