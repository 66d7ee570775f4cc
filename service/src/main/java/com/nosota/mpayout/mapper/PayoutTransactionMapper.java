package com.nosota.mpayout.mapper;

import com.nosota.mpayout.api.dto.PayoutTransactionDTO;
import com.nosota.mpayout.api.response.PayoutTransferResponse;
import com.nosota.mpayout.api.response.ReconciliationResponse;
import com.nosota.mpayout.dto.ReconciliationSummary;
import com.nosota.mpayout.model.PayoutTransaction;
import com.nosota.mpayout.service.AccountMasking;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.factory.Mappers;

import java.util.List;

/**
 * MapStruct mapper from PayoutTransaction to its API views. The account number never leaves the
 * service unmasked.
 */
@Mapper(imports = AccountMasking.class)
public interface PayoutTransactionMapper {

    PayoutTransactionMapper INSTANCE = Mappers.getMapper(PayoutTransactionMapper.class);

    @Mapping(target = "maskedAccountNumber", expression = "java(AccountMasking.mask(transaction.getAccountNumber()))")
    PayoutTransactionDTO toDTO(PayoutTransaction transaction);

    List<PayoutTransactionDTO> toDTOList(List<PayoutTransaction> transactions);

    @Mapping(target = "transactionId", source = "transaction.id")
    @Mapping(target = "maskedAccountNumber", expression = "java(AccountMasking.mask(transaction.getAccountNumber()))")
    @Mapping(target = "message", source = "message")
    PayoutTransferResponse toTransferResponse(PayoutTransaction transaction, String message);

    ReconciliationResponse toResponse(ReconciliationSummary summary);
}
