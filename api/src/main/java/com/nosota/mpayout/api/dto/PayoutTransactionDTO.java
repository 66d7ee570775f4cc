package com.nosota.mpayout.api.dto;

import com.nosota.mpayout.api.model.PayoutStatus;
import com.nosota.mpayout.api.model.TransferMode;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
@EqualsAndHashCode
public class PayoutTransactionDTO {
    private UUID id;
    private Long merchantId;
    private String clientRefId;
    private String maskedAccountNumber;
    private String ifscCode;
    private String accountHolderName;
    private String bankName;
    private TransferMode transferMode;
    private BigDecimal amount;
    private BigDecimal charge;
    private BigDecimal totalDebited;
    private String providerTransactionId;
    private String referenceNumber;
    private String schemeName;
    private PayoutStatus status;
    private String failureReason;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
    private LocalDateTime completedAt;
}
