package com.nosota.mpayout.service;

import com.nosota.mpayout.api.request.AccountVerificationRequest;
import com.nosota.mpayout.api.request.PayoutTransferRequest;
import com.nosota.mpayout.error.PayoutValidationException;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Validates and normalizes transfer requests. Rules run in a fixed order and the first failure is reported:
 * <ol>
 *   <li>required fields: account number, IFSC, beneficiary name, amount, transfer mode</li>
 *   <li>bank id and bank name</li>
 *   <li>beneficiary mobile, sender name, sender mobile</li>
 *   <li>mobile format (10 digits starting with 6-9)</li>
 *   <li>account number (9-18 digits) and IFSC format</li>
 *   <li>amount: positive, at most 2 decimals, within configured limits</li>
 * </ol>
 * Account verification requests only go through the account number and IFSC rules.
 */
@Component
public class PayoutRequestValidator {

    private static final Pattern MOBILE = Pattern.compile("^[6-9]\\d{9}$");
    private static final Pattern ACCOUNT_NUMBER = Pattern.compile("^\\d{9,18}$");
    private static final Pattern IFSC = Pattern.compile("^[A-Z]{4}0[A-Z0-9]{6}$");
    private static final Pattern SEPARATORS = Pattern.compile("[\\s-]");

    @Value("${payout.limits.min-amount:100}")
    private BigDecimal minAmount;

    @Value("${payout.limits.max-amount:200000}")
    private BigDecimal maxAmount;

    /**
     * @return the request with trimmed text, IFSC upper-cased and separators removed from numbers
     * @throws PayoutValidationException on the first failing rule
     */
    public PayoutTransferRequest validate(PayoutTransferRequest request) throws PayoutValidationException {
        if (request == null) {
            throw new PayoutValidationException("request", "Request body is required");
        }

        String accountNumber = digits(request.accountNumber());
        String ifsc = trim(request.ifscCode());
        String holderName = trim(request.accountHolderName());
        if (isBlank(accountNumber) || isBlank(ifsc) || isBlank(holderName)
                || request.amount() == null || request.transferMode() == null) {
            throw new PayoutValidationException(firstMissing(accountNumber, ifsc, holderName, request),
                    "Missing required fields: accountNumber, ifscCode, accountHolderName, amount, transferMode");
        }

        String bankName = trim(request.bankName());
        if (request.bankId() == null || isBlank(bankName)) {
            throw new PayoutValidationException("bankId", "Bank ID and bank name are required");
        }

        String beneficiaryMobile = digits(request.beneficiaryMobile());
        if (isBlank(beneficiaryMobile)) {
            throw new PayoutValidationException("beneficiaryMobile", "Beneficiary mobile number is required");
        }
        String senderName = trim(request.senderName());
        if (isBlank(senderName)) {
            throw new PayoutValidationException("senderName", "Sender name is required");
        }
        String senderMobile = digits(request.senderMobile());
        if (isBlank(senderMobile)) {
            throw new PayoutValidationException("senderMobile", "Sender mobile number is required");
        }

        if (!MOBILE.matcher(beneficiaryMobile).matches()) {
            throw new PayoutValidationException("beneficiaryMobile",
                    "Invalid beneficiary mobile number. Must be 10 digits starting with 6-9");
        }
        if (!MOBILE.matcher(senderMobile).matches()) {
            throw new PayoutValidationException("senderMobile",
                    "Invalid sender mobile number. Must be 10 digits starting with 6-9");
        }

        if (!ACCOUNT_NUMBER.matcher(accountNumber).matches()) {
            throw new PayoutValidationException("accountNumber", "Account number must be 9-18 digits");
        }
        ifsc = ifsc.toUpperCase(Locale.ROOT);
        if (!IFSC.matcher(ifsc).matches()) {
            throw new PayoutValidationException("ifscCode", "Invalid IFSC code format");
        }

        BigDecimal amount = request.amount();
        if (amount.signum() <= 0) {
            throw new PayoutValidationException("amount", "Amount must be greater than 0");
        }
        if (amount.stripTrailingZeros().scale() > 2) {
            throw new PayoutValidationException("amount", "Amount must have at most 2 decimal places");
        }
        if (amount.compareTo(minAmount) < 0) {
            throw new PayoutValidationException("amount", "Minimum transfer amount is ₹" + minAmount.toPlainString());
        }
        if (amount.compareTo(maxAmount) > 0) {
            throw new PayoutValidationException("amount", "Maximum transfer amount is ₹" + maxAmount.toPlainString());
        }

        String clientRefId = trim(request.clientRefId());
        if (clientRefId != null && (clientRefId.isEmpty() || clientRefId.length() > 64)) {
            throw new PayoutValidationException("clientRefId", "Client reference id must be 1-64 characters");
        }

        return new PayoutTransferRequest(
                accountNumber,
                ifsc,
                holderName,
                request.bankId(),
                bankName,
                beneficiaryMobile,
                senderName,
                senderMobile,
                trim(request.senderEmail()),
                amount.setScale(2),
                request.transferMode(),
                trim(request.remarks()),
                clientRefId);
    }

    /**
     * @return the request with separators removed from the account number, IFSC upper-cased and blank bank name dropped
     */
    public AccountVerificationRequest validate(AccountVerificationRequest request) throws PayoutValidationException {
        if (request == null) {
            throw new PayoutValidationException("request", "Request body is required");
        }

        String accountNumber = digits(request.accountNumber());
        String ifsc = trim(request.ifscCode());
        if (isBlank(accountNumber) || isBlank(ifsc)) {
            throw new PayoutValidationException(isBlank(accountNumber) ? "accountNumber" : "ifscCode",
                    "Account number and IFSC code are required");
        }
        if (!ACCOUNT_NUMBER.matcher(accountNumber).matches()) {
            throw new PayoutValidationException("accountNumber", "Invalid account number. Must be 9-18 digits only");
        }
        ifsc = SEPARATORS.matcher(ifsc).replaceAll("").toUpperCase(Locale.ROOT);
        if (!IFSC.matcher(ifsc).matches()) {
            throw new PayoutValidationException("ifscCode", "Invalid IFSC code format. Expected format: ABCD0123456");
        }

        String bankName = trim(request.bankName());
        return new AccountVerificationRequest(accountNumber, ifsc, isBlank(bankName) ? null : bankName);
    }

    private static String firstMissing(String accountNumber, String ifsc, String holderName,
                                       PayoutTransferRequest request) {
        if (isBlank(accountNumber)) {
            return "accountNumber";
        }
        if (isBlank(ifsc)) {
            return "ifscCode";
        }
        if (isBlank(holderName)) {
            return "accountHolderName";
        }
        return request.amount() == null ? "amount" : "transferMode";
    }

    private static String digits(String value) {
        return value == null ? null : SEPARATORS.matcher(value).replaceAll("");
    }

    private static String trim(String value) {
        return value == null ? null : value.trim();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isEmpty();
    }
}
