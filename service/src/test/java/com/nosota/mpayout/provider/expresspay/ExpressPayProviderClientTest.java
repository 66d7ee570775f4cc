package com.nosota.mpayout.provider.expresspay;

import com.nosota.mpayout.api.model.TransferMode;
import com.nosota.mpayout.error.ProviderUnavailableException;
import com.nosota.mpayout.provider.AccountVerification;
import com.nosota.mpayout.provider.ProviderBank;
import com.nosota.mpayout.provider.ProviderFloatBalance;
import com.nosota.mpayout.provider.ProviderStatus;
import com.nosota.mpayout.provider.ProviderTransferRequest;
import com.nosota.mpayout.provider.StatusCheckResult;
import com.nosota.mpayout.provider.TransferOutcome;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;
import java.net.ConnectException;
import java.net.URI;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExpressPayProviderClientTest {

    private final AtomicReference<ClientRequest> lastRequest = new AtomicReference<>();

    private ExpressPayProviderClient client(ExchangeFunction exchange, long timeoutMs) {
        ExchangeFunction recording = request -> {
            lastRequest.set(request);
            return exchange.exchange(request);
        };
        WebClient webClient = WebClient.builder()
                .baseUrl("http://provider.test/api/fzep/payout")
                .exchangeFunction(recording)
                .build();
        return new ExpressPayProviderClient(webClient, timeoutMs, "");
    }

    private ExpressPayProviderClient respondingWith(HttpStatus status, String json) {
        return client(request -> Mono.just(ClientResponse.create(status)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .body(json)
                .build()), 2000);
    }

    private static ProviderTransferRequest transfer() {
        return new ProviderTransferRequest("123456789012", "SBIN0001234", "Asha Rao", new BigDecimal("500.00"),
                TransferMode.IMPS, 7, "State Bank of India", "9123456780", "Kiran Stores", "9876543210",
                null, "Payout", "PAY-42-1-ABC123");
    }

    @Nested
    @DisplayName("initiate transfer")
    class Initiate {

        @Test
        @DisplayName("status 2 is accepted as SUCCESS with provider id and reference")
        void success() {
            TransferOutcome outcome = respondingWith(HttpStatus.OK, """
                    {"success":true,"status":200,"message":"Transaction processed",
                     "data":{"clientReqId":"PAY-42-1-ABC123","transaction_id":"EP1001","referenceNo":"RRN55",
                             "status":"2","remark":"credited"}}
                    """).initiateTransfer(transfer());

            assertThat(outcome.kind()).isEqualTo(TransferOutcome.Kind.ACCEPTED);
            assertThat(outcome.status()).isEqualTo(ProviderStatus.SUCCESS);
            assertThat(outcome.providerTransactionId()).isEqualTo("EP1001");
            assertThat(outcome.referenceNumber()).isEqualTo("RRN55");
            assertThat(lastRequest.get().method()).isEqualTo(HttpMethod.POST);
            assertThat(lastRequest.get().url().getPath()).endsWith("/expressPay2");
        }

        @Test
        @DisplayName("status 1 is accepted as PENDING")
        void pending() {
            TransferOutcome outcome = respondingWith(HttpStatus.OK, """
                    {"success":true,"data":{"transaction_id":"EP1002","status":"1"}}
                    """).initiateTransfer(transfer());

            assertThat(outcome.kind()).isEqualTo(TransferOutcome.Kind.ACCEPTED);
            assertThat(outcome.status()).isEqualTo(ProviderStatus.PENDING);
        }

        @Test
        @DisplayName("status 0 is a rejection carrying the provider remark")
        void failedStatus() {
            TransferOutcome outcome = respondingWith(HttpStatus.OK, """
                    {"success":true,"data":{"transaction_id":"EP1003","status":"0","remark":"Invalid account"}}
                    """).initiateTransfer(transfer());

            assertThat(outcome.kind()).isEqualTo(TransferOutcome.Kind.REJECTED);
            assertThat(outcome.message()).isEqualTo("Invalid account");
        }

        @Test
        @DisplayName("success=false is a rejection")
        void unsuccessful() {
            TransferOutcome outcome = respondingWith(HttpStatus.OK, """
                    {"success":false,"status":400,"message":"Insufficient balance in partner account"}
                    """).initiateTransfer(transfer());

            assertThat(outcome.kind()).isEqualTo(TransferOutcome.Kind.REJECTED);
            assertThat(outcome.message()).isEqualTo("Insufficient balance in partner account");
        }

        @Test
        @DisplayName("HTTP 400 is a rejection")
        void badRequest() {
            TransferOutcome outcome = respondingWith(HttpStatus.BAD_REQUEST, "{\"success\":false}")
                    .initiateTransfer(transfer());

            assertThat(outcome.kind()).isEqualTo(TransferOutcome.Kind.REJECTED);
        }

        @Test
        @DisplayName("HTTP 504 is a timeout")
        void gatewayTimeout() {
            TransferOutcome outcome = respondingWith(HttpStatus.GATEWAY_TIMEOUT, "{}")
                    .initiateTransfer(transfer());

            assertThat(outcome.kind()).isEqualTo(TransferOutcome.Kind.TIMEOUT);
        }

        @Test
        @DisplayName("HTTP 500 and 502 leave the outcome unknown")
        void serverErrors() {
            TransferOutcome internal = respondingWith(HttpStatus.INTERNAL_SERVER_ERROR, "{}")
                    .initiateTransfer(transfer());
            TransferOutcome badGateway = respondingWith(HttpStatus.BAD_GATEWAY, "<html>bad gateway</html>")
                    .initiateTransfer(transfer());

            assertThat(internal.kind()).isEqualTo(TransferOutcome.Kind.TIMEOUT);
            assertThat(internal.message()).isEqualTo("Provider returned HTTP 500");
            assertThat(badGateway.kind()).isEqualTo(TransferOutcome.Kind.TIMEOUT);
            assertThat(badGateway.message()).isEqualTo("Provider returned HTTP 502");
        }

        @Test
        @DisplayName("no answer within the budget is a timeout")
        void noAnswer() {
            TransferOutcome outcome = client(request -> Mono.never(), 100).initiateTransfer(transfer());

            assertThat(outcome.kind()).isEqualTo(TransferOutcome.Kind.TIMEOUT);
            assertThat(outcome.message()).isEqualTo("Request timeout after 100ms");
        }

        @Test
        @DisplayName("refused connection is a rejection")
        void connectionRefused() {
            TransferOutcome outcome = client(request -> Mono.error(new WebClientRequestException(
                    new ConnectException("Connection refused"), HttpMethod.POST,
                    URI.create("http://provider.test/expressPay2"), HttpHeaders.EMPTY)), 2000)
                    .initiateTransfer(transfer());

            assertThat(outcome.kind()).isEqualTo(TransferOutcome.Kind.REJECTED);
        }
    }

    @Test
    void statusCheckMapsCodeAndOperatorReference() {
        StatusCheckResult result = respondingWith(HttpStatus.OK, """
                {"success":true,"data":{"status":"2","msg":"Success","opid":"UTR777"}}
                """).getStatus("EP1001");

        assertThat(result.ok()).isTrue();
        assertThat(result.status()).isEqualTo(ProviderStatus.SUCCESS);
        assertThat(result.operatorReference()).isEqualTo("UTR777");
        assertThat(lastRequest.get().url().getQuery()).isEqualTo("transaction_id=EP1001");
    }

    @Test
    void statusCheckErrorIsReportedNotThrown() {
        StatusCheckResult result = respondingWith(HttpStatus.BAD_GATEWAY, "{}").getStatus("EP1001");

        assertThat(result.ok()).isFalse();
        assertThat(result.status()).isNull();
    }

    @Test
    void floatBalance() throws Exception {
        ProviderFloatBalance balance = respondingWith(HttpStatus.OK, """
                {"success":true,"data":{"balance":25000.50,"lien":500}}
                """).getFloatBalance();

        assertThat(balance.available()).isEqualByComparingTo("24500.50");
    }

    @Test
    void floatBalanceFailureThrows() {
        assertThatThrownBy(() -> respondingWith(HttpStatus.OK, "{\"success\":false,\"message\":\"Unauthorized\"}")
                .getFloatBalance())
                .isInstanceOf(ProviderUnavailableException.class)
                .hasMessageContaining("Unauthorized");
    }

    @Test
    void bankListMapsCapabilities() throws Exception {
        List<ProviderBank> banks = respondingWith(HttpStatus.OK, """
                {"success":true,"data":[
                  {"id":1,"bankName":"State Bank of India","code":"SBIN","ifsc":"SBIN","isIMPS":true,"isNEFT":true,"isPopular":true},
                  {"id":2,"bankName":"Karur Vysya Bank","code":"KVBL","ifsc":"KVBL","isIMPS":true}
                ]}
                """).listBanks();

        assertThat(banks).containsExactly(
                new ProviderBank(1, "State Bank of India", "SBIN", "SBIN", true, true, true),
                new ProviderBank(2, "Karur Vysya Bank", "KVBL", "KVBL", true, false, false));
    }

    @Nested
    @DisplayName("account verification")
    class VerifyAccount {

        @Test
        @DisplayName("returns holder, bank and branch of a valid account")
        void verified() {
            AccountVerification result = respondingWith(HttpStatus.OK, """
                    {"success":true,"status":200,
                     "data":{"accountHolderName":"ASHA RAO","bankName":"State Bank of India","branchName":"MG Road",
                             "isValid":true,"transactionId":"AV77"}}
                    """).verifyAccount("123456789012", "SBIN0001234", null);

            assertThat(result.verified()).isTrue();
            assertThat(result.accountHolderName()).isEqualTo("ASHA RAO");
            assertThat(result.branchName()).isEqualTo("MG Road");
            assertThat(result.providerReference()).isEqualTo("AV77");
            assertThat(lastRequest.get().method()).isEqualTo(HttpMethod.POST);
            assertThat(lastRequest.get().url().getPath()).isEqualTo("/api/fzep/payout/accountVerify");
        }

        @Test
        @DisplayName("falls back to the requested bank name and N/A")
        void missingDetails() {
            AccountVerification result = respondingWith(HttpStatus.OK, """
                    {"success":true,"data":{"isValid":true}}
                    """).verifyAccount("123456789012", "SBIN0001234", "SBI");

            assertThat(result.verified()).isTrue();
            assertThat(result.accountHolderName()).isEqualTo("N/A");
            assertThat(result.bankName()).isEqualTo("SBI");
        }

        @Test
        @DisplayName("isValid false is a failed verification")
        void invalidAccount() {
            AccountVerification result = respondingWith(HttpStatus.OK, """
                    {"success":true,"data":{"isValid":false}}
                    """).verifyAccount("123456789012", "SBIN0001234", null);

            assertThat(result.verified()).isFalse();
        }

        @Test
        @DisplayName("provider message is passed through when unsuccessful")
        void unsuccessful() {
            AccountVerification result = respondingWith(HttpStatus.OK,
                    "{\"success\":false,\"message\":\"Invalid IFSC\"}")
                    .verifyAccount("123456789012", "SBIN0001234", null);

            assertThat(result.verified()).isFalse();
            assertThat(result.message()).isEqualTo("Invalid IFSC");
        }

        @Test
        @DisplayName("transport errors are reported, not thrown")
        void serverError() {
            AccountVerification result = respondingWith(HttpStatus.BAD_GATEWAY, "{}")
                    .verifyAccount("123456789012", "SBIN0001234", null);

            assertThat(result.verified()).isFalse();
            assertThat(result.message()).startsWith("Account verification failed");
        }
    }

    @Test
    void apiRequestIdIsSixteenDigits() {
        assertThat(ExpressPayProviderClient.generateApiRequestId()).matches("[1-9]\\d{15}");
    }
}
