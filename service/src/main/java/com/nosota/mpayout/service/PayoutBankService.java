package com.nosota.mpayout.service;

import com.nosota.mpayout.api.response.BankResponse;
import com.nosota.mpayout.api.response.ProviderBalanceResponse;
import com.nosota.mpayout.error.ProviderUnavailableException;
import com.nosota.mpayout.provider.PayoutProvider;
import com.nosota.mpayout.provider.ProviderBank;
import com.nosota.mpayout.provider.ProviderFloatBalance;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Read-only provider data: the bank list (cached in memory for {@code payout.provider.bank-cache-hours})
 * and the provider float balance.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PayoutBankService {

    private final PayoutProvider payoutProvider;
    private final Clock clock;

    private final AtomicReference<CachedBanks> cache = new AtomicReference<>();

    @Value("${payout.provider.bank-cache-hours:24}")
    private long cacheHours;

    /**
     * @param search case-insensitive substring of bank name or code, ignored when blank
     */
    public List<BankResponse> listBanks(boolean impsOnly, boolean neftOnly, boolean popularOnly, String search)
            throws ProviderUnavailableException {
        String needle = search == null || search.isBlank() ? null : search.trim().toLowerCase(Locale.ROOT);

        return banks().stream()
                .filter(bank -> !impsOnly || bank.impsEnabled())
                .filter(bank -> !neftOnly || bank.neftEnabled())
                .filter(bank -> !popularOnly || bank.popular())
                .filter(bank -> needle == null || contains(bank.bankName(), needle) || contains(bank.code(), needle))
                .map(bank -> new BankResponse(bank.bankId(), bank.bankName(), bank.code(), bank.ifscPrefix(),
                        bank.impsEnabled(), bank.neftEnabled(), bank.popular()))
                .toList();
    }

    public ProviderBalanceResponse getProviderBalance() throws ProviderUnavailableException {
        ProviderFloatBalance balance = payoutProvider.getFloatBalance();
        return new ProviderBalanceResponse(balance.balance(), balance.lien(), balance.available());
    }

    private List<ProviderBank> banks() throws ProviderUnavailableException {
        Instant now = clock.instant();
        CachedBanks cached = cache.get();
        if (cached != null && cached.loadedAt().plus(Duration.ofHours(cacheHours)).isAfter(now)) {
            return cached.banks();
        }

        List<ProviderBank> banks = payoutProvider.listBanks();
        cache.set(new CachedBanks(banks, now));
        log.info("Loaded {} banks from provider", banks.size());
        return banks;
    }

    private static boolean contains(String value, String needle) {
        return value != null && value.toLowerCase(Locale.ROOT).contains(needle);
    }

    private record CachedBanks(List<ProviderBank> banks, Instant loadedAt) {
    }
}
