package com.flagship.split_escrow.split;

import com.flagship.split_escrow.common.CurrencyCode;
import com.flagship.split_escrow.exception.CurrencyConservationException;
import com.flagship.split_escrow.exception.ErrorCode;
import com.flagship.split_escrow.exception.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.IntStream;

/**
 * Turns a gross amount and a percentage split into a platform fee and a
 * per-recipient net breakdown.
 *
 * Algorithm:
 * 1. platformFee = round_half_up(gross * 5%), netPool = gross - platformFee
 * 2. every recipient gets floor(netPool * pct / totalPct)
 * 3. the leftover minor units go one each to the recipients with the largest
 *    fractional remainders (Largest Remainder / Hamilton method); ties keep
 *    input order
 *
 * Shares are taken against totalPct, the actual sum of the percentages, not
 * against 100. A split accepted within the 100 ± 0.01 tolerance therefore
 * still hands out the whole net pool, and the leftover in step 3 is always
 * fewer units than there are recipients.
 *
 * The calculator is a pure function: no I/O, no state, deterministic.
 * A result whose net amounts do not add up to the net pool is a defect and
 * raises {@link CurrencyConservationException}.
 */
@Component
@Slf4j
public class SplitCalculator {

    public static final BigDecimal PLATFORM_FEE_PERCENT = new BigDecimal("5");
    public static final BigDecimal SUM_TOLERANCE = new BigDecimal("0.01");

    private static final BigDecimal HUNDRED = new BigDecimal("100");
    private static final int SHARE_SCALE = 12;

    public SplitBreakdown calculate(long grossAmount, CurrencyCode currency, List<RevenueSplit> splits) {
        if (grossAmount <= 0) {
            throw new ValidationException(ErrorCode.INVALID_AMOUNT,
                    "Gross amount must be a positive number of minor units, got " + grossAmount);
        }
        if (currency == null) {
            throw new ValidationException(ErrorCode.INVALID_AMOUNT, "Currency is required");
        }

        List<RevenueSplit> percentageSplits = percentageBearing(splits);
        BigDecimal totalPercentage = validatePercentages(percentageSplits);

        long platformFee = percentOf(grossAmount, PLATFORM_FEE_PERCENT);
        long taxWithheld = 0L;
        long netPool = grossAmount - platformFee - taxWithheld;

        int count = percentageSplits.size();
        long[] net = new long[count];
        BigDecimal[] fractional = new BigDecimal[count];
        long floorSum = 0;

        BigDecimal pool = BigDecimal.valueOf(netPool);
        for (int i = 0; i < count; i++) {
            BigDecimal exact = pool.multiply(percentageSplits.get(i).getPercentage())
                    .divide(totalPercentage, SHARE_SCALE, RoundingMode.HALF_EVEN);
            BigDecimal floor = exact.setScale(0, RoundingMode.FLOOR);
            net[i] = floor.longValueExact();
            fractional[i] = exact.subtract(floor);
            floorSum += net[i];
        }

        long residual = netPool - floorSum;
        List<Integer> byRemainder = IntStream.range(0, count).boxed()
                .sorted(Comparator.comparing((Integer i) -> fractional[i]).reversed())
                .toList();
        for (int rank = 0; rank < residual && rank < count; rank++) {
            net[byRemainder.get(rank)] += 1;
        }

        List<RecipientShare> shares = new ArrayList<>(count);
        long distributed = 0;
        for (int i = 0; i < count; i++) {
            RevenueSplit split = percentageSplits.get(i);
            shares.add(new RecipientShare(
                    i,
                    split.getRecipientId(),
                    split.getPlaceholderLabel(),
                    split.getPercentage(),
                    percentOf(grossAmount, split.getPercentage()),
                    percentOf(platformFee, split.getPercentage()),
                    0L,
                    net[i]
            ));
            distributed += net[i];
        }

        if (distributed != netPool) {
            log.error("CRITICAL currency conservation violated in split calculation: gross={}, currency={}, netPool={}, distributed={}",
                    grossAmount, currency, netPool, distributed);
            throw new CurrencyConservationException(netPool, distributed);
        }

        log.debug("Split calculated: gross={}, currency={}, fee={}, recipients={}, residual={}",
                grossAmount, currency, platformFee, count, residual);

        return new SplitBreakdown(grossAmount, currency, platformFee, taxWithheld, netPool,
                distributed, List.copyOf(shares));
    }

    /**
     * Checks that the percentage-bearing entries form a valid model and
     * returns their total.
     *
     * @throws ValidationException PERCENTAGE_MODEL_REQUIRED or SPLIT_SUM_INVALID
     */
    public BigDecimal validatePercentages(List<RevenueSplit> splits) {
        List<RevenueSplit> percentageSplits = percentageBearing(splits);
        if (percentageSplits.isEmpty()) {
            throw new ValidationException(ErrorCode.PERCENTAGE_MODEL_REQUIRED,
                    "At least one split must carry a percentage");
        }

        BigDecimal total = BigDecimal.ZERO;
        for (RevenueSplit split : percentageSplits) {
            BigDecimal pct = split.getPercentage();
            if (pct.signum() < 0 || pct.compareTo(HUNDRED) > 0) {
                throw new ValidationException(ErrorCode.SPLIT_SUM_INVALID,
                        "Split percentage must be between 0 and 100, got " + pct.toPlainString());
            }
            total = total.add(pct);
        }

        if (total.subtract(HUNDRED).abs().compareTo(SUM_TOLERANCE) > 0) {
            throw new ValidationException(ErrorCode.SPLIT_SUM_INVALID,
                    "Split percentages must sum to 100 (±0.01), got " + total.toPlainString());
        }
        return total;
    }

    private static List<RevenueSplit> percentageBearing(List<RevenueSplit> splits) {
        if (splits == null) {
            return List.of();
        }
        return splits.stream().filter(RevenueSplit::hasPercentage).toList();
    }

    private static long percentOf(long amount, BigDecimal percentage) {
        return BigDecimal.valueOf(amount)
                .multiply(percentage)
                .divide(HUNDRED)
                .setScale(0, RoundingMode.HALF_UP)
                .longValueExact();
    }
}
