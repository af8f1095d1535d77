package com.taxengine.rule;

import com.taxengine.contract.ErrorType;
import com.taxengine.contract.RuleEngineException;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * A validated progressive schedule.
 *
 * Bands are evaluated as marginal slices in ascending {@code bracket_order}. Two
 * bands are contiguous when the next minimum is at most one unit above the previous
 * maximum (the "500,001 after 500,000" convention); the slice of such a band starts
 * at the previous maximum so the schedule has no holes. A declared {@code fixed_amount}
 * states the tax accrued on entering its band; it is checked against the cumulative tax
 * of the bands below but never replaces it, so the schedule stays continuous and
 * non-decreasing at every boundary.
 */
public final class BracketSchedule {

    static final String STEP = "bracket_validation";

    private static final BigDecimal CONTIGUITY_GAP = BigDecimal.ONE;
    private static final BigDecimal FIXED_AMOUNT_TOLERANCE = BigDecimal.ONE;

    private final List<TaxBracket> brackets;
    private final List<BigDecimal> lowerBounds;

    private BracketSchedule(List<TaxBracket> brackets, List<BigDecimal> lowerBounds) {
        this.brackets = brackets;
        this.lowerBounds = lowerBounds;
    }

    /**
     * Validates ordering, contiguity, rates and fixed amounts.
     *
     * @throws RuleEngineException with {@link ErrorType#RULE_VALIDATION_FAILED} when the set is malformed
     */
    public static BracketSchedule of(List<TaxBracket> raw) {
        if (raw == null || raw.isEmpty()) {
            throw invalid("bracket set is empty");
        }
        Set<Integer> orders = new HashSet<>();
        for (TaxBracket bracket : raw) {
            if (!orders.add(bracket.bracketOrder())) {
                throw invalid("duplicate bracket_order " + bracket.bracketOrder());
            }
        }
        List<TaxBracket> sorted = raw.stream()
            .sorted(Comparator.comparingInt(TaxBracket::bracketOrder))
            .toList();

        List<BigDecimal> lowers = new ArrayList<>();
        BigDecimal cumulative = BigDecimal.ZERO;
        TaxBracket previous = null;
        for (int i = 0; i < sorted.size(); i++) {
            TaxBracket bracket = sorted.get(i);
            int order = bracket.bracketOrder();
            if (bracket.minIncome() == null || bracket.minIncome().signum() < 0) {
                throw invalid("bracket " + order + " needs a non-negative min_income");
            }
            if (bracket.rate() == null || bracket.rate().signum() < 0 || bracket.rate().compareTo(BigDecimal.ONE) > 0) {
                throw invalid("bracket " + order + " rate must be a fraction between 0 and 1");
            }
            if (bracket.fixedAmount().signum() < 0) {
                throw invalid("bracket " + order + " fixed_amount must not be negative");
            }
            if (bracket.isOpenEnded() && i < sorted.size() - 1) {
                throw invalid("only the last bracket may be open-ended, bracket " + order + " is not last");
            }
            if (!bracket.isOpenEnded() && bracket.maxIncome().compareTo(bracket.minIncome()) < 0) {
                throw invalid("bracket " + order + " has max_income below min_income");
            }

            BigDecimal lower = bracket.minIncome();
            if (previous != null) {
                BigDecimal gap = bracket.minIncome().subtract(previous.maxIncome());
                if (gap.signum() < 0) {
                    throw invalid("brackets " + previous.bracketOrder() + " and " + order + " overlap");
                }
                if (gap.compareTo(CONTIGUITY_GAP) > 0) {
                    throw invalid("gap between brackets " + previous.bracketOrder() + " and " + order);
                }
                lower = previous.maxIncome();
            }
            if (bracket.fixedAmount().signum() > 0
                && bracket.fixedAmount().subtract(cumulative).abs().compareTo(FIXED_AMOUNT_TOLERANCE) > 0) {
                throw invalid("bracket " + order + " fixed_amount " + bracket.fixedAmount().toPlainString()
                    + " does not match the tax accrued below it (" + Numbers.currency(cumulative).toPlainString() + ")");
            }
            lowers.add(lower);
            if (!bracket.isOpenEnded()) {
                cumulative = cumulative.add(bracket.maxIncome().subtract(lower).multiply(bracket.rate(), Numbers.MATH));
            }
            previous = bracket;
        }
        return new BracketSchedule(sorted, List.copyOf(lowers));
    }

    public List<TaxBracket> brackets() {
        return brackets;
    }

    /**
     * Tax on {@code income}. Only bands with a non-zero contribution are reported.
     */
    public Evaluation evaluate(BigDecimal income) {
        List<Contribution> contributions = new ArrayList<>();
        if (income == null || income.signum() <= 0) {
            return new Evaluation(BigDecimal.ZERO, contributions);
        }
        BigDecimal cumulative = BigDecimal.ZERO;
        for (int i = 0; i < brackets.size(); i++) {
            TaxBracket bracket = brackets.get(i);
            BigDecimal lower = lowerBounds.get(i);
            if (income.compareTo(lower) <= 0) {
                break;
            }
            boolean containsIncome = bracket.isOpenEnded() || income.compareTo(bracket.maxIncome()) <= 0;
            BigDecimal upper = containsIncome ? income : bracket.maxIncome();
            BigDecimal slice = upper.subtract(lower).max(BigDecimal.ZERO);
            BigDecimal amount = slice.multiply(bracket.rate(), Numbers.MATH);

            if (amount.signum() != 0) {
                contributions.add(new Contribution(bracket.bracketOrder(), lower, upper, slice,
                    bracket.rate(), amount));
            }
            cumulative = cumulative.add(amount);
            if (containsIncome) {
                break;
            }
        }
        return new Evaluation(cumulative, contributions);
    }

    private static RuleEngineException invalid(String message) {
        return new RuleEngineException(ErrorType.RULE_VALIDATION_FAILED, STEP, message);
    }

    public record Evaluation(BigDecimal total, List<Contribution> contributions) {
        public Evaluation {
            contributions = List.copyOf(contributions);
        }
    }

    /** One band's share of the tax. */
    public record Contribution(int bracketOrder, BigDecimal lowerBound, BigDecimal upperBound,
                               BigDecimal taxableSlice, BigDecimal rate, BigDecimal amount) {
    }
}
