package com.titiplex.tracker.core.sip;

import com.titiplex.tracker.core.error.ValidationException;
import com.titiplex.tracker.core.model.Money;
import com.titiplex.tracker.core.model.Preferences;
import com.titiplex.tracker.core.model.SipProjection;
import com.titiplex.tracker.core.model.SipRequirement;
import com.titiplex.tracker.core.model.SipResult;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * Systematic Investment Plan maths, annuity-due convention (each installment is invested
 * at the start of its month):
 * <pre>
 *   FV = P * (((1 + r)^n - 1) / r) * (1 + r),   r = annualRate / 12 / 100
 * </pre>
 * With {@code r = 0} this degrades to {@code FV = P * n}. Intermediate values keep
 * {@link MathContext#DECIMAL128} precision; results are rounded to cents when the result
 * record is built.
 */
@Service
public class SipCalculator {

    private static final MathContext MC = MathContext.DECIMAL128;
    private static final BigDecimal TWELVE = BigDecimal.valueOf(12);
    private static final BigDecimal ONE_HUNDRED = BigDecimal.valueOf(100);
    static final String AUTOMATE_ADVICE =
            "Tip: automate this SIP from your bank on the day your salary arrives so you never skip an installment.";

    public SipProjection futureValue(BigDecimal monthlyInvestment, BigDecimal annualRatePercent, int months) {
        requireNonNegative(monthlyInvestment, "Monthly investment");
        validatePlan(annualRatePercent, months);

        BigDecimal fv = monthlyInvestment.multiply(growthFactor(annualRatePercent, months), MC);
        BigDecimal invested = monthlyInvestment.multiply(BigDecimal.valueOf(months));
        return new SipProjection(
                monthlyInvestment,
                annualRatePercent,
                months,
                Money.round(fv),
                Money.round(invested),
                Money.round(fv.subtract(invested, MC)));
    }

    public SipRequirement requiredMonthlyInvestment(BigDecimal targetFutureValue, BigDecimal annualRatePercent, int months) {
        requireNonNegative(targetFutureValue, "Target amount");
        validatePlan(annualRatePercent, months);

        BigDecimal p = targetFutureValue.divide(growthFactor(annualRatePercent, months), MC);
        return new SipRequirement(targetFutureValue, annualRatePercent, months, Money.round(p));
    }

    /**
     * Whole months in a period given in (possibly fractional) years, rounded down.
     */
    public int monthsForYears(BigDecimal years) {
        if (years == null) {
            throw new ValidationException("Period is required");
        }
        int months;
        try {
            months = years.multiply(TWELVE).setScale(0, RoundingMode.DOWN).intValueExact();
        } catch (ArithmeticException e) {
            throw new ValidationException("Period is too long: " + years.toPlainString() + " years");
        }
        if (months <= 0) {
            throw new ValidationException("Period must be at least one month");
        }
        return months;
    }

    /**
     * Value of one monthly unit after {@code months}: {@code ((1+r)^n - 1) / r * (1+r)}, or {@code n} when r is 0.
     */
    BigDecimal growthFactor(BigDecimal annualRatePercent, int months) {
        BigDecimal r = annualRatePercent.divide(TWELVE, MC).divide(ONE_HUNDRED, MC);
        if (r.signum() == 0) {
            return BigDecimal.valueOf(months);
        }
        BigDecimal onePlusR = BigDecimal.ONE.add(r, MC);
        BigDecimal compounded = onePlusR.pow(months, MC);
        return compounded.subtract(BigDecimal.ONE, MC)
                .divide(r, MC)
                .multiply(onePlusR, MC);
    }

    public String describe(SipResult result, Preferences prefs) {
        String sym = prefs.currencySymbol();
        StringBuilder sb = new StringBuilder();
        if (result instanceof SipProjection p) {
            sb.append("Monthly SIP: ").append(Money.format(sym, p.monthlyInvestment())).append('\n');
            appendPlan(sb, p);
            sb.append('\n');
            sb.append("Total invested: ").append(Money.format(sym, p.totalInvested())).append('\n');
            sb.append("Estimated gains: ").append(Money.format(sym, p.estimatedGains())).append('\n');
            sb.append("Estimated corpus at end: ").append(Money.format(sym, p.futureValue())).append('\n');
        } else if (result instanceof SipRequirement q) {
            sb.append("Goal: ").append(Money.format(sym, q.targetFutureValue())).append('\n');
            appendPlan(sb, q);
            sb.append('\n');
            sb.append("To reach the goal you need about ")
                    .append(Money.format(sym, q.requiredMonthlyInvestment())).append(" per month\n");
        }
        return sb.toString();
    }

    /**
     * Calculator panel text: the projection for the entered installment, then the installment a goal needs
     * when {@code requirement} is present, then the closing advice.
     */
    public String describe(SipProjection projection, SipRequirement requirement, Preferences prefs) {
        String sym = prefs.currencySymbol();
        StringBuilder sb = new StringBuilder(describe(projection, prefs));
        if (requirement != null) {
            sb.append('\n');
            sb.append("Goal: ").append(Money.format(sym, requirement.targetFutureValue())).append('\n');
            sb.append("Required monthly SIP: ")
                    .append(Money.format(sym, requirement.requiredMonthlyInvestment())).append('\n');
        }
        sb.append('\n').append(AUTOMATE_ADVICE).append('\n');
        return sb.toString();
    }

    private static void appendPlan(StringBuilder sb, SipResult r) {
        sb.append("Annual return assumed: ").append(r.annualRatePercent().setScale(2, RoundingMode.HALF_UP).toPlainString()).append("%\n");
        sb.append("Period: ").append(r.months()).append(" months\n");
    }

    private static void validatePlan(BigDecimal annualRatePercent, int months) {
        if (annualRatePercent == null || annualRatePercent.signum() < 0) {
            throw new ValidationException("Annual return must be zero or more");
        }
        if (months <= 0) {
            throw new ValidationException("Number of months must be positive: " + months);
        }
    }

    private static void requireNonNegative(BigDecimal value, String what) {
        if (value == null) {
            throw new ValidationException(what + " is required");
        }
        if (value.signum() < 0) {
            throw new ValidationException(what + " must be zero or more");
        }
    }
}
