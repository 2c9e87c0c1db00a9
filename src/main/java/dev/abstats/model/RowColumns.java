package dev.abstats.model;

/**
 * The numeric columns of one variation's aggregate: summable counts and sums, followed by quantile
 * bookkeeping that cannot be summed across dimensions.
 */
public record RowColumns(
        double users,
        double count,
        double mainSum,
        double mainSumSquares,
        double denominatorSum,
        double denominatorSumSquares,
        double mainDenominatorSumProduct,
        double covariateSum,
        double covariateSumSquares,
        double mainCovariateSumProduct,
        double quantileN,
        double quantileNstar,
        double quantile,
        double quantileLower,
        double quantileUpper) {

    public static final RowColumns ZERO =
            new RowColumns(0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0);

    /** Adds the summable columns of {@code other}; quantile columns keep this row's values. */
    public RowColumns plus(RowColumns other) {
        return new RowColumns(
                users + other.users,
                count + other.count,
                mainSum + other.mainSum,
                mainSumSquares + other.mainSumSquares,
                denominatorSum + other.denominatorSum,
                denominatorSumSquares + other.denominatorSumSquares,
                mainDenominatorSumProduct + other.mainDenominatorSumProduct,
                covariateSum + other.covariateSum,
                covariateSumSquares + other.covariateSumSquares,
                mainCovariateSumProduct + other.mainCovariateSumProduct,
                quantileN,
                quantileNstar,
                quantile,
                quantileLower,
                quantileUpper);
    }

    /**
     * Subtracts the running-sum columns of {@code previous} (main and denominator sums, squares and
     * cross products). Users, counts, covariate sums and quantile columns are left untouched.
     */
    public RowColumns minusRunningSums(RowColumns previous) {
        return new RowColumns(
                users,
                count,
                mainSum - previous.mainSum,
                mainSumSquares - previous.mainSumSquares,
                denominatorSum - previous.denominatorSum,
                denominatorSumSquares - previous.denominatorSumSquares,
                mainDenominatorSumProduct - previous.mainDenominatorSumProduct,
                covariateSum,
                covariateSumSquares,
                mainCovariateSumProduct - previous.mainCovariateSumProduct,
                quantileN,
                quantileNstar,
                quantile,
                quantileLower,
                quantileUpper);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private double users;
        private double count;
        private boolean countSet;
        private double mainSum;
        private double mainSumSquares;
        private double denominatorSum;
        private double denominatorSumSquares;
        private double mainDenominatorSumProduct;
        private double covariateSum;
        private double covariateSumSquares;
        private double mainCovariateSumProduct;
        private double quantileN;
        private double quantileNstar;
        private double quantile;
        private double quantileLower;
        private double quantileUpper;

        public Builder users(double users) {
            this.users = users;
            return this;
        }

        /** Defaults to {@link #users(double)} when never set. */
        public Builder count(double count) {
            this.count = count;
            this.countSet = true;
            return this;
        }

        public Builder main(double sum, double sumSquares) {
            this.mainSum = sum;
            this.mainSumSquares = sumSquares;
            return this;
        }

        public Builder denominator(double sum, double sumSquares, double mainProduct) {
            this.denominatorSum = sum;
            this.denominatorSumSquares = sumSquares;
            this.mainDenominatorSumProduct = mainProduct;
            return this;
        }

        public Builder covariate(double sum, double sumSquares, double mainProduct) {
            this.covariateSum = sum;
            this.covariateSumSquares = sumSquares;
            this.mainCovariateSumProduct = mainProduct;
            return this;
        }

        public Builder quantile(double n, double nStar, double value, double lower, double upper) {
            this.quantileN = n;
            this.quantileNstar = nStar;
            this.quantile = value;
            this.quantileLower = lower;
            this.quantileUpper = upper;
            return this;
        }

        public RowColumns build() {
            return new RowColumns(
                    users,
                    countSet ? count : users,
                    mainSum,
                    mainSumSquares,
                    denominatorSum,
                    denominatorSumSquares,
                    mainDenominatorSumProduct,
                    covariateSum,
                    covariateSumSquares,
                    mainCovariateSumProduct,
                    quantileN,
                    quantileNstar,
                    quantile,
                    quantileLower,
                    quantileUpper);
        }
    }
}
